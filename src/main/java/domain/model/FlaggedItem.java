package domain.model;

import java.util.Objects;

/**
 * A single (location, reason) entry that needs human review.
 *
 * <p>Flagged items are data, not faults: the conversion always completes.</p>
 */
public final class FlaggedItem {

    private final int statementNumber;
    private final int line;
    private final String functionName;
    private final FlagCode code;
    private final String reason;

    public FlaggedItem(int statementNumber, int line, String functionName, FlagCode code, String reason) {
        this.statementNumber = statementNumber;
        this.line = line;
        this.functionName = nullToEmpty(functionName);
        this.code = code == null ? FlagCode.MANUAL_REVIEW_REQUIRED : code;
        this.reason = nullToEmpty(reason);
    }

    /** Statement-level item that is not tied to one function call. */
    public static FlaggedItem ofStatement(int statementNumber, int line, FlagCode code, String reason) {
        return new FlaggedItem(statementNumber, line, "", code, reason);
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }

    public int getStatementNumber() {
        return statementNumber;
    }

    /** 1-based source line. */
    public int getLine() {
        return line;
    }

    /** Function name as written; empty for statement-level items. */
    public String getFunctionName() {
        return functionName;
    }

    public FlagCode getCode() {
        return code;
    }

    public String getReason() {
        return reason;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FlaggedItem)) return false;
        FlaggedItem that = (FlaggedItem) o;
        return statementNumber == that.statementNumber
                && line == that.line
                && functionName.equals(that.functionName)
                && code == that.code
                && reason.equals(that.reason);
    }

    @Override
    public int hashCode() {
        return Objects.hash(statementNumber, line, functionName, code, reason);
    }

    @Override
    public String toString() {
        return "#" + statementNumber + " line " + line + " [" + code + "] "
                + (functionName.isEmpty() ? "" : functionName + ": ") + reason;
    }
}
