package domain.model;

import domain.mapping.FunctionCategory;

import java.util.Locale;

/**
 * Outcome of one recognized function call.
 *
 * <p>{@code replacement} is present only for CONVERTED; {@code reason} and {@code code} only
 * otherwise.</p>
 */
public final class CallSiteResult {

    private final String functionName;
    private final Disposition disposition;
    private final FlagCode code;
    private final String replacement;
    private final String reason;
    private final FunctionCategory category;
    private final int line;
    private final boolean changed;

    private CallSiteResult(
            String functionName,
            Disposition disposition,
            FlagCode code,
            String replacement,
            String reason,
            FunctionCategory category,
            int line,
            boolean changed
    ) {
        this.functionName = functionName == null ? "" : functionName;
        this.disposition = disposition;
        this.code = code;
        this.replacement = replacement;
        this.reason = reason;
        this.category = category == null ? FunctionCategory.OTHER : category;
        this.line = line;
        this.changed = changed;
    }

    /**
     * @param changed false when the call was already in target form
     */
    public static CallSiteResult converted(
            String functionName,
            String replacement,
            FunctionCategory category,
            int line,
            boolean changed
    ) {
        return new CallSiteResult(functionName, Disposition.CONVERTED, null, replacement, null, category, line, changed);
    }

    public static CallSiteResult flagged(
            String functionName,
            FlagCode code,
            String reason,
            FunctionCategory category,
            int line
    ) {
        return new CallSiteResult(functionName, Disposition.FLAGGED, code, null, reason, category, line, false);
    }

    public static CallSiteResult unsupported(String functionName, int line) {
        String reason = functionName.toUpperCase(Locale.ROOT) + " function not supported";
        return new CallSiteResult(functionName, Disposition.UNSUPPORTED, FlagCode.UNSUPPORTED_FUNCTION,
                null, reason, FunctionCategory.OTHER, line, false);
    }

    public String getFunctionName() {
        return functionName;
    }

    public Disposition getDisposition() {
        return disposition;
    }

    public FlagCode getCode() {
        return code;
    }

    public String getReplacement() {
        return replacement;
    }

    public String getReason() {
        return reason;
    }

    public FunctionCategory getCategory() {
        return category;
    }

    public int getLine() {
        return line;
    }

    public boolean isChanged() {
        return changed;
    }

    public boolean isConverted() {
        return disposition == Disposition.CONVERTED;
    }

    @Override
    public String toString() {
        return functionName + "@" + line + ":" + disposition
                + (isConverted() ? "{" + replacement + "}" : "{" + reason + "}");
    }
}
