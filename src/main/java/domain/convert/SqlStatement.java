package domain.convert;

import java.util.Collections;
import java.util.List;

/**
 * One top-level statement as cut out of the input by {@link SqlStatementSplitter}.
 *
 * <p>{@code text} excludes the terminator and any leading or trailing comments; those stay in
 * the gaps between statements and are copied verbatim to the output.</p>
 */
public class SqlStatement {

    private final int number;
    private final String text;
    private final int startOffset;
    private final int endOffset;
    private final int startLine;
    private final List<String> comments;
    private final boolean valid;

    public SqlStatement(
            int number,
            String text,
            int startOffset,
            int endOffset,
            int startLine,
            List<String> comments,
            boolean valid
    ) {
        this.number = number;
        this.text = (text == null) ? "" : text;
        this.startOffset = startOffset;
        this.endOffset = endOffset;
        this.startLine = startLine;
        this.comments = (comments == null) ? List.of() : Collections.unmodifiableList(comments);
        this.valid = valid;
    }

    /** Standalone statement, e.g. for tests: offsets cover the whole text, line 1. */
    public static SqlStatement of(String text) {
        String t = (text == null) ? "" : text;
        return new SqlStatement(1, t, 0, t.length(), 1, List.of(), true);
    }

    /** 1-based position in the input. */
    public int getNumber() {
        return number;
    }

    public String getText() {
        return text;
    }

    public int getStartOffset() {
        return startOffset;
    }

    /** Exclusive. */
    public int getEndOffset() {
        return endOffset;
    }

    /** 1-based line of the first code character. */
    public int getStartLine() {
        return startLine;
    }

    /** Comment bodies found in the statement's span, detached ones included. */
    public List<String> getComments() {
        return comments;
    }

    /** False when the input ended inside an open literal, comment or parenthesis. */
    public boolean isValid() {
        return valid;
    }

    @Override
    public String toString() {
        return "SqlStatement{#" + number + ", line=" + startLine + ", valid=" + valid + ", text='" + text + "'}";
    }
}
