package domain.mapping;

/**
 * Result of an {@link ArgumentRewriter}: a complete replacement expression, the reason why the
 * call needs manual review, or a marker that the call is already in target form.
 */
public final class RewriteOutcome {

    private static final RewriteOutcome UNCHANGED = new RewriteOutcome(null, null, false);

    private final String text;
    private final String reason;
    private final boolean condition;

    private RewriteOutcome(String text, String reason, boolean condition) {
        this.text = text;
        this.reason = reason;
        this.condition = condition;
    }

    /** The call is valid target SQL as written; the engine keeps its text untouched. */
    public static RewriteOutcome unchanged() {
        return UNCHANGED;
    }

    public static RewriteOutcome converted(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("converted text is blank");
        }
        return new RewriteOutcome(text, null, false);
    }

    /**
     * Converted text that is a search condition (e.g. {@code x IS NULL}), not a value.
     * Only valid where T-SQL accepts a predicate.
     */
    public static RewriteOutcome condition(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("converted text is blank");
        }
        return new RewriteOutcome(text, null, true);
    }

    public static RewriteOutcome manualReview(String reason) {
        String r = (reason == null || reason.isBlank()) ? "manual review required" : reason.trim();
        return new RewriteOutcome(null, r, false);
    }

    public boolean isConverted() {
        return text != null;
    }

    public boolean isUnchanged() {
        return this == UNCHANGED;
    }

    public boolean isCondition() {
        return condition;
    }

    public boolean isManualReview() {
        return reason != null;
    }

    /** Replacement expression; {@code null} when manual review is required. */
    public String getText() {
        return text;
    }

    /** Review reason; {@code null} when converted. */
    public String getReason() {
        return reason;
    }

    @Override
    public String toString() {
        if (isUnchanged()) return "unchanged";
        return isConverted() ? "converted{" + text + "}" : "manualReview{" + reason + "}";
    }
}
