package domain.mapping;

import java.util.Locale;

/**
 * One entry of the function mapping table.
 *
 * <p>Immutable. Keyed by the upper-cased source function name; the registry never mutates an
 * entry once built.</p>
 */
public final class FunctionMapping {

    /** Arity bound meaning "no upper limit". */
    public static final int UNBOUNDED = -1;

    private final String sourceName;
    private final String targetName;
    private final RuleKind kind;
    private final FunctionCategory category;
    private final ArgumentRewriter rewriter;
    private final String reason;
    private final int minArgs;
    private final int maxArgs;

    private FunctionMapping(
            String sourceName,
            String targetName,
            RuleKind kind,
            FunctionCategory category,
            ArgumentRewriter rewriter,
            String reason,
            int minArgs,
            int maxArgs
    ) {
        String key = normalize(sourceName);
        if (key.isEmpty()) throw new IllegalArgumentException("sourceName is blank");
        if (kind == null) throw new IllegalArgumentException("kind is null: " + key);
        if (kind == RuleKind.REORDER && rewriter == null) {
            throw new IllegalArgumentException("REORDER rule without rewriter: " + key);
        }
        if (maxArgs != UNBOUNDED && maxArgs < minArgs) {
            throw new IllegalArgumentException("maxArgs < minArgs: " + key);
        }
        this.sourceName = key;
        this.targetName = (targetName == null || targetName.isBlank()) ? key : targetName.trim();
        this.kind = kind;
        this.category = category == null ? FunctionCategory.OTHER : category;
        this.rewriter = rewriter;
        this.reason = (reason == null || reason.isBlank()) ? null : reason.trim();
        this.minArgs = Math.max(0, minArgs);
        this.maxArgs = maxArgs;
    }

    public static FunctionMapping direct(String sourceName, String targetName, FunctionCategory category) {
        return new FunctionMapping(sourceName, targetName, RuleKind.DIRECT, category, null, null, 0, UNBOUNDED);
    }

    /** Identity entry for a name that is already valid in the target dialect. */
    public static FunctionMapping same(String name, FunctionCategory category) {
        return direct(name, normalize(name), category);
    }

    public static FunctionMapping reorder(
            String sourceName,
            String targetName,
            FunctionCategory category,
            int minArgs,
            int maxArgs,
            ArgumentRewriter rewriter
    ) {
        return new FunctionMapping(sourceName, targetName, RuleKind.REORDER, category, rewriter, null, minArgs, maxArgs);
    }

    public static FunctionMapping flag(String sourceName, FunctionCategory category, String reason) {
        String r = (reason == null || reason.isBlank())
                ? normalize(sourceName) + " function requires manual review"
                : reason;
        return new FunctionMapping(sourceName, null, RuleKind.FLAG, category, null, r, 0, UNBOUNDED);
    }

    static String normalize(String name) {
        return (name == null) ? "" : name.trim().toUpperCase(Locale.ROOT);
    }

    public String getSourceName() {
        return sourceName;
    }

    public String getTargetName() {
        return targetName;
    }

    public RuleKind getKind() {
        return kind;
    }

    public FunctionCategory getCategory() {
        return category;
    }

    /** Only present for REORDER rules. */
    public ArgumentRewriter getRewriter() {
        return rewriter;
    }

    /** Review reason; present for FLAG rules. */
    public String getReason() {
        return reason;
    }

    public int getMinArgs() {
        return minArgs;
    }

    public int getMaxArgs() {
        return maxArgs;
    }

    public boolean acceptsArgCount(int n) {
        if (n < minArgs) return false;
        return maxArgs == UNBOUNDED || n <= maxArgs;
    }

    @Override
    public String toString() {
        return "FunctionMapping{" +
                "sourceName='" + sourceName + '\'' +
                ", targetName='" + targetName + '\'' +
                ", kind=" + kind +
                ", category=" + category +
                '}';
    }
}
