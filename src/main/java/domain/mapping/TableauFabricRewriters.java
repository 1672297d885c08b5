package domain.mapping;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Argument rewriters for the Tableau functions whose Fabric form is not a plain rename.
 *
 * <p>Every rewriter either returns a complete expression or asks for manual review; none of them
 * guesses. Predicate rewrites (CONTAINS/STARTSWITH/ENDSWITH, one-argument ISNULL) produce a
 * search condition; the rewrite engine flags them when the call does not sit where a condition
 * is allowed.</p>
 */
final class TableauFabricRewriters {

    // Tableau date part literal -> T-SQL datepart keyword
    private static final Map<String, String> DATE_PARTS = Map.ofEntries(
            Map.entry("year", "year"),
            Map.entry("quarter", "quarter"),
            Map.entry("month", "month"),
            Map.entry("dayofyear", "dayofyear"),
            Map.entry("day", "day"),
            Map.entry("week", "week"),
            Map.entry("weekday", "weekday"),
            Map.entry("hour", "hour"),
            Map.entry("minute", "minute"),
            Map.entry("second", "second")
    );

    private TableauFabricRewriters() {
    }

    static ArgumentRewriter today() {
        return (name, args) -> RewriteOutcome.converted("CAST(GETDATE() AS DATE)");
    }

    static ArgumentRewriter castAs(String sqlType) {
        return (name, args) -> RewriteOutcome.converted("CAST(" + args.get(0) + " AS " + sqlType + ")");
    }

    static ArgumentRewriter str(int varcharLength) {
        return castAs("VARCHAR(" + varcharLength + ")");
    }

    /** SPLIT(s, 'd', 1): only the first token has a CHARINDEX-based equivalent. */
    static ArgumentRewriter split() {
        return (name, args) -> {
            String s = args.get(0);
            String delim = args.get(1);
            String idx = args.get(2);
            if (!idx.equals("1")) {
                return RewriteOutcome.manualReview("SPLIT with index != 1 requires manual rewrite");
            }
            return RewriteOutcome.converted("SUBSTRING(" + s + ", 1, CHARINDEX(" + delim + ", " + s + ") - 1)");
        };
    }

    static ArgumentRewriter contains() {
        return (name, args) -> RewriteOutcome.condition("CHARINDEX(" + args.get(1) + ", " + args.get(0) + ") > 0");
    }

    static ArgumentRewriter startsWith() {
        return (name, args) -> RewriteOutcome.condition("CHARINDEX(" + args.get(1) + ", " + args.get(0) + ") = 1");
    }

    static ArgumentRewriter endsWith() {
        return (name, args) -> {
            String s = args.get(0);
            String suffix = args.get(1);
            return RewriteOutcome.condition("RIGHT(" + s + ", LEN(" + suffix + ")) = " + suffix);
        };
    }

    /** FIND(s, needle [, start]) -> CHARINDEX(needle, s [, start]) */
    static ArgumentRewriter find() {
        return (name, args) -> {
            StringBuilder sb = new StringBuilder("CHARINDEX(")
                    .append(args.get(1))
                    .append(", ")
                    .append(args.get(0));
            if (args.size() > 2) sb.append(", ").append(args.get(2));
            return RewriteOutcome.converted(sb.append(')').toString());
        };
    }

    /** T-SQL SUBSTRING always needs a length. */
    static ArgumentRewriter substr() {
        return (name, args) -> {
            String s = args.get(0);
            String len = (args.size() > 2) ? args.get(2) : "LEN(" + s + ")";
            return RewriteOutcome.converted("SUBSTRING(" + s + ", " + args.get(1) + ", " + len + ")");
        };
    }

    /** IF(test, then, else); the block form IF ... THEN ... END is not a call. */
    static ArgumentRewriter iif() {
        return (name, args) -> RewriteOutcome.converted("IIF(" + String.join(", ", args) + ")");
    }

    static ArgumentRewriter zn() {
        return (name, args) -> RewriteOutcome.converted("ISNULL(" + args.get(0) + ", 0)");
    }

    /** Tableau ISNULL(x) is a test; the two-argument form is already T-SQL. */
    static ArgumentRewriter isNull() {
        return (name, args) -> {
            if (args.size() == 2) return RewriteOutcome.unchanged();
            return RewriteOutcome.condition(args.get(0) + " IS NULL");
        };
    }

    /** Tableau LOG(x) is base 10; LOG(x, base) means the same in both dialects. */
    static ArgumentRewriter log() {
        return (name, args) -> {
            if (args.size() == 2) return RewriteOutcome.unchanged();
            return RewriteOutcome.converted("LOG10(" + args.get(0) + ")");
        };
    }

    /**
     * DATEADD/DATEDIFF/DATEPART/DATENAME/DATETRUNC: Tableau passes the date part as a string
     * literal, T-SQL as a bare keyword.
     *
     * @param maxTableauArgs argument count at which the Tableau-only start_of_week argument is present
     */
    static ArgumentRewriter datePart(int maxTableauArgs) {
        return (name, args) -> {
            String fn = name.toUpperCase(Locale.ROOT);
            if (args.size() >= maxTableauArgs) {
                return RewriteOutcome.manualReview(fn + " start_of_week argument requires manual review");
            }

            String part = args.get(0);
            if (isStringLiteral(part)) {
                String key = unquote(part).trim().toLowerCase(Locale.ROOT);
                String mapped = DATE_PARTS.get(key);
                if (mapped == null) {
                    return RewriteOutcome.manualReview(fn + " date part " + part + " has no T-SQL equivalent");
                }
                List<String> out = new ArrayList<>(args);
                out.set(0, mapped);
                return RewriteOutcome.converted(fn + "(" + String.join(", ", out) + ")");
            }

            // already a bare datepart keyword (T-SQL form)
            if (DATE_PARTS.containsKey(part.toLowerCase(Locale.ROOT))) {
                return RewriteOutcome.unchanged();
            }
            return RewriteOutcome.manualReview(fn + " date part must be a literal, got: " + part);
        };
    }

    static boolean isStringLiteral(String s) {
        return s != null && s.length() >= 2 && s.charAt(0) == '\'' && s.charAt(s.length() - 1) == '\'';
    }

    static String unquote(String literal) {
        return literal.substring(1, literal.length() - 1).replace("''", "'");
    }
}
