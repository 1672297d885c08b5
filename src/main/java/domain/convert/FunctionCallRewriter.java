package domain.convert;

import domain.mapping.FunctionMapping;
import domain.mapping.RewriteOutcome;
import domain.mapping.RuleKind;
import domain.model.CallSiteResult;
import domain.model.Disposition;
import domain.model.FlagCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Applies resolved mapping rules to the call sites of one statement.
 *
 * <p>The output is rebuilt left to right from the unmodified statement text: source between call
 * sites is copied verbatim, each call site is replaced by its rendering. A call's argument text
 * is rendered first, so rewrites of nested calls stay embedded in the enclosing call whatever
 * happens to it (converted, flagged or unsupported).</p>
 *
 * <p>With a {@link BooleanLiteralRewriter}, TRUE/FALSE in copied text become 1/0, except inside
 * calls that are kept as written for review.</p>
 */
public final class FunctionCallRewriter {

    private static final Logger log = LoggerFactory.getLogger(FunctionCallRewriter.class);

    // keywords after which T-SQL expects a search condition
    private static final Set<String> CONDITION_KEYWORDS = Set.of(
            "AND", "HAVING", "NOT", "ON", "OR", "WHEN", "WHERE"
    );

    private final BooleanLiteralRewriter booleans;

    public FunctionCallRewriter() {
        this(null);
    }

    /**
     * @param booleans rewrites boolean literals in converted text; {@code null} keeps them
     */
    FunctionCallRewriter(BooleanLiteralRewriter booleans) {
        this.booleans = booleans;
    }

    public Rewritten rewrite(String text, List<CallSite> sites) {
        String src = (text == null) ? "" : text;
        List<CallSite> all = (sites == null) ? List.of() : sites;

        Map<Integer, List<CallSite>> children = new HashMap<>();
        Map<Integer, CallSite> byIndex = new HashMap<>();
        List<CallSite> roots = new ArrayList<>();
        for (CallSite cs : all) {
            byIndex.put(cs.getIndex(), cs);
            if (cs.getParent() == CallSite.NO_PARENT) roots.add(cs);
            else children.computeIfAbsent(cs.getParent(), k -> new ArrayList<>()).add(cs);
        }

        CallSiteResult[] results = new CallSiteResult[all.size()];
        Pass pass = new Pass(src, children, byIndex, results, booleans);
        SqlFragment fragment = pass.render(0, src.length(), roots, booleans != null);

        return new Rewritten(fragment, Arrays.asList(results));
    }

    private static String arityText(FunctionMapping m) {
        if (m.getMaxArgs() == FunctionMapping.UNBOUNDED) return "at least " + m.getMinArgs();
        if (m.getMinArgs() == m.getMaxArgs()) return String.valueOf(m.getMinArgs());
        return m.getMinArgs() + ".." + m.getMaxArgs();
    }

    static List<String> splitArguments(String argumentText) {
        if (argumentText == null || argumentText.isBlank()) return List.of();
        return SqlStatementSplitter.splitTopLevelByComma(argumentText)
                .stream()
                .map(String::trim)
                .toList();
    }

    /** State of one rewrite call. */
    private static final class Pass {
        private final String src;
        private final Map<Integer, List<CallSite>> children;
        private final Map<Integer, CallSite> byIndex;
        private final CallSiteResult[] results;
        private final BooleanLiteralRewriter booleans;

        Pass(
                String src,
                Map<Integer, List<CallSite>> children,
                Map<Integer, CallSite> byIndex,
                CallSiteResult[] results,
                BooleanLiteralRewriter booleans
        ) {
            this.src = src;
            this.children = children;
            this.byIndex = byIndex;
            this.results = results;
            this.booleans = booleans;
        }

        SqlFragment render(int from, int to, List<CallSite> calls, boolean literals) {
            SqlFragment acc = SqlFragment.empty();
            int cursor = from;
            for (CallSite cs : calls) {
                acc = SqlFragment.merge(acc, copy(cursor, cs.getNameStart(), literals));
                acc = SqlFragment.merge(acc, renderCall(cs, literals));
                cursor = cs.getCloseParen() + 1;
            }
            return SqlFragment.merge(acc, copy(cursor, to, literals));
        }

        private SqlFragment copy(int from, int to, boolean literals) {
            String text = src.substring(from, to);
            return SqlFragment.verbatim(literals ? booleans.rewrite(text) : text);
        }

        private SqlFragment renderArgs(CallSite cs, boolean literals) {
            return render(
                    cs.getOpenParen() + 1,
                    cs.getCloseParen(),
                    children.getOrDefault(cs.getIndex(), List.of()),
                    literals
            );
        }

        private SqlFragment renderCall(CallSite cs, boolean literals) {
            FunctionMapping m = cs.getMapping();
            // calls kept for review keep their literals too
            boolean keep = m == null || m.getKind() == RuleKind.FLAG;
            SqlFragment args = renderArgs(cs, literals && !keep);

            // name, whitespace and '(' as written
            String head = src.substring(cs.getNameEnd(), cs.getOpenParen() + 1);
            String asWritten = cs.getName() + head + args.getText() + ")";

            if (m == null) {
                results[cs.getIndex()] = CallSiteResult.unsupported(cs.getName(), cs.getLine());
                return SqlFragment.of(asWritten, SqlFragment.worse(Disposition.UNSUPPORTED, args.getDisposition()));
            }

            return switch (m.getKind()) {
                case FLAG -> flagged(cs, m, FlagCode.MANUAL_REVIEW_REQUIRED, m.getReason(), asWritten, args);
                case DIRECT -> direct(cs, m, head, args);
                case REORDER -> {
                    SqlFragment out = reorder(cs, m, asWritten, args);
                    if (literals && !results[cs.getIndex()].isConverted()) {
                        // render again without literal rewrites so the call stays as written
                        SqlFragment plain = renderArgs(cs, false);
                        String original = cs.getName() + head + plain.getText() + ")";
                        yield SqlFragment.of(original, SqlFragment.worse(Disposition.FLAGGED, plain.getDisposition()));
                    }
                    yield out;
                }
            };
        }

        private SqlFragment direct(CallSite cs, FunctionMapping m, String head, SqlFragment args) {
            String target = m.getTargetName();
            // keep the author's spelling when the name is already the target
            boolean rename = !target.equalsIgnoreCase(cs.getName());
            String name = rename ? target : cs.getName();
            String out = name + head + args.getText() + ")";
            results[cs.getIndex()] = CallSiteResult.converted(cs.getName(), out, m.getCategory(), cs.getLine(), rename);
            return SqlFragment.of(out, args.getDisposition());
        }

        private SqlFragment reorder(CallSite cs, FunctionMapping m, String asWritten, SqlFragment args) {
            List<String> parsed = splitArguments(args.getText());
            String upper = m.getSourceName();

            if (!m.acceptsArgCount(parsed.size())) {
                String reason = upper + " expects " + arityText(m) + " argument(s) but got " + parsed.size();
                return flagged(cs, m, FlagCode.ARGUMENT_ARITY_MISMATCH, reason, asWritten, args);
            }

            RewriteOutcome outcome;
            try {
                outcome = m.getRewriter().rewrite(cs.getName(), parsed);
            } catch (RuntimeException e) {
                log.debug("Rewriter for {} failed on line {}: {}", upper, cs.getLine(), e.toString());
                String reason = upper + " could not be rewritten (" + e.getClass().getSimpleName() + ")";
                return flagged(cs, m, FlagCode.MANUAL_REVIEW_REQUIRED, reason, asWritten, args);
            }

            if (outcome == null) {
                return flagged(cs, m, FlagCode.MANUAL_REVIEW_REQUIRED, upper + " rewriter returned no result", asWritten, args);
            }
            if (outcome.isManualReview()) {
                return flagged(cs, m, FlagCode.MANUAL_REVIEW_REQUIRED, outcome.getReason(), asWritten, args);
            }

            if (outcome.isCondition() && !inConditionPosition(cs)) {
                String reason = upper + " becomes a search condition in T-SQL and cannot be used as a value here";
                return flagged(cs, m, FlagCode.MANUAL_REVIEW_REQUIRED, reason, asWritten, args);
            }

            String out = outcome.isUnchanged() ? asWritten : outcome.getText();
            boolean changed = !outcome.isUnchanged() && !out.equals(asWritten);
            results[cs.getIndex()] = CallSiteResult.converted(cs.getName(), out, m.getCategory(), cs.getLine(), changed);
            return SqlFragment.of(out, args.getDisposition());
        }

        /**
         * True after WHERE/AND/OR/NOT/WHEN/HAVING/ON, inside a grouping parenthesis, or as the
         * first argument of IIF.
         */
        private boolean inConditionPosition(CallSite cs) {
            int p = cs.getNameStart() - 1;
            while (p >= 0 && Character.isWhitespace(src.charAt(p))) p--;
            if (p < 0) return false;

            char c = src.charAt(p);
            if (c == '(') {
                CallSite parent = byIndex.get(cs.getParent());
                if (parent == null || parent.getOpenParen() != p) return true;
                FunctionMapping pm = parent.getMapping();
                return pm != null && "IIF".equalsIgnoreCase(pm.getTargetName());
            }
            if (!SqlScan.isIdentifierPart(c)) return false;

            int end = p + 1;
            while (p >= 0 && SqlScan.isIdentifierPart(src.charAt(p))) p--;
            return CONDITION_KEYWORDS.contains(src.substring(p + 1, end).toUpperCase(Locale.ROOT));
        }

        private SqlFragment flagged(
                CallSite cs,
                FunctionMapping m,
                FlagCode code,
                String reason,
                String asWritten,
                SqlFragment args
        ) {
            results[cs.getIndex()] = CallSiteResult.flagged(cs.getName(), code, reason, m.getCategory(), cs.getLine());
            return SqlFragment.of(asWritten, SqlFragment.worse(Disposition.FLAGGED, args.getDisposition()));
        }
    }

    /** Converted statement text plus one result per call site, in source order. */
    public static final class Rewritten {
        private final SqlFragment fragment;
        private final List<CallSiteResult> results;

        Rewritten(SqlFragment fragment, List<CallSiteResult> results) {
            this.fragment = fragment;
            this.results = Collections.unmodifiableList(results);
        }

        public String getText() {
            return fragment.getText();
        }

        /** Worst call-site disposition; CONVERTED when there are no call sites. */
        public Disposition getDisposition() {
            return fragment.getDisposition();
        }

        public List<CallSiteResult> getResults() {
            return results;
        }
    }
}
