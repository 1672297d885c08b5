package domain.convert;

import domain.mapping.FunctionMappingLookup;
import domain.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Internal implementation of {@link SqlDialectConverter}.
 *
 * <p>Pipeline per statement:
 * <ul>
 *   <li>{@link SqlStatementSplitter}: cuts the input into statements</li>
 *   <li>{@link StructuralValidator}: rejects unbalanced statements, which pass through verbatim</li>
 *   <li>{@link FunctionCallRecognizer}: finds call sites and resolves them against the table</li>
 *   <li>{@link FunctionCallRewriter}: renders the converted statement, with
 *       {@link BooleanLiteralRewriter} for TRUE/FALSE outside calls kept for review</li>
 *   <li>{@link LodExpressionDetector}: flags level-of-detail expressions</li>
 * </ul>
 */
final class SqlDialectConverterEngine {

    private static final Logger log = LoggerFactory.getLogger(SqlDialectConverterEngine.class);

    static final String LOD_REASON =
            "LOD expression {%s ...} is not supported; rewrite with a windowed aggregate or a grouped subquery";

    private final ConverterOptions options;

    private final SqlStatementSplitter splitter;
    private final StructuralValidator validator;
    private final FunctionCallRecognizer recognizer;
    private final FunctionCallRewriter rewriter;
    private final LodExpressionDetector lodDetector;

    SqlDialectConverterEngine(FunctionMappingLookup mappings, ConverterOptions options) {
        this.options = options;

        this.splitter = new SqlStatementSplitter();
        this.validator = new StructuralValidator();
        this.recognizer = new FunctionCallRecognizer(mappings);
        this.rewriter = new FunctionCallRewriter(options.isRewriteBooleanLiterals() ? new BooleanLiteralRewriter() : null);
        this.lodDetector = new LodExpressionDetector();
    }

    ConversionOutput convert(String text) {
        ConversionMetrics metrics = ConversionMetrics.empty();
        if (text == null) return new ConversionOutput("", metrics, List.of());

        List<SqlStatement> statements = splitter.split(text);
        List<StatementResult> results = new ArrayList<>(statements.size());

        // gaps between statements (terminators, whitespace, detached comments) are copied as is
        StringBuilder out = new StringBuilder(text.length() + 64);
        int cursor = 0;
        for (SqlStatement st : statements) {
            out.append(text, cursor, st.getStartOffset());

            StatementResult r = convertStatement(st);
            metrics.record(r);
            results.add(r);

            out.append(r.getConvertedText());
            cursor = st.getEndOffset();
        }
        out.append(text, cursor, text.length());

        log.debug("Converted {} statement(s): {}", statements.size(), metrics);
        return new ConversionOutput(out.toString(), metrics, results);
    }

    StatementResult convertStatement(SqlStatement st) {
        try {
            ValidationResult v = validator.validate(st);
            if (!v.isOk()) {
                log.debug("Statement #{} (line {}) rejected: {}", st.getNumber(), st.getStartLine(), v.getError());
                return StatementResult.syntaxError(st.getNumber(), st.getStartLine(), st.getText(), v.getError());
            }

            List<CallSite> sites = recognizer.recognize(st);
            FunctionCallRewriter.Rewritten rw = rewriter.rewrite(st.getText(), sites);

            return StatementResult.rewritten(
                    st.getNumber(),
                    st.getStartLine(),
                    st.getText(),
                    rw.getText(),
                    rw.getResults(),
                    statementFlags(st)
            );
        } catch (RuntimeException e) {
            log.warn("Statement #{} (line {}) could not be converted, kept as is", st.getNumber(), st.getStartLine(), e);
            String reason = "conversion failed: " + e.getClass().getSimpleName()
                    + (e.getMessage() == null ? "" : " - " + e.getMessage());
            return StatementResult.conversionError(st.getNumber(), st.getStartLine(), st.getText(), reason);
        }
    }

    private List<FlaggedItem> statementFlags(SqlStatement st) {
        if (!options.isDetectLodExpressions()) return List.of();

        List<LodExpressionDetector.Match> lods = lodDetector.find(st.getText());
        if (lods.isEmpty()) return List.of();

        LineIndex lines = new LineIndex(st.getText());
        List<FlaggedItem> out = new ArrayList<>(lods.size());
        for (LodExpressionDetector.Match m : lods) {
            int line = st.getStartLine() + lines.lineOf(m.offset) - 1;
            out.add(FlaggedItem.ofStatement(st.getNumber(), line, FlagCode.LOD_EXPRESSION, String.format(LOD_REASON, m.keyword)));
        }
        return out;
    }
}
