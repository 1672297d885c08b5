package domain.convert;

import domain.mapping.FunctionCategory;
import domain.mapping.FunctionMapping;
import domain.mapping.FunctionMappingLookup;
import domain.model.*;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class SqlDialectConverterTest {

    private final SqlDialectConverter converter = new SqlDialectConverter();

    private static void assertMetricsInvariant(ConversionMetrics m) {
        assertEquals(m.getTotal(), m.getSuccessful() + m.getFlagged() + m.getSyntaxError());
    }

    @Test
    void should_rename_first_call_only_when_second_is_already_target() {
        ConversionOutput out = converter.convert("SELECT NOW() AS t, UPPER(name) FROM c;");

        assertEquals("SELECT GETDATE() AS t, UPPER(name) FROM c;", out.getText());

        ConversionMetrics m = out.getMetrics();
        assertEquals(1, m.getTotal());
        assertEquals(1, m.getSuccessful());
        assertTrue(m.getFlaggedItems().isEmpty());
        assertEquals(Map.of(FunctionCategory.DATE, 1), m.getConversionsByCategory());
        assertEquals(100.0, m.successRate(), 0.0001);
    }

    @Test
    void median_should_be_flagged_once_and_kept_verbatim() {
        ConversionOutput out = converter.convert("SELECT MEDIAN(x) FROM t;");

        assertEquals("SELECT MEDIAN(x) FROM t;", out.getText());

        ConversionMetrics m = out.getMetrics();
        assertEquals(1, m.getFlagged());
        assertEquals(1, m.getFlaggedItems().size());

        FlaggedItem item = m.getFlaggedItems().get(0);
        assertEquals("MEDIAN", item.getFunctionName());
        assertEquals(FlagCode.MANUAL_REVIEW_REQUIRED, item.getCode());
        assertTrue(item.getReason().contains("WITHIN GROUP (ORDER BY"));
        assertMetricsInvariant(m);
    }

    @Test
    void unbalanced_statement_should_pass_through_as_syntax_error() {
        String sql = "SELECT UPPER(name FROM t;";
        ConversionOutput out = converter.convert(sql);

        assertEquals(sql, out.getText());

        ConversionMetrics m = out.getMetrics();
        assertEquals(1, m.getTotal());
        assertEquals(0, m.getSuccessful());
        assertEquals(1, m.getSyntaxError());
        assertEquals(FlagCode.SYNTAX_ERROR, m.getFlaggedItems().get(0).getCode());
        assertEquals(StructuralValidator.UNBALANCED_PARENTHESES, m.getFlaggedItems().get(0).getReason());
        assertEquals(0.0, m.successRate(), 0.0001);
    }

    @Test
    void unsupported_function_should_be_recorded_once_across_casings() {
        ConversionOutput out = converter.convert("SELECT Zz_Made_Up(a) FROM t;\nSELECT zz_made_up(b) FROM t;");

        ConversionMetrics m = out.getMetrics();
        assertEquals(Set.of("ZZ_MADE_UP"), m.getUnsupportedFunctions());
        assertEquals(2, m.getFlaggedItems().size());
        assertEquals(2, m.getFlagged());
        assertTrue(m.getFlaggedItems().stream().allMatch(f -> f.getCode() == FlagCode.UNSUPPORTED_FUNCTION));
    }

    @Test
    void arity_mismatch_should_flag_and_never_emit_malformed_sql() {
        ConversionOutput out = converter.convert("SELECT a FROM t WHERE STARTSWITH(a);");

        assertEquals("SELECT a FROM t WHERE STARTSWITH(a);", out.getText());
        FlaggedItem item = out.getMetrics().getFlaggedItems().get(0);
        assertEquals(FlagCode.ARGUMENT_ARITY_MISMATCH, item.getCode());
        assertEquals("STARTSWITH expects 2 argument(s) but got 1", item.getReason());
    }

    @Test
    void direct_rename_should_keep_argument_text_byte_identical() {
        String args = " (SELECT MAX(d) FROM (x)) ,\n  'a(b' , [c)d] /* ) */ ";
        ConversionOutput out = converter.convert("SELECT NOW(" + args + ")");

        assertEquals("SELECT GETDATE(" + args + ")", out.getText());
    }

    @Test
    void converting_converted_text_again_should_be_a_no_op() {
        String sql = "SELECT NOW() AS t, IFNULL(a, 0), LENGTH(name), MAKEDATE(2024, 1, 1),\n"
                + "       STR(id), TODAY(), DATEDIFF('day', a, b), ZN(q)\n"
                + "FROM c\n"
                + "WHERE CONTAINS(name, 'x');";

        ConversionOutput first = converter.convert(sql);
        assertEquals(
                "SELECT GETDATE() AS t, ISNULL(a, 0), LEN(name), DATEFROMPARTS(2024, 1, 1),\n"
                        + "       CAST(id AS VARCHAR(20)), CAST(GETDATE() AS DATE), DATEDIFF(day, a, b), ISNULL(q, 0)\n"
                        + "FROM c\n"
                        + "WHERE CHARINDEX('x', name) > 0;",
                first.getText()
        );

        ConversionOutput second = converter.convert(first.getText());
        assertEquals(first.getText(), second.getText());
        assertEquals(0, second.getMetrics().getTotalConversions());
        assertEquals(1, second.getMetrics().getSuccessful());
    }

    @Test
    void statement_count_should_match_segmented_input() {
        String sql = "SELECT 1;\n\nSELECT UPPER(a) FROM t;\n;\nSELECT MEDIAN(b) FROM t\n";
        ConversionOutput out = converter.convert(sql);

        assertEquals(new SqlStatementSplitter().split(sql).size(), out.getStatements().size());
        assertEquals(3, out.getMetrics().getTotal());
        assertEquals(List.of(1, 2, 3), out.getStatements().stream().map(StatementResult::getNumber).toList());
        assertMetricsInvariant(out.getMetrics());
    }

    @Test
    void gaps_between_statements_should_be_copied_verbatim() {
        String sql = "-- header\nSELECT NOW();\n\n/* c */ SELECT 1 ;  \n";
        assertEquals("-- header\nSELECT GETDATE();\n\n/* c */ SELECT 1 ;  \n", converter.convert(sql).getText());
    }

    @Test
    void flagged_items_should_carry_statement_number_and_line() {
        ConversionOutput out = converter.convert("SELECT 1;\n\nSELECT a,\n  MEDIAN(x)\nFROM t;");

        FlaggedItem item = out.getMetrics().getFlaggedItems().get(0);
        assertEquals(2, item.getStatementNumber());
        assertEquals(4, item.getLine());
    }

    @Test
    void lod_expression_should_be_flagged_at_statement_level() {
        ConversionOutput out = converter.convert("SELECT { FIXED region : SUM(sales) } AS s FROM t;");

        assertEquals("SELECT { FIXED region : SUM(sales) } AS s FROM t;", out.getText());

        ConversionMetrics m = out.getMetrics();
        assertEquals(1, m.getFlagged());
        FlaggedItem item = m.getFlaggedItems().get(0);
        assertEquals(FlagCode.LOD_EXPRESSION, item.getCode());
        assertEquals("", item.getFunctionName());
        assertTrue(item.getReason().contains("FIXED"));
    }

    @Test
    void boolean_literals_should_become_bits_unless_disabled() {
        String sql = "SELECT IF(flag = TRUE, 1, 0) FROM t WHERE x.true_col = FALSE AND s = 'TRUE';";

        assertEquals(
                "SELECT IIF(flag = 1, 1, 0) FROM t WHERE x.true_col = 0 AND s = 'TRUE';",
                converter.convert(sql).getText()
        );

        SqlDialectConverter keep = new SqlDialectConverter(ConverterOptions.builder().rewriteBooleanLiterals(false).build());
        assertEquals(
                "SELECT IIF(flag = TRUE, 1, 0) FROM t WHERE x.true_col = FALSE AND s = 'TRUE';",
                keep.convert(sql).getText()
        );
    }

    @Test
    void varchar_length_should_follow_options() {
        SqlDialectConverter wide = new SqlDialectConverter(ConverterOptions.builder().varcharLength(50).build());
        assertEquals("SELECT CAST(id AS VARCHAR(50))", wide.convert("SELECT STR(id)").getText());
    }

    @Test
    void nested_calls_should_convert_inside_flagged_calls() {
        ConversionOutput out = converter.convert("SELECT MEDIAN(ZN(x)) FROM t;");

        assertEquals("SELECT MEDIAN(ISNULL(x, 0)) FROM t;", out.getText());
        assertEquals(1, out.getMetrics().getFlagged());
        assertEquals(Map.of(FunctionCategory.LOGICAL, 1), out.getMetrics().getConversionsByCategory());
    }

    @Test
    void inner_rewrites_should_stay_embedded_in_outer_calls_around_a_flagged_call() {
        ConversionOutput out = converter.convert("SELECT DATEDIFF('day', IF(MEDIAN(x) > 0, a, b), c) FROM t;");

        assertEquals("SELECT DATEDIFF(day, IIF(MEDIAN(x) > 0, a, b), c) FROM t;", out.getText());

        StatementResult st = out.getStatements().get(0);
        assertEquals(Disposition.FLAGGED, st.getDisposition());
        assertEquals(1, st.getFlaggedItems().size());
        assertEquals("MEDIAN", st.getFlaggedItems().get(0).getFunctionName());
        assertEquals(List.of("DATEDIFF", "IF", "MEDIAN"),
                st.getCallSites().stream().map(CallSiteResult::getFunctionName).toList());
    }

    @Test
    void if_block_form_should_be_flagged_not_renamed() {
        String sql = "SELECT IF (a > b) THEN 'x' ELSE 'y' END FROM t;";
        ConversionOutput out = converter.convert(sql);

        assertEquals(sql, out.getText());
        assertEquals(0, out.getMetrics().getSuccessful());
        assertEquals(1, out.getMetrics().getFlagged());

        FlaggedItem item = out.getMetrics().getFlaggedItems().get(0);
        assertEquals(FlagCode.ARGUMENT_ARITY_MISMATCH, item.getCode());
        assertEquals("IF", item.getFunctionName());
        assertMetricsInvariant(out.getMetrics());
    }

    @Test
    void qualified_table_names_should_not_be_reported_as_functions() {
        String sql = "INSERT INTO dbo.orders (a, b) VALUES (1, 2);\nCREATE TABLE dbo.orders (id INT);";
        ConversionOutput out = converter.convert(sql);

        assertEquals(sql, out.getText());
        assertEquals(2, out.getMetrics().getSuccessful());
        assertTrue(out.getMetrics().getUnsupportedFunctions().isEmpty());
        assertTrue(out.getMetrics().getFlaggedItems().isEmpty());
    }

    @Test
    void boolean_literals_inside_flagged_calls_should_be_kept() {
        ConversionOutput out = converter.convert("SELECT MEDIAN(TRUE), ZN(FALSE) FROM t WHERE a = TRUE;");

        assertEquals("SELECT MEDIAN(TRUE), ISNULL(0, 0) FROM t WHERE a = 1;", out.getText());
        assertEquals(1, out.getMetrics().getFlagged());
    }

    @Test
    void isnull_used_as_a_value_should_be_flagged() {
        ConversionOutput out = converter.convert("SELECT ISNULL(x) AS n FROM t WHERE ISNULL(y);");

        assertEquals("SELECT ISNULL(x) AS n FROM t WHERE y IS NULL;", out.getText());
        assertEquals(1, out.getMetrics().getFlagged());

        FlaggedItem item = out.getMetrics().getFlaggedItems().get(0);
        assertEquals(FlagCode.MANUAL_REVIEW_REQUIRED, item.getCode());
        assertEquals("ISNULL", item.getFunctionName());
    }

    @Test
    void empty_input_should_yield_empty_metrics() {
        ConversionOutput out = converter.convert("");
        assertEquals("", out.getText());
        assertEquals(0, out.getMetrics().getTotal());
        assertEquals(0.0, out.getMetrics().successRate(), 0.0001);

        assertEquals("", converter.convert(null).getText());
        assertEquals("  \n-- nothing\n", converter.convert("  \n-- nothing\n").getText());
    }

    @Test
    void unexpected_failure_should_degrade_to_conversion_error() {
        FunctionMappingLookup broken = new FunctionMappingLookup() {
            @Override
            public FunctionMapping find(String functionName) {
                throw new IllegalStateException("lookup down");
            }

            @Override
            public int size() {
                return 0;
            }

            @Override
            public Set<String> names() {
                return Set.of();
            }
        };

        ConversionOutput out = new SqlDialectConverter(broken).convert("SELECT NOW();\nSELECT 1;");

        assertEquals("SELECT NOW();\nSELECT 1;", out.getText());
        ConversionMetrics m = out.getMetrics();
        assertEquals(2, m.getTotal());
        assertEquals(1, m.getFlagged());
        assertEquals(1, m.getSuccessful());
        assertEquals(FlagCode.CONVERSION_ERROR, m.getFlaggedItems().get(0).getCode());
        assertTrue(m.getFlaggedItems().get(0).getReason().contains("IllegalStateException"));
    }
}
