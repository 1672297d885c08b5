package domain.convert;

import domain.mapping.TableauFabricMappings;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FunctionCallRecognizerTest {

    private final FunctionCallRecognizer recognizer = new FunctionCallRecognizer(TableauFabricMappings.defaults());

    private static List<String> names(List<CallSite> sites) {
        return sites.stream().map(CallSite::getName).toList();
    }

    @Test
    void should_find_calls_in_source_order_with_spans() {
        String sql = "SELECT NOW() AS t, UPPER (name) FROM c";
        List<CallSite> sites = recognizer.recognize(sql, 1);

        assertEquals(List.of("NOW", "UPPER"), names(sites));

        CallSite upper = sites.get(1);
        assertEquals(sql.indexOf("UPPER"), upper.getNameStart());
        assertEquals(sql.indexOf('(', upper.getNameEnd()), upper.getOpenParen());
        assertEquals("name", upper.getArgumentText());
        assertTrue(upper.isMapped());
    }

    @Test
    void should_link_nested_calls_to_enclosing_call() {
        List<CallSite> sites = recognizer.recognize("SELECT UPPER(TRIM(LEFT(a, 2))), (ABS(b))", 1);

        assertEquals(List.of("UPPER", "TRIM", "LEFT", "ABS"), names(sites));
        assertEquals(CallSite.NO_PARENT, sites.get(0).getParent());
        assertEquals(0, sites.get(1).getParent());
        assertEquals(1, sites.get(2).getParent());
        // grouping parentheses are not calls
        assertEquals(CallSite.NO_PARENT, sites.get(3).getParent());
    }

    @Test
    void should_skip_keywords_literals_comments_and_variables() {
        String sql = "SELECT 'UPPER(x)', [LOWER(y)], \"ABS(z)\" -- SUM(a)\n"
                + "FROM t WHERE EXISTS (SELECT 1) AND a IN (1) AND @fn(1) = 1 /* MAX(b) */";

        assertTrue(recognizer.recognize(sql, 1).isEmpty());
    }

    @Test
    void should_not_treat_object_names_as_calls() {
        assertEquals(List.of("CAST"), names(recognizer.recognize("SELECT CAST(x AS VARCHAR(20))", 1)));
        assertTrue(recognizer.recognize("INSERT INTO orders(a, b) VALUES (1, 2)", 1).isEmpty());
        assertTrue(recognizer.recognize("INSERT INTO dbo.orders (a, b) VALUES (1, 2)", 1).isEmpty());
        assertTrue(recognizer.recognize("CREATE TABLE dbo.orders (id INT)", 1).isEmpty());
        assertTrue(recognizer.recognize("CREATE TABLE [sales].\"dbo\".[orders] (id INT)", 1).isEmpty());
        assertTrue(recognizer.recognize("INSERT INTO /* target */ sales . dbo.orders(a) SELECT 1", 1).isEmpty());
        assertEquals(List.of("UPPER", "fn"),
                names(recognizer.recognize("INSERT INTO dbo.t (a) SELECT UPPER(x) FROM s WHERE dbo.fn(y) = 1", 1)));
    }

    @Test
    void should_match_maximal_identifier_not_prefix() {
        List<CallSite> sites = recognizer.recognize("SELECT DATENAME('month', d), DATEADD('day', 1, d)", 1);

        assertEquals(List.of("DATENAME", "DATEADD"), names(sites));
        assertEquals("DATENAME", sites.get(0).getMapping().getSourceName());
    }

    @Test
    void should_resolve_unknown_and_mixed_case_names() {
        List<CallSite> sites = recognizer.recognize("SELECT now(), My_Udf(1)", 1);

        assertEquals("NOW", sites.get(0).getMapping().getSourceName());
        assertNull(sites.get(1).getMapping());
        assertFalse(sites.get(1).isMapped());
    }

    @Test
    void should_report_source_line_of_each_call() {
        List<CallSite> sites = recognizer.recognize("SELECT a,\n  MEDIAN(x),\n\n  ZN(y)", 10);

        assertEquals(11, sites.get(0).getLine());
        assertEquals(13, sites.get(1).getLine());
    }
}
