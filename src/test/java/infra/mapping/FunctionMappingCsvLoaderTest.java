package infra.mapping;

import domain.mapping.FunctionCategory;
import domain.mapping.FunctionMapping;
import domain.mapping.RuleKind;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.StringReader;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FunctionMappingCsvLoaderTest {

    @TempDir
    Path tempDir;

    private final FunctionMappingCsvLoader loader = new FunctionMappingCsvLoader();

    private static Path fixture(String name) throws URISyntaxException {
        return Path.of(FunctionMappingCsvLoaderTest.class.getResource("/" + name).toURI());
    }

    @Test
    void should_load_direct_and_flag_rows_and_skip_comments() throws Exception {
        List<FunctionMapping> rows = loader.load(fixture("mapping_override.csv"));

        assertEquals(3, rows.size());

        FunctionMapping udf = rows.get(0);
        assertEquals("MY_UDF", udf.getSourceName());
        assertEquals("MY_UDF_V2", udf.getTargetName());
        assertEquals(RuleKind.DIRECT, udf.getKind());

        assertEquals(FunctionCategory.AGGREGATE, rows.get(1).getCategory());

        FunctionMapping legacy = rows.get(2);
        assertEquals(RuleKind.FLAG, legacy.getKind());
        assertEquals("LEGACY_FN has no Fabric counterpart", legacy.getReason());
    }

    @Test
    void should_accept_bom_and_any_column_order() throws Exception {
        String csv = "\uFEFFKind,Source,Target\nDIRECT,ifnull,ISNULL\n";
        List<FunctionMapping> rows = loader.load(new StringReader(csv), "inline");

        assertEquals(1, rows.size());
        assertEquals("IFNULL", rows.get(0).getSourceName());
        assertEquals(FunctionCategory.OTHER, rows.get(0).getCategory());
    }

    @Test
    void should_reject_invalid_rows_with_location() {
        IllegalArgumentException noTarget = assertThrows(IllegalArgumentException.class,
                () -> loader.load(new StringReader("source,kind,target\nX,DIRECT,\n"), "m.csv"));
        assertTrue(noTarget.getMessage().contains("mapping csv m.csv line 2"), noTarget.getMessage());

        assertThrows(IllegalArgumentException.class,
                () -> loader.load(new StringReader("source,kind\nX,REORDER\n"), "m.csv"));
        assertThrows(IllegalArgumentException.class,
                () -> loader.load(new StringReader("source,kind\nX,RENAME\n"), "m.csv"));
        assertThrows(IllegalArgumentException.class,
                () -> loader.load(new StringReader("source,target\nX,Y\n"), "m.csv"));
    }

    @Test
    void should_fail_on_missing_file() {
        assertThrows(IllegalArgumentException.class, () -> loader.load(tempDir.resolve("absent.csv")));
    }

    @Test
    void empty_file_should_yield_no_rows() throws Exception {
        Path empty = Files.writeString(tempDir.resolve("empty.csv"), "");
        assertTrue(loader.load(empty).isEmpty());
    }
}
