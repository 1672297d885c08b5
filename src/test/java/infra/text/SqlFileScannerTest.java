package infra.text;

import domain.text.SqlSource;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SqlFileScannerTest {

    @TempDir
    Path tempDir;

    @Test
    void should_walk_directory_for_sql_and_txt_files_in_sorted_order() throws Exception {
        Files.createDirectories(tempDir.resolve("b"));
        Files.writeString(tempDir.resolve("b/two.SQL"), "SELECT 2");
        Files.writeString(tempDir.resolve("a.txt"), "SELECT 1");
        Files.writeString(tempDir.resolve("notes.md"), "# not sql");

        List<SqlSource> found = new SqlFileScanner().scan(tempDir);

        assertEquals(List.of("a.txt", "b/two.SQL"), found.stream().map(SqlSource::getRelativePath).toList());
    }

    @Test
    void should_return_single_file_as_is() throws Exception {
        Path f = Files.writeString(tempDir.resolve("query.dat"), "SELECT 1");

        List<SqlSource> found = new SqlFileScanner().scan(f);

        assertEquals(1, found.size());
        assertEquals("query.dat", found.get(0).getRelativePath());
    }

    @Test
    void should_fail_on_missing_input() {
        assertThrows(IllegalArgumentException.class, () -> new SqlFileScanner().scan(tempDir.resolve("nope")));
    }

    @Test
    void provider_should_strip_bom() throws Exception {
        Path f = tempDir.resolve("bom.sql");
        Files.write(f, "\uFEFFSELECT 1".getBytes(StandardCharsets.UTF_8));

        assertEquals("SELECT 1", new Utf8SqlTextProvider().read(new SqlSource(f, "bom.sql")));
    }

    @Test
    void provider_should_wrap_io_failure() {
        SqlSource missing = new SqlSource(tempDir.resolve("missing.sql"), "missing.sql");
        IllegalStateException e = assertThrows(IllegalStateException.class, () -> new Utf8SqlTextProvider().read(missing));
        assertTrue(e.getMessage().startsWith("Failed to read sql file: "));
    }
}
