package infra.output;

import domain.text.SqlSource;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class FileSqlOutputWriterTest {

    @TempDir
    Path tempDir;

    @Test
    void should_write_sql_under_mirrored_directory_with_suffix() throws Exception {
        FileSqlOutputWriter w = new FileSqlOutputWriter();

        Path out = tempDir.resolve("output");
        SqlSource src = new SqlSource(tempDir.resolve("in/reports/sales.sql"), "reports/sales.sql");

        Path written = w.write(out, src, "-- test\nSELECT GETDATE()");

        Path expected = out.resolve("reports").resolve("sales_fabric.sql").toAbsolutePath().normalize();
        assertEquals(expected, written);
        assertTrue(Files.exists(expected), "expected file not found: " + expected);
        assertEquals("-- test\nSELECT GETDATE()", Files.readString(expected));
    }

    @Test
    void null_writer_should_write_nothing() {
        SqlSource src = new SqlSource(tempDir.resolve("a.sql"), "a.sql");
        assertNull(new NullSqlOutputWriter().write(tempDir, src, "SELECT 1"));
        assertFalse(Files.exists(tempDir.resolve("a_fabric.sql")));
    }
}
