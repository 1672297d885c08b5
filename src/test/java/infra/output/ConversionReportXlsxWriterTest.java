package infra.output;

import domain.convert.SqlDialectConverter;
import domain.model.FileConversionResult;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConversionReportXlsxWriterTest {

    @TempDir
    Path tempDir;

    @Test
    void should_write_result_flagged_unsupported_and_category_sheets() throws Exception {
        SqlDialectConverter converter = new SqlDialectConverter();
        List<FileConversionResult> results = List.of(
                FileConversionResult.success("a.sql", "out/a_fabric.sql",
                        converter.convert("SELECT NOW(), MEDIAN(x), FOO(1) FROM t;").getMetrics()),
                FileConversionResult.success("b.sql", "out/b_fabric.sql",
                        converter.convert("SELECT foo(2);").getMetrics()),
                FileConversionResult.skip("c.sql", "SQL_TEXT_EMPTY", null)
        );

        Path xlsx = tempDir.resolve("report/result.xlsx");
        new XlsxResultWriter(new ConversionReportXlsxWriter()).write(xlsx, results, "v-test");

        assertTrue(Files.exists(xlsx));
        try (InputStream in = Files.newInputStream(xlsx); Workbook wb = WorkbookFactory.create(in)) {
            Sheet result = wb.getSheet("result");
            assertEquals(3, result.getLastRowNum());
            assertEquals("status", result.getRow(0).getCell(0).getStringCellValue());
            assertEquals("SUCCESS", result.getRow(1).getCell(0).getStringCellValue());
            assertEquals(1.0, result.getRow(1).getCell(3).getNumericCellValue());
            assertEquals("SKIP", result.getRow(3).getCell(0).getStringCellValue());
            assertEquals("SQL_TEXT_EMPTY", result.getRow(3).getCell(8).getStringCellValue());

            Sheet flagged = wb.getSheet("flagged");
            assertEquals(3, flagged.getLastRowNum());
            assertEquals("MEDIAN", flagged.getRow(1).getCell(3).getStringCellValue());

            Sheet unsupported = wb.getSheet("unsupported");
            assertEquals(1, unsupported.getLastRowNum());
            assertEquals("FOO", unsupported.getRow(1).getCell(0).getStringCellValue());
            assertEquals(2.0, unsupported.getRow(1).getCell(1).getNumericCellValue());
            assertEquals("a.sql, b.sql", unsupported.getRow(1).getCell(2).getStringCellValue());

            Sheet categories = wb.getSheet("categories");
            assertEquals("DATE", categories.getRow(1).getCell(0).getStringCellValue());
            assertEquals(1.0, categories.getRow(1).getCell(1).getNumericCellValue());
            Row version = categories.getRow(categories.getLastRowNum());
            assertEquals("mappingVersion", version.getCell(0).getStringCellValue());
            assertEquals("v-test", version.getCell(1).getStringCellValue());
        }
    }

    @Test
    void should_reject_null_arguments() {
        ConversionReportXlsxWriter w = new ConversionReportXlsxWriter();
        assertThrows(IllegalArgumentException.class, () -> w.write(null, List.of(), "v"));
        assertThrows(IllegalArgumentException.class, () -> w.write(tempDir.resolve("x.xlsx"), null, "v"));
    }
}
