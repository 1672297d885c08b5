package infra.output;

import domain.mapping.FunctionCategory;
import domain.model.ConversionMetrics;
import domain.model.FileConversionResult;
import domain.model.FlaggedItem;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;

import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * XLSX report writer.
 *
 * <p>Sheets:
 * <ul>
 *   <li>result: one row per input file (SUCCESS/SKIP, statement counts, success rate)</li>
 *   <li>flagged: every flagged item with file, statement, line and reason</li>
 *   <li>unsupported: unsupported functions and the files they occur in</li>
 *   <li>categories: converted calls per function category, plus the mapping table version</li>
 * </ul>
 */
public final class ConversionReportXlsxWriter {

    static final String[] RESULT_HEADER = {
            "status", "file", "outputFile", "total", "successful", "flagged", "syntaxError",
            "successRate", "message", "detail"
    };
    static final String[] FLAGGED_HEADER = {"file", "statement", "line", "function", "code", "reason"};
    static final String[] UNSUPPORTED_HEADER = {"function", "fileCount", "files"};
    static final String[] CATEGORY_HEADER = {"category", "conversions"};

    private static void header(Sheet sh, String[] names) {
        Row header = sh.createRow(0);
        for (int i = 0; i < names.length; i++) {
            header.createCell(i)
                    .setCellValue(names[i]);
        }
    }

    private static void writeResultSheet(Workbook wb, List<FileConversionResult> results) {
        Sheet sh = wb.createSheet("result");
        header(sh, RESULT_HEADER);
        int r = 1;

        for (FileConversionResult it : results) {
            Row row = sh.createRow(r++);
            row.createCell(0)
                    .setCellValue(nullToEmpty(it.getStatus()));
            row.createCell(1)
                    .setCellValue(nullToEmpty(it.getInputFile()));
            row.createCell(2)
                    .setCellValue(nullToEmpty(it.getOutputFile()));

            ConversionMetrics m = it.getMetrics();
            if (m != null) {
                row.createCell(3)
                        .setCellValue(m.getTotal());
                row.createCell(4)
                        .setCellValue(m.getSuccessful());
                row.createCell(5)
                        .setCellValue(m.getFlagged());
                row.createCell(6)
                        .setCellValue(m.getSyntaxError());
                row.createCell(7)
                        .setCellValue(Math.round(m.successRate() * 10.0) / 10.0);
            }
            row.createCell(8)
                    .setCellValue(nullToEmpty(it.getMessage()));
            row.createCell(9)
                    .setCellValue(nullToEmpty(it.getDetail()));
        }
    }

    private static void writeFlaggedSheet(Workbook wb, List<FileConversionResult> results) {
        Sheet sh = wb.createSheet("flagged");
        header(sh, FLAGGED_HEADER);
        int r = 1;

        for (FileConversionResult it : results) {
            if (it.getMetrics() == null) continue;
            for (FlaggedItem f : it.getMetrics().getFlaggedItems()) {
                Row row = sh.createRow(r++);
                row.createCell(0)
                        .setCellValue(nullToEmpty(it.getInputFile()));
                row.createCell(1)
                        .setCellValue(f.getStatementNumber());
                row.createCell(2)
                        .setCellValue(f.getLine());
                row.createCell(3)
                        .setCellValue(nullToEmpty(f.getFunctionName()));
                row.createCell(4)
                        .setCellValue(f.getCode() == null ? "" : f.getCode().name());
                row.createCell(5)
                        .setCellValue(nullToEmpty(f.getReason()));
            }
        }
    }

    private static void writeUnsupportedSheet(Workbook wb, List<FileConversionResult> results) {
        // function -> files, both in first-seen order
        Map<String, Set<String>> byFunction = new LinkedHashMap<>();
        for (FileConversionResult it : results) {
            if (it.getMetrics() == null) continue;
            for (String fn : it.getMetrics().getUnsupportedFunctions()) {
                byFunction.computeIfAbsent(fn, k -> new LinkedHashSet<>()).add(it.getInputFile());
            }
        }

        Sheet sh = wb.createSheet("unsupported");
        header(sh, UNSUPPORTED_HEADER);
        int r = 1;

        for (Map.Entry<String, Set<String>> e : byFunction.entrySet()) {
            Row row = sh.createRow(r++);
            row.createCell(0)
                    .setCellValue(e.getKey());
            row.createCell(1)
                    .setCellValue(e.getValue().size());
            row.createCell(2)
                    .setCellValue(String.join(", ", e.getValue()));
        }
    }

    private static void writeCategoriesSheet(Workbook wb, List<FileConversionResult> results, String mappingVersion) {
        ConversionMetrics total = ConversionMetrics.empty();
        for (FileConversionResult it : results) {
            if (it.getMetrics() != null) total = ConversionMetrics.merge(total, it.getMetrics());
        }

        Sheet sh = wb.createSheet("categories");
        header(sh, CATEGORY_HEADER);
        int r = 1;

        Map<FunctionCategory, Integer> counts = total.getConversionsByCategory();
        for (FunctionCategory c : FunctionCategory.values()) {
            Row row = sh.createRow(r++);
            row.createCell(0)
                    .setCellValue(c.name());
            row.createCell(1)
                    .setCellValue(counts.getOrDefault(c, 0));
        }

        r++;
        Row v = sh.createRow(r);
        v.createCell(0)
                .setCellValue("mappingVersion");
        v.createCell(1)
                .setCellValue(nullToEmpty(mappingVersion));
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }

    public void write(Path resultXlsx, List<FileConversionResult> results, String mappingVersion) {
        if (resultXlsx == null) throw new IllegalArgumentException("resultXlsx is null");
        if (results == null) throw new IllegalArgumentException("results is null");

        try {
            Path parent = resultXlsx.toAbsolutePath()
                    .normalize()
                    .getParent();
            if (parent != null) Files.createDirectories(parent);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to create resultXlsx parent dir: " + resultXlsx, e);
        }

        try (Workbook wb = new XSSFWorkbook()) {
            writeResultSheet(wb, results);
            writeFlaggedSheet(wb, results);
            writeUnsupportedSheet(wb, results);
            writeCategoriesSheet(wb, results, mappingVersion);

            try (OutputStream os = Files.newOutputStream(resultXlsx)) {
                wb.write(os);
            }
        } catch (Exception e) {
            throw new IllegalStateException("Failed to write xlsx: " + resultXlsx, e);
        }
    }
}
