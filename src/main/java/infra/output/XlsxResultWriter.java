package infra.output;

import domain.model.FormatResult;
import domain.output.ResultWriter;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;

import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * XLSX run report.
 *
 * <p>Sheets:
 * <ul>
 *   <li>result: one row per formatted input (SUCCESS/FAIL)</li>
 *   <li>summary: totals</li>
 * </ul>
 */
public final class XlsxResultWriter implements ResultWriter {

    public static final String SHEET_RESULT = "result";
    static final String SHEET_SUMMARY = "summary";

    private static void writeResultSheet(Workbook wb, List<FormatResult> results) {
        Sheet sh = wb.createSheet(SHEET_RESULT);
        int r = 0;
        Row header = sh.createRow(r++);
        header.createCell(0)
                .setCellValue("status");
        header.createCell(1)
                .setCellValue("source");
        header.createCell(2)
                .setCellValue("target");
        header.createCell(3)
                .setCellValue("inputChars");
        header.createCell(4)
                .setCellValue("outputChars");
        header.createCell(5)
                .setCellValue("elapsedMs");
        header.createCell(6)
                .setCellValue("message");

        for (FormatResult it : results) {
            Row row = sh.createRow(r++);
            row.createCell(0)
                    .setCellValue(it.getStatus());
            row.createCell(1)
                    .setCellValue(it.getSource());
            row.createCell(2)
                    .setCellValue(it.getTarget());
            row.createCell(3)
                    .setCellValue(it.getInputChars());
            row.createCell(4)
                    .setCellValue(it.getOutputChars());
            row.createCell(5)
                    .setCellValue(it.getElapsedMs());
            row.createCell(6)
                    .setCellValue(it.getMessage());
        }
    }

    private static void writeSummarySheet(Workbook wb, List<FormatResult> results) {
        int success = 0;
        long inChars = 0;
        long outChars = 0;
        for (FormatResult it : results) {
            if (it.isSuccess()) success++;
            inChars += it.getInputChars();
            outChars += it.getOutputChars();
        }

        Sheet sh = wb.createSheet(SHEET_SUMMARY);
        int r = 0;
        r = summaryRow(sh, r, "total", results.size());
        r = summaryRow(sh, r, "success", success);
        r = summaryRow(sh, r, "fail", results.size() - success);
        r = summaryRow(sh, r, "inputChars", inChars);
        summaryRow(sh, r, "outputChars", outChars);
    }

    private static int summaryRow(Sheet sh, int r, String key, long value) {
        Row row = sh.createRow(r);
        row.createCell(0)
                .setCellValue(key);
        row.createCell(1)
                .setCellValue(value);
        return r + 1;
    }

    @Override
    public void write(Path reportFile, List<FormatResult> results) {
        if (reportFile == null) throw new IllegalArgumentException("reportFile is null");
        if (results == null) throw new IllegalArgumentException("results is null");

        try {
            Path parent = reportFile.toAbsolutePath()
                    .normalize()
                    .getParent();
            if (parent != null) Files.createDirectories(parent);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to create report parent dir: " + reportFile, e);
        }

        try (Workbook wb = new XSSFWorkbook()) {
            writeResultSheet(wb, results);
            writeSummarySheet(wb, results);

            try (OutputStream os = Files.newOutputStream(reportFile)) {
                wb.write(os);
            }
        } catch (Exception e) {
            throw new IllegalStateException("Failed to write xlsx: " + reportFile, e);
        }
    }
}
