package infra.output;

import domain.model.ReportedDiagnostic;
import domain.model.StatementReport;
import domain.output.ReportWriter;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;

import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * XLSX report writer.
 *
 * <p>Sheets:
 * <ul>
 *   <li>statements: one row per statement (PARSED / UNSUPPORTED_INPUT, counts, root kind)</li>
 *   <li>diagnostics: non-fatal diagnostics and unsupported-input failures</li>
 * </ul>
 */
public final class XlsxReportWriter implements ReportWriter {

    private static final String[] STATEMENT_HEADERS = {
            "status", "sourceFile", "statementIndex", "start", "end",
            "leafCount", "nodeCount", "diagnosticCount", "rootKind", "message"
    };

    private static final String[] DIAGNOSTIC_HEADERS = {
            "code", "sourceFile", "statementIndex", "start", "end", "message"
    };

    private static void writeHeader(Sheet sh, String[] headers) {
        Row header = sh.createRow(0);
        for (int i = 0; i < headers.length; i++) {
            header.createCell(i)
                    .setCellValue(headers[i]);
        }
    }

    private static void writeStatementsSheet(Workbook wb, List<StatementReport> statements) {
        Sheet sh = wb.createSheet("statements");
        writeHeader(sh, STATEMENT_HEADERS);
        int r = 1;

        for (StatementReport it : statements) {
            Row row = sh.createRow(r++);
            row.createCell(0)
                    .setCellValue(it.getStatus());
            row.createCell(1)
                    .setCellValue(it.getSourceFile());
            row.createCell(2)
                    .setCellValue(it.getStatementIndex());
            row.createCell(3)
                    .setCellValue(it.getStart());
            row.createCell(4)
                    .setCellValue(it.getEnd());
            row.createCell(5)
                    .setCellValue(it.getLeafCount());
            row.createCell(6)
                    .setCellValue(it.getNodeCount());
            row.createCell(7)
                    .setCellValue(it.getDiagnosticCount());
            row.createCell(8)
                    .setCellValue(it.getRootKind());
            row.createCell(9)
                    .setCellValue(it.getMessage());
        }
    }

    private static void writeDiagnosticsSheet(Workbook wb, List<ReportedDiagnostic> diagnostics) {
        Sheet sh = wb.createSheet("diagnostics");
        writeHeader(sh, DIAGNOSTIC_HEADERS);
        int r = 1;

        for (ReportedDiagnostic d : diagnostics) {
            Row row = sh.createRow(r++);
            row.createCell(0)
                    .setCellValue(d.getCode());
            row.createCell(1)
                    .setCellValue(d.getSourceFile());
            row.createCell(2)
                    .setCellValue(d.getStatementIndex());
            row.createCell(3)
                    .setCellValue(d.getStart());
            row.createCell(4)
                    .setCellValue(d.getEnd());
            // xlsx cells are capped at 32767 chars
            row.createCell(5)
                    .setCellValue(limit(d.getMessage(), 32_000));
        }
    }

    private static String limit(String s, int max) {
        if (s == null) return "";
        return s.length() <= max ? s : s.substring(0, max);
    }

    @Override
    public void write(Path report, List<StatementReport> statements, List<ReportedDiagnostic> diagnostics) {
        if (report == null) throw new IllegalArgumentException("report is null");
        if (statements == null) throw new IllegalArgumentException("statements is null");
        if (diagnostics == null) throw new IllegalArgumentException("diagnostics is null");

        try {
            Path parent = report.toAbsolutePath()
                    .normalize()
                    .getParent();
            if (parent != null) Files.createDirectories(parent);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to create report parent dir: " + report, e);
        }

        try (Workbook wb = new XSSFWorkbook()) {
            writeStatementsSheet(wb, statements);
            writeDiagnosticsSheet(wb, diagnostics);

            try (OutputStream os = Files.newOutputStream(report)) {
                wb.write(os);
            }
        } catch (Exception e) {
            throw new IllegalStateException("Failed to write xlsx: " + report, e);
        }
    }
}
