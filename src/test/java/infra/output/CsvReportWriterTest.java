package infra.output;

import domain.model.ReportedDiagnostic;
import domain.model.StatementReport;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CsvReportWriterTest {

    private static final CSVFormat READ = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .build();

    @TempDir
    Path tempDir;

    @Test
    void should_write_statements_and_sibling_diagnostics() throws Exception {
        Path report = tempDir.resolve("reports").resolve("cst-report.csv");
        List<StatementReport> statements = List.of(
                new StatementReport(StatementReport.STATUS_PARSED, "a.sql", 0, 0, 9, 4, 2, 1, "Statement", ""),
                new StatementReport(StatementReport.STATUS_UNSUPPORTED, "a.sql", 1, 9, 20, 0, 0, 0, "", "unsupported character '$'"));
        List<ReportedDiagnostic> diagnostics = List.of(
                new ReportedDiagnostic("PARSE_FAILED", "a.sql", 0, 0, 9, "Encountered \"a, b\""));

        new CsvReportWriter().write(report, statements, diagnostics);

        try (Reader r = Files.newBufferedReader(report, StandardCharsets.UTF_8);
             CSVParser p = READ.parse(r)) {
            List<CSVRecord> rows = p.getRecords();
            assertEquals(2, rows.size());
            assertEquals("PARSED", rows.get(0).get("status"));
            assertEquals("Statement", rows.get(0).get("rootKind"));
            assertEquals("4", rows.get(0).get("leafCount"));
            assertEquals("UNSUPPORTED_INPUT", rows.get(1).get("status"));
            assertEquals("unsupported character '$'", rows.get(1).get("message"));
        }

        Path diag = CsvReportWriter.diagnosticsPath(report);
        assertEquals("cst-report-diagnostics.csv", diag.getFileName().toString());
        try (Reader r = Files.newBufferedReader(diag, StandardCharsets.UTF_8);
             CSVParser p = READ.parse(r)) {
            List<CSVRecord> rows = p.getRecords();
            assertEquals(1, rows.size());
            assertEquals("PARSE_FAILED", rows.get(0).get("code"));
            assertEquals("Encountered \"a, b\"", rows.get(0).get("message"));
        }
    }

    @Test
    void should_reject_null_arguments() {
        CsvReportWriter w = new CsvReportWriter();
        assertThrows(IllegalArgumentException.class, () -> w.write(null, List.of(), List.of()));
        assertThrows(IllegalArgumentException.class, () -> w.write(tempDir.resolve("x.csv"), null, List.of()));
    }
}
