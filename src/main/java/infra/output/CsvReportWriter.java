package infra.output;

import domain.model.ReportedDiagnostic;
import domain.model.StatementReport;
import domain.output.ReportWriter;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;

import java.io.BufferedWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * CSV report writer (UTF-8).
 *
 * <p>Statements go to the given file, diagnostics to a sibling
 * {@code <name>-diagnostics.csv}.</p>
 */
public final class CsvReportWriter implements ReportWriter {

    private static final CSVFormat STATEMENTS = CSVFormat.DEFAULT
            .builder()
            .setHeader("status", "sourceFile", "statementIndex", "start", "end",
                    "leafCount", "nodeCount", "diagnosticCount", "rootKind", "message")
            .build();

    private static final CSVFormat DIAGNOSTICS = CSVFormat.DEFAULT
            .builder()
            .setHeader("code", "sourceFile", "statementIndex", "start", "end", "message")
            .build();

    public static Path diagnosticsPath(Path report) {
        String name = report.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String base = dot > 0 ? name.substring(0, dot) : name;
        return report.resolveSibling(base + "-diagnostics.csv");
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

        try (BufferedWriter w = Files.newBufferedWriter(report, StandardCharsets.UTF_8);
             CSVPrinter printer = new CSVPrinter(w, STATEMENTS)) {
            for (StatementReport it : statements) {
                printer.printRecord(
                        it.getStatus(),
                        it.getSourceFile(),
                        it.getStatementIndex(),
                        it.getStart(),
                        it.getEnd(),
                        it.getLeafCount(),
                        it.getNodeCount(),
                        it.getDiagnosticCount(),
                        it.getRootKind(),
                        it.getMessage());
            }
        } catch (Exception e) {
            throw new IllegalStateException("Failed to write csv: " + report, e);
        }

        Path diagnosticsCsv = diagnosticsPath(report);
        try (BufferedWriter w = Files.newBufferedWriter(diagnosticsCsv, StandardCharsets.UTF_8);
             CSVPrinter printer = new CSVPrinter(w, DIAGNOSTICS)) {
            for (ReportedDiagnostic d : diagnostics) {
                printer.printRecord(
                        d.getCode(),
                        d.getSourceFile(),
                        d.getStatementIndex(),
                        d.getStart(),
                        d.getEnd(),
                        d.getMessage());
            }
        } catch (Exception e) {
            throw new IllegalStateException("Failed to write csv: " + diagnosticsCsv, e);
        }
    }
}
