package infra.output;

import domain.model.ReportedDiagnostic;
import domain.model.StatementReport;
import domain.output.ReportWriter;

import java.nio.file.Path;
import java.util.List;

/**
 * No-op implementation (feature toggle).
 */
public final class NullReportWriter implements ReportWriter {
    @Override
    public void write(Path report, List<StatementReport> statements, List<ReportedDiagnostic> diagnostics) {
        // intentionally no-op
    }
}
