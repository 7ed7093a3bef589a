package domain.output;

import domain.model.ReportedDiagnostic;
import domain.model.StatementReport;

import java.nio.file.Path;
import java.util.List;

/** Stores the statement/diagnostic report. */
public interface ReportWriter {

    void write(Path report, List<StatementReport> statements, List<ReportedDiagnostic> diagnostics);
}
