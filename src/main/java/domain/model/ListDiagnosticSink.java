package domain.model;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * List-backed sink with de-duplication by (code|file|statement|span|message).
 */
public final class ListDiagnosticSink implements DiagnosticSink {

    private final List<ReportedDiagnostic> target;
    private final Set<String> seen = new HashSet<>(256);

    public ListDiagnosticSink(List<ReportedDiagnostic> target) {
        this.target = target;
    }

    private static String key(ReportedDiagnostic d) {
        return d.getCode() + "|"
                + d.getSourceFile() + "|"
                + d.getStatementIndex() + "|"
                + d.getStart() + ".." + d.getEnd() + "|"
                + d.getMessage();
    }

    @Override
    public void report(ReportedDiagnostic diagnostic) {
        if (diagnostic == null || target == null) return;
        if (seen.add(key(diagnostic))) {
            target.add(diagnostic);
        }
    }
}
