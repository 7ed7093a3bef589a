package domain.model;

/**
 * Sink for diagnostics reported while processing many sources.
 *
 * <p>Lets the batch runner collect diagnostics without coupling the parsing loop to a
 * particular report format.</p>
 */
public interface DiagnosticSink {

    static DiagnosticSink none() {
        return NullDiagnosticSink.INSTANCE;
    }

    void report(ReportedDiagnostic diagnostic);
}
