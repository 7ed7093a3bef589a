package domain.model;

import domain.cst.DiagnosticCode;
import domain.cst.ParseDiagnostic;
import domain.cst.SourceSpan;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ListDiagnosticSinkTest {

    @Test
    void should_dedupe_identical_diagnostics() {
        List<ReportedDiagnostic> out = new ArrayList<>();
        ListDiagnosticSink sink = new ListDiagnosticSink(out);

        ParseDiagnostic d = new ParseDiagnostic(DiagnosticCode.PARSE_FAILED, "boom", SourceSpan.of(3, 9));
        sink.report(ReportedDiagnostic.of("a.sql", 0, d));
        sink.report(ReportedDiagnostic.of("a.sql", 0, d));
        sink.report(ReportedDiagnostic.of("a.sql", 1, d));
        sink.report(null);

        assertEquals(2, out.size());
        ReportedDiagnostic first = out.get(0);
        assertEquals("PARSE_FAILED", first.getCode());
        assertEquals("a.sql", first.getSourceFile());
        assertEquals(3, first.getStart());
        assertEquals(9, first.getEnd());
        assertEquals("boom", first.getMessage());
    }

    @Test
    void none_discards_everything() {
        DiagnosticSink sink = DiagnosticSink.none();
        assertDoesNotThrow(() -> sink.report(new ReportedDiagnostic(null, null, 0, 0, 0, null)));
    }
}
