package app;

import domain.cst.ParseDiagnostic;
import domain.cst.ParseOutcome;
import domain.cst.SyntaxNode;
import domain.cst.SyntaxTree;
import domain.cst.SyntaxTreePrinter;
import domain.model.DiagnosticSink;
import domain.model.ReportedDiagnostic;
import domain.model.StatementReport;
import domain.source.SourceFileParseResult;
import domain.source.StatementParseResult;
import domain.source.StatementSlice;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns the parse result of one source into report rows, sink diagnostics and a
 * printable dump.
 */
final class CstReportAssembler {

    private CstReportAssembler() {
    }

    static List<StatementReport> toReports(String sourceName, SourceFileParseResult result, DiagnosticSink sink) {
        List<StatementReport> out = new ArrayList<>(result.getStatements().size());

        for (StatementParseResult r : result.getStatements()) {
            StatementSlice slice = r.getSlice();
            ParseOutcome outcome = r.getOutcome();

            if (outcome instanceof ParseOutcome.Parsed) {
                ParseOutcome.Parsed parsed = (ParseOutcome.Parsed) outcome;
                SyntaxTree tree = parsed.tree();
                SyntaxNode root = tree.rootNode();

                for (ParseDiagnostic d : parsed.diagnostics()) {
                    sink.report(ReportedDiagnostic.of(sourceName, slice.getIndex(), d));
                }
                out.add(new StatementReport(
                        StatementReport.STATUS_PARSED,
                        sourceName,
                        slice.getIndex(),
                        slice.getOffset(),
                        slice.getEnd(),
                        tree.leaves().size(),
                        tree.nodes().size(),
                        parsed.diagnostics().size(),
                        root == null ? "" : root.getKind().getName(),
                        ""));
            } else {
                ParseOutcome.UnsupportedInput unsupported = (ParseOutcome.UnsupportedInput) outcome;
                sink.report(new ReportedDiagnostic(
                        ReportedDiagnostic.UNSUPPORTED_INPUT,
                        sourceName,
                        slice.getIndex(),
                        unsupported.span().getStart(),
                        unsupported.span().getEnd(),
                        unsupported.message()));
                out.add(new StatementReport(
                        StatementReport.STATUS_UNSUPPORTED,
                        sourceName,
                        slice.getIndex(),
                        slice.getOffset(),
                        slice.getEnd(),
                        0,
                        0,
                        0,
                        "",
                        unsupported.message()));
            }
        }
        return out;
    }

    static String toDump(SourceFileParseResult result) {
        StringBuilder sb = new StringBuilder();
        for (StatementParseResult r : result.getStatements()) {
            StatementSlice slice = r.getSlice();
            sb.append("-- statement ").append(slice.getIndex())
                    .append(" @").append(slice.getOffset()).append("..").append(slice.getEnd())
                    .append('\n');

            ParseOutcome outcome = r.getOutcome();
            if (outcome instanceof ParseOutcome.Parsed) {
                ParseOutcome.Parsed parsed = (ParseOutcome.Parsed) outcome;
                sb.append(SyntaxTreePrinter.print(parsed.tree()));
                sb.append(SyntaxTreePrinter.print(parsed.diagnostics()));
            } else {
                ParseOutcome.UnsupportedInput unsupported = (ParseOutcome.UnsupportedInput) outcome;
                sb.append("UNSUPPORTED_INPUT@").append(unsupported.span()).append(": ")
                        .append(unsupported.message()).append('\n');
            }
        }
        return sb.toString();
    }
}
