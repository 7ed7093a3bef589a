package domain.source;

import domain.cst.ParseDiagnostic;
import domain.cst.ParseOutcome;

import java.util.ArrayList;
import java.util.List;

/** Per-statement results for one SQL source. */
public final class SourceFileParseResult {

    private final String source;
    private final List<StatementParseResult> statements;

    public SourceFileParseResult(String source, List<StatementParseResult> statements) {
        this.source = source == null ? "" : source;
        this.statements = statements == null ? List.of() : List.copyOf(statements);
    }

    public String getSource() {
        return source;
    }

    public List<StatementParseResult> getStatements() {
        return statements;
    }

    public int unsupportedCount() {
        int n = 0;
        for (StatementParseResult r : statements) {
            if (!r.isParsed()) n++;
        }
        return n;
    }

    /** Diagnostics of all parsed statements, in source order; spans are source offsets. */
    public List<ParseDiagnostic> diagnostics() {
        List<ParseDiagnostic> out = new ArrayList<>();
        for (StatementParseResult r : statements) {
            if (r.getOutcome() instanceof ParseOutcome.Parsed) {
                out.addAll(((ParseOutcome.Parsed) r.getOutcome()).diagnostics());
            }
        }
        return out;
    }

    /** Leaf text of every parsed statement, concatenated. Equals the source when all parsed. */
    public String text() {
        StringBuilder sb = new StringBuilder(source.length());
        for (StatementParseResult r : statements) {
            if (r.getOutcome() instanceof ParseOutcome.Parsed) {
                sb.append(((ParseOutcome.Parsed) r.getOutcome()).tree().text());
            }
        }
        return sb.toString();
    }
}
