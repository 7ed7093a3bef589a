package domain.source;

import domain.cst.StatementParser;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Parses every statement of a SQL source, each with its offset in the source so spans of
 * all trees share one coordinate space. Unsupported input in one statement does not stop
 * the others.
 */
public final class SourceFileParser {

    private final StatementParser statementParser;

    public SourceFileParser(StatementParser statementParser) {
        this.statementParser = Objects.requireNonNull(statementParser, "statementParser");
    }

    public SourceFileParseResult parse(String source) {
        List<StatementParseResult> out = new ArrayList<>();
        for (StatementSlice slice : SqlStatementSplitter.split(source)) {
            out.add(new StatementParseResult(slice, statementParser.parseStatement(slice.getText(), slice.getOffset())));
        }
        return new SourceFileParseResult(source, out);
    }
}
