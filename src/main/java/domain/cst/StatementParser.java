package domain.cst;

import domain.grammar.AstNode;
import domain.grammar.GrammarOracle;
import domain.grammar.GrammarOracleException;
import domain.grammar.GrammarToken;

import java.util.Collections;
import java.util.List;

/**
 * Entry point: builds the lossless tree of one SQL statement.
 *
 * <p>The classifier lexer and both oracle calls run once, eagerly, then the
 * {@link Reconciler} drives a fresh {@link TreeBuilder}. Instances hold no per-call state
 * and may be shared between threads as long as the oracle can be.</p>
 */
public final class StatementParser {

    private final GrammarOracle oracle;
    private final SyntaxKindMapper kinds;

    public StatementParser(GrammarOracle oracle) {
        this(oracle, SyntaxKindMapper.identity());
    }

    public StatementParser(GrammarOracle oracle, SyntaxKindMapper kinds) {
        this.oracle = oracle == null ? GrammarOracle.none() : oracle;
        this.kinds = kinds == null ? SyntaxKindMapper.identity() : kinds;
    }

    public ParseOutcome parseStatement(String text) {
        return parseStatement(text, 0);
    }

    /**
     * @param text       one statement, terminator included if present
     * @param baseOffset added to every span of the result
     */
    public ParseOutcome parseStatement(String text, int baseOffset) {
        if (baseOffset < 0) throw new IllegalArgumentException("baseOffset must be >= 0: " + baseOffset);
        String s = text == null ? "" : text;

        List<GenericToken> generic;
        try {
            generic = ClassifierLexer.tokenize(s);
        } catch (UnsupportedInputException e) {
            return new ParseOutcome.UnsupportedInput(e.getMessage(), e.getSpan().shift(baseOffset));
        }

        TreeBuilder builder = new TreeBuilder(baseOffset);
        if (s.isEmpty()) {
            return new ParseOutcome.Parsed(builder.finish(), builder.getDiagnostics());
        }

        SourceSpan whole = SourceSpan.of(0, s.length());
        List<GrammarToken> grammarTokens = scan(s, whole, builder);
        List<AstNode> astNodes = parse(s, whole, builder);

        new Reconciler(kinds).reconcile(s, generic, grammarTokens, astNodes, builder);
        return new ParseOutcome.Parsed(builder.finish(), builder.getDiagnostics());
    }

    private List<GrammarToken> scan(String s, SourceSpan whole, TreeBuilder builder) {
        try {
            List<GrammarToken> tokens = oracle.scan(s);
            return tokens == null ? Collections.emptyList() : tokens;
        } catch (GrammarOracleException e) {
            builder.recordError(DiagnosticCode.SCAN_FAILED, messageOf(e), reportedSpan(e, whole));
        } catch (RuntimeException e) {
            builder.recordError(DiagnosticCode.SCAN_FAILED, messageOf(e), whole);
        }
        return Collections.emptyList();
    }

    private List<AstNode> parse(String s, SourceSpan whole, TreeBuilder builder) {
        try {
            List<AstNode> nodes = oracle.parse(s);
            return nodes == null ? Collections.emptyList() : nodes;
        } catch (GrammarOracleException e) {
            builder.recordError(DiagnosticCode.PARSE_FAILED, messageOf(e), reportedSpan(e, whole));
        } catch (RuntimeException e) {
            builder.recordError(DiagnosticCode.PARSE_FAILED, messageOf(e), whole);
        }
        return Collections.emptyList();
    }

    // oracle ranges are trusted only when they fit inside the statement
    private static SourceSpan reportedSpan(GrammarOracleException e, SourceSpan whole) {
        SourceSpan span = e.getSpan();
        if (span == null || span.getEnd() > whole.getEnd()) return whole;
        return span;
    }

    private static String messageOf(Exception e) {
        String m = e.getMessage();
        if (m == null || m.isBlank()) return e.getClass().getSimpleName();
        return m.trim();
    }
}
