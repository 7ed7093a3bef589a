package domain.grammar;

import java.util.List;

/**
 * Grammar-aware scanner/parser consulted while building a tree.
 *
 * <p>Both calls see the same statement text and may fail independently. {@link #parse}
 * does not have to return nodes in document order.</p>
 */
public interface GrammarOracle {

    /** Oracle that knows no grammar: empty results, never fails. */
    static GrammarOracle none() {
        return NoGrammarOracle.INSTANCE;
    }

    List<GrammarToken> scan(String text) throws GrammarOracleException;

    List<AstNode> parse(String text) throws GrammarOracleException;
}
