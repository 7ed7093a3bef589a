package domain.cst;

import domain.grammar.AstNode;
import domain.grammar.GrammarToken;

/** Uses the oracle's kind names unchanged. */
final class IdentitySyntaxKindMapper implements SyntaxKindMapper {

    static final IdentitySyntaxKindMapper INSTANCE = new IdentitySyntaxKindMapper();

    private IdentitySyntaxKindMapper() {
    }

    @Override
    public SyntaxKind tokenKind(GrammarToken token) {
        return SyntaxKind.token(token.getKind());
    }

    @Override
    public SyntaxKind nodeKind(AstNode node) {
        return SyntaxKind.node(node.getKind());
    }
}
