package domain.cst;

import domain.grammar.AstNode;
import domain.grammar.GrammarToken;

/**
 * Lookup from oracle token/node kinds to tree kinds.
 *
 * <p>The default keeps the oracle's names as they are.</p>
 */
public interface SyntaxKindMapper {

    static SyntaxKindMapper identity() {
        return IdentitySyntaxKindMapper.INSTANCE;
    }

    SyntaxKind tokenKind(GrammarToken token);

    SyntaxKind nodeKind(AstNode node);
}
