package domain.cst;

import domain.grammar.AstNode;
import domain.grammar.GrammarToken;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Merges classifier tokens, grammar tokens and AST node starts into one pass over a
 * {@link TreeBuilder}.
 *
 * <p>The classifier tokens drive the loop because they cover every character. For each of
 * them the reconciler</p>
 * <ol>
 *   <li>opens every pending AST node that starts before the token ends,</li>
 *   <li>picks the grammar token kind when the next grammar token starts or ends inside the
 *   token, the classifier kind otherwise,</li>
 *   <li>appends the token text as a leaf of the innermost open node.</li>
 * </ol>
 * <p>Leaf text is always sliced with classifier boundaries. Grammar spans only select kinds.</p>
 */
public final class Reconciler {

    private static final Comparator<AstNode> BY_POSITION = Comparator.comparingInt(AstNode::getPosition);

    private final SyntaxKindMapper kinds;

    public Reconciler() {
        this(SyntaxKindMapper.identity());
    }

    public Reconciler(SyntaxKindMapper kinds) {
        this.kinds = kinds == null ? SyntaxKindMapper.identity() : kinds;
    }

    /**
     * Builds the tree for {@code text} into {@code builder}.
     *
     * @param astNodes AST nodes in any order; sorted here by position (stable, so a parent
     *                 reported before a child at the same position stays first)
     */
    public void reconcile(String text,
                          List<GenericToken> genericTokens,
                          List<GrammarToken> grammarTokens,
                          List<AstNode> astNodes,
                          TreeBuilder builder) {
        String s = text == null ? "" : text;

        List<AstNode> sorted = new ArrayList<>(astNodes == null ? List.of() : astNodes);
        sorted.sort(BY_POSITION);

        TokenCursor<GenericToken> generic = new TokenCursor<>(genericTokens);
        TokenCursor<AstNode> nodes = new TokenCursor<>(sorted);
        TokenCursor<GrammarToken> fine = new TokenCursor<>(grammarTokens);

        // the first node is the statement root; every later token has a node to attach to
        if (nodes.hasNext()) {
            AstNode root = nodes.advance();
            openNode(root, SourceSpan.empty(clamp(root.getPosition(), s.length())), builder);
        }

        while (generic.hasNext()) {
            GenericToken token = generic.advance();
            SourceSpan span = token.getSpan();

            while (nodes.hasNext() && nodes.peek().getPosition() < span.getEnd()) {
                openNode(nodes.advance(), span, builder);
            }

            builder.appendLeaf(resolveKind(token, fine), token.slice(s));
        }

        if (nodes.hasNext()) {
            AstNode first = nodes.peek();
            builder.recordError(DiagnosticCode.NODE_OUT_OF_RANGE,
                    nodes.remaining() + " AST node(s) start at or after the end of the statement (first: "
                            + first.getKind() + " at " + first.getPosition() + ")",
                    SourceSpan.empty(s.length()));
        }

        builder.closeTo(1);
    }

    private SyntaxKind resolveKind(GenericToken token, TokenCursor<GrammarToken> fine) {
        SourceSpan span = token.getSpan();

        // grammar tokens left behind (wholly before this token) can no longer match anything
        while (fine.hasNext() && isBehind(fine.peek().getSpan(), span)) {
            fine.advance();
        }

        if (fine.hasNext() && startsOrEndsInside(fine.peek().getSpan(), span)) {
            return kinds.tokenKind(fine.advance());
        }
        return SyntaxKind.of(token.getKind());
    }

    private void openNode(AstNode node, SourceSpan at, TreeBuilder builder) {
        int depth = node.getDepth();
        int current = builder.currentDepth();

        if (depth < 1) {
            builder.recordError(DiagnosticCode.NODE_DEPTH_INCONSISTENT,
                    "AST node " + node.getKind() + " reported depth " + depth + "; nested under depth " + current,
                    at);
            depth = current + 1;
        } else if (depth > current + 1) {
            builder.recordError(DiagnosticCode.NODE_DEPTH_INCONSISTENT,
                    "AST node " + node.getKind() + " at depth " + depth + " opened inside depth " + current,
                    at);
        }

        builder.open(kinds.nodeKind(node), depth);
    }

    static boolean startsOrEndsInside(SourceSpan grammar, SourceSpan token) {
        if (token.contains(grammar.getStart())) return true;
        // end is exclusive: the token holds the grammar token's last character
        return grammar.getEnd() > token.getStart() && grammar.getEnd() <= token.getEnd();
    }

    private static boolean isBehind(SourceSpan grammar, SourceSpan token) {
        return grammar.getEnd() <= token.getStart() && !token.contains(grammar.getStart());
    }

    private static int clamp(int position, int length) {
        return Math.max(0, Math.min(position, length));
    }
}
