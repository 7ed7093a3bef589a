package domain.cst;

import domain.grammar.AstNode;
import domain.grammar.GrammarToken;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class ReconcilerTest {

    private static SyntaxTree reconcile(String text, List<GrammarToken> fine, List<AstNode> nodes, TreeBuilder b) {
        new Reconciler().reconcile(text, ClassifierLexer.tokenize(text), fine, nodes, b);
        return b.finish();
    }

    private static GrammarToken tok(String kind, int start, int end) {
        return new GrammarToken(kind, SourceSpan.of(start, end));
    }

    @Test
    void reconcile_opensNestedNodesFromOneTokenSpan() {
        // "a + b": Root > BinaryExpr > Column(a), Column(b)
        String text = "a + b";
        List<AstNode> nodes = List.of(
                new AstNode("Root", 0, 1),
                new AstNode("BinaryExpr", 0, 2),
                new AstNode("Column", 0, 3),
                new AstNode("Column", 4, 3));

        SyntaxTree tree = reconcile(text, List.of(), nodes, new TreeBuilder());

        SyntaxNode root = tree.rootNode();
        assertEquals("Root", root.getKind().getName());
        SyntaxNode expr = (SyntaxNode) root.getChildren().get(0);
        assertEquals("BinaryExpr", expr.getKind().getName());

        // trailing trivia stays in the open node until a sibling opens
        assertEquals(2, expr.getChildren().size());
        SyntaxNode colA = (SyntaxNode) expr.getChildren().get(0);
        SyntaxNode colB = (SyntaxNode) expr.getChildren().get(1);
        assertEquals("a + ", colA.text());
        assertEquals("b", colB.text());
        assertEquals(SourceSpan.of(4, 5), colB.getSpan());
        assertEquals(text, tree.text());
    }

    @Test
    void reconcile_childDepthIsParentDepthPlusOne() {
        String text = "select a from t";
        List<AstNode> nodes = List.of(
                new AstNode("Statement", 0, 1),
                new AstNode("Select", 0, 2),
                new AstNode("Column", 7, 3),
                new AstNode("Table", 14, 3));

        SyntaxTree tree = reconcile(text, List.of(), nodes, new TreeBuilder());
        for (SyntaxNode n : tree.nodes()) {
            for (SyntaxElement child : n.getChildren()) {
                if (!child.isLeaf()) {
                    assertEquals(n.getDepth() + 1, ((SyntaxNode) child).getDepth(), child.toString());
                }
            }
        }
        assertEquals(4, tree.nodes().size());
        assertEquals(text, tree.text());
    }

    @Test
    void reconcile_sortsNodesByPositionKeepingParentFirst() {
        String text = "select a from t";
        List<AstNode> unsorted = List.of(
                new AstNode("Table", 14, 3),
                new AstNode("Statement", 0, 1),
                new AstNode("Column", 7, 3),
                new AstNode("Select", 0, 2));

        TreeBuilder b = new TreeBuilder();
        SyntaxTree tree = reconcile(text, List.of(), unsorted, b);

        // Table comes first in the input but starts last: it is not the root
        assertEquals("Statement", tree.rootNode().getKind().getName());
        assertEquals(List.of("Statement", "Select", "Column", "Table"),
                tree.nodes().stream().map(n -> n.getKind().getName()).collect(Collectors.toList()));
        assertTrue(b.getDiagnostics().isEmpty());
    }

    @Test
    void reconcile_fineKindWinsWhenGrammarTokenOverlaps() {
        String text = "select  x";
        List<GrammarToken> fine = List.of(tok("SELECT", 0, 6), tok("IDENT", 8, 9));

        SyntaxTree tree = reconcile(text, fine, List.of(), new TreeBuilder());
        List<SyntaxLeaf> leaves = tree.leaves();

        assertEquals(SyntaxKind.token("SELECT"), leaves.get(0).getKind());
        assertEquals(SyntaxKind.of(CoarseKind.WHITESPACE), leaves.get(1).getKind());
        assertEquals(SyntaxKind.token("IDENT"), leaves.get(2).getKind());
    }

    @Test
    void reconcile_leafTextUsesClassifierBoundaries_evenWhenGrammarSpansDiffer() {
        // grammar sees "<>" as one operator; classifier splits it
        String text = "a<>b";
        List<GrammarToken> fine = List.of(tok("IDENT", 0, 1), tok("NOT_EQUALS", 1, 3), tok("IDENT", 3, 4));

        SyntaxTree tree = reconcile(text, fine, List.of(), new TreeBuilder());
        List<SyntaxLeaf> leaves = tree.leaves();

        assertEquals(4, leaves.size());
        assertEquals("<", leaves.get(1).text());
        assertEquals(SyntaxKind.token("NOT_EQUALS"), leaves.get(1).getKind());
        // ">" holds the end of the consumed operator; the next grammar token starts after it
        assertEquals(">", leaves.get(2).text());
        assertEquals(SyntaxKind.of(CoarseKind.GREATER), leaves.get(2).getKind());
        assertEquals(SyntaxKind.token("IDENT"), leaves.get(3).getKind());
        assertEquals(text, tree.text());
    }

    @Test
    void reconcile_grammarTokenLeftBehind_doesNotBlockLaterTokens() {
        // two grammar tokens inside one classifier word: the second is stale afterwards
        String text = "ab c";
        List<GrammarToken> fine = List.of(tok("A", 0, 1), tok("B", 1, 2), tok("C", 3, 4));

        SyntaxTree tree = reconcile(text, fine, List.of(), new TreeBuilder());
        List<SyntaxLeaf> leaves = tree.leaves();

        assertEquals(SyntaxKind.token("A"), leaves.get(0).getKind());
        assertEquals(SyntaxKind.of(CoarseKind.WHITESPACE), leaves.get(1).getKind());
        assertEquals(SyntaxKind.token("C"), leaves.get(2).getKind());
    }

    @Test
    void reconcile_noNodes_putsAllLeavesAtTopLevel() {
        String text = "selec * fro";
        SyntaxTree tree = reconcile(text, List.of(), List.of(), new TreeBuilder());

        assertTrue(tree.nodes().isEmpty());
        assertEquals(5, tree.getChildren().size());
        assertEquals(text, tree.text());
    }

    @Test
    void reconcile_skippedDepth_isRecordedAndTreeStaysLossless() {
        String text = "a b";
        List<AstNode> nodes = List.of(new AstNode("Root", 0, 1), new AstNode("Deep", 2, 4));

        TreeBuilder b = new TreeBuilder();
        SyntaxTree tree = reconcile(text, List.of(), nodes, b);

        assertEquals(1, b.getDiagnostics().size());
        assertEquals(DiagnosticCode.NODE_DEPTH_INCONSISTENT, b.getDiagnostics().get(0).getCode());
        assertEquals(SourceSpan.of(2, 3), b.getDiagnostics().get(0).getSpan());
        assertEquals(2, tree.nodes().size());
        assertEquals(text, tree.text());
    }

    @Test
    void reconcile_nonPositiveDepth_isNestedUnderCurrentNode() {
        String text = "a b";
        List<AstNode> nodes = List.of(new AstNode("Root", 0, 1), new AstNode("Broken", 2, 0));

        TreeBuilder b = new TreeBuilder();
        SyntaxTree tree = reconcile(text, List.of(), nodes, b);

        SyntaxNode root = tree.rootNode();
        assertNotNull(root);
        SyntaxNode broken = (SyntaxNode) root.getChildren().get(2);
        assertEquals("Broken", broken.getKind().getName());
        assertEquals(2, broken.getDepth());
        assertEquals(DiagnosticCode.NODE_DEPTH_INCONSISTENT, b.getDiagnostics().get(0).getCode());
    }

    @Test
    void reconcile_nodeBeyondText_isReportedNotOpened() {
        String text = "a";
        List<AstNode> nodes = List.of(new AstNode("Root", 0, 1), new AstNode("Ghost", 10, 2));

        TreeBuilder b = new TreeBuilder();
        SyntaxTree tree = reconcile(text, List.of(), nodes, b);

        assertEquals(1, tree.nodes().size());
        assertEquals(DiagnosticCode.NODE_OUT_OF_RANGE, b.getDiagnostics().get(0).getCode());
        assertEquals(SourceSpan.empty(1), b.getDiagnostics().get(0).getSpan());
    }

    @Test
    void startsOrEndsInside_treatsEndAsExclusive() {
        SourceSpan token = SourceSpan.of(6, 7);
        assertFalse(Reconciler.startsOrEndsInside(SourceSpan.of(0, 6), token));
        assertTrue(Reconciler.startsOrEndsInside(SourceSpan.of(0, 7), token));
        assertTrue(Reconciler.startsOrEndsInside(SourceSpan.of(6, 10), token));
        assertFalse(Reconciler.startsOrEndsInside(SourceSpan.of(7, 8), token));
    }
}
