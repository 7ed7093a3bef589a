package infra.grammar;

import domain.cst.DiagnosticCode;
import domain.cst.ParseOutcome;
import domain.cst.SourceSpan;
import domain.cst.StatementParser;
import domain.cst.SyntaxLeaf;
import domain.cst.SyntaxNode;
import domain.cst.SyntaxTree;
import domain.grammar.AstNode;
import domain.grammar.GrammarOracleException;
import domain.grammar.GrammarToken;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class JSqlParserGrammarOracleTest {

    private final JSqlParserGrammarOracle oracle = new JSqlParserGrammarOracle();

    @Test
    void scan_reportsMeaningfulTokensWithOffsets() throws Exception {
        List<GrammarToken> tokens = oracle.scan("select a from t");

        assertEquals(4, tokens.size());
        assertEquals(SourceSpan.of(0, 6), tokens.get(0).getSpan());
        assertEquals("SELECT", tokens.get(0).getKind());
        assertEquals(SourceSpan.of(7, 8), tokens.get(1).getSpan());
        assertEquals(SourceSpan.of(9, 13), tokens.get(2).getSpan());
        assertEquals(SourceSpan.of(14, 15), tokens.get(3).getSpan());
    }

    @Test
    void scan_skipsCommentsAndWhitespace() throws Exception {
        List<GrammarToken> tokens = oracle.scan("select /* c */ 1 -- x");

        assertEquals(2, tokens.size());
        assertEquals(SourceSpan.of(15, 16), tokens.get(1).getSpan());
    }

    @Test
    void scan_tabsDoNotShiftOffsets() throws Exception {
        List<GrammarToken> tokens = oracle.scan("select\t\ta\nfrom\tt");

        assertEquals(SourceSpan.of(8, 9), tokens.get(1).getSpan());
        assertEquals(SourceSpan.of(10, 14), tokens.get(2).getSpan());
        assertEquals(SourceSpan.of(15, 16), tokens.get(3).getSpan());
    }

    @Test
    void parse_validSelect_returnsPreorderNodesStartingWithRoot() throws Exception {
        String sql = "select a, b from t where a = 1";
        List<AstNode> nodes = oracle.parse(sql);

        assertFalse(nodes.isEmpty());
        assertEquals(1, nodes.get(0).getDepth());
        assertEquals(0, nodes.get(0).getPosition());
        for (AstNode n : nodes) {
            assertTrue(n.getDepth() >= 1, n.toString());
            assertTrue(n.getPosition() >= 0 && n.getPosition() < sql.length(), n.toString());
            assertFalse(n.getKind().isBlank(), n.toString());
        }
        for (int i = 1; i < nodes.size(); i++) {
            assertTrue(nodes.get(i).getDepth() <= nodes.get(i - 1).getDepth() + 1, "pre-order depth jump at " + i);
        }
    }

    @Test
    void parse_malformedSql_throws() {
        GrammarOracleException e = assertThrows(GrammarOracleException.class, () -> oracle.parse("selec * fro"));
        assertFalse(e.getMessage().isBlank());
    }

    @Test
    void parse_commentOnlyText_returnsNoNodes() throws Exception {
        assertTrue(oracle.parse("  -- nothing here\n").isEmpty());
    }

    @Test
    void statementParser_validSql_isLosslessWithStructureAndNoDiagnostics() {
        String sql = "select *,some_col from contact where id = '123 4 5';";
        ParseOutcome.Parsed parsed = new StatementParser(oracle).parseStatement(sql).orElseThrow();

        SyntaxTree tree = parsed.tree();
        assertEquals(sql, tree.text());
        assertTrue(parsed.diagnostics().isEmpty(), parsed.diagnostics().toString());

        SyntaxNode root = tree.rootNode();
        assertNotNull(root);
        assertEquals(1, root.getDepth());

        SyntaxLeaf first = tree.leaves().get(0);
        assertEquals("select", first.text());
        assertTrue(first.getKind().isFine(), first.toString());

        SyntaxLeaf literal = tree.leaves().stream().filter(l -> l.text().equals("'123 4 5'")).findFirst().orElseThrow();
        assertTrue(literal.getKind().isFine(), literal.toString());
    }

    @Test
    void statementParser_invalidSql_degradesWithParseDiagnostic() {
        String sql = "selec * fro";
        ParseOutcome.Parsed parsed = new StatementParser(oracle).parseStatement(sql).orElseThrow();

        assertEquals(sql, parsed.tree().text());
        assertTrue(parsed.tree().nodes().isEmpty());
        assertEquals(1, parsed.diagnostics().size());
        assertEquals(DiagnosticCode.PARSE_FAILED, parsed.diagnostics().get(0).getCode());
        assertEquals(SourceSpan.of(0, sql.length()), parsed.diagnostics().get(0).getSpan());
    }

    @Test
    void statementParser_multiLineWithComments_isLossless() {
        String sql = "-- header\nselect a,\n\tb /* inline */\nfrom t\nwhere a > 1;";
        ParseOutcome.Parsed parsed = new StatementParser(oracle).parseStatement(sql, 7).orElseThrow();

        assertEquals(sql, parsed.tree().text());
        assertTrue(parsed.diagnostics().isEmpty(), parsed.diagnostics().toString());
        assertEquals(SourceSpan.of(7, 7 + sql.length()), parsed.tree().getSpan());
    }

    private static String nestedParentheses(int depth) {
        return "select " + "(".repeat(depth) + "1" + ")".repeat(depth);
    }

    private static String nestedArithmetic(int depth) {
        String[] ops = {" + ", " * ", " - ", " / "};
        StringBuilder sb = new StringBuilder("select ");
        for (int i = 0; i < depth; i++) {
            sb.append("c").append(i).append(ops[i % ops.length]).append('(');
        }
        sb.append("c").append(depth);
        sb.append(")".repeat(depth));
        return sb.append(" from t").toString();
    }

    @Test
    void statementParser_deeplyNestedParentheses_parsesQuicklyAndLosslessly() {
        String sql = nestedParentheses(40);

        ParseOutcome.Parsed parsed = assertTimeoutPreemptively(Duration.ofSeconds(10),
                () -> new StatementParser(oracle).parseStatement(sql).orElseThrow());

        assertEquals(sql, parsed.tree().text());
        assertTrue(parsed.diagnostics().isEmpty(), parsed.diagnostics().toString());
        assertNotNull(parsed.tree().rootNode());
        assertEquals("Statement", parsed.tree().rootNode().getKind().getName());

        Set<Integer> expressionDepths = parsed.tree().nodes().stream()
                .filter(n -> n.getKind().getName().equals("Expression"))
                .map(SyntaxNode::getDepth)
                .collect(Collectors.toSet());
        assertTrue(expressionDepths.size() >= 2, "nested Expression nodes expected, depths " + expressionDepths);
    }

    @Test
    void statementParser_deepArithmeticExpression_parsesQuicklyAndLosslessly() {
        String sql = nestedArithmetic(32);

        ParseOutcome.Parsed parsed = assertTimeoutPreemptively(Duration.ofSeconds(10),
                () -> new StatementParser(oracle).parseStatement(sql).orElseThrow());

        assertEquals(sql, parsed.tree().text());
        assertTrue(parsed.diagnostics().isEmpty(), parsed.diagnostics().toString());
        assertTrue(parsed.tree().nodes().stream().anyMatch(n -> n.getKind().getName().equals("Expression")));
    }

    @Test
    void parse_deeplyNestedInvalidSql_failsWithoutComplexRetry() {
        String sql = "selec " + "(".repeat(30) + "1" + ")".repeat(30);

        assertTimeoutPreemptively(Duration.ofSeconds(10),
                () -> assertThrows(GrammarOracleException.class, () -> oracle.parse(sql)));
    }

    @Test
    void constructor_rejectsNonPositiveTimeout() {
        assertThrows(IllegalArgumentException.class, () -> new JSqlParserGrammarOracle(0));
    }
}
