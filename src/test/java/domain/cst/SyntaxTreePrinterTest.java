package domain.cst;

import domain.grammar.GrammarOracle;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SyntaxTreePrinterTest {

    @Test
    void print_nestedTree_indentsChildrenAndEscapesText() {
        TreeBuilder b = new TreeBuilder();
        b.open(SyntaxKind.node("Statement"), 1);
        b.appendLeaf(SyntaxKind.token("SELECT"), "select");
        b.appendLeaf(SyntaxKind.of(CoarseKind.NEWLINE), "\n");
        b.open(SyntaxKind.node("Column"), 2);
        b.appendLeaf(SyntaxKind.of(CoarseKind.WORD), "a");

        String dump = SyntaxTreePrinter.print(b.finish());

        assertEquals(
                "Statement@0..8\n"
                        + "  SELECT@0..6 \"select\"\n"
                        + "  NEWLINE@6..7 \"\\n\"\n"
                        + "  Column@7..8\n"
                        + "    WORD@7..8 \"a\"\n",
                dump);
    }

    @Test
    void print_topLevelLeaves_haveNoIndent() {
        SyntaxTree tree = new StatementParser(GrammarOracle.none()).parseStatement("a 'b'").orElseThrow().tree();

        assertEquals("WORD@0..1 \"a\"\nWHITESPACE@1..2 \" \"\nSCONST@2..5 \"'b'\"\n", SyntaxTreePrinter.print(tree));
    }
}
