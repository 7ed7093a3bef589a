package domain.cst;

import java.util.List;

/**
 * Indented text dump of a tree, one element per line:
 * <pre>
 * Statement@0..8
 *   SELECT@0..6 "select"
 *   WHITESPACE@6..7 " "
 *   S_LONG@7..8 "1"
 * </pre>
 */
public final class SyntaxTreePrinter {

    private static final String INDENT = "  ";

    private SyntaxTreePrinter() {
    }

    public static String print(SyntaxTree tree) {
        StringBuilder sb = new StringBuilder();
        if (tree == null) return "";
        for (SyntaxElement e : tree.getChildren()) {
            append(sb, e, 0);
        }
        return sb.toString();
    }

    public static String print(List<ParseDiagnostic> diagnostics) {
        StringBuilder sb = new StringBuilder();
        if (diagnostics == null) return "";
        for (ParseDiagnostic d : diagnostics) {
            sb.append(d.getCode()).append('@').append(d.getSpan()).append(": ")
                    .append(escape(d.getMessage())).append('\n');
        }
        return sb.toString();
    }

    private static void append(StringBuilder sb, SyntaxElement e, int level) {
        sb.append(INDENT.repeat(level))
                .append(e.getKind().getName())
                .append('@')
                .append(e.getSpan());
        if (e.isLeaf()) {
            sb.append(" \"").append(escape(e.text())).append("\"\n");
            return;
        }
        sb.append('\n');
        for (SyntaxElement child : ((SyntaxNode) e).getChildren()) {
            append(sb, child, level + 1);
        }
    }

    static String escape(String s) {
        StringBuilder sb = new StringBuilder(s.length());
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '\n': sb.append("\\n"); break;
                case '\r': sb.append("\\r"); break;
                case '\t': sb.append("\\t"); break;
                case '"': sb.append("\\\""); break;
                case '\\': sb.append("\\\\"); break;
                default: sb.append(c);
            }
        }
        return sb.toString();
    }
}
