package domain.source;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a SQL source into statements at top-level semicolons.
 *
 * <p>Semicolons inside string literals, quoted identifiers and comments do not split.
 * The terminator stays with its statement, and the blanks/comments after it go to the
 * next statement, so the slices partition the source. A trailing slice holding only
 * blanks and comments is attached to the previous statement.</p>
 */
public final class SqlStatementSplitter {

    private SqlStatementSplitter() {
    }

    public static List<StatementSlice> split(String source) {
        List<StatementSlice> out = new ArrayList<>();
        String s = source == null ? "" : source;
        if (s.isEmpty()) return out;

        int start = 0;
        int pos = 0;
        while (pos < s.length()) {
            char c = s.charAt(pos);
            if (c == '-' && pos + 1 < s.length() && s.charAt(pos + 1) == '-') {
                pos = skipLineComment(s, pos);
                continue;
            }
            if (c == '/' && pos + 1 < s.length() && s.charAt(pos + 1) == '*') {
                pos = skipBlockComment(s, pos);
                continue;
            }
            if (c == '\'' || c == '"') {
                pos = skipQuoted(s, pos, c);
                continue;
            }
            pos++;
            if (c == ';') {
                out.add(new StatementSlice(out.size(), s.substring(start, pos), start));
                start = pos;
            }
        }

        if (start < s.length()) {
            String tail = s.substring(start);
            if (!out.isEmpty() && isTrivia(tail)) {
                StatementSlice last = out.remove(out.size() - 1);
                out.add(new StatementSlice(last.getIndex(), last.getText() + tail, last.getOffset()));
            } else {
                out.add(new StatementSlice(out.size(), tail, start));
            }
        }
        return out;
    }

    private static int skipLineComment(String s, int pos) {
        int p = pos + 2;
        while (p < s.length() && s.charAt(p) != '\n') p++;
        return p;
    }

    private static int skipBlockComment(String s, int pos) {
        int end = s.indexOf("*/", pos + 2);
        return end < 0 ? s.length() : end + 2;
    }

    // doubled quote is an escape; an unterminated quote runs to the end
    private static int skipQuoted(String s, int pos, char quote) {
        int p = pos + 1;
        while (p < s.length()) {
            if (s.charAt(p) == quote) {
                if (p + 1 < s.length() && s.charAt(p + 1) == quote) {
                    p += 2;
                    continue;
                }
                return p + 1;
            }
            p++;
        }
        return s.length();
    }

    static boolean isTrivia(String s) {
        int pos = 0;
        while (pos < s.length()) {
            char c = s.charAt(pos);
            if (Character.isWhitespace(c)) {
                pos++;
            } else if (c == '-' && pos + 1 < s.length() && s.charAt(pos + 1) == '-') {
                pos = skipLineComment(s, pos);
            } else if (c == '/' && pos + 1 < s.length() && s.charAt(pos + 1) == '*') {
                pos = skipBlockComment(s, pos);
            } else {
                return false;
            }
        }
        return true;
    }
}
