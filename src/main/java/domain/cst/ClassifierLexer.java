package domain.cst;

import java.util.ArrayList;
import java.util.List;

/**
 * Character-class tokenizer used as the backbone of every tree.
 *
 * <p>It knows nothing about SQL grammar: words are words, quotes are literals, runs of
 * blanks are kept as they are. The tokens it returns partition the input exactly, which
 * is what makes the tree lossless even when the grammar oracle gives up.</p>
 *
 * <p>Where two classes could match, the longer one wins ({@code --} starts a comment,
 * not a minus). Characters outside the supported alphabet raise
 * {@link UnsupportedInputException}.</p>
 */
public final class ClassifierLexer {

    private final String s;
    private int pos = 0;

    // next "*/" at or after the last lookup; -1 once the text has none left
    private int nextClose = -2;

    private ClassifierLexer(String s) {
        this.s = (s == null) ? "" : s;
    }

    public static List<GenericToken> tokenize(String text) {
        ClassifierLexer lx = new ClassifierLexer(text);
        List<GenericToken> out = new ArrayList<>(Math.max(16, lx.s.length() / 3));
        while (lx.hasNext()) {
            int start = lx.pos;
            CoarseKind kind = lx.readToken();
            out.add(new GenericToken(kind, SourceSpan.of(start, lx.pos)));
        }
        return out;
    }

    static boolean isWordChar(int cp) {
        if (Character.isLetterOrDigit(cp) || cp == '_') return true;
        switch (Character.getType(cp)) {
            case Character.NON_SPACING_MARK:
            case Character.ENCLOSING_MARK:
            case Character.COMBINING_SPACING_MARK:
            case Character.CONNECTOR_PUNCTUATION:
                return true;
            default:
                return false;
        }
    }

    private boolean hasNext() {
        return pos < s.length();
    }

    private char peek() {
        return (pos < s.length()) ? s.charAt(pos) : '\0';
    }

    private boolean peekIsLineComment() {
        return pos + 1 < s.length() && s.charAt(pos) == '-' && s.charAt(pos + 1) == '-';
    }

    private boolean peekIsBlockComment() {
        return pos + 1 < s.length() && s.charAt(pos) == '/' && s.charAt(pos + 1) == '*'
                && findClose(pos + 2) >= 0;
    }

    /** Lookups only move forward, so one failed search answers every later one. */
    private int findClose(int from) {
        if (nextClose == -1) return -1;
        if (nextClose < from) nextClose = s.indexOf("*/", from);
        return nextClose;
    }

    private CoarseKind readToken() {
        char c = peek();

        if (peekIsLineComment()) {
            readLineComment();
            return CoarseKind.COMMENT;
        }
        if (peekIsBlockComment()) {
            readBlockComment();
            return CoarseKind.COMMENT;
        }
        if (c == '\'') {
            readSingleQuotedString();
            return CoarseKind.SCONST;
        }
        if (c == ' ') {
            readRun(' ');
            return CoarseKind.WHITESPACE;
        }
        if (c == '\t') {
            readRun('\t');
            return CoarseKind.TAB;
        }
        if (c == '\n' || c == '\r') {
            while (pos < s.length() && (s.charAt(pos) == '\n' || s.charAt(pos) == '\r')) pos++;
            return CoarseKind.NEWLINE;
        }

        CoarseKind punct = CoarseKind.forPunctuation(c);
        if (punct != null) {
            pos++;
            return punct;
        }

        int cp = s.codePointAt(pos);
        if (isWordChar(cp)) {
            readWord();
            return CoarseKind.WORD;
        }

        throw new UnsupportedInputException(
                "unsupported character " + describe(cp) + " at offset " + pos,
                SourceSpan.of(pos, pos + Character.charCount(cp)));
    }

    private void readLineComment() {
        pos += 2;
        while (pos < s.length() && s.charAt(pos) != '\n' && s.charAt(pos) != '\r') pos++;
    }

    private void readBlockComment() {
        pos = findClose(pos + 2) + 2;
    }

    // '' inside a literal is an escaped quote, not the end of it
    private void readSingleQuotedString() {
        int start = pos;
        pos++;
        while (pos < s.length()) {
            if (s.charAt(pos) == '\'') {
                if (pos + 1 < s.length() && s.charAt(pos + 1) == '\'') {
                    pos += 2;
                    continue;
                }
                pos++;
                return;
            }
            pos++;
        }
        pos = start;
        throw new UnsupportedInputException(
                "unterminated string literal at offset " + start, SourceSpan.of(start, s.length()));
    }

    private void readRun(char c) {
        while (pos < s.length() && s.charAt(pos) == c) pos++;
    }

    private void readWord() {
        while (pos < s.length()) {
            int cp = s.codePointAt(pos);
            if (!isWordChar(cp)) break;
            pos += Character.charCount(cp);
        }
    }

    private static String describe(int cp) {
        if (cp < 0x20 || cp == 0x7F) return String.format("U+%04X", cp);
        return "'" + new String(Character.toChars(cp)) + "' (" + String.format("U+%04X", cp) + ")";
    }
}
