package domain.cst;

/**
 * Token classes recognized by {@link ClassifierLexer}.
 *
 * <p>Punctuation constants carry the single character they match.</p>
 */
public enum CoarseKind {

    PERCENT('%'),
    L_PAREN('('),
    R_PAREN(')'),
    STAR('*'),
    PLUS('+'),
    COMMA(','),
    MINUS('-'),
    DOT('.'),
    SLASH('/'),
    COLON(':'),
    SEMICOLON(';'),
    LESS('<'),
    EQUALS('='),
    GREATER('>'),
    QUESTION('?'),
    L_BRACKET('['),
    BACKSLASH('\\'),
    R_BRACKET(']'),
    CARET('^'),

    /** Run of letters, digits, marks and underscores. */
    WORD,

    /** Single-quoted string literal, quotes included. */
    SCONST,

    /** Run of spaces. */
    WHITESPACE,

    /** Run of line breaks ({@code \n}, {@code \r}). */
    NEWLINE,

    /** Run of tabs. */
    TAB,

    /** {@code -- ...} up to the line end, or a closed {@code /* ... *}{@code /} block. */
    COMMENT;

    private final char punctuation;

    CoarseKind() {
        this('\0');
    }

    CoarseKind(char punctuation) {
        this.punctuation = punctuation;
    }

    public boolean isPunctuation() {
        return punctuation != '\0';
    }

    public char getPunctuation() {
        return punctuation;
    }

    static CoarseKind forPunctuation(char c) {
        for (CoarseKind k : values()) {
            if (k.punctuation != '\0' && k.punctuation == c) return k;
        }
        return null;
    }
}
