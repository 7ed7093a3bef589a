package domain.cst;

/**
 * Thrown by {@link ClassifierLexer} when text contains characters outside the supported
 * alphabet. This is an input-class problem, not a SQL syntax error.
 */
public class UnsupportedInputException extends RuntimeException {

    private final SourceSpan span;

    public UnsupportedInputException(String message, SourceSpan span) {
        super(message);
        this.span = span;
    }

    public SourceSpan getSpan() {
        return span;
    }
}
