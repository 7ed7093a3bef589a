package domain.grammar;

import domain.cst.SourceSpan;

/**
 * Raised by a {@link GrammarOracle} when it cannot scan or parse a statement.
 *
 * <p>This is an expected outcome for SQL being edited; callers record it and carry on.</p>
 */
public class GrammarOracleException extends Exception {

    private final SourceSpan span;

    public GrammarOracleException(String message) {
        this(message, null, null);
    }

    public GrammarOracleException(String message, Throwable cause) {
        this(message, null, cause);
    }

    public GrammarOracleException(String message, SourceSpan span, Throwable cause) {
        super(message, cause);
        this.span = span;
    }

    /** Range the oracle blamed, or {@code null} when it only knows the statement failed. */
    public SourceSpan getSpan() {
        return span;
    }
}
