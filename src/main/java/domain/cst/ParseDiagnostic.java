package domain.cst;

import java.util.Objects;

/**
 * A non-fatal problem attached to a parsed statement.
 */
public final class ParseDiagnostic {

    private final DiagnosticCode code;
    private final String message;
    private final SourceSpan span;

    public ParseDiagnostic(DiagnosticCode code, String message, SourceSpan span) {
        this.code = Objects.requireNonNull(code, "code");
        this.message = message == null ? "" : message;
        this.span = Objects.requireNonNull(span, "span");
    }

    public DiagnosticCode getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }

    public SourceSpan getSpan() {
        return span;
    }

    ParseDiagnostic shift(int base) {
        return base == 0 ? this : new ParseDiagnostic(code, message, span.shift(base));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ParseDiagnostic)) return false;
        ParseDiagnostic other = (ParseDiagnostic) o;
        return code == other.code && message.equals(other.message) && span.equals(other.span);
    }

    @Override
    public int hashCode() {
        return Objects.hash(code, message, span);
    }

    @Override
    public String toString() {
        return code + "@" + span + ": " + message;
    }
}
