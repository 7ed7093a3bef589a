package domain.cst;

import java.util.Objects;

/** A classifier token. The sequence produced for a text partitions it without gaps. */
public final class GenericToken {

    private final CoarseKind kind;
    private final SourceSpan span;

    public GenericToken(CoarseKind kind, SourceSpan span) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.span = Objects.requireNonNull(span, "span");
    }

    public CoarseKind getKind() {
        return kind;
    }

    public SourceSpan getSpan() {
        return span;
    }

    public String slice(String text) {
        return text.substring(span.getStart(), span.getEnd());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GenericToken)) return false;
        GenericToken other = (GenericToken) o;
        return kind == other.kind && span.equals(other.span);
    }

    @Override
    public int hashCode() {
        return 31 * kind.hashCode() + span.hashCode();
    }

    @Override
    public String toString() {
        return kind + "@" + span;
    }
}
