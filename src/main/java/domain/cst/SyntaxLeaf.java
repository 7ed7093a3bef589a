package domain.cst;

import java.util.Objects;

/** A token leaf: a kind and the exact slice of source text it stands for. */
public final class SyntaxLeaf implements SyntaxElement {

    private final SyntaxKind kind;
    private final String text;
    private final SourceSpan span;

    public SyntaxLeaf(SyntaxKind kind, String text, SourceSpan span) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.text = text == null ? "" : text;
        this.span = Objects.requireNonNull(span, "span");
    }

    @Override
    public SyntaxKind getKind() {
        return kind;
    }

    @Override
    public SourceSpan getSpan() {
        return span;
    }

    @Override
    public String text() {
        return text;
    }

    @Override
    public boolean isLeaf() {
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SyntaxLeaf)) return false;
        SyntaxLeaf other = (SyntaxLeaf) o;
        return kind.equals(other.kind) && text.equals(other.text) && span.equals(other.span);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, text, span);
    }

    @Override
    public String toString() {
        return kind + "@" + span + " \"" + text + "\"";
    }
}
