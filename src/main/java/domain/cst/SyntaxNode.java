package domain.cst;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * An internal node. {@code depth} is the AST depth the node was opened at (root = 1).
 */
public final class SyntaxNode implements SyntaxElement {

    private final SyntaxKind kind;
    private final int depth;
    private final SourceSpan span;
    private final List<SyntaxElement> children;

    public SyntaxNode(SyntaxKind kind, int depth, SourceSpan span, List<SyntaxElement> children) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.depth = depth;
        this.span = Objects.requireNonNull(span, "span");
        this.children = children == null ? Collections.emptyList() : List.copyOf(children);
    }

    @Override
    public SyntaxKind getKind() {
        return kind;
    }

    public int getDepth() {
        return depth;
    }

    @Override
    public SourceSpan getSpan() {
        return span;
    }

    public List<SyntaxElement> getChildren() {
        return children;
    }

    @Override
    public String text() {
        StringBuilder sb = new StringBuilder(span.length());
        for (SyntaxElement child : children) {
            sb.append(child.text());
        }
        return sb.toString();
    }

    @Override
    public boolean isLeaf() {
        return false;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SyntaxNode)) return false;
        SyntaxNode other = (SyntaxNode) o;
        return depth == other.depth
                && kind.equals(other.kind)
                && span.equals(other.span)
                && children.equals(other.children);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, depth, span, children);
    }

    @Override
    public String toString() {
        return kind + "@" + span;
    }
}
