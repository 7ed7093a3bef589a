package domain.cst;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Immutable concrete syntax tree of one statement.
 *
 * <p>The top level is an ordered list because leaves land there whenever no node is open
 * (for example when the grammar oracle failed). Concatenating {@link #leaves()} yields
 * the statement text.</p>
 */
public final class SyntaxTree {

    private final List<SyntaxElement> children;
    private final SourceSpan span;

    public SyntaxTree(List<SyntaxElement> children, SourceSpan span) {
        this.children = children == null ? Collections.emptyList() : List.copyOf(children);
        this.span = Objects.requireNonNull(span, "span");
    }

    public List<SyntaxElement> getChildren() {
        return children;
    }

    public SourceSpan getSpan() {
        return span;
    }

    public boolean isEmpty() {
        return children.isEmpty();
    }

    public String text() {
        StringBuilder sb = new StringBuilder(span.length());
        for (SyntaxLeaf leaf : leaves()) {
            sb.append(leaf.text());
        }
        return sb.toString();
    }

    /** The single top-level node, or {@code null} when the top level is not exactly one node. */
    public SyntaxNode rootNode() {
        if (children.size() != 1 || children.get(0).isLeaf()) return null;
        return (SyntaxNode) children.get(0);
    }

    /** All leaves in document order. */
    public List<SyntaxLeaf> leaves() {
        List<SyntaxLeaf> out = new ArrayList<>();
        for (SyntaxElement e : preorder()) {
            if (e.isLeaf()) out.add((SyntaxLeaf) e);
        }
        return out;
    }

    /** All internal nodes in pre-order. */
    public List<SyntaxNode> nodes() {
        List<SyntaxNode> out = new ArrayList<>();
        for (SyntaxElement e : preorder()) {
            if (!e.isLeaf()) out.add((SyntaxNode) e);
        }
        return out;
    }

    private List<SyntaxElement> preorder() {
        List<SyntaxElement> out = new ArrayList<>();
        Deque<SyntaxElement> stack = new ArrayDeque<>();
        for (int i = children.size() - 1; i >= 0; i--) stack.push(children.get(i));

        while (!stack.isEmpty()) {
            SyntaxElement e = stack.pop();
            out.add(e);
            if (!e.isLeaf()) {
                List<SyntaxElement> kids = ((SyntaxNode) e).getChildren();
                for (int i = kids.size() - 1; i >= 0; i--) stack.push(kids.get(i));
            }
        }
        return out;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SyntaxTree)) return false;
        SyntaxTree other = (SyntaxTree) o;
        return span.equals(other.span) && children.equals(other.children);
    }

    @Override
    public int hashCode() {
        return Objects.hash(children, span);
    }
}
