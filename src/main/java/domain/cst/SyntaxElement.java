package domain.cst;

/** A node or a leaf of a {@link SyntaxTree}. */
public interface SyntaxElement {

    SyntaxKind getKind();

    SourceSpan getSpan();

    /** Exact source text covered by this element. */
    String text();

    boolean isLeaf();
}
