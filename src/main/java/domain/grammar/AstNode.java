package domain.grammar;

/**
 * A flattened AST node: kind, start offset of its first meaningful token and its
 * pre-order depth (root = 1).
 */
public final class AstNode {

    private final String kind;
    private final int position;
    private final int depth;

    public AstNode(String kind, int position, int depth) {
        this.kind = kind == null ? "" : kind;
        this.position = position;
        this.depth = depth;
    }

    public String getKind() {
        return kind;
    }

    public int getPosition() {
        return position;
    }

    public int getDepth() {
        return depth;
    }

    @Override
    public String toString() {
        return kind + "@" + position + "#" + depth;
    }
}
