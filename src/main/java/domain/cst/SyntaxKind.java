package domain.cst;

import java.util.Objects;

/**
 * Label of a tree element.
 *
 * <p>A kind remembers where it came from: the classifier lexer (coarse), a grammar token
 * (fine) or a grammar AST node.</p>
 */
public final class SyntaxKind {

    public enum Origin {
        CLASSIFIER,
        GRAMMAR_TOKEN,
        GRAMMAR_NODE
    }

    private final Origin origin;
    private final String name;

    private SyntaxKind(Origin origin, String name) {
        this.origin = Objects.requireNonNull(origin, "origin");
        this.name = (name == null || name.isBlank()) ? "UNKNOWN" : name;
    }

    public static SyntaxKind of(CoarseKind kind) {
        return new SyntaxKind(Origin.CLASSIFIER, kind.name());
    }

    public static SyntaxKind token(String name) {
        return new SyntaxKind(Origin.GRAMMAR_TOKEN, name);
    }

    public static SyntaxKind node(String name) {
        return new SyntaxKind(Origin.GRAMMAR_NODE, name);
    }

    public Origin getOrigin() {
        return origin;
    }

    public String getName() {
        return name;
    }

    public boolean isFine() {
        return origin == Origin.GRAMMAR_TOKEN;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SyntaxKind)) return false;
        SyntaxKind other = (SyntaxKind) o;
        return origin == other.origin && name.equals(other.name);
    }

    @Override
    public int hashCode() {
        return 31 * origin.hashCode() + name.hashCode();
    }

    @Override
    public String toString() {
        return name;
    }
}
