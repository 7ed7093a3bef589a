package domain.grammar;

import domain.cst.SourceSpan;

import java.util.Objects;

/**
 * A token reported by a {@link GrammarOracle}.
 *
 * <p>Spans only cover meaningful text (no whitespace or comments) and need not line up
 * with classifier token boundaries.</p>
 */
public final class GrammarToken {

    private final String kind;
    private final SourceSpan span;

    public GrammarToken(String kind, SourceSpan span) {
        this.kind = kind == null ? "" : kind;
        this.span = Objects.requireNonNull(span, "span");
    }

    public String getKind() {
        return kind;
    }

    public SourceSpan getSpan() {
        return span;
    }

    @Override
    public String toString() {
        return kind + "@" + span;
    }
}
