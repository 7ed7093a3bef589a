package domain.cst;

/**
 * Half-open range {@code [start, end)} over statement text.
 *
 * <p>Offsets are Java {@code char} indexes. Spans produced while parsing a statement are
 * relative to that statement; {@link #shift(int)} moves them into an enclosing document.</p>
 */
public final class SourceSpan {

    private final int start;
    private final int end;

    public SourceSpan(int start, int end) {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("invalid span: " + start + ".." + end);
        }
        this.start = start;
        this.end = end;
    }

    public static SourceSpan of(int start, int end) {
        return new SourceSpan(start, end);
    }

    public static SourceSpan empty(int at) {
        return new SourceSpan(at, at);
    }

    public int getStart() {
        return start;
    }

    public int getEnd() {
        return end;
    }

    public int length() {
        return end - start;
    }

    public boolean isEmpty() {
        return start == end;
    }

    public boolean contains(int offset) {
        return offset >= start && offset < end;
    }

    public SourceSpan shift(int base) {
        if (base == 0) return this;
        return new SourceSpan(start + base, end + base);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SourceSpan)) return false;
        SourceSpan other = (SourceSpan) o;
        return start == other.start && end == other.end;
    }

    @Override
    public int hashCode() {
        return 31 * start + end;
    }

    @Override
    public String toString() {
        return start + ".." + end;
    }
}
