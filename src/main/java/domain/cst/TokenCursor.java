package domain.cst;

import java.util.Collections;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Forward-only cursor with one element of lookahead.
 */
public final class TokenCursor<T> {

    private final List<T> items;
    private int index = 0;

    public TokenCursor(List<T> items) {
        this.items = items == null ? Collections.emptyList() : items;
    }

    public boolean hasNext() {
        return index < items.size();
    }

    /** Next element without consuming it, or {@code null} at the end. */
    public T peek() {
        return hasNext() ? items.get(index) : null;
    }

    public T advance() {
        if (!hasNext()) throw new NoSuchElementException("cursor exhausted at " + index);
        return items.get(index++);
    }

    public int remaining() {
        return items.size() - index;
    }
}
