package domain.source;

/** One statement cut out of a larger source, with its offset in that source. */
public final class StatementSlice {

    private final int index;
    private final String text;
    private final int offset;

    public StatementSlice(int index, String text, int offset) {
        this.index = index;
        this.text = text == null ? "" : text;
        this.offset = offset;
    }

    /** 0-based position of the statement within its source. */
    public int getIndex() {
        return index;
    }

    public String getText() {
        return text;
    }

    public int getOffset() {
        return offset;
    }

    public int getEnd() {
        return offset + text.length();
    }
}
