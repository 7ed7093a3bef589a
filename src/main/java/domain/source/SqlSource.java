package domain.source;

/** A named SQL source, typically one {@code .sql} file. */
public final class SqlSource {

    private final String name;
    private final String text;

    public SqlSource(String name, String text) {
        this.name = name == null ? "" : name;
        this.text = text == null ? "" : text;
    }

    /** Path relative to the scanned root, {@code /}-separated. */
    public String getName() {
        return name;
    }

    public String getText() {
        return text;
    }
}
