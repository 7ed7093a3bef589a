package domain.output;

import java.util.Locale;

/**
 * File naming policy for tree dumps.
 * <p>
 * {@code <source name without .sql>.cst.txt}, e.g. {@code reports/daily.sql -> reports_daily.cst.txt}.
 * Directory separators in the relative source name are flattened to {@code _}.
 */
public final class TreeDumpFileNamePolicy {

    public static final String SUFFIX = ".cst.txt";

    private TreeDumpFileNamePolicy() {
    }

    public static String build(String sourceName) {
        String s = sourceName == null ? "" : sourceName.trim();
        if (s.toLowerCase(Locale.ROOT).endsWith(".sql")) s = s.substring(0, s.length() - 4);
        s = s.replace('/', '_').replace('\\', '_');
        s = safePart(s, "statement");
        return limit(s, 180) + SUFFIX;
    }

    private static String safePart(String raw, String fallback) {
        String s = (raw == null) ? "" : raw.trim();
        if (s.isEmpty()) s = fallback;
        s = s.replace('\n', '_')
                .replace('\r', '_');

        // Keep only filename-safe characters.
        s = s.replaceAll("[^a-zA-Z0-9._-]", "_");

        // avoid hidden/odd files on Windows
        if (s.startsWith(".")) s = "_" + s.substring(1);

        String u = s.toUpperCase(Locale.ROOT);
        if (u.equals("CON") || u.equals("PRN") || u.equals("AUX") || u.equals("NUL")
                || u.matches("COM[1-9]") || u.matches("LPT[1-9]")) {
            s = "_" + s;
        }
        return s;
    }

    private static String limit(String s, int max) {
        if (s == null) return "";
        if (s.length() <= max) return s;
        return s.substring(0, max);
    }
}
