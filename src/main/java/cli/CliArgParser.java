package cli;

import domain.grammar.GrammarOracleKind;
import domain.output.ReportFormat;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * CLI argument parsing helpers.
 */
public final class CliArgParser {

    private CliArgParser() {
    }

    public static int parseInt(String s, int def) {
        if (s == null || s.isBlank()) return def;
        try {
            return Integer.parseInt(s.trim());
        } catch (NumberFormatException e) {
            return def;
        }
    }

    public static boolean parseBoolean(String s, boolean def) {
        if (s == null || s.isBlank()) return def;
        String v = s.trim()
                .toLowerCase(Locale.ROOT);
        return v.equals("true") || v.equals("1") || v.equals("y") || v.equals("yes");
    }

    /**
     * Presence-style flag.
     * <ul>
     *   <li>--noTreeOut       => true</li>
     *   <li>--noTreeOut=true  => true</li>
     *   <li>--noTreeOut=false => false</li>
     * </ul>
     */
    public static boolean flag(Map<String, String> argv, String key) {
        if (argv == null || key == null) return false;
        if (!argv.containsKey(key)) return false;
        String raw = argv.get(key);
        if (raw == null || raw.isBlank()) return true;
        return parseBoolean(raw, true);
    }

    /**
     * Oracle selection.
     * <ul>
     *   <li>jsqlparser / jsql / grammar -> JSQLPARSER</li>
     *   <li>none / off / lexer -> NONE</li>
     * </ul>
     * Default: JSQLPARSER
     */
    public static GrammarOracleKind parseOracle(String raw) {
        if (raw == null || raw.isBlank()) return GrammarOracleKind.JSQLPARSER;
        String v = raw.trim()
                .toLowerCase(Locale.ROOT);

        if (v.equals("none") || v.equals("off") || v.equals("lexer")) return GrammarOracleKind.NONE;
        if (v.equals("jsqlparser") || v.equals("jsql") || v.equals("grammar")) return GrammarOracleKind.JSQLPARSER;

        try {
            return Enum.valueOf(GrammarOracleKind.class, v.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ignore) {
            return GrammarOracleKind.JSQLPARSER;
        }
    }

    /**
     * Report format; inferred from the report file extension when not given.
     * Default: XLSX
     */
    public static ReportFormat parseReportFormat(String raw, String reportPath) {
        String v = (raw == null) ? "" : raw.trim()
                .toLowerCase(Locale.ROOT);
        if (v.isEmpty() && reportPath != null) {
            String p = reportPath.trim()
                    .toLowerCase(Locale.ROOT);
            if (p.endsWith(".csv")) return ReportFormat.CSV;
            if (p.endsWith(".xlsx")) return ReportFormat.XLSX;
        }
        if (v.equals("csv")) return ReportFormat.CSV;
        if (v.equals("none") || v.equals("off")) return ReportFormat.NONE;
        return ReportFormat.XLSX;
    }

    public static Map<String, String> parseArgs(String[] args) {
        Map<String, String> m = new HashMap<>();
        if (args == null) return m;

        for (int i = 0; i < args.length; i++) {
            String a = args[i];
            if (a == null) continue;
            a = a.trim();
            if (!a.startsWith("--")) continue;

            String k;
            String v;

            int eq = a.indexOf('=');
            if (eq > 2) {
                k = a.substring(2, eq)
                        .trim();
                v = a.substring(eq + 1)
                        .trim();
            } else {
                k = a.substring(2)
                        .trim();
                v = "";
                if (i + 1 < args.length && args[i + 1] != null && !args[i + 1].startsWith("--")) {
                    v = args[i + 1].trim();
                    i++;
                }
            }

            if (!k.isEmpty()) m.put(k, v);
        }

        return m;
    }
}
