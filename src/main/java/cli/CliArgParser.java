package cli;

import domain.fingerprint.OrderByStyle;
import domain.output.ReportFormat;
import domain.text.StatementFormat;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * CLI argument parsing helpers.
 */
public final class CliArgParser {

    /** System property prefix: {@code -Dfingerprint.maxDepth=8} acts like {@code --maxDepth=8}. */
    public static final String PROP_PREFIX = "fingerprint.";

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
     *   <li>--quiet       => true</li>
     *   <li>--quiet=true  => true</li>
     *   <li>--quiet=false => false</li>
     * </ul>
     * Falls back to {@code -Dfingerprint.<key>} when the argument is absent.
     */
    public static boolean flag(Map<String, String> argv, String key) {
        if (key == null) return false;
        if (argv == null || !argv.containsKey(key)) {
            return parseBoolean(System.getProperty(PROP_PREFIX + key), false);
        }
        String raw = argv.get(key);
        if (raw == null || raw.isBlank()) return true;
        return parseBoolean(raw, true);
    }

    /**
     * Argument value, else {@code -Dfingerprint.<key>}, else {@code def}.
     */
    public static String option(Map<String, String> argv, String key, String def) {
        String v = (argv == null) ? null : argv.get(key);
        if (v != null && !v.isBlank()) return v.trim();
        v = System.getProperty(PROP_PREFIX + key);
        if (v != null && !v.isBlank()) return v.trim();
        return def;
    }

    /**
     * Report format: text / csv / xlsx (excel) / none (off). Unknown values fall back to TEXT.
     */
    public static ReportFormat parseReportFormat(String raw) {
        if (raw == null || raw.isBlank()) return ReportFormat.TEXT;
        String v = raw.trim()
                .toLowerCase(Locale.ROOT);
        switch (v) {
            case "csv":
                return ReportFormat.CSV;
            case "xlsx":
            case "excel":
                return ReportFormat.XLSX;
            case "none":
            case "off":
                return ReportFormat.NONE;
            default:
                return ReportFormat.TEXT;
        }
    }

    /**
     * Input format. Explicit value wins; otherwise {@code .csv} files are CSV and everything else is LINES.
     */
    public static StatementFormat parseStatementFormat(String raw, String inputLocation) {
        if (raw != null && !raw.isBlank()) {
            String v = raw.trim()
                    .toLowerCase(Locale.ROOT);
            if (v.equals("csv")) return StatementFormat.CSV;
            if (v.equals("lines") || v.equals("line") || v.equals("sql") || v.equals("txt")) return StatementFormat.LINES;
        }
        if (inputLocation != null && inputLocation.trim().toLowerCase(Locale.ROOT).endsWith(".csv")) {
            return StatementFormat.CSV;
        }
        return StatementFormat.LINES;
    }

    public static OrderByStyle parseOrderByStyle(String raw) {
        if (raw == null || raw.isBlank()) return OrderByStyle.FLAT;
        String v = raw.trim()
                .toUpperCase(Locale.ROOT);
        try {
            return OrderByStyle.valueOf(v);
        } catch (IllegalArgumentException ignore) {
            return OrderByStyle.FLAT;
        }
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
