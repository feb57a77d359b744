package cli;

import domain.format.KeywordCase;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * CLI argument parsing helpers.
 *
 * <p>Every option can also come from a system property {@code -Dsqlfmt.<key>};
 * an explicit {@code --key} argument wins.</p>
 */
public final class CliArgParser {

    public static final String PROP_PREFIX = "sqlfmt.";

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
        if (v.equals("true") || v.equals("1") || v.equals("y") || v.equals("yes")) return true;
        if (v.equals("false") || v.equals("0") || v.equals("n") || v.equals("no")) return false;
        return def;
    }

    /**
     * Presence-style flag.
     * <ul>
     *   <li>--tab       => true</li>
     *   <li>--tab=true  => true</li>
     *   <li>--tab=false => false</li>
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
     * Flag with system property fallback ({@code -Dsqlfmt.<key>=true}).
     */
    public static boolean flagOrProperty(Map<String, String> argv, String key, boolean def) {
        if (argv != null && argv.containsKey(key)) return flag(argv, key);
        return parseBoolean(System.getProperty(PROP_PREFIX + key), def);
    }

    /**
     * Option value: argument first, then {@code -Dsqlfmt.<key>}, else null.
     */
    public static String option(Map<String, String> argv, String key) {
        if (argv != null) {
            String v = argv.get(key);
            if (v != null && !v.isBlank()) return v.trim();
        }
        String p = System.getProperty(PROP_PREFIX + key);
        return (p == null || p.isBlank()) ? null : p.trim();
    }

    /**
     * Keyword case (upper / lower / unchanged). Default: UPPER.
     */
    public static KeywordCase parseKeywordCase(String raw) {
        return KeywordCase.parse(raw, KeywordCase.UPPER);
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
