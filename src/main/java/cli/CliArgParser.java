package cli;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * CLI argument parsing helpers.
 *
 * <p>Options are {@code --key=value} or {@code --key value}; anything else is ignored.</p>
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
        if (v.equals("true") || v.equals("1") || v.equals("y") || v.equals("yes")) return true;
        if (v.equals("false") || v.equals("0") || v.equals("n") || v.equals("no")) return false;
        return def;
    }

    /**
     * Presence-style flag.
     * <ul>
     *   <li>--noResult       => true</li>
     *   <li>--noResult=true  => true</li>
     *   <li>--noResult=false => false</li>
     *   <li>absent           => -DnoResult, else false</li>
     * </ul>
     */
    public static boolean flag(Map<String, String> argv, String key) {
        if (key == null) return false;
        if (argv == null || !argv.containsKey(key)) {
            return parseBoolean(System.getProperty(key), false);
        }
        String raw = argv.get(key);
        if (raw == null || raw.isBlank()) return true;
        return parseBoolean(raw, true);
    }

    /**
     * Option value: command line first, then {@code -Dkey=value}, then {@code def}.
     */
    public static String option(Map<String, String> argv, String key, String def) {
        String v = (argv == null) ? null : argv.get(key);
        if (v != null && !v.isBlank()) return v.trim();

        v = System.getProperty(key);
        if (v != null && !v.isBlank()) return v.trim();
        return def;
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
