package domain.output;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * File naming policy for converted SQL.
 * <p>
 * {@code <dir>/<name>.<ext>} becomes {@code <dir>/<name>_fabric.<ext>}; directories below the
 * input root are kept so the output mirrors the input tree.
 * <p>
 * e.g. reports/sales.sql -> reports/sales_fabric.sql
 */
public final class SqlFileNamePolicy {

    public static final String SUFFIX = "_fabric";

    private SqlFileNamePolicy() {
    }

    /**
     * Build the output path (relative, '/'-separated) for an input path relative to the input root.
     */
    public static String build(String relativePath) {
        String rel = (relativePath == null) ? "" : relativePath.trim().replace('\\', '/');

        List<String> parts = new ArrayList<>();
        for (String p : rel.split("/")) {
            if (p.isEmpty() || p.equals(".") || p.equals("..")) continue;
            parts.add(p);
        }
        String fileName = parts.isEmpty() ? "" : parts.remove(parts.size() - 1);

        StringBuilder sb = new StringBuilder();
        for (String dir : parts) {
            sb.append(limit(safePart(dir, "dir"), 80)).append('/');
        }
        sb.append(outputFileName(fileName));
        return sb.toString();
    }

    /**
     * {@code sales.sql} -> {@code sales_fabric.sql}; a name without extension gets {@code .sql}.
     */
    public static String outputFileName(String inputFileName) {
        String name = (inputFileName == null) ? "" : inputFileName.trim();
        int dot = name.lastIndexOf('.');

        String base = (dot > 0) ? name.substring(0, dot) : name;
        String ext = (dot > 0) ? name.substring(dot) : ".sql";

        base = limit(safePart(base, "unnamed"), 180);
        ext = safePart(ext, ".sql");
        return base + SUFFIX + ext;
    }

    private static String safePart(String raw, String fallback) {
        String s = (raw == null) ? "" : raw.trim();
        if (s.isEmpty()) s = fallback;
        s = s.replace('\n', '_')
                .replace('\r', '_');

        // Keep only filename-safe characters.
        s = s.replaceAll("[^a-zA-Z0-9._-]", "_");

        // windows reserved names protection
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
