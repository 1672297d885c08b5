package domain.mapping;

import java.util.Locale;

/** Function family used for the per-category conversion counters. */
public enum FunctionCategory {
    DATE,
    STRING,
    AGGREGATE,
    LOGICAL,
    CONVERSION,
    MATHEMATICAL,
    OTHER;

    /**
     * Lenient parse used by the CSV loader. Unknown or blank values map to {@link #OTHER}.
     */
    public static FunctionCategory parse(String raw) {
        if (raw == null || raw.isBlank()) return OTHER;
        String v = raw.trim().toUpperCase(Locale.ROOT);
        if (v.equals("MATH")) return MATHEMATICAL;
        for (FunctionCategory c : values()) {
            if (c.name().equals(v)) return c;
        }
        return OTHER;
    }
}
