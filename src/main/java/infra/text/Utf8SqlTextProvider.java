package infra.text;

import domain.text.SqlSource;
import domain.text.SqlTextProvider;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

/**
 * Reads input files as UTF-8 (BOM tolerated).
 */
public final class Utf8SqlTextProvider implements SqlTextProvider {

    private static String stripBom(String s) {
        if (s == null || s.isEmpty()) return s;
        if (s.charAt(0) == '\uFEFF') return s.substring(1);
        return s;
    }

    @Override
    public String read(SqlSource source) {
        if (source == null) throw new IllegalArgumentException("source is null");
        try {
            return stripBom(Files.readString(source.getFile(), StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read sql file: " + source.getFile(), e);
        }
    }
}
