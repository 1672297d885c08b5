package domain.text;

import java.nio.file.Path;

/**
 * One input file: its location and its path relative to the input root (used for output
 * naming and reporting).
 */
public final class SqlSource {

    private final Path file;
    private final String relativePath;

    public SqlSource(Path file, String relativePath) {
        if (file == null) throw new IllegalArgumentException("file is null");
        this.file = file;
        String rel = (relativePath == null || relativePath.isBlank())
                ? String.valueOf(file.getFileName())
                : relativePath;
        // report rows and output layout use '/' on every OS
        this.relativePath = rel.replace('\\', '/');
    }

    public Path getFile() {
        return file;
    }

    public String getRelativePath() {
        return relativePath;
    }

    @Override
    public String toString() {
        return relativePath;
    }
}
