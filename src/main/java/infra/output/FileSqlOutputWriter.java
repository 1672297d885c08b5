package infra.output;

import domain.output.SqlFileNamePolicy;
import domain.output.SqlOutputWriter;
import domain.text.SqlSource;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * {@link SqlOutputWriter} that stores converted SQL into files.
 * <p>
 * Output layout:
 * <outDir>/<input sub-directories>/<name>_fabric.<ext>
 */
public final class FileSqlOutputWriter implements SqlOutputWriter {

    @Override
    public Path write(Path outDir, SqlSource source, String convertedSql) {
        if (outDir == null) throw new IllegalArgumentException("outDir is null");
        if (source == null) throw new IllegalArgumentException("source is null");

        Path target = outDir.resolve(SqlFileNamePolicy.build(source.getRelativePath()))
                .toAbsolutePath()
                .normalize();

        try {
            Path parent = target.getParent();
            if (parent != null) Files.createDirectories(parent);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create output directory: " + target.getParent(), e);
        }

        try {
            Files.writeString(target, convertedSql == null ? "" : convertedSql, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write converted sql: " + target, e);
        }
        return target;
    }
}
