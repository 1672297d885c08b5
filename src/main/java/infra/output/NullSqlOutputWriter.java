package infra.output;

import domain.output.SqlOutputWriter;
import domain.text.SqlSource;

import java.nio.file.Path;

/**
 * No-op implementation (feature toggle).
 */
public final class NullSqlOutputWriter implements SqlOutputWriter {
    @Override
    public Path write(Path outDir, SqlSource source, String convertedSql) {
        return null;
    }
}
