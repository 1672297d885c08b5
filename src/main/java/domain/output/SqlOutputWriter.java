package domain.output;

import domain.text.SqlSource;

import java.nio.file.Path;

/** Stores converted SQL. */
public interface SqlOutputWriter {

    /**
     * @return the written file, or null when nothing was written
     */
    Path write(Path outDir, SqlSource source, String convertedSql);
}
