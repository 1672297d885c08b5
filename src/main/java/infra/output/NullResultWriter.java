package infra.output;

import domain.model.FileConversionResult;
import domain.output.ResultWriter;

import java.nio.file.Path;
import java.util.List;

/**
 * No-op implementation (feature toggle).
 */
public final class NullResultWriter implements ResultWriter {
    @Override
    public void write(Path resultXlsx, List<FileConversionResult> results, String mappingVersion) {
        // report disabled
    }
}
