package domain.output;

import domain.model.FileConversionResult;

import java.nio.file.Path;
import java.util.List;

/** Stores the run report. */
public interface ResultWriter {

    void write(Path resultXlsx, List<FileConversionResult> results, String mappingVersion);
}
