package infra.output;

import domain.model.FileConversionResult;
import domain.output.ResultWriter;

import java.nio.file.Path;
import java.util.List;

/** {@link ResultWriter} backed by {@link ConversionReportXlsxWriter}. */
public final class XlsxResultWriter implements ResultWriter {

    private final ConversionReportXlsxWriter delegate;

    public XlsxResultWriter(ConversionReportXlsxWriter delegate) {
        this.delegate = (delegate == null) ? new ConversionReportXlsxWriter() : delegate;
    }

    @Override
    public void write(Path resultXlsx, List<FileConversionResult> results, String mappingVersion) {
        delegate.write(resultXlsx, results, mappingVersion);
    }
}
