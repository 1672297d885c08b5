package app;

import domain.convert.ConverterOptions;
import domain.convert.SqlDialectConverter;
import domain.mapping.FunctionMappingRegistry;
import domain.mapping.TableauFabricMappings;
import domain.output.ResultWriter;
import domain.output.SqlOutputWriter;
import domain.text.SqlTextCleaner;
import domain.text.SqlTextProvider;
import infra.mapping.FunctionMappingCsvLoader;
import infra.output.*;
import infra.text.SqlFileScanner;
import infra.text.Utf8SqlTextProvider;

import java.nio.file.Path;

/**
 * Object-assembly factory for {@link DialectConvertCliApp}.
 * <p>
 * Keeps the CLI app focused on orchestration/logging; object creation and feature toggles
 * live here.
 */
final class DialectConvertComponentsFactory {

    /**
     * Built-in table, optionally extended by an operator CSV whose rows override built-ins.
     */
    FunctionMappingRegistry createMappingRegistry(Path mappingCsv, int varcharLength) {
        FunctionMappingRegistry.Builder b = TableauFabricMappings.builder(varcharLength);
        if (mappingCsv != null) {
            b.addAll(new FunctionMappingCsvLoader().load(mappingCsv));
            b.version(TableauFabricMappings.VERSION + "+" + mappingCsv.getFileName());
        }
        return b.build();
    }

    ConverterOptions createOptions(int varcharLength, boolean rewriteBooleans) {
        return ConverterOptions.builder()
                .varcharLength(varcharLength)
                .rewriteBooleanLiterals(rewriteBooleans)
                .build();
    }

    SqlDialectConverter createConverter(FunctionMappingRegistry registry, ConverterOptions options) {
        return new SqlDialectConverter(registry, options);
    }

    SqlFileScanner createScanner() {
        return new SqlFileScanner();
    }

    SqlTextProvider createTextProvider() {
        return new Utf8SqlTextProvider();
    }

    SqlTextCleaner createCleaner() {
        return new SqlTextCleaner();
    }

    SqlOutputWriter createSqlOutputWriter(boolean enable) {
        if (!enable) return new NullSqlOutputWriter();
        return new FileSqlOutputWriter();
    }

    ResultWriter createResultWriter(boolean enable) {
        if (!enable) return new NullResultWriter();
        return new XlsxResultWriter(new ConversionReportXlsxWriter());
    }
}
