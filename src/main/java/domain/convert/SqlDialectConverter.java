package domain.convert;

import domain.mapping.FunctionMappingLookup;
import domain.mapping.TableauFabricMappings;

/**
 * Tableau to Fabric SQL converter.
 *
 * <p>{@link #convert(String)} is the single entry point: it never throws and does no I/O. Each call
 * owns its metrics, so one instance can serve any number of threads as long as the mapping
 * table it was given is read-only (as {@link domain.mapping.FunctionMappingRegistry} is).</p>
 *
 * <p>The heavy lifting lives in {@link SqlDialectConverterEngine}.</p>
 */
public class SqlDialectConverter {

    private final SqlDialectConverterEngine engine;

    /** Built-in table and default options. */
    public SqlDialectConverter() {
        this(ConverterOptions.defaults());
    }

    public SqlDialectConverter(ConverterOptions options) {
        this(TableauFabricMappings.defaults(options.getVarcharLength()), options);
    }

    public SqlDialectConverter(FunctionMappingLookup mappings) {
        this(mappings, ConverterOptions.defaults());
    }

    public SqlDialectConverter(FunctionMappingLookup mappings, ConverterOptions options) {
        if (mappings == null) throw new IllegalArgumentException("mappings is null");
        this.engine = new SqlDialectConverterEngine(mappings, options == null ? ConverterOptions.defaults() : options);
    }

    public ConversionOutput convert(String text) {
        return engine.convert(text);
    }
}
