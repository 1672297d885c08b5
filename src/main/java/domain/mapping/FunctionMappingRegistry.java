package domain.mapping;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Process-wide function mapping table.
 *
 * <p>Built once through {@link Builder}; afterwards the registry is read-only, so a single instance
 * can be shared by any number of concurrent conversions without locking.</p>
 *
 * <p>Lookups are case-insensitive and always on the exact identifier token, never on a substring,
 * so {@code LOG} and {@code LOG10} or {@code DATE} and {@code DATEADD} can never shadow each other.</p>
 */
public final class FunctionMappingRegistry implements FunctionMappingLookup {

    private static final Logger log = LoggerFactory.getLogger(FunctionMappingRegistry.class);

    // key = SOURCE_NAME (UPPER)
    private final Map<String, FunctionMapping> mappingMap;
    private final String version;

    private FunctionMappingRegistry(Map<String, FunctionMapping> mappingMap, String version) {
        this.mappingMap = Collections.unmodifiableMap(new LinkedHashMap<>(mappingMap));
        this.version = (version == null || version.isBlank()) ? "custom" : version.trim();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public FunctionMapping find(String functionName) {
        if (functionName == null) return null;
        String key = FunctionMapping.normalize(functionName);
        if (key.isEmpty()) return null;
        return mappingMap.get(key);
    }

    @Override
    public int size() {
        return mappingMap.size();
    }

    @Override
    public Set<String> names() {
        return mappingMap.keySet();
    }

    /** Entries in registration order. */
    public Collection<FunctionMapping> entries() {
        return mappingMap.values();
    }

    public String getVersion() {
        return version;
    }

    /** Number of entries per rule kind, e.g. for the run log. */
    public Map<RuleKind, Integer> countByKind() {
        Map<RuleKind, Integer> m = new EnumMap<>(RuleKind.class);
        for (FunctionMapping fm : mappingMap.values()) {
            m.merge(fm.getKind(), 1, Integer::sum);
        }
        return m;
    }

    /**
     * Collects entries; later registrations of the same name replace earlier ones, so operator
     * extensions loaded after the defaults win.
     */
    public static final class Builder {

        private final Map<String, FunctionMapping> entries = new LinkedHashMap<>(128);
        private String version;
        private int overridden;

        private Builder() {
        }

        public Builder version(String version) {
            this.version = version;
            return this;
        }

        public Builder add(FunctionMapping mapping) {
            if (mapping == null) throw new IllegalArgumentException("mapping is null");
            if (entries.put(mapping.getSourceName(), mapping) != null) {
                overridden++;
            }
            return this;
        }

        public Builder addAll(Collection<FunctionMapping> mappings) {
            if (mappings == null) return this;
            for (FunctionMapping m : mappings) add(m);
            return this;
        }

        public FunctionMappingRegistry build() {
            FunctionMappingRegistry registry = new FunctionMappingRegistry(entries, version);
            log.info("Function mapping registry built: version={}, size={}, overridden={}, byKind={}",
                    registry.getVersion(), registry.size(), overridden, registry.countByKind());
            return registry;
        }
    }
}
