package infra.mapping;

import domain.mapping.FunctionCategory;
import domain.mapping.FunctionMapping;
import domain.mapping.RuleKind;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * CSV loader for operator-supplied function mappings.
 *
 * <p>Header: {@code source,target,kind,category,reason} (case-insensitive, UTF-8, BOM tolerated).
 * Only DIRECT and FLAG rows are accepted; argument restructuring needs code and stays in
 * {@link domain.mapping.TableauFabricMappings}.</p>
 *
 * <pre>
 * source,target,kind,category,reason
 * ATTR,MIN,DIRECT,AGGREGATE,
 * RAWSQL_INT,,FLAG,OTHER,pass-through SQL must be reviewed
 * </pre>
 */
public final class FunctionMappingCsvLoader {

    private static final Logger log = LoggerFactory.getLogger(FunctionMappingCsvLoader.class);

    private static final String COL_SOURCE = "source";
    private static final String COL_TARGET = "target";
    private static final String COL_KIND = "kind";
    private static final String COL_CATEGORY = "category";
    private static final String COL_REASON = "reason";

    private static String stripBom(String s) {
        if (s == null || s.isEmpty()) return s;
        if (s.charAt(0) == '\uFEFF') return s.substring(1);
        return s;
    }

    private static String norm(String s) {
        return s == null ? "" : s.trim().toLowerCase(Locale.ROOT);
    }

    private static String get(CSVRecord r, Map<String, Integer> idx, String key) {
        Integer i = idx.get(key);
        if (i == null || i >= r.size()) return "";
        String v = r.get(i);
        return v == null ? "" : v.trim();
    }

    /**
     * Load mappings from a CSV file.
     *
     * @throws IllegalArgumentException on a missing file, a missing column or an invalid row
     * @throws IllegalStateException    when the file cannot be read
     */
    public List<FunctionMapping> load(Path csvPath) {
        if (csvPath == null) throw new IllegalArgumentException("csvPath is null");
        if (!Files.exists(csvPath)) throw new IllegalArgumentException("mapping csv not found: " + csvPath);

        try (Reader reader = Files.newBufferedReader(csvPath, StandardCharsets.UTF_8)) {
            List<FunctionMapping> out = load(reader, csvPath.toString());
            log.info("Loaded {} function mapping(s) from {}", out.size(), csvPath);
            return out;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load mapping csv: " + csvPath, e);
        }
    }

    /**
     * @param location used in error messages only
     */
    public List<FunctionMapping> load(Reader reader, String location) throws IOException {
        try (CSVParser parser = CSVFormat.DEFAULT
                .builder()
                .setTrim(true)
                .setIgnoreEmptyLines(true)
                .build()
                .parse(reader)) {

            Iterator<CSVRecord> it = parser.iterator();
            if (!it.hasNext()) return Collections.emptyList();

            CSVRecord headerRec = it.next();
            Map<String, Integer> idx = new HashMap<>();
            for (int i = 0; i < headerRec.size(); i++) {
                idx.putIfAbsent(norm(stripBom(headerRec.get(i))), i);
            }
            for (String required : List.of(COL_SOURCE, COL_KIND)) {
                if (!idx.containsKey(required)) {
                    throw new IllegalArgumentException("mapping csv " + location + ": missing column '" + required + "'");
                }
            }

            List<FunctionMapping> out = new ArrayList<>();
            while (it.hasNext()) {
                CSVRecord r = it.next();
                String source = get(r, idx, COL_SOURCE);
                if (source.isEmpty() || source.startsWith("#")) continue;

                out.add(toMapping(r, idx, location, source));
            }
            return out;
        }
    }

    private static FunctionMapping toMapping(CSVRecord r, Map<String, Integer> idx, String location, String source) {
        // header is line 1
        String where = "mapping csv " + location + " line " + r.getRecordNumber();

        String rawKind = get(r, idx, COL_KIND).toUpperCase(Locale.ROOT);
        RuleKind kind;
        try {
            kind = RuleKind.valueOf(rawKind);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(where + ": unknown kind '" + rawKind + "'", e);
        }

        FunctionCategory category = FunctionCategory.parse(get(r, idx, COL_CATEGORY));

        return switch (kind) {
            case DIRECT -> {
                String target = get(r, idx, COL_TARGET);
                if (target.isEmpty()) {
                    throw new IllegalArgumentException(where + ": DIRECT mapping for " + source + " needs a target");
                }
                yield FunctionMapping.direct(source, target, category);
            }
            case FLAG -> FunctionMapping.flag(source, category, get(r, idx, COL_REASON));
            case REORDER -> throw new IllegalArgumentException(
                    where + ": REORDER mapping for " + source + " cannot be declared in csv");
        };
    }
}
