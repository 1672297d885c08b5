package domain.mapping;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static domain.mapping.FunctionCategory.*;

/**
 * Built-in Tableau to Microsoft Fabric (T-SQL) function table.
 *
 * <p>Bump {@link #VERSION} whenever an entry changes meaning; the version is written to the run
 * log and to the report so converted output can be traced back to the table that produced it.</p>
 */
public final class TableauFabricMappings {

    public static final String VERSION = "tableau-fabric-2024.1";

    public static final int DEFAULT_VARCHAR_LENGTH = 20;

    private TableauFabricMappings() {
    }

    public static FunctionMappingRegistry defaults() {
        return builder(DEFAULT_VARCHAR_LENGTH).build();
    }

    public static FunctionMappingRegistry defaults(int varcharLength) {
        return builder(varcharLength).build();
    }

    /**
     * Builder preloaded with the built-in entries, so operators can layer extensions on top
     * before building.
     */
    public static FunctionMappingRegistry.Builder builder(int varcharLength) {
        return FunctionMappingRegistry.builder()
                .version(VERSION)
                .addAll(entries(varcharLength));
    }

    public static List<FunctionMapping> entries(int varcharLength) {
        if (varcharLength <= 0) {
            throw new IllegalArgumentException("varcharLength must be positive: " + varcharLength);
        }
        List<FunctionMapping> list = new ArrayList<>(128);
        addDate(list);
        addString(list);
        addAggregate(list);
        addLogical(list);
        addConversion(list, varcharLength);
        addMath(list);
        addTargetNative(list);
        return Collections.unmodifiableList(list);
    }

    private static void addDate(List<FunctionMapping> list) {
        list.add(FunctionMapping.direct("NOW", "GETDATE", DATE));
        list.add(FunctionMapping.reorder("TODAY", "CAST", DATE, 0, 0, TableauFabricRewriters.today()));
        list.add(FunctionMapping.same("YEAR", DATE));
        list.add(FunctionMapping.same("MONTH", DATE));
        list.add(FunctionMapping.same("DAY", DATE));
        list.add(FunctionMapping.direct("MAKEDATE", "DATEFROMPARTS", DATE));
        list.add(FunctionMapping.flag("MAKEDATETIME", DATE,
                "MAKEDATETIME has no argument-compatible T-SQL equivalent; rewrite with DATETIMEFROMPARTS"));

        // Tableau: DATEADD('day', 1, d) / T-SQL: DATEADD(day, 1, d)
        list.add(FunctionMapping.reorder("DATEADD", "DATEADD", DATE, 3, 3, TableauFabricRewriters.datePart(4)));
        list.add(FunctionMapping.reorder("DATEDIFF", "DATEDIFF", DATE, 3, 4, TableauFabricRewriters.datePart(4)));
        list.add(FunctionMapping.reorder("DATEPART", "DATEPART", DATE, 2, 3, TableauFabricRewriters.datePart(3)));
        list.add(FunctionMapping.reorder("DATENAME", "DATENAME", DATE, 2, 3, TableauFabricRewriters.datePart(3)));
        list.add(FunctionMapping.reorder("DATETRUNC", "DATETRUNC", DATE, 2, 3, TableauFabricRewriters.datePart(3)));
    }

    private static void addString(List<FunctionMapping> list) {
        for (String n : List.of("LEN", "LEFT", "RIGHT", "TRIM", "LTRIM", "RTRIM", "UPPER", "LOWER", "REPLACE")) {
            list.add(FunctionMapping.same(n, STRING));
        }
        list.add(FunctionMapping.direct("LENGTH", "LEN", STRING));
        list.add(FunctionMapping.reorder("SUBSTR", "SUBSTRING", STRING, 2, 3, TableauFabricRewriters.substr()));
        list.add(FunctionMapping.reorder("SPLIT", "SUBSTRING", STRING, 3, 3, TableauFabricRewriters.split()));
        list.add(FunctionMapping.reorder("CONTAINS", "CHARINDEX", STRING, 2, 2, TableauFabricRewriters.contains()));
        list.add(FunctionMapping.reorder("STARTSWITH", "CHARINDEX", STRING, 2, 2, TableauFabricRewriters.startsWith()));
        list.add(FunctionMapping.reorder("ENDSWITH", "RIGHT", STRING, 2, 2, TableauFabricRewriters.endsWith()));
        list.add(FunctionMapping.reorder("FIND", "CHARINDEX", STRING, 2, 3, TableauFabricRewriters.find()));
    }

    private static void addAggregate(List<FunctionMapping> list) {
        for (String n : List.of("SUM", "AVG", "COUNT", "MIN", "MAX", "STDEV", "STDEVP", "VAR", "VARP")) {
            list.add(FunctionMapping.same(n, AGGREGATE));
        }
        list.add(FunctionMapping.flag("MEDIAN", AGGREGATE,
                "MEDIAN function requires manual review: rewrite as PERCENTILE_CONT(0.5) WITHIN GROUP (ORDER BY ...) OVER (...)"));
    }

    private static void addLogical(List<FunctionMapping> list) {
        list.add(FunctionMapping.reorder("IF", "IIF", LOGICAL, 3, 3, TableauFabricRewriters.iif()));
        list.add(FunctionMapping.direct("IFNULL", "ISNULL", LOGICAL));
        list.add(FunctionMapping.reorder("ZN", "ISNULL", LOGICAL, 1, 1, TableauFabricRewriters.zn()));
        list.add(FunctionMapping.reorder("ISNULL", "ISNULL", LOGICAL, 1, 2, TableauFabricRewriters.isNull()));
    }

    private static void addConversion(List<FunctionMapping> list, int varcharLength) {
        list.add(FunctionMapping.reorder("INT", "CAST", CONVERSION, 1, 1, TableauFabricRewriters.castAs("INT")));
        list.add(FunctionMapping.reorder("FLOAT", "CAST", CONVERSION, 1, 1, TableauFabricRewriters.castAs("FLOAT")));
        list.add(FunctionMapping.reorder("DATE", "CAST", CONVERSION, 1, 1, TableauFabricRewriters.castAs("DATE")));
        list.add(FunctionMapping.reorder("STR", "CAST", CONVERSION, 1, 1, TableauFabricRewriters.str(varcharLength)));
    }

    private static void addMath(List<FunctionMapping> list) {
        for (String n : List.of("ABS", "ROUND", "CEILING", "FLOOR", "SQRT", "POWER", "EXP")) {
            list.add(FunctionMapping.same(n, MATHEMATICAL));
        }
        list.add(FunctionMapping.direct("LN", "LOG", MATHEMATICAL));
        list.add(FunctionMapping.reorder("LOG", "LOG10", MATHEMATICAL, 1, 2, TableauFabricRewriters.log()));
    }

    // names that are already T-SQL, so converted output converts to itself
    private static void addTargetNative(List<FunctionMapping> list) {
        list.add(FunctionMapping.same("GETDATE", DATE));
        list.add(FunctionMapping.same("DATEFROMPARTS", DATE));
        list.add(FunctionMapping.same("DATETIMEFROMPARTS", DATE));
        list.add(FunctionMapping.same("IIF", LOGICAL));
        list.add(FunctionMapping.same("COALESCE", LOGICAL));
        list.add(FunctionMapping.same("NULLIF", LOGICAL));
        list.add(FunctionMapping.same("SUBSTRING", STRING));
        list.add(FunctionMapping.same("CHARINDEX", STRING));
        list.add(FunctionMapping.same("CONCAT", STRING));
        list.add(FunctionMapping.same("STRING_SPLIT", STRING));
        list.add(FunctionMapping.same("LOG10", MATHEMATICAL));
        list.add(FunctionMapping.same("CAST", CONVERSION));
        list.add(FunctionMapping.same("CONVERT", CONVERSION));
        for (String t : List.of("VARCHAR", "NVARCHAR", "CHAR", "NCHAR", "DECIMAL", "NUMERIC")) {
            list.add(FunctionMapping.same(t, CONVERSION));
        }
    }
}
