package domain.mapping;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FunctionMappingRegistryTest {

    @Test
    void find_should_be_case_insensitive_on_exact_name() {
        FunctionMappingRegistry r = FunctionMappingRegistry.builder()
                .add(FunctionMapping.direct("DATE", "CAST", FunctionCategory.CONVERSION))
                .add(FunctionMapping.direct("DATEADD", "DATEADD", FunctionCategory.DATE))
                .build();

        assertEquals("DATEADD", r.find("dateAdd").getSourceName());
        assertEquals("DATE", r.find(" Date ").getSourceName());
        assertNull(r.find("DATEA"));
        assertNull(r.find(""));
        assertNull(r.find(null));
        assertTrue(r.isMapped("date"));
    }

    @Test
    void later_registration_should_override_earlier() {
        FunctionMappingRegistry r = FunctionMappingRegistry.builder()
                .add(FunctionMapping.flag("MEDIAN", FunctionCategory.AGGREGATE, "review"))
                .add(FunctionMapping.direct("median", "MEDIAN_APPROX", FunctionCategory.AGGREGATE))
                .build();

        assertEquals(1, r.size());
        assertEquals(RuleKind.DIRECT, r.find("MEDIAN").getKind());
        assertEquals("MEDIAN_APPROX", r.find("MEDIAN").getTargetName());
    }

    @Test
    void should_expose_version_and_counts() {
        FunctionMappingRegistry r = FunctionMappingRegistry.builder()
                .version("v-test")
                .addAll(List.of(
                        FunctionMapping.same("UPPER", FunctionCategory.STRING),
                        FunctionMapping.flag("MEDIAN", FunctionCategory.AGGREGATE, null)
                ))
                .build();

        assertEquals("v-test", r.getVersion());
        assertEquals(1, r.countByKind().get(RuleKind.DIRECT));
        assertEquals(1, r.countByKind().get(RuleKind.FLAG));
        assertNull(r.countByKind().get(RuleKind.REORDER));
        assertEquals("MEDIAN function requires manual review", r.find("median").getReason());
        assertEquals("custom", FunctionMappingRegistry.builder().build().getVersion());
    }

    @Test
    void names_should_be_read_only() {
        FunctionMappingRegistry r = FunctionMappingRegistry.builder()
                .add(FunctionMapping.same("ABS", FunctionCategory.MATHEMATICAL))
                .build();

        assertThrows(UnsupportedOperationException.class, () -> r.names().add("X"));
    }

    @Test
    void mapping_factories_should_validate_arguments() {
        assertThrows(IllegalArgumentException.class, () -> FunctionMapping.direct(" ", "X", FunctionCategory.OTHER));
        assertThrows(IllegalArgumentException.class,
                () -> FunctionMapping.reorder("X", "Y", FunctionCategory.OTHER, 1, 1, null));
        assertThrows(IllegalArgumentException.class,
                () -> FunctionMapping.reorder("X", "Y", FunctionCategory.OTHER, 2, 1, (n, a) -> RewriteOutcome.unchanged()));

        FunctionMapping m = FunctionMapping.reorder("FIND", "CHARINDEX", FunctionCategory.STRING, 2, 3,
                (n, a) -> RewriteOutcome.unchanged());
        assertFalse(m.acceptsArgCount(1));
        assertTrue(m.acceptsArgCount(3));
        assertFalse(m.acceptsArgCount(4));
        assertTrue(FunctionMapping.direct("NOW", "GETDATE", FunctionCategory.DATE).acceptsArgCount(7));
    }
}
