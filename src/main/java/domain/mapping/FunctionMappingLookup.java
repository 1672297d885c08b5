package domain.mapping;

import java.util.Set;

/**
 * Minimal read-only abstraction for function mapping lookup.
 *
 * <p>Used to keep the convert layer testable without the built-in table or CSV loaders.</p>
 */
public interface FunctionMappingLookup {

    /**
     * Case-insensitive lookup on the exact function name.
     *
     * @return the mapping, or {@code null} when the function is unsupported
     */
    FunctionMapping find(String functionName);

    default boolean isMapped(String functionName) {
        return find(functionName) != null;
    }

    int size();

    /** Upper-cased source function names. */
    Set<String> names();
}
