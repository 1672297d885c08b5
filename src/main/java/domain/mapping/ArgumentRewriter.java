package domain.mapping;

import java.util.List;

/**
 * Restructures the arguments of a REORDER call into a target-dialect expression.
 *
 * <p>Implementations must be pure: the same name and arguments always give the same outcome.
 * They receive arguments already split on top-level commas and trimmed; nested calls inside an
 * argument have already been rewritten.</p>
 */
@FunctionalInterface
public interface ArgumentRewriter {

    /**
     * @param functionName the function name as written in the source (case preserved)
     * @param args         trimmed top-level arguments, never {@code null}
     */
    RewriteOutcome rewrite(String functionName, List<String> args);
}
