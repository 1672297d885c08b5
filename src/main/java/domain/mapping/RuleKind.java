package domain.mapping;

/**
 * How a mapped function is rewritten.
 *
 * <p>There is no UNSUPPORTED constant: a function without an entry in the mapping table
 * is unsupported by definition.</p>
 */
public enum RuleKind {

    /**
     * Only the function name changes; argument text is kept byte-for-byte.
     */
    DIRECT,

    /**
     * Arguments are split and restructured by an {@link ArgumentRewriter}.
     */
    REORDER,

    /**
     * The call is recognized but must be rewritten by a human.
     */
    FLAG
}
