package domain.model;

/**
 * Standard codes for flagged items.
 *
 * <p>Keep the set small and stable. Add codes only when the meaning is clear
 * and actionable for the reviewer.</p>
 */
public enum FlagCode {

    /**
     * The function has no entry in the mapping table.
     */
    UNSUPPORTED_FUNCTION,

    /**
     * A mapping exists but the call cannot be completed mechanically.
     */
    MANUAL_REVIEW_REQUIRED,

    /**
     * A restructuring rule was called with an argument count it does not accept.
     */
    ARGUMENT_ARITY_MISMATCH,

    /**
     * The statement failed the structural check and was passed through verbatim.
     */
    SYNTAX_ERROR,

    /**
     * Tableau level-of-detail expression ({FIXED ...}, {INCLUDE ...}, {EXCLUDE ...}).
     */
    LOD_EXPRESSION,

    /**
     * Conversion of the statement failed unexpectedly; the original text was kept.
     */
    CONVERSION_ERROR
}
