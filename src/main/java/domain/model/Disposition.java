package domain.model;

/**
 * Classification outcome of one call site or one statement.
 */
public enum Disposition {

    /** Rewritten (or already valid) target SQL. */
    CONVERTED,

    /** Recognized, but needs a human to finish the rewrite. */
    FLAGGED,

    /** No mapping exists for the function. Call sites only; the statement is FLAGGED. */
    UNSUPPORTED,

    /** Rejected by the structural validator; text kept verbatim. */
    SYNTAX_ERROR
}
