package domain.model;

/**
 * Standard warning codes for fingerprinting and reporting.
 *
 * <p>Keep the set small and stable.</p>
 */
public enum WarningCode {

    /**
     * Blank input, or input that does not start with SELECT / WITH. The statement gets an empty signature.
     */
    MALFORMED_INPUT,

    /**
     * Recognized syntax outside the supported shape (CTE prefix, set operation, multi-statement batch).
     * The statement is still fingerprinted, more coarsely.
     */
    UNSUPPORTED_CONSTRUCT,

    /**
     * Parentheses do not balance. Unclosed groups run to the end of the statement.
     */
    UNBALANCED_PARENTHESES,

    /**
     * Nesting exceeded the configured depth; the statement is skipped.
     */
    RECURSION_LIMIT_EXCEEDED,

    /**
     * Fingerprinting failed with an unexpected exception.
     */
    FINGERPRINT_ERROR
}
