package domain.model;

/**
 * One item of a grouped token sequence: either a plain {@link SqlToken} or a balanced {@link ParenGroup}.
 */
public interface SqlElement {

    int getStartOffset();

    /**
     * Whitespace and comments. Never part of reconstructed text.
     */
    boolean isTrivia();
}
