package domain.fingerprint;

/**
 * How ORDER BY directions appear in a signature.
 */
public enum OrderByStyle {

    /**
     * {@code ORDER BY a DESC, b} gives {@code [a, DESC, b]}: the direction is its own item right after its column.
     */
    FLAT,

    /**
     * {@code ORDER BY a DESC, b} gives {@code [a DESC, b]}.
     */
    PAIRED
}
