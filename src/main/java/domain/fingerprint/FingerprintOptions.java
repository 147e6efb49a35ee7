package domain.fingerprint;

/**
 * Immutable pipeline settings.
 */
public final class FingerprintOptions {

    public static final int DEFAULT_MAX_SUBQUERY_DEPTH = 16;
    public static final int DEFAULT_MAX_PAREN_DEPTH = 256;

    private static final FingerprintOptions DEFAULTS =
            new FingerprintOptions(DEFAULT_MAX_SUBQUERY_DEPTH, DEFAULT_MAX_PAREN_DEPTH, OrderByStyle.FLAT);

    private final int maxSubqueryDepth;
    private final int maxParenDepth;
    private final OrderByStyle orderByStyle;

    public FingerprintOptions(int maxSubqueryDepth, int maxParenDepth, OrderByStyle orderByStyle) {
        if (maxSubqueryDepth < 1) throw new IllegalArgumentException("maxSubqueryDepth must be >= 1: " + maxSubqueryDepth);
        if (maxParenDepth < 1) throw new IllegalArgumentException("maxParenDepth must be >= 1: " + maxParenDepth);
        this.maxSubqueryDepth = maxSubqueryDepth;
        this.maxParenDepth = maxParenDepth;
        this.orderByStyle = orderByStyle == null ? OrderByStyle.FLAT : orderByStyle;
    }

    public static FingerprintOptions defaults() {
        return DEFAULTS;
    }

    public FingerprintOptions withMaxSubqueryDepth(int depth) {
        return new FingerprintOptions(depth, maxParenDepth, orderByStyle);
    }

    public FingerprintOptions withMaxParenDepth(int depth) {
        return new FingerprintOptions(maxSubqueryDepth, depth, orderByStyle);
    }

    public FingerprintOptions withOrderByStyle(OrderByStyle style) {
        return new FingerprintOptions(maxSubqueryDepth, maxParenDepth, style);
    }

    public int getMaxSubqueryDepth() {
        return maxSubqueryDepth;
    }

    public int getMaxParenDepth() {
        return maxParenDepth;
    }

    public OrderByStyle getOrderByStyle() {
        return orderByStyle;
    }

    @Override
    public String toString() {
        return "maxSubqueryDepth=" + maxSubqueryDepth + ", maxParenDepth=" + maxParenDepth + ", orderBy=" + orderByStyle;
    }
}
