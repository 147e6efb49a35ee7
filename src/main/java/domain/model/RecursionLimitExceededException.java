package domain.model;

/**
 * Subquery or parenthesis nesting went deeper than the configured bound.
 */
public final class RecursionLimitExceededException extends RuntimeException {

    private final int depth;
    private final int limit;

    public RecursionLimitExceededException(String what, int depth, int limit) {
        super(what + " nesting depth " + depth + " exceeds limit " + limit);
        this.depth = depth;
        this.limit = limit;
    }

    public int getDepth() {
        return depth;
    }

    public int getLimit() {
        return limit;
    }
}
