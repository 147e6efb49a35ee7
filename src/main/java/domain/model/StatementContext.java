package domain.model;

/**
 * Where a statement came from, for warning attribution: input name plus 1-based line (or record) number.
 */
public final class StatementContext {

    private static final StatementContext NONE = new StatementContext("", 0);

    private final String source;
    private final int lineNumber;

    public StatementContext(String source, int lineNumber) {
        this.source = source == null ? "" : source;
        this.lineNumber = Math.max(0, lineNumber);
    }

    public static StatementContext none() {
        return NONE;
    }

    public String getSource() {
        return source;
    }

    public int getLineNumber() {
        return lineNumber;
    }

    @Override
    public String toString() {
        return source.isEmpty() ? "#" + lineNumber : source + ":" + lineNumber;
    }
}
