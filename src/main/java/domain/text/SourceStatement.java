package domain.text;

import domain.model.StatementContext;

/**
 * One SQL statement read from an input, with its origin.
 */
public final class SourceStatement {

    private final String source;
    private final int lineNumber;
    private final String sql;

    public SourceStatement(String source, int lineNumber, String sql) {
        this.source = source == null ? "" : source;
        this.lineNumber = lineNumber;
        this.sql = sql == null ? "" : sql;
    }

    public String getSource() {
        return source;
    }

    public int getLineNumber() {
        return lineNumber;
    }

    public String getSql() {
        return sql;
    }

    public StatementContext toContext() {
        return new StatementContext(source, lineNumber);
    }

    @Override
    public String toString() {
        return source + ":" + lineNumber + " " + sql;
    }
}
