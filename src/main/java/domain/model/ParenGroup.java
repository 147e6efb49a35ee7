package domain.model;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

/**
 * A maximal balanced-parenthesis span.
 *
 * <p>{@code close} is null when the input ended before the matching {@code )}.</p>
 */
public final class ParenGroup implements SqlElement {

    private final SqlToken open;
    private final List<SqlElement> children;
    private final SqlToken close;

    public ParenGroup(SqlToken open, List<SqlElement> children, SqlToken close) {
        this.open = open;
        this.children = children == null ? Collections.emptyList() : Collections.unmodifiableList(children);
        this.close = close;
    }

    public SqlToken getOpen() {
        return open;
    }

    public List<SqlElement> getChildren() {
        return children;
    }

    public SqlToken getClose() {
        return close;
    }

    public boolean isClosed() {
        return close != null;
    }

    @Override
    public int getStartOffset() {
        return open.getStartOffset();
    }

    @Override
    public boolean isTrivia() {
        return false;
    }

    /**
     * A subquery starts with SELECT; anything else is an expression or IN-list group.
     */
    public boolean isSubquery() {
        SqlElement first = firstSignificantChild();
        return first instanceof SqlToken && ((SqlToken) first).isKeyword("SELECT");
    }

    public SqlElement firstSignificantChild() {
        for (SqlElement e : children) {
            if (!e.isTrivia()) return e;
        }
        return null;
    }

    /** True when any nested level holds a quoted literal. */
    public boolean containsStringLiteral() {
        return anyToken(TokenKind.STRING_LITERAL, false);
    }

    /** True when this group or any nested group is a subquery. */
    public boolean containsSubquery() {
        return anyToken(null, true);
    }

    private boolean anyToken(TokenKind kind, boolean subquery) {
        Deque<ParenGroup> work = new ArrayDeque<>();
        work.push(this);
        while (!work.isEmpty()) {
            ParenGroup g = work.pop();
            if (subquery && g.isSubquery()) return true;
            for (SqlElement e : g.children) {
                if (e instanceof ParenGroup) {
                    work.push((ParenGroup) e);
                } else if (kind != null && ((SqlToken) e).is(kind)) {
                    return true;
                }
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return "ParenGroup@" + getStartOffset() + (isSubquery() ? "[subquery]" : "") + children;
    }
}
