package domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Structural fingerprint of a statement. Two statements with equal signatures share a shape.
 *
 * <p>{@code fromTables} / {@code joinTables} are sorted with duplicates kept;
 * {@code groupBy} / {@code orderBy} keep clause order. Instances are immutable and
 * safe to use as map keys.</p>
 */
public final class StatementSignature {

    private final List<String> fromTables;
    private final List<String> joinTables;
    private final String whereCondition;
    private final List<String> groupBy;
    private final List<String> orderBy;

    public StatementSignature(
            List<String> fromTables,
            List<String> joinTables,
            String whereCondition,
            List<String> groupBy,
            List<String> orderBy
    ) {
        this.fromTables = freeze(fromTables);
        this.joinTables = freeze(joinTables);
        this.whereCondition = whereCondition == null ? "" : whereCondition;
        this.groupBy = freeze(groupBy);
        this.orderBy = freeze(orderBy);
    }

    private static List<String> freeze(List<String> in) {
        if (in == null || in.isEmpty()) return Collections.emptyList();
        return Collections.unmodifiableList(new ArrayList<>(in));
    }

    public List<String> getFromTables() {
        return fromTables;
    }

    public List<String> getJoinTables() {
        return joinTables;
    }

    public String getWhereCondition() {
        return whereCondition;
    }

    public List<String> getGroupBy() {
        return groupBy;
    }

    public List<String> getOrderBy() {
        return orderBy;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StatementSignature)) return false;
        StatementSignature other = (StatementSignature) o;
        return fromTables.equals(other.fromTables)
                && joinTables.equals(other.joinTables)
                && whereCondition.equals(other.whereCondition)
                && groupBy.equals(other.groupBy)
                && orderBy.equals(other.orderBy);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fromTables, joinTables, whereCondition, groupBy, orderBy);
    }

    /**
     * Tuple-like rendering used as the category key in reports.
     */
    @Override
    public String toString() {
        return "(" + tuple(fromTables) + ", " + tuple(joinTables) + ", " + quote(whereCondition)
                + ", " + tuple(groupBy) + ", " + tuple(orderBy) + ")";
    }

    private static String tuple(List<String> items) {
        StringBuilder sb = new StringBuilder("(");
        for (int i = 0; i < items.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(quote(items.get(i)));
        }
        if (items.size() == 1) sb.append(',');
        return sb.append(')').toString();
    }

    private static String quote(String s) {
        return "'" + s.replace("\\", "\\\\").replace("'", "\\'") + "'";
    }
}
