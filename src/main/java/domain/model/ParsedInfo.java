package domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Extraction result for one statement, before sorting into a {@link StatementSignature}.
 *
 * <p>Lists keep extraction order. Unparsable input yields {@link #empty()}.</p>
 */
public final class ParsedInfo {

    private static final ParsedInfo EMPTY = new ParsedInfo(null, null, "", null, null);

    private final List<String> fromTables;
    private final List<String> joinTables;
    private final String whereCondition;
    private final List<String> groupBy;
    private final List<String> orderBy;

    public ParsedInfo(
            List<String> fromTables,
            List<String> joinTables,
            String whereCondition,
            List<String> groupBy,
            List<String> orderBy
    ) {
        this.fromTables = copy(fromTables);
        this.joinTables = copy(joinTables);
        this.whereCondition = whereCondition == null ? "" : whereCondition;
        this.groupBy = copy(groupBy);
        this.orderBy = copy(orderBy);
    }

    public static ParsedInfo empty() {
        return EMPTY;
    }

    private static List<String> copy(List<String> in) {
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

    public boolean isEmpty() {
        return fromTables.isEmpty() && joinTables.isEmpty() && whereCondition.isEmpty()
                && groupBy.isEmpty() && orderBy.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ParsedInfo)) return false;
        ParsedInfo other = (ParsedInfo) o;
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

    @Override
    public String toString() {
        return "ParsedInfo{from=" + fromTables
                + ", join=" + joinTables
                + ", where='" + whereCondition + "'"
                + ", groupBy=" + groupBy
                + ", orderBy=" + orderBy + "}";
    }
}
