package domain.model;

import java.util.Objects;

/**
 * A resolved FROM / JOIN entry. Aliases of plain tables are not kept.
 */
public final class TableReference {

    public static final String SUBQUERY_PREFIX = "sub:";

    private final String label;
    private final boolean subqueryDerived;

    public TableReference(String label, boolean subqueryDerived) {
        this.label = label == null ? "" : label;
        this.subqueryDerived = subqueryDerived;
    }

    public static TableReference table(String name) {
        return new TableReference(name, false);
    }

    public static TableReference derived(String innerTableOrAlias) {
        return new TableReference(SUBQUERY_PREFIX + (innerTableOrAlias == null ? "" : innerTableOrAlias), true);
    }

    public String getLabel() {
        return label;
    }

    public boolean isSubqueryDerived() {
        return subqueryDerived;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TableReference)) return false;
        TableReference other = (TableReference) o;
        return subqueryDerived == other.subqueryDerived && label.equals(other.label);
    }

    @Override
    public int hashCode() {
        return Objects.hash(label, subqueryDerived);
    }

    @Override
    public String toString() {
        return label;
    }
}
