package domain.fingerprint;

import domain.model.ClauseKind;
import domain.model.ClauseRegion;
import domain.model.SqlElement;
import domain.model.SqlToken;
import domain.model.TableReference;
import domain.model.TokenKind;

import java.util.ArrayList;
import java.util.List;

/**
 * Per-clause extraction over a {@link Segmentation}.
 */
final class ClauseExtractors {

    private ClauseExtractors() {
    }

    /** One label per comma-separated FROM entry, in clause order. */
    static List<String> fromTables(Segmentation seg, TableReferenceResolver resolver, int depth) {
        List<String> out = new ArrayList<>();
        for (ClauseRegion r : seg.all(ClauseKind.FROM)) {
            for (TableReference ref : resolver.resolveList(r.getElements(), depth)) {
                out.add(ref.getLabel());
            }
        }
        return out;
    }

    /** One label per JOIN region: the joined table, with the ON / USING part skipped. */
    static List<String> joinTables(Segmentation seg, TableReferenceResolver resolver, int depth) {
        List<String> out = new ArrayList<>();
        for (ClauseRegion r : seg.all(ClauseKind.JOIN)) {
            TableReference ref = resolver.resolve(beforeJoinCondition(r.getElements()), depth);
            if (ref != null) out.add(ref.getLabel());
        }
        return out;
    }

    static List<String> groupBy(Segmentation seg, ConditionCanonicalizer renderer) {
        List<String> out = new ArrayList<>();
        ClauseRegion r = seg.first(ClauseKind.GROUP_BY);
        if (r == null) return out;
        for (List<SqlElement> item : SqlElements.splitByComma(r.getElements())) {
            String text = renderer.render(item);
            if (!text.isEmpty()) out.add(text);
        }
        return out;
    }

    /**
     * Column items in clause order. A direction (with anything after it, e.g. {@code NULLS LAST})
     * follows its column as a separate item for {@link OrderByStyle#FLAT}, or is appended to it for
     * {@link OrderByStyle#PAIRED}.
     */
    static List<String> orderBy(Segmentation seg, ConditionCanonicalizer renderer, OrderByStyle style) {
        List<String> out = new ArrayList<>();
        ClauseRegion r = seg.first(ClauseKind.ORDER_BY);
        if (r == null) return out;

        for (List<SqlElement> item : SqlElements.splitByComma(r.getElements())) {
            List<SqlElement> sig = SqlElements.significant(item);
            int dir = lastDirection(sig);
            if (dir < 0) {
                String text = renderer.render(sig);
                if (!text.isEmpty()) out.add(text);
                continue;
            }

            String column = renderer.render(sig.subList(0, dir));
            String direction = renderer.render(sig.subList(dir, sig.size()));
            if (style == OrderByStyle.PAIRED) {
                out.add(column.isEmpty() ? direction : column + " " + direction);
            } else {
                if (!column.isEmpty()) out.add(column);
                out.add(direction);
            }
        }
        return out;
    }

    private static int lastDirection(List<SqlElement> sig) {
        for (int i = sig.size() - 1; i >= 0; i--) {
            if (SqlElements.is(sig.get(i), TokenKind.DIRECTION)) return i;
        }
        return -1;
    }

    private static List<SqlElement> beforeJoinCondition(List<SqlElement> elements) {
        for (int i = 0; i < elements.size(); i++) {
            SqlToken t = SqlElements.asToken(elements.get(i));
            if (t != null && (t.isKeyword("ON") || t.isKeyword("USING"))) {
                return elements.subList(0, i);
            }
        }
        return elements;
    }
}
