package domain.fingerprint;

import domain.model.ClauseKind;
import domain.model.ClauseRegion;
import domain.model.ParenGroup;
import domain.model.RecursionLimitExceededException;
import domain.model.SqlElement;
import domain.model.SqlToken;
import domain.model.TableReference;
import domain.model.TokenKind;

import java.util.ArrayList;
import java.util.List;

/**
 * Resolves one FROM / JOIN entry to a {@link TableReference}.
 *
 * <ul>
 *   <li>{@code t}, {@code t a}, {@code t AS a}: label {@code t}</li>
 *   <li>{@code (SELECT .. FROM inner ..) a}: label {@code sub:inner}, or {@code sub:a} when the inner FROM
 *       has no resolvable name</li>
 *   <li>{@code (t1 JOIN t2 ON ..)}: parentheses without SELECT are unwrapped</li>
 * </ul>
 */
final class TableReferenceResolver {

    private final int maxSubqueryDepth;

    TableReferenceResolver(int maxSubqueryDepth) {
        this.maxSubqueryDepth = maxSubqueryDepth;
    }

    /**
     * @param span  elements of one entry (trivia allowed)
     * @param depth subquery nesting depth of the statement owning {@code span}
     * @return the reference, or null when the span holds nothing nameable
     */
    TableReference resolve(List<SqlElement> span, int depth) {
        List<SqlElement> sig = SqlElements.significant(span);
        int idx = skipLateral(sig, 0);
        if (idx >= sig.size()) return null;

        SqlElement primary = unwrap(sig.get(idx));
        if (primary instanceof ParenGroup) {
            String inner = innerTable((ParenGroup) primary, depth + 1);
            if (inner != null) return TableReference.derived(inner);
            String alias = aliasAfter(sig, idx + 1);
            return TableReference.derived(alias == null ? "" : alias);
        }

        String name = nameOf(primary);
        return name == null ? null : TableReference.table(name);
    }

    List<TableReference> resolveList(List<SqlElement> region, int depth) {
        List<TableReference> out = new ArrayList<>();
        for (List<SqlElement> entry : SqlElements.splitByComma(region)) {
            TableReference ref = resolve(entry, depth);
            if (ref != null) out.add(ref);
        }
        return out;
    }

    /**
     * First table named after the subquery's own FROM, descending through derived tables.
     */
    private String innerTable(ParenGroup subquery, int depth) {
        if (depth > maxSubqueryDepth) {
            throw new RecursionLimitExceededException("subquery", depth, maxSubqueryDepth);
        }
        ClauseRegion from = ClauseWalker.segment(subquery.getChildren()).first(ClauseKind.FROM);
        if (from == null) return null;

        List<SqlElement> first = SqlElements.significant(SqlElements.splitByComma(from.getElements()).get(0));
        int idx = skipLateral(first, 0);
        if (idx >= first.size()) return null;

        SqlElement primary = unwrap(first.get(idx));
        if (primary instanceof ParenGroup) return innerTable((ParenGroup) primary, depth + 1);
        return nameOf(primary);
    }

    /** Strips parentheses that do not start a SELECT. */
    private static SqlElement unwrap(SqlElement e) {
        SqlElement cur = e;
        while (cur instanceof ParenGroup && !((ParenGroup) cur).isSubquery()) {
            List<SqlElement> inner = SqlElements.significant(((ParenGroup) cur).getChildren());
            int idx = skipLateral(inner, 0);
            if (idx >= inner.size()) return null;
            cur = inner.get(idx);
        }
        return cur;
    }

    private static int skipLateral(List<SqlElement> sig, int from) {
        int i = from;
        while (i < sig.size() && SqlElements.isKeyword(sig.get(i), "LATERAL")) i++;
        return i;
    }

    private static String aliasAfter(List<SqlElement> sig, int idx) {
        int i = idx;
        if (i < sig.size() && SqlElements.isKeyword(sig.get(i), "AS")) i++;
        if (i >= sig.size()) return null;
        SqlToken t = SqlElements.asToken(sig.get(i));
        if (t == null) return null;
        return (t.is(TokenKind.IDENTIFIER) || t.is(TokenKind.STRING_LITERAL)) ? t.getText() : null;
    }

    private static String nameOf(SqlElement e) {
        SqlToken t = SqlElements.asToken(e);
        if (t == null || t.is(TokenKind.PUNCTUATION) || t.is(TokenKind.OPERATOR)) return null;
        return t.getText();
    }
}
