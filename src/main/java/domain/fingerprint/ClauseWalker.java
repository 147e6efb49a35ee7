package domain.fingerprint;

import domain.model.ClauseKind;
import domain.model.ClauseRegion;
import domain.model.ParenGroup;
import domain.model.SqlElement;
import domain.model.SqlToken;
import domain.model.TokenKind;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Locates top-level clause regions in one left-to-right pass.
 *
 * <p>States: NEUTRAL, SELECTING, the five region states, OTHER (HAVING / LIMIT / ... whose
 * content is not part of the signature) and TERMINAL. Only tokens at the current level are
 * inspected: a {@link ParenGroup} is consumed whole, so FROM / WHERE / JOIN inside a subquery or
 * an IN-list never open a region here.</p>
 */
public final class ClauseWalker {

    private static final Set<String> JOIN_MODIFIERS = Collections.unmodifiableSet(new HashSet<>(Arrays.asList(
            "LEFT", "RIGHT", "FULL", "INNER", "OUTER", "CROSS", "NATURAL", "STRAIGHT"
    )));

    /** Clauses that close the current region without contributing to the signature. */
    private static final Set<String> OTHER_CLAUSES = Collections.unmodifiableSet(new HashSet<>(Arrays.asList(
            "HAVING", "LIMIT", "OFFSET", "FETCH", "WINDOW", "QUALIFY", "FOR"
    )));

    /** Words after {@code FOR} that make it a locking / output clause ({@code FOR UPDATE}, {@code FOR XML PATH}). */
    private static final Set<String> FOR_CLAUSE_WORDS = Collections.unmodifiableSet(new HashSet<>(Arrays.asList(
            "UPDATE", "SHARE", "NO", "KEY", "READ", "XML", "JSON", "BROWSE"
    )));

    private static final Set<String> SET_OPERATORS = Collections.unmodifiableSet(new HashSet<>(Arrays.asList(
            "UNION", "INTERSECT", "EXCEPT", "MINUS"
    )));

    private static final int MAX_JOIN_MODIFIERS = 3;

    private enum State {
        NEUTRAL,
        SELECTING,
        IN_REGION,
        OTHER,
        TERMINAL
    }

    private ClauseWalker() {
    }

    public static Segmentation segment(List<SqlElement> elements) {
        List<ClauseRegion> regions = new ArrayList<>();
        State state = State.NEUTRAL;
        ClauseKind kind = null;
        String introducer = null;
        List<SqlElement> cur = null;
        SqlToken terminator = null;

        for (int i = 0; i < elements.size() && state != State.TERMINAL; i++) {
            SqlElement e = elements.get(i);
            SqlToken t = SqlElements.asToken(e);

            if (t != null && !t.isTrivia()) {
                ClauseKind next = null;
                String nextIntroducer = null;
                int consumedTo = i;

                if (t.isPunct(';')) {
                    terminator = t;
                    state = State.TERMINAL;
                } else if (t.is(TokenKind.KEYWORD)) {
                    String u = t.upper();
                    int joinEnd;
                    if (u.equals("SELECT") && state == State.NEUTRAL) {
                        state = State.SELECTING;
                        continue;
                    } else if (u.equals("FROM") && !isDistinctFrom(elements, i)) {
                        next = ClauseKind.FROM;
                        nextIntroducer = "FROM";
                    } else if (u.equals("WHERE")) {
                        next = ClauseKind.WHERE;
                        nextIntroducer = "WHERE";
                    } else if ((u.equals("GROUP") || u.equals("ORDER")) && followedByBy(elements, i)) {
                        next = u.equals("GROUP") ? ClauseKind.GROUP_BY : ClauseKind.ORDER_BY;
                        nextIntroducer = u + " BY";
                        consumedTo = SqlElements.nextSignificant(elements, i + 1);
                    } else if ((joinEnd = matchJoin(elements, i)) >= 0) {
                        next = ClauseKind.JOIN;
                        nextIntroducer = joinIntroducer(elements, i, joinEnd);
                        consumedTo = joinEnd;
                    } else if (OTHER_CLAUSES.contains(u) && opensOtherClause(elements, i, u)) {
                        if (cur != null) regions.add(new ClauseRegion(kind, introducer, cur));
                        cur = null;
                        kind = null;
                        state = State.OTHER;
                        continue;
                    } else if (SET_OPERATORS.contains(u) && !isColumnExclusion(elements, i, state)) {
                        terminator = t;
                        state = State.TERMINAL;
                    }
                }

                if (state == State.TERMINAL) break;

                if (next != null) {
                    if (cur != null) regions.add(new ClauseRegion(kind, introducer, cur));
                    kind = next;
                    introducer = nextIntroducer;
                    cur = new ArrayList<>();
                    state = State.IN_REGION;
                    i = consumedTo;
                    continue;
                }
            }

            if (cur != null) cur.add(e);
        }

        if (cur != null) regions.add(new ClauseRegion(kind, introducer, cur));
        return new Segmentation(regions, terminator);
    }

    /** {@code SELECT * EXCEPT (col)} excludes columns rather than starting a set operation. */
    private static boolean isColumnExclusion(List<SqlElement> elements, int i, State state) {
        if (state != State.SELECTING || !SqlElements.isKeyword(elements.get(i), "EXCEPT")) return false;
        int n = SqlElements.nextSignificant(elements, i + 1);
        return n >= 0 && elements.get(n) instanceof ParenGroup
                && !((ParenGroup) elements.get(n)).isSubquery();
    }

    /** {@code a IS [NOT] DISTINCT FROM b} is a predicate, not a FROM clause. */
    private static boolean isDistinctFrom(List<SqlElement> elements, int i) {
        int d = previousSignificant(elements, i);
        if (d < 0 || !SqlElements.isKeyword(elements.get(d), "DISTINCT")) return false;
        int p = previousSignificant(elements, d);
        if (p >= 0 && SqlElements.isKeyword(elements.get(p), "NOT")) p = previousSignificant(elements, p);
        return p >= 0 && SqlElements.isKeyword(elements.get(p), "IS");
    }

    /**
     * HAVING and QUALIFY always open a clause. The other words are also common column names
     * ({@code offset}, {@code window}), so they count only when the next token fits the clause.
     */
    private static boolean opensOtherClause(List<SqlElement> elements, int i, String word) {
        if (word.equals("HAVING") || word.equals("QUALIFY")) return true;

        int n = SqlElements.nextSignificant(elements, i + 1);
        if (n < 0) return false;
        SqlElement next = elements.get(n);
        SqlToken t = SqlElements.asToken(next);

        switch (word) {
            case "LIMIT":
            case "OFFSET":
                return next instanceof ParenGroup
                        || t.is(TokenKind.NUMERIC_LITERAL)
                        || t.is(TokenKind.IDENTIFIER)
                        || t.isOperator("?")
                        || t.isOperator(":")
                        || t.isKeyword("ALL");
            case "FETCH":
                return t != null && (t.upper().equals("FIRST") || t.upper().equals("NEXT"));
            case "WINDOW": {
                if (t == null || !t.is(TokenKind.IDENTIFIER)) return false;
                int as = SqlElements.nextSignificant(elements, n + 1);
                return as >= 0 && SqlElements.isKeyword(elements.get(as), "AS");
            }
            case "FOR":
                return t != null && FOR_CLAUSE_WORDS.contains(t.upper());
            default:
                return false;
        }
    }

    private static int previousSignificant(List<SqlElement> elements, int from) {
        for (int k = from - 1; k >= 0; k--) {
            if (!elements.get(k).isTrivia()) return k;
        }
        return -1;
    }

    private static boolean followedByBy(List<SqlElement> elements, int i) {
        int n = SqlElements.nextSignificant(elements, i + 1);
        return n >= 0 && SqlElements.isKeyword(elements.get(n), "BY");
    }

    /**
     * Matches {@code [modifier...] JOIN} starting at {@code i}, where modifiers are LEFT/RIGHT/FULL,
     * INNER/OUTER/STRAIGHT and CROSS/NATURAL. Returns the index of the JOIN token, or -1.
     */
    static int matchJoin(List<SqlElement> elements, int i) {
        int j = i;
        int modifiers = 0;
        while (j >= 0) {
            SqlToken t = SqlElements.asToken(elements.get(j));
            if (t == null || !t.is(TokenKind.KEYWORD)) return -1;
            String u = t.upper();
            if (u.equals("JOIN") || u.equals("STRAIGHT_JOIN")) return j;
            if (!JOIN_MODIFIERS.contains(u) || ++modifiers > MAX_JOIN_MODIFIERS) return -1;
            j = SqlElements.nextSignificant(elements, j + 1);
        }
        return -1;
    }

    private static String joinIntroducer(List<SqlElement> elements, int from, int to) {
        StringBuilder sb = new StringBuilder();
        for (int k = from; k <= to; k++) {
            SqlElement e = elements.get(k);
            if (e.isTrivia()) continue;
            if (sb.length() > 0) sb.append(' ');
            sb.append(((SqlToken) e).upper());
        }
        return sb.toString();
    }
}
