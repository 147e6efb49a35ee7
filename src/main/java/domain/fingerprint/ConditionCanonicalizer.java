package domain.fingerprint;

import domain.model.ParenGroup;
import domain.model.ParsedInfo;
import domain.model.RecursionLimitExceededException;
import domain.model.SqlElement;
import domain.model.SqlToken;
import domain.model.StatementContext;
import domain.model.TableReference;
import domain.model.TokenKind;
import domain.model.WarningSink;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

/**
 * Renders predicate elements as canonical condition text.
 *
 * <ol>
 *   <li>literals become placeholders ({@link LiteralAbstractor})</li>
 *   <li>{@code IN (...)} collapses to {@code IN ('X')} or {@code IN (9)}; a list holding a SELECT is
 *       canonicalized instead</li>
 *   <li>a parenthesized SELECT is fingerprinted by the whole pipeline and replaced by
 *       {@code (sub:<sorted tables>|<inner condition>)}</li>
 *   <li>pieces are joined by single spaces; keywords are upper-cased</li>
 * </ol>
 *
 * <p>Output is a fixpoint: feeding it back through {@link #canonicalize(String)} returns it unchanged.</p>
 */
public final class ConditionCanonicalizer {

    private static final String COMPACT_HEAD = "sub";

    private final FingerprintPass pass;
    private final int maxSubqueryDepth;
    private final int maxParenDepth;

    ConditionCanonicalizer(FingerprintPass pass, FingerprintOptions options) {
        this.pass = pass;
        this.maxSubqueryDepth = options.getMaxSubqueryDepth();
        this.maxParenDepth = options.getMaxParenDepth();
    }

    /**
     * Canonicalizes free-standing condition text (no leading WHERE).
     */
    public static String canonicalize(String conditionText) {
        return canonicalize(conditionText, FingerprintOptions.defaults());
    }

    public static String canonicalize(String conditionText, FingerprintOptions options) {
        FingerprintPass pass = new FingerprintPass(options, StatementContext.none(), WarningSink.none());
        List<SqlElement> elements = SqlElements.group(SqlLexer.tokenize(conditionText));
        return pass.canonicalizer().canonicalize(elements, 0);
    }

    /**
     * @param depth subquery depth of the statement owning the condition
     */
    String canonicalize(List<SqlElement> elements, int depth) {
        return renderLevel(elements, depth, 0, true);
    }

    /**
     * Plain rendering (no literal abstraction, no subquery folding) for GROUP BY / ORDER BY items.
     */
    String render(List<SqlElement> elements) {
        return renderLevel(elements, 0, 0, false);
    }

    private String renderLevel(List<SqlElement> elements, int depth, int parenDepth, boolean abstractLiterals) {
        CanonicalText out = new CanonicalText();
        List<SqlElement> sig = SqlElements.significant(elements);

        SqlElement prev = null;
        for (int i = 0; i < sig.size(); i++) {
            SqlElement e = sig.get(i);

            if (e instanceof ParenGroup) {
                String group = renderGroup((ParenGroup) e, prev, depth, parenDepth, abstractLiterals);
                out.append(group, isCallee(prev));
            } else {
                SqlToken t = (SqlToken) e;
                boolean glueBefore = t.isPunct(',') || t.isPunct(')') || t.isPunct('.') || t.isPunct(';');
                out.append(tokenText(t, abstractLiterals), glueBefore);
                if (t.isPunct('.')) {
                    out.glueNext();
                } else if (isUnarySign(t, prev) && i + 1 < sig.size()
                        && SqlElements.is(sig.get(i + 1), TokenKind.NUMERIC_LITERAL)) {
                    out.glueNext();
                }
            }
            prev = e;
        }
        return out.toString();
    }

    private String renderGroup(ParenGroup g, SqlElement prev, int depth, int parenDepth, boolean abstractLiterals) {
        int inner = parenDepth + 1;
        if (inner > maxParenDepth) {
            throw new RecursionLimitExceededException("parenthesis", inner, maxParenDepth);
        }
        String close = g.isClosed() ? ")" : "";

        if (!abstractLiterals) {
            return "(" + renderLevel(g.getChildren(), depth, inner, false) + close;
        }

        String compact = renderCompactForm(g, depth, inner);
        if (compact != null) return compact;

        if (g.isSubquery()) return subqueryForm(g, depth);

        if (SqlElements.isKeyword(prev, "IN") && !holdsSubquery(g)) {
            return g.containsStringLiteral() ? "(" + LiteralAbstractor.SINGLE_QUOTED + ")" : "(" + LiteralAbstractor.NUMBER + ")";
        }
        return "(" + renderLevel(g.getChildren(), depth, inner, true) + close;
    }

    private String subqueryForm(ParenGroup g, int depth) {
        int inner = depth + 1;
        if (inner > maxSubqueryDepth) {
            throw new RecursionLimitExceededException("subquery", inner, maxSubqueryDepth);
        }
        ParsedInfo info = pass.parseLevel(g.getChildren(), inner);

        List<String> tables = new ArrayList<>(info.getFromTables());
        tables.addAll(info.getJoinTables());
        Collections.sort(tables);

        return "(" + TableReference.SUBQUERY_PREFIX + String.join(",", tables) + "|" + info.getWhereCondition() + ")";
    }

    /**
     * Re-renders an already canonical {@code (sub:<tables>|<condition>)}; null when {@code g} is not one.
     */
    private String renderCompactForm(ParenGroup g, int depth, int parenDepth) {
        List<SqlElement> ch = g.getChildren();
        int b = compactColon(g);
        if (b < 0) return null;

        StringBuilder tables = new StringBuilder();
        int bar = -1;
        for (int k = b + 1; k < ch.size(); k++) {
            SqlElement e = ch.get(k);
            if (e instanceof ParenGroup) return null;
            SqlToken t = (SqlToken) e;
            if (t.isOperator("|")) {
                bar = k;
                break;
            }
            if (t.isTrivia()) return null;
            tables.append(t.getText());
        }
        if (bar < 0) return null;

        String condition = renderLevel(ch.subList(bar + 1, ch.size()), depth, parenDepth, true);
        return "(" + TableReference.SUBQUERY_PREFIX + tables + "|" + condition + (g.isClosed() ? ")" : "");
    }

    /** Index of the colon in a leading {@code sub:}, or -1. */
    private static int compactColon(ParenGroup g) {
        List<SqlElement> ch = g.getChildren();
        int a = SqlElements.nextSignificant(ch, 0);
        if (a < 0) return -1;
        SqlToken head = SqlElements.asToken(ch.get(a));
        if (head == null || !head.is(TokenKind.IDENTIFIER) || !head.getText().equals(COMPACT_HEAD)) return -1;

        int b = a + 1;
        if (b >= ch.size()) return -1;
        SqlToken colon = SqlElements.asToken(ch.get(b));
        return colon != null && colon.isOperator(":") ? b : -1;
    }

    /**
     * True when {@code g} or any group nested in it is a subquery, raw or already in compact form.
     * Such IN lists keep their shape so a second pass renders them the same way.
     */
    private static boolean holdsSubquery(ParenGroup g) {
        if (g.containsSubquery()) return true;
        Deque<ParenGroup> stack = new ArrayDeque<>();
        stack.push(g);
        while (!stack.isEmpty()) {
            ParenGroup cur = stack.pop();
            if (compactColon(cur) >= 0) return true;
            for (SqlElement e : cur.getChildren()) {
                if (e instanceof ParenGroup) stack.push((ParenGroup) e);
            }
        }
        return false;
    }

    private static String tokenText(SqlToken t, boolean abstractLiterals) {
        if (abstractLiterals) {
            String placeholder = LiteralAbstractor.abstractToken(t);
            if (placeholder != null) return placeholder;
        }
        switch (t.getKind()) {
            case KEYWORD:
            case DIRECTION:
            case BOOLEAN_LITERAL:
            case NULL_LITERAL:
                return t.upper();
            default:
                return t.getText();
        }
    }

    /** A group glued to the previous token is a call: {@code lower(x)}, {@code LEFT(x, 3)}. */
    private static boolean isCallee(SqlElement prev) {
        SqlToken t = SqlElements.asToken(prev);
        if (t == null) return false;
        return t.is(TokenKind.IDENTIFIER) || t.isKeyword("LEFT") || t.isKeyword("RIGHT");
    }

    private static boolean isUnarySign(SqlToken t, SqlElement prev) {
        if (!t.isOperator("-") && !t.isOperator("+")) return false;
        if (prev == null) return true;
        SqlToken p = SqlElements.asToken(prev);
        if (p == null) return false;
        return p.is(TokenKind.OPERATOR) || p.is(TokenKind.KEYWORD) || p.isPunct(',');
    }
}
