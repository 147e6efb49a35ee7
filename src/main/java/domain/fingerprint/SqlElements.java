package domain.fingerprint;

import domain.model.ParenGroup;
import domain.model.SqlElement;
import domain.model.SqlToken;
import domain.model.TokenKind;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Folds a flat token list into {@link ParenGroup}s and offers small helpers over element lists.
 *
 * <p>Grouping uses an explicit stack, so arbitrarily deep parentheses cannot overflow the call stack.
 * A {@code )} with no open group stays a plain PUNCTUATION token; groups still open at the end
 * are closed implicitly.</p>
 */
public final class SqlElements {

    private SqlElements() {
    }

    public static List<SqlElement> group(List<SqlToken> tokens) {
        Deque<Frame> stack = new ArrayDeque<>();
        Frame top = new Frame(null);
        stack.push(top);

        for (SqlToken t : tokens) {
            if (t.isPunct('(')) {
                stack.push(new Frame(t));
                continue;
            }
            if (t.isPunct(')') && stack.size() > 1) {
                Frame f = stack.pop();
                stack.peek().items.add(new ParenGroup(f.open, f.items, t));
                continue;
            }
            stack.peek().items.add(t);
        }

        while (stack.size() > 1) {
            Frame f = stack.pop();
            stack.peek().items.add(new ParenGroup(f.open, f.items, null));
        }
        return top.items;
    }

    /** True when every {@code (} has a matching {@code )} and vice versa. */
    public static boolean isBalanced(List<SqlToken> tokens) {
        int depth = 0;
        for (SqlToken t : tokens) {
            if (t.isPunct('(')) depth++;
            else if (t.isPunct(')')) {
                if (--depth < 0) return false;
            }
        }
        return depth == 0;
    }

    static List<SqlElement> significant(List<SqlElement> elements) {
        List<SqlElement> out = new ArrayList<>(elements.size());
        for (SqlElement e : elements) {
            if (!e.isTrivia()) out.add(e);
        }
        return out;
    }

    static int nextSignificant(List<SqlElement> elements, int from) {
        for (int i = from; i < elements.size(); i++) {
            if (!elements.get(i).isTrivia()) return i;
        }
        return -1;
    }

    static SqlToken asToken(SqlElement e) {
        return (e instanceof SqlToken) ? (SqlToken) e : null;
    }

    static boolean isKeyword(SqlElement e, String kw) {
        SqlToken t = asToken(e);
        return t != null && t.isKeyword(kw);
    }

    static boolean isComma(SqlElement e) {
        SqlToken t = asToken(e);
        return t != null && t.isPunct(',');
    }

    static boolean is(SqlElement e, TokenKind kind) {
        SqlToken t = asToken(e);
        return t != null && t.is(kind);
    }

    /**
     * Splits at top-level commas. Parenthesized content never splits since groups are atomic.
     */
    static List<List<SqlElement>> splitByComma(List<SqlElement> elements) {
        List<List<SqlElement>> out = new ArrayList<>();
        List<SqlElement> cur = new ArrayList<>();
        for (SqlElement e : elements) {
            if (isComma(e)) {
                out.add(cur);
                cur = new ArrayList<>();
            } else {
                cur.add(e);
            }
        }
        out.add(cur);
        return out;
    }

    private static final class Frame {
        final SqlToken open;
        final List<SqlElement> items = new ArrayList<>();

        Frame(SqlToken open) {
            this.open = open;
        }
    }
}
