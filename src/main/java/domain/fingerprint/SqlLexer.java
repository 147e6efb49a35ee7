package domain.fingerprint;

import domain.model.SqlToken;
import domain.model.TokenKind;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Splits raw SQL text into typed tokens.
 *
 * <p>Total: any input yields a token list whose texts concatenate back to the input.
 * Characters that start no other token become single-character OPERATOR tokens.</p>
 */
public final class SqlLexer {

    static final Set<String> KEYWORDS = Collections.unmodifiableSet(new HashSet<>(Arrays.asList(
            "SELECT", "FROM", "WHERE", "JOIN", "STRAIGHT_JOIN",
            "LEFT", "RIGHT", "FULL", "INNER", "OUTER", "CROSS", "NATURAL", "STRAIGHT",
            "ON", "USING", "GROUP", "ORDER", "BY", "HAVING", "LIMIT", "OFFSET", "FETCH",
            "WINDOW", "QUALIFY", "FOR",
            "UNION", "INTERSECT", "EXCEPT", "MINUS", "WITH", "RECURSIVE", "LATERAL",
            "AS", "DISTINCT", "ALL", "ANY", "SOME",
            "AND", "OR", "NOT", "IN", "IS", "BETWEEN", "LIKE", "ILIKE", "EXISTS", "ESCAPE",
            "CASE", "WHEN", "THEN", "ELSE", "END",
            "INSERT", "INTO", "VALUES", "UPDATE", "SET", "DELETE", "MERGE",
            "CREATE", "ALTER", "DROP", "TRUNCATE"
    )));

    private static final Set<String> DIRECTIONS = Collections.unmodifiableSet(new HashSet<>(Arrays.asList(
            "ASC", "DESC"
    )));

    private static final String[] MULTI_CHAR_OPERATORS = {"<=", ">=", "<>", "!=", "==", "||", "::"};

    private SqlLexer() {
    }

    public static List<SqlToken> tokenize(String text) {
        List<SqlToken> out = new ArrayList<>();
        if (text == null || text.isEmpty()) return out;

        SqlScan st = new SqlScan(text);
        while (st.hasNext()) {
            int start = st.pos;
            char c = st.peek();

            if (Character.isWhitespace(c)) {
                out.add(new SqlToken(TokenKind.WHITESPACE, st.readSpaces(), start));
                continue;
            }
            if (st.peekIsLineComment()) {
                out.add(new SqlToken(TokenKind.COMMENT, st.readLineComment(), start));
                continue;
            }
            if (st.peekIsBlockComment()) {
                out.add(new SqlToken(TokenKind.COMMENT, st.readBlockComment(), start));
                continue;
            }
            if (st.peekIsSingleQuotedString()) {
                out.add(new SqlToken(TokenKind.STRING_LITERAL, st.readSingleQuotedString(), start));
                continue;
            }
            if (st.peekIsDoubleQuotedString()) {
                out.add(new SqlToken(TokenKind.STRING_LITERAL, st.readDoubleQuotedString(), start));
                continue;
            }
            if (st.peekIsBacktickIdentifier()) {
                String name = st.readBacktickIdentifier() + st.readQualifiedTail();
                out.add(new SqlToken(TokenKind.IDENTIFIER, name, start));
                continue;
            }
            if (st.peekIsNumber()) {
                String num = st.readNumber();
                if (SqlScan.isWordChar(st.peek())) {
                    // 1st_col, 2fa: a word that happens to start with digits
                    out.add(new SqlToken(TokenKind.IDENTIFIER, num + st.readIdentifier(), start));
                } else {
                    out.add(new SqlToken(TokenKind.NUMERIC_LITERAL, num, start));
                }
                continue;
            }
            if (SqlScan.isWordStart(c)) {
                String word = st.readIdentifier();
                out.add(new SqlToken(classifyWord(word), word, start));
                continue;
            }
            if (c == '(' || c == ')' || c == ',' || c == ';' || c == '.') {
                st.read();
                out.add(new SqlToken(TokenKind.PUNCTUATION, String.valueOf(c), start));
                continue;
            }

            out.add(new SqlToken(TokenKind.OPERATOR, readOperator(st), start));
        }
        return out;
    }

    static TokenKind classifyWord(String word) {
        if (word.indexOf('.') >= 0) return TokenKind.IDENTIFIER;
        String u = word.toUpperCase(Locale.ROOT);
        if (KEYWORDS.contains(u)) return TokenKind.KEYWORD;
        if (DIRECTIONS.contains(u)) return TokenKind.DIRECTION;
        if (u.equals("TRUE") || u.equals("FALSE")) return TokenKind.BOOLEAN_LITERAL;
        if (u.equals("NULL")) return TokenKind.NULL_LITERAL;
        return TokenKind.IDENTIFIER;
    }

    private static String readOperator(SqlScan st) {
        for (String op : MULTI_CHAR_OPERATORS) {
            if (st.s.startsWith(op, st.pos)) {
                st.pos += op.length();
                return op;
            }
        }
        return String.valueOf(st.read());
    }
}
