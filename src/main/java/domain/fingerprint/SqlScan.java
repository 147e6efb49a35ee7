package domain.fingerprint;

/**
 * Character cursor over SQL text. Every {@code read*} method consumes at least one character
 * when the matching {@code peek*} is true, and never reads past the end.
 */
final class SqlScan {
    final String s;
    int pos = 0;

    SqlScan(String s) {
        this.s = (s == null) ? "" : s;
    }

    static boolean isWordChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '$';
    }

    static boolean isWordStart(char c) {
        return Character.isLetter(c) || c == '_' || c == '$' || c == '@';
    }

    boolean hasNext() {
        return pos < s.length();
    }

    char peek() {
        return (pos < s.length()) ? s.charAt(pos) : '\0';
    }

    char peekAt(int ahead) {
        int p = pos + ahead;
        return (p < s.length()) ? s.charAt(p) : '\0';
    }

    char read() {
        return (pos < s.length()) ? s.charAt(pos++) : '\0';
    }

    String readSpaces() {
        int start = pos;
        while (pos < s.length() && Character.isWhitespace(s.charAt(pos))) pos++;
        return s.substring(start, pos);
    }

    boolean peekIsLineComment() {
        return pos + 1 < s.length() && s.charAt(pos) == '-' && s.charAt(pos + 1) == '-';
    }

    boolean peekIsBlockComment() {
        return pos + 1 < s.length() && s.charAt(pos) == '/' && s.charAt(pos + 1) == '*';
    }

    boolean peekIsSingleQuotedString() {
        return pos < s.length() && s.charAt(pos) == '\'';
    }

    boolean peekIsDoubleQuotedString() {
        return pos < s.length() && s.charAt(pos) == '"';
    }

    boolean peekIsBacktickIdentifier() {
        return pos < s.length() && s.charAt(pos) == '`';
    }

    /** Digit, or a dot directly followed by a digit ({@code .5}). */
    boolean peekIsNumber() {
        char c = peek();
        if (c >= '0' && c <= '9') return true;
        char n = peekAt(1);
        return c == '.' && n >= '0' && n <= '9';
    }

    String readLineComment() {
        int start = pos;
        while (pos < s.length()) {
            if (s.charAt(pos) == '\n') break;
            pos++;
        }
        return s.substring(start, pos);
    }

    String readBlockComment() {
        int start = pos;
        pos += 2; // /*
        while (pos < s.length()) {
            if (pos + 1 < s.length() && s.charAt(pos) == '*' && s.charAt(pos + 1) == '/') {
                pos += 2;
                return s.substring(start, pos);
            }
            pos++;
        }
        return s.substring(start, pos);
    }

    /**
     * Reads a quoted run closed by {@code quote}. A doubled quote or a backslash escape does not close it.
     */
    String readQuoted(char quote) {
        int start = pos;
        pos++; // opening quote
        while (pos < s.length()) {
            char c = s.charAt(pos++);
            if (c == '\\' && quote != '`') {
                if (pos < s.length()) pos++;
                continue;
            }
            if (c == quote) {
                // escaped '' / ""
                if (pos < s.length() && s.charAt(pos) == quote) {
                    pos++;
                    continue;
                }
                break;
            }
        }
        return s.substring(start, pos);
    }

    String readSingleQuotedString() {
        return readQuoted('\'');
    }

    String readDoubleQuotedString() {
        return readQuoted('"');
    }

    String readBacktickIdentifier() {
        return readQuoted('`');
    }

    /**
     * Integer or decimal, with an optional exponent. Stops before a second dot.
     */
    String readNumber() {
        int start = pos;
        while (pos < s.length() && Character.isDigit(s.charAt(pos))) pos++;
        if (pos < s.length() && s.charAt(pos) == '.') {
            pos++;
            while (pos < s.length() && Character.isDigit(s.charAt(pos))) pos++;
        }
        if (pos < s.length() && (s.charAt(pos) == 'e' || s.charAt(pos) == 'E')) {
            int p = pos + 1;
            if (p < s.length() && (s.charAt(p) == '+' || s.charAt(p) == '-')) p++;
            if (p < s.length() && Character.isDigit(s.charAt(p))) {
                pos = p;
                while (pos < s.length() && Character.isDigit(s.charAt(pos))) pos++;
            }
        }
        return s.substring(start, pos);
    }

    /**
     * Word with dotted parts ({@code schema.table.column}); a trailing {@code .*} is included.
     */
    String readIdentifier() {
        int start = pos;
        while (pos < s.length()) {
            char c = s.charAt(pos);
            if (isWordChar(c) || c == '@' || c == '#') {
                pos++;
                continue;
            }
            if (c == '.') {
                char n = peekAt(1);
                if (isWordChar(n) || n == '`') {
                    pos++;
                    if (n == '`') readBacktickIdentifier();
                    continue;
                }
                if (n == '*') {
                    pos += 2;
                }
            }
            break;
        }
        return s.substring(start, pos);
    }

    /**
     * Continues a dotted name after a quoted part, e.g. {@code `db`.`t`}.
     */
    String readQualifiedTail() {
        int start = pos;
        while (peek() == '.') {
            char n = peekAt(1);
            if (n == '`') {
                pos++;
                readBacktickIdentifier();
            } else if (isWordChar(n)) {
                pos++;
                readIdentifier();
            } else if (n == '*') {
                pos += 2;
                break;
            } else {
                break;
            }
        }
        return s.substring(start, pos);
    }
}
