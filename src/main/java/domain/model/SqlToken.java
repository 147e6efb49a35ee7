package domain.model;

import java.util.Locale;
import java.util.Objects;

/**
 * A typed lexical token. {@code text} keeps the original casing.
 */
public final class SqlToken implements SqlElement {

    private final TokenKind kind;
    private final String text;
    private final int startOffset;

    public SqlToken(TokenKind kind, String text, int startOffset) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.text = text == null ? "" : text;
        this.startOffset = startOffset;
    }

    public TokenKind getKind() {
        return kind;
    }

    public String getText() {
        return text;
    }

    @Override
    public int getStartOffset() {
        return startOffset;
    }

    public int getEndOffset() {
        return startOffset + text.length();
    }

    @Override
    public boolean isTrivia() {
        return kind == TokenKind.WHITESPACE || kind == TokenKind.COMMENT;
    }

    public String upper() {
        return text.toUpperCase(Locale.ROOT);
    }

    public boolean is(TokenKind k) {
        return kind == k;
    }

    /** Case-insensitive keyword test. */
    public boolean isKeyword(String kw) {
        return kind == TokenKind.KEYWORD && text.equalsIgnoreCase(kw);
    }

    public boolean isPunct(char c) {
        return kind == TokenKind.PUNCTUATION && text.length() == 1 && text.charAt(0) == c;
    }

    public boolean isOperator(String op) {
        return kind == TokenKind.OPERATOR && text.equals(op);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SqlToken)) return false;
        SqlToken other = (SqlToken) o;
        return startOffset == other.startOffset && kind == other.kind && text.equals(other.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, text, startOffset);
    }

    @Override
    public String toString() {
        return kind + "(" + text + ")@" + startOffset;
    }
}
