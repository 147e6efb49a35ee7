package domain.model;

/**
 * Lexical classes produced by the SQL lexer.
 *
 * <p>Owned by this project so that clause extraction never depends on a third-party
 * tokenizer's classification.</p>
 */
public enum TokenKind {
    KEYWORD,
    IDENTIFIER,
    PUNCTUATION,
    STRING_LITERAL,
    NUMERIC_LITERAL,
    BOOLEAN_LITERAL,
    NULL_LITERAL,
    COMMENT,
    WHITESPACE,
    OPERATOR,

    /**
     * ASC / DESC.
     */
    DIRECTION
}
