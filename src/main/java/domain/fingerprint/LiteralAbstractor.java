package domain.fingerprint;

import domain.model.SqlToken;

/**
 * Placeholder substitution for literal tokens.
 *
 * <p>Numbers become {@code 9}, quoted strings {@code 'X'} / {@code "X"}, TRUE/FALSE {@code B};
 * NULL is only upper-cased. Placeholders map to themselves, so abstraction is idempotent.</p>
 */
public final class LiteralAbstractor {

    public static final String NUMBER = "9";
    public static final String SINGLE_QUOTED = "'X'";
    public static final String DOUBLE_QUOTED = "\"X\"";
    public static final String BOOLEAN = "B";
    public static final String NULL = "NULL";

    private LiteralAbstractor() {
    }

    /**
     * @return the placeholder, or null when {@code t} is not a literal
     */
    public static String abstractToken(SqlToken t) {
        return switch (t.getKind()) {
            case NUMERIC_LITERAL -> NUMBER;
            case STRING_LITERAL -> t.getText().startsWith("\"") ? DOUBLE_QUOTED : SINGLE_QUOTED;
            case BOOLEAN_LITERAL -> BOOLEAN;
            case NULL_LITERAL -> NULL;
            default -> null;
        };
    }
}
