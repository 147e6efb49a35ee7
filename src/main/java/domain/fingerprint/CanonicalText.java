package domain.fingerprint;

/**
 * Joins rendered pieces with single spaces unless a piece asks to be glued to its neighbour.
 */
final class CanonicalText {

    private final StringBuilder sb = new StringBuilder();
    private boolean glueNext = false;

    void append(String piece, boolean glueBefore) {
        if (piece == null || piece.isEmpty()) return;
        if (sb.length() > 0 && !glueBefore && !glueNext) sb.append(' ');
        sb.append(piece);
        glueNext = false;
    }

    void glueNext() {
        glueNext = true;
    }

    @Override
    public String toString() {
        return sb.toString();
    }
}
