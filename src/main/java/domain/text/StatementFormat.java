package domain.text;

/**
 * Input layout.
 * <ul>
 *   <li>{@link #LINES}: one statement per line</li>
 *   <li>{@link #CSV}: CSV with a header row and a sql / query column</li>
 * </ul>
 */
public enum StatementFormat {
    LINES,
    CSV
}
