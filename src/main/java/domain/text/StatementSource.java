package domain.text;

import java.io.Reader;
import java.util.List;

/**
 * Reads SQL statements from an input.
 */
public interface StatementSource {

    /**
     * @param location file path, or {@code -} for standard input
     */
    List<SourceStatement> load(String location);

    List<SourceStatement> load(Reader reader, String sourceName);
}
