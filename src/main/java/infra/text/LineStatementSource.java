package infra.text;

import domain.text.SourceStatement;
import domain.text.StatementSource;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.List;

/**
 * One statement per line.
 *
 * <p>Blank lines and lines starting with {@code --} or {@code #} are skipped; a trailing
 * {@code ;} is dropped. Line numbers are 1-based physical lines.</p>
 */
public final class LineStatementSource implements StatementSource {

    @Override
    public List<SourceStatement> load(String location) {
        if (location == null || location.isBlank()) {
            throw new IllegalArgumentException("input location is blank");
        }
        try (Reader reader = InputLocations.open(location)) {
            return load(reader, InputLocations.displayName(location));
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read statements: " + location, e);
        }
    }

    @Override
    public List<SourceStatement> load(Reader reader, String sourceName) {
        List<SourceStatement> out = new ArrayList<>();
        BufferedReader br = (reader instanceof BufferedReader) ? (BufferedReader) reader : new BufferedReader(reader);
        try {
            String line;
            int lineNo = 0;
            while ((line = br.readLine()) != null) {
                lineNo++;
                String sql = (lineNo == 1 ? InputLocations.stripBom(line) : line).trim();
                if (sql.isEmpty() || sql.startsWith("--") || sql.startsWith("#")) continue;
                while (sql.endsWith(";")) {
                    sql = sql.substring(0, sql.length() - 1).trim();
                }
                if (sql.isEmpty()) continue;
                out.add(new SourceStatement(sourceName, lineNo, sql));
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read statements: " + sourceName, e);
        }
        return out;
    }
}
