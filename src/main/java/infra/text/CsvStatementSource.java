package infra.text;

import domain.text.SourceStatement;
import domain.text.StatementSource;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;

/**
 * CSV statement loader.
 *
 * <p>The first row is read as the header (not via commons-csv header mode, so blank header cells
 * are tolerated and named {@code COL_n}). The SQL column is the first whose normalized name is one of
 * {@code sql}, {@code sql_text}, {@code sqltext}, {@code query}, {@code statement}; without one, the
 * first column is used. Rows with blank SQL are skipped. Line numbers are CSV record numbers
 * (header = 1).</p>
 */
public final class CsvStatementSource implements StatementSource {

    private static final String[] SQL_HEADERS = {"sql", "sqltext", "query", "statement"};

    @Override
    public List<SourceStatement> load(String location) {
        if (location == null || location.isBlank()) {
            throw new IllegalArgumentException("csv location is blank");
        }
        try (Reader reader = InputLocations.open(location)) {
            return load(reader, InputLocations.displayName(location));
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read csv: " + location, e);
        }
    }

    @Override
    public List<SourceStatement> load(Reader reader, String sourceName) {
        try (CSVParser parser = CSVFormat.DEFAULT
                .builder()
                .setTrim(true)
                .build()
                .parse(reader)) {

            Iterator<CSVRecord> it = parser.iterator();
            if (!it.hasNext()) return new ArrayList<>();

            CSVRecord headerRec = it.next();
            List<String> headers = new ArrayList<>(headerRec.size());
            for (int i = 0; i < headerRec.size(); i++) {
                String h = InputLocations.stripBom(headerRec.get(i)).trim();
                if (h.isBlank()) h = "COL_" + (i + 1);
                headers.add(h);
            }
            int sqlCol = sqlColumn(headers);

            List<SourceStatement> out = new ArrayList<>(1024);
            while (it.hasNext()) {
                CSVRecord r = it.next();
                if (sqlCol >= r.size()) continue;
                String sql = r.get(sqlCol);
                if (sql == null || sql.isBlank()) continue;
                out.add(new SourceStatement(sourceName, (int) r.getRecordNumber(), sql.trim()));
            }
            return out;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read csv: " + sourceName, e);
        }
    }

    static int sqlColumn(List<String> headers) {
        for (String wanted : SQL_HEADERS) {
            for (int i = 0; i < headers.size(); i++) {
                if (norm(headers.get(i)).equals(wanted)) return i;
            }
        }
        return 0;
    }

    private static String norm(String s) {
        String t = InputLocations.stripBom(s == null ? "" : s).trim().toLowerCase(Locale.ROOT);
        // letters/digits only
        return t.replaceAll("[^\\p{L}\\p{Nd}]+", "");
    }
}
