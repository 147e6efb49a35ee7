package domain.category;

import domain.fingerprint.SqlFingerprinter;
import domain.model.StatementSignature;
import domain.model.WarningSink;
import domain.text.SourceStatement;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Groups statements by equal {@link StatementSignature}.
 *
 * <p>Categories are numbered in order of first appearance; members keep input order.
 * Not thread-safe: one instance accumulates one run.</p>
 */
public final class SqlCategorizer {

    private final Map<StatementSignature, StatementCategory> categories = new LinkedHashMap<>();

    public static List<StatementCategory> categorize(SqlFingerprinter fingerprinter, List<String> sqls) {
        SqlCategorizer categorizer = new SqlCategorizer();
        int line = 0;
        for (String sql : sqls) {
            line++;
            SourceStatement st = new SourceStatement("", line, sql);
            categorizer.add(fingerprinter.fingerprint(sql, st.toContext(), WarningSink.none()), st);
        }
        return categorizer.getCategories();
    }

    public StatementCategory add(StatementSignature signature, SourceStatement statement) {
        StatementCategory c = categories.get(signature);
        if (c == null) {
            c = new StatementCategory(categories.size() + 1, signature);
            categories.put(signature, c);
        }
        c.add(statement);
        return c;
    }

    public List<StatementCategory> getCategories() {
        return new ArrayList<>(categories.values());
    }

    public int size() {
        return categories.size();
    }
}
