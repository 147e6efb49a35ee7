package infra.output;

import domain.category.StatementCategory;
import domain.model.FingerprintWarning;
import domain.model.StatementSignature;
import domain.output.ReportWriter;
import domain.text.SourceStatement;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * CSV report: one row per statement, signature columns repeated per member.
 *
 * <p>List-valued columns are joined with {@code " | "}. Warnings are not part of this layout.</p>
 */
public final class CsvReportWriter implements ReportWriter {

    static final String[] HEADER = {
            "category", "size", "from_tables", "join_tables", "where_condition", "group_by", "order_by",
            "source", "line", "sql"
    };

    private static final String LIST_SEPARATOR = " | ";

    @Override
    public void write(Path out, List<StatementCategory> categories, List<FingerprintWarning> warnings) {
        if (out == null) throw new IllegalArgumentException("csv report path is null");

        CSVFormat format = CSVFormat.DEFAULT.builder()
                .setHeader(HEADER)
                .build();
        try {
            Path parent = out.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            try (Writer w = Files.newBufferedWriter(out, StandardCharsets.UTF_8);
                 CSVPrinter printer = new CSVPrinter(w, format)) {
                for (StatementCategory c : categories) {
                    StatementSignature sig = c.getSignature();
                    for (SourceStatement m : c.getMembers()) {
                        printer.printRecord(
                                c.getNumber(),
                                c.size(),
                                String.join(LIST_SEPARATOR, sig.getFromTables()),
                                String.join(LIST_SEPARATOR, sig.getJoinTables()),
                                sig.getWhereCondition(),
                                String.join(LIST_SEPARATOR, sig.getGroupBy()),
                                String.join(LIST_SEPARATOR, sig.getOrderBy()),
                                m.getSource(),
                                m.getLineNumber(),
                                m.getSql()
                        );
                    }
                }
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write csv report: " + out, e);
        }
    }
}
