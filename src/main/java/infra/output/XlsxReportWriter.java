package infra.output;

import domain.category.StatementCategory;
import domain.model.FingerprintWarning;
import domain.model.StatementSignature;
import domain.output.ReportWriter;
import domain.text.SourceStatement;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;

import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * XLSX report writer.
 *
 * <p>Sheets:
 * <ul>
 *   <li>categories: one row per signature with its member count</li>
 *   <li>statements: one row per input statement with its category number</li>
 *   <li>warnings: non-fatal warnings (standard codes)</li>
 * </ul>
 */
public final class XlsxReportWriter implements ReportWriter {

    static final String SHEET_CATEGORIES = "categories";
    static final String SHEET_STATEMENTS = "statements";
    static final String SHEET_WARNINGS = "warnings";

    // Excel rejects longer cell text
    private static final int MAX_CELL_CHARS = 32_767;

    private static void writeCategoriesSheet(Workbook wb, List<StatementCategory> categories) {
        Sheet sh = wb.createSheet(SHEET_CATEGORIES);
        int r = 0;
        header(sh.createRow(r++), "category", "size", "from_tables", "join_tables",
                "where_condition", "group_by", "order_by");

        for (StatementCategory c : categories) {
            StatementSignature sig = c.getSignature();
            Row row = sh.createRow(r++);
            row.createCell(0)
                    .setCellValue(c.getNumber());
            row.createCell(1)
                    .setCellValue(c.size());
            row.createCell(2)
                    .setCellValue(clip(String.join(", ", sig.getFromTables())));
            row.createCell(3)
                    .setCellValue(clip(String.join(", ", sig.getJoinTables())));
            row.createCell(4)
                    .setCellValue(clip(sig.getWhereCondition()));
            row.createCell(5)
                    .setCellValue(clip(String.join(", ", sig.getGroupBy())));
            row.createCell(6)
                    .setCellValue(clip(String.join(", ", sig.getOrderBy())));
        }
    }

    private static void writeStatementsSheet(Workbook wb, List<StatementCategory> categories) {
        Sheet sh = wb.createSheet(SHEET_STATEMENTS);
        int r = 0;
        header(sh.createRow(r++), "category", "source", "line", "sql");

        for (StatementCategory c : categories) {
            for (SourceStatement m : c.getMembers()) {
                Row row = sh.createRow(r++);
                row.createCell(0)
                        .setCellValue(c.getNumber());
                row.createCell(1)
                        .setCellValue(m.getSource());
                row.createCell(2)
                        .setCellValue(m.getLineNumber());
                row.createCell(3)
                        .setCellValue(clip(m.getSql()));
            }
        }
    }

    private static void writeWarningsSheet(Workbook wb, List<FingerprintWarning> warnings) {
        Sheet sh = wb.createSheet(SHEET_WARNINGS);
        int r = 0;
        header(sh.createRow(r++), "code", "source", "line", "message", "detail");

        for (FingerprintWarning w : warnings) {
            Row row = sh.createRow(r++);
            row.createCell(0)
                    .setCellValue(w.getCode().name());
            row.createCell(1)
                    .setCellValue(w.getSource());
            row.createCell(2)
                    .setCellValue(w.getLineNumber());
            row.createCell(3)
                    .setCellValue(clip(w.getMessage()));
            row.createCell(4)
                    .setCellValue(clip(w.getDetail()));
        }
    }

    private static void header(Row row, String... names) {
        for (int i = 0; i < names.length; i++) {
            row.createCell(i)
                    .setCellValue(names[i]);
        }
    }

    private static String clip(String s) {
        if (s == null) return "";
        return s.length() > MAX_CELL_CHARS ? s.substring(0, MAX_CELL_CHARS) : s;
    }

    @Override
    public void write(Path out, List<StatementCategory> categories, List<FingerprintWarning> warnings) {
        if (out == null) throw new IllegalArgumentException("xlsx report path is null");
        if (categories == null) throw new IllegalArgumentException("categories is null");
        if (warnings == null) throw new IllegalArgumentException("warnings is null");

        try {
            Path parent = out.toAbsolutePath()
                    .normalize()
                    .getParent();
            if (parent != null) Files.createDirectories(parent);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to create report parent dir: " + out, e);
        }

        try (Workbook wb = new XSSFWorkbook()) {
            writeCategoriesSheet(wb, categories);
            writeStatementsSheet(wb, categories);
            writeWarningsSheet(wb, warnings);

            try (OutputStream os = Files.newOutputStream(out)) {
                wb.write(os);
            }
        } catch (Exception e) {
            throw new IllegalStateException("Failed to write xlsx: " + out, e);
        }
    }
}
