package infra.output;

import domain.category.SqlCategorizer;
import domain.category.StatementCategory;
import domain.fingerprint.SqlFingerprinter;
import domain.model.FingerprintWarning;
import domain.model.StatementContext;
import domain.model.WarningCode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TextReportWriterTest {

    @TempDir
    Path tempDir;

    private static List<StatementCategory> sample() {
        return SqlCategorizer.categorize(SqlFingerprinter.withDefaults(), List.of(
                "SELECT * FROM table1 WHERE id = 1",
                "SELECT * FROM table2",
                "SELECT * FROM table1 WHERE id = 2"
        ));
    }

    @Test
    void printsCategoryBlocksToConsoleWhenNoPath() {
        ByteArrayOutputStream buf = new ByteArrayOutputStream();
        PrintStream console = new PrintStream(buf, true, StandardCharsets.UTF_8);

        new TextReportWriter(console).write(null, sample(), List.of());

        String text = buf.toString(StandardCharsets.UTF_8);
        String nl = System.lineSeparator();
        assertTrue(text.startsWith("Category: (('table1',), (), 'id = 9', (), ())" + nl
                + "  SELECT * FROM table1 WHERE id = 1" + nl
                + "  SELECT * FROM table1 WHERE id = 2" + nl
                + nl
                + "Category: (('table2',), (), '', (), ())" + nl), text);
        assertFalse(text.contains("Warnings:"));
    }

    @Test
    void writesFileWithWarningsSection() throws Exception {
        Path out = tempDir.resolve("report").resolve("categories.txt");
        FingerprintWarning w = FingerprintWarning.of(WarningCode.MALFORMED_INPUT,
                new StatementContext("in.sql", 4), "statement does not start with SELECT", "offset=0");

        new TextReportWriter().write(out, sample(), List.of(w));

        String text = Files.readString(out, StandardCharsets.UTF_8);
        assertTrue(text.contains("Category: (('table2',), (), '', (), ())"));
        assertTrue(text.contains("Warnings:"));
        assertTrue(text.contains("  MALFORMED_INPUT in.sql:4 statement does not start with SELECT (offset=0)"));
    }
}
