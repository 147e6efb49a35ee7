package app;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.InputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SqlFingerprintCliAppTest {

    @TempDir
    Path tempDir;

    private Path writeInput(String... lines) throws Exception {
        Path in = tempDir.resolve("queries.sql");
        Files.write(in, List.of(lines), StandardCharsets.UTF_8);
        return in;
    }

    @Test
    void csvReportGroupsStatements() throws Exception {
        Path in = writeInput(
                "SELECT * FROM table1 WHERE id = 1",
                "SELECT * FROM table4 WHERE category IN ('A','B','C') AND status IN (0,1,2)",
                "SELECT * FROM table1 WHERE id = 2"
        );
        Path out = tempDir.resolve("out").resolve("report.csv");

        int rc = SqlFingerprintCliApp.run(new String[]{
                "--input=" + in, "--report=csv", "--out=" + out, "--quiet"
        });

        assertEquals(0, rc);
        try (Reader r = Files.newBufferedReader(out, StandardCharsets.UTF_8);
             CSVParser p = CSVFormat.DEFAULT.builder().setHeader().setSkipHeaderRecord(true).build().parse(r)) {
            List<CSVRecord> rows = p.getRecords();
            assertEquals(3, rows.size());
            assertEquals("2", rows.get(0).get("size"));
            assertEquals("3", rows.get(1).get("line"));
            assertEquals("category IN ('X') AND status IN (9)", rows.get(2).get("where_condition"));
        }
    }

    @Test
    void textReportToFile() throws Exception {
        Path in = writeInput("SELECT * FROM table1 WHERE id = 1", "not sql at all");
        Path out = tempDir.resolve("report.txt");

        int rc = SqlFingerprintCliApp.run(new String[]{
                "--input", in.toString(), "--report", "text", "--out", out.toString(), "--quiet"
        });

        assertEquals(0, rc);
        String text = Files.readString(out, StandardCharsets.UTF_8);
        assertTrue(text.contains("Category: (('table1',), (), 'id = 9', (), ())"));
        assertTrue(text.contains("Category: ((), (), '', (), ())"));
        assertTrue(text.contains("MALFORMED_INPUT queries.sql:2"));
    }

    @Test
    void tooDeepStatementIsSkippedAndRecorded() throws Exception {
        Path in = writeInput(
                "SELECT * FROM t WHERE a IN (SELECT a FROM u WHERE b IN (SELECT b FROM v))",
                "SELECT * FROM t WHERE a = 1"
        );
        Path out = tempDir.resolve("report.xlsx");

        int rc = SqlFingerprintCliApp.run(new String[]{
                "--input=" + in, "--report=xlsx", "--out=" + out, "--maxDepth=1", "--quiet"
        });

        assertEquals(0, rc);
        try (InputStream is = Files.newInputStream(out);
             Workbook wb = new XSSFWorkbook(is)) {
            Sheet stmts = wb.getSheet("statements");
            assertEquals(1, stmts.getLastRowNum());
            assertEquals(2.0, stmts.getRow(1).getCell(2).getNumericCellValue());

            Sheet warns = wb.getSheet("warnings");
            assertEquals(1, warns.getLastRowNum());
            assertEquals("RECURSION_LIMIT_EXCEEDED", warns.getRow(1).getCell(0).getStringCellValue());
        }
    }

    @Test
    void failFastStopsWithNonZeroExit() throws Exception {
        Path in = writeInput(
                "SELECT * FROM t WHERE a IN (SELECT a FROM u WHERE b IN (SELECT b FROM v))",
                "SELECT * FROM t WHERE a = 1"
        );

        int rc = SqlFingerprintCliApp.run(new String[]{
                "--input=" + in, "--report=none", "--maxDepth=1", "--failFast", "--quiet"
        });

        assertEquals(1, rc);
    }

    @Test
    void maxLimitsProcessedStatements() throws Exception {
        Path in = writeInput("SELECT * FROM a", "SELECT * FROM b", "SELECT * FROM c");
        Path out = tempDir.resolve("limited.csv");

        int rc = SqlFingerprintCliApp.run(new String[]{
                "--input=" + in, "--report=csv", "--out=" + out, "--max=2", "--quiet"
        });

        assertEquals(0, rc);
        assertEquals(3, Files.readAllLines(out, StandardCharsets.UTF_8).size());
    }

    @Test
    void missingInputFails() {
        int rc = SqlFingerprintCliApp.run(new String[]{
                "--input=" + tempDir.resolve("missing.sql"), "--report=none", "--quiet"
        });
        assertEquals(1, rc);
    }

    @Test
    void invalidDepthIsUsageError() throws Exception {
        Path in = writeInput("SELECT * FROM a");
        int rc = SqlFingerprintCliApp.run(new String[]{"--input=" + in, "--maxDepth=0", "--report=none"});
        assertEquals(2, rc);
    }
}
