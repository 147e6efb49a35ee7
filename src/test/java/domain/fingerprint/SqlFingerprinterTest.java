package domain.fingerprint;

import domain.model.FingerprintWarning;
import domain.model.ListWarningSink;
import domain.model.ParsedInfo;
import domain.model.RecursionLimitExceededException;
import domain.model.StatementContext;
import domain.model.StatementSignature;
import domain.model.WarningCode;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SqlFingerprinterTest {

    private final SqlFingerprinter fingerprinter = SqlFingerprinter.withDefaults();

    private static void assertSignature(StatementSignature sig,
                                        List<String> from, List<String> join, String where,
                                        List<String> groupBy, List<String> orderBy) {
        assertEquals(from, sig.getFromTables(), "from");
        assertEquals(join, sig.getJoinTables(), "join");
        assertEquals(where, sig.getWhereCondition(), "where");
        assertEquals(groupBy, sig.getGroupBy(), "group_by");
        assertEquals(orderBy, sig.getOrderBy(), "order_by");
    }

    // ------------------------------------------------------------------
    // end-to-end
    // ------------------------------------------------------------------

    @Test
    void simpleWhere() {
        assertSignature(fingerprinter.fingerprint("SELECT * FROM table1 WHERE id = 1"),
                List.of("table1"), List.of(), "id = 9", List.of(), List.of());
    }

    @Test
    void joinWithStringAndNumber() {
        assertSignature(fingerprinter.fingerprint(
                        "SELECT * FROM table1 JOIN table2 ON table1.id = table2.id WHERE table1.name = 'John' AND table2.age > 30"),
                List.of("table1"), List.of("table2"), "table1.name = 'X' AND table2.age > 9", List.of(), List.of());
    }

    @Test
    void inListsOfStringsAndNumbers() {
        assertSignature(fingerprinter.fingerprint(
                        "SELECT * FROM table4 WHERE category IN ('A','B','C') AND status IN (0,1,2)"),
                List.of("table4"), List.of(), "category IN ('X') AND status IN (9)", List.of(), List.of());
    }

    @Test
    void inListWithSubquery() {
        assertSignature(fingerprinter.fingerprint(
                        "SELECT * FROM table6 WHERE id IN (SELECT id FROM table7 WHERE value > 100)"),
                List.of("table6"), List.of(), "id IN (sub:table7|value > 9)", List.of(), List.of());
    }

    @Test
    void derivedTableInFrom() {
        assertSignature(fingerprinter.fingerprint(
                        "SELECT * FROM (SELECT id, name FROM table8 WHERE status = 'active') subquery WHERE subquery.id > 10"),
                List.of("sub:table8"), List.of(), "subquery.id > 9", List.of(), List.of());
    }

    @Test
    void betweenGroupByOrderBy() {
        assertSignature(fingerprinter.fingerprint(
                        "SELECT * FROM table4 WHERE date BETWEEN '2023-01-01' AND '2023-12-31' AND category IN ('A','B','C') "
                                + "GROUP BY category, date ORDER BY date DESC"),
                List.of("table4"), List.of(), "date BETWEEN 'X' AND 'X' AND category IN ('X')",
                List.of("category", "date"), List.of("date", "DESC"));
    }

    @Test
    void pairedOrderByStyle() {
        SqlFingerprinter paired = new SqlFingerprinter(FingerprintOptions.defaults().withOrderByStyle(OrderByStyle.PAIRED));
        StatementSignature sig = paired.fingerprint("SELECT * FROM t ORDER BY a DESC, b ASC, c");
        assertEquals(List.of("a DESC", "b ASC", "c"), sig.getOrderBy());
    }

    @Test
    void parseKeepsExtractionOrderWhileSignatureSorts() {
        String sql = "SELECT * FROM zeta, alpha JOIN omega ON 1 = 1 JOIN beta ON 1 = 1";

        ParsedInfo info = fingerprinter.parse(sql);
        assertEquals(List.of("zeta", "alpha"), info.getFromTables());
        assertEquals(List.of("omega", "beta"), info.getJoinTables());

        StatementSignature sig = fingerprinter.fingerprint(sql);
        assertEquals(List.of("alpha", "zeta"), sig.getFromTables());
        assertEquals(List.of("beta", "omega"), sig.getJoinTables());
    }

    // ------------------------------------------------------------------
    // properties
    // ------------------------------------------------------------------

    @Test
    void literalValuesDoNotChangeTheSignature() {
        StatementSignature a = fingerprinter.fingerprint(
                "SELECT * FROM t WHERE a = 1 AND b = 'x' AND c = TRUE AND d IN (1, 2) AND e > -3.5");
        StatementSignature b = fingerprinter.fingerprint(
                "select * from t where a = 42 and b = 'something else' and c = false and d in (7) and e > -0.25");

        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
    }

    @Test
    void fromTableOrderDoesNotChangeTheSignature() {
        assertEquals(
                fingerprinter.fingerprint("SELECT * FROM a, b, c WHERE a.x = 1"),
                fingerprinter.fingerprint("SELECT * FROM c, a, b WHERE a.x = 2"));
    }

    @Test
    void duplicateTablesAreKept() {
        assertEquals(List.of("t", "t"), fingerprinter.fingerprint("SELECT * FROM t a, t b").getFromTables());
    }

    @Test
    void differentShapesDiffer() {
        assertNotEquals(
                fingerprinter.fingerprint("SELECT * FROM t WHERE a = 1"),
                fingerprinter.fingerprint("SELECT * FROM t WHERE b = 1"));
        assertNotEquals(
                fingerprinter.fingerprint("SELECT * FROM t ORDER BY a"),
                fingerprinter.fingerprint("SELECT * FROM t ORDER BY a DESC"));
    }

    @Test
    void missingClausesGiveEmptyComponents() {
        assertSignature(fingerprinter.fingerprint("SELECT a, b FROM t"),
                List.of("t"), List.of(), "", List.of(), List.of());
    }

    @Test
    void whereConditionIsAFixpoint() {
        String where = fingerprinter.fingerprint(
                "SELECT * FROM t WHERE id IN (SELECT id FROM u WHERE v IN (1, 2)) AND x = 'y'").getWhereCondition();
        assertEquals(where, ConditionCanonicalizer.canonicalize(where));
    }

    @Test
    void keywordsAndCommentsInsideStringsDoNotConfuseClauses() {
        assertSignature(fingerprinter.fingerprint(
                        "SELECT * FROM t WHERE note = 'FROM x WHERE y -- not a comment' ORDER BY id"),
                List.of("t"), List.of(), "note = 'X'", List.of(), List.of("id"));
    }

    @Test
    void distinctFromComparisonIsPartOfTheCondition() {
        assertSignature(fingerprinter.fingerprint("SELECT * FROM t WHERE a IS DISTINCT FROM b AND c = 1"),
                List.of("t"), List.of(), "a IS DISTINCT FROM b AND c = 9", List.of(), List.of());
        assertSignature(fingerprinter.fingerprint("SELECT * FROM t WHERE a IS NOT DISTINCT FROM 'z'"),
                List.of("t"), List.of(), "a IS NOT DISTINCT FROM 'X'", List.of(), List.of());
    }

    @Test
    void columnNamedLikeAClauseKeepsTheRestOfTheCondition() {
        assertSignature(fingerprinter.fingerprint("SELECT * FROM t WHERE offset = 1 AND b = 2"),
                List.of("t"), List.of(), "OFFSET = 9 AND b = 9", List.of(), List.of());
        assertSignature(fingerprinter.fingerprint("SELECT * FROM t WHERE a = 1 ORDER BY a LIMIT 10 OFFSET 5"),
                List.of("t"), List.of(), "a = 9", List.of(), List.of("a"));
        assertSignature(fingerprinter.fingerprint("SELECT * FROM t WHERE a = 1 FOR UPDATE"),
                List.of("t"), List.of(), "a = 9", List.of(), List.of());
    }

    // ------------------------------------------------------------------
    // errors and warnings
    // ------------------------------------------------------------------

    @Test
    void malformedInputFailsSoft() {
        List<FingerprintWarning> warnings = new ArrayList<>();
        ListWarningSink sink = new ListWarningSink(warnings);
        StatementContext ctx = new StatementContext("q.sql", 7);

        assertTrue(fingerprinter.parse("", ctx, sink).isEmpty());
        assertTrue(fingerprinter.parse("UPDATE t SET a = 1", ctx, sink).isEmpty());
        assertEquals(fingerprinter.fingerprint("DELETE FROM t"), fingerprinter.fingerprint("garbage ( ' text"));

        assertEquals(2, warnings.size());
        for (FingerprintWarning w : warnings) {
            assertEquals(WarningCode.MALFORMED_INPUT, w.getCode());
            assertEquals("q.sql", w.getSource());
            assertEquals(7, w.getLineNumber());
        }
        assertTrue(warnings.get(1).getDetail().contains("UPDATE"));
    }

    @Test
    void unsupportedConstructsAreFingerprintedWithAWarning() {
        List<FingerprintWarning> warnings = new ArrayList<>();
        ListWarningSink sink = new ListWarningSink(warnings);

        ParsedInfo union = fingerprinter.parse("SELECT a FROM t WHERE a = 1 UNION SELECT a FROM u", StatementContext.none(), sink);
        assertEquals(List.of("t"), union.getFromTables());
        assertEquals("a = 9", union.getWhereCondition());

        ParsedInfo cte = fingerprinter.parse("WITH x AS (SELECT * FROM base) SELECT * FROM x WHERE k = 2", StatementContext.none(), sink);
        assertEquals(List.of("x"), cte.getFromTables());
        assertEquals("k = 9", cte.getWhereCondition());

        fingerprinter.parse("SELECT 1 FROM a; SELECT 2 FROM b", StatementContext.none(), sink);

        assertEquals(3, warnings.size());
        assertTrue(warnings.stream().allMatch(w -> w.getCode() == WarningCode.UNSUPPORTED_CONSTRUCT));
    }

    @Test
    void trailingSemicolonIsNotWarned() {
        List<FingerprintWarning> warnings = new ArrayList<>();
        fingerprinter.parse("SELECT * FROM t WHERE a = 1;  ", StatementContext.none(), new ListWarningSink(warnings));
        assertTrue(warnings.isEmpty());
    }

    @Test
    void unbalancedParenthesesAreWarnedButParsed() {
        List<FingerprintWarning> warnings = new ArrayList<>();
        ParsedInfo info = fingerprinter.parse("SELECT * FROM t WHERE a IN (1, 2", StatementContext.none(),
                new ListWarningSink(warnings));

        assertEquals("a IN (9)", info.getWhereCondition());
        assertEquals(1, warnings.size());
        assertEquals(WarningCode.UNBALANCED_PARENTHESES, warnings.get(0).getCode());
    }

    @Test
    void deepSubqueryNestingThrows() {
        SqlFingerprinter shallow = new SqlFingerprinter(FingerprintOptions.defaults().withMaxSubqueryDepth(2));
        String sql = "SELECT * FROM t WHERE a IN (SELECT a FROM u WHERE b IN (SELECT b FROM v WHERE c IN (SELECT c FROM w)))";

        assertThrows(RecursionLimitExceededException.class, () -> shallow.fingerprint(sql));
        assertDoesNotThrow(() -> fingerprinter.fingerprint(sql));
    }

    @Test
    void pathologicalNestingFailsDeterministically() {
        StringBuilder sb = new StringBuilder("SELECT * FROM t WHERE a = ");
        for (int i = 0; i < 10_000; i++) sb.append('(');
        sb.append('1');
        for (int i = 0; i < 10_000; i++) sb.append(')');

        assertThrows(RecursionLimitExceededException.class, () -> fingerprinter.fingerprint(sb.toString()));
    }

    @Test
    void signatureRendersAsTuple() {
        assertEquals("(('table1',), (), 'id = 9', (), ())",
                fingerprinter.fingerprint("SELECT * FROM table1 WHERE id = 1").toString());
    }
}
