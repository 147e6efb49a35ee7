package domain.fingerprint;

import domain.model.RecursionLimitExceededException;
import domain.model.TableReference;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TableReferenceResolverTest {

    private final TableReferenceResolver resolver = new TableReferenceResolver(FingerprintOptions.DEFAULT_MAX_SUBQUERY_DEPTH);

    private TableReference resolve(String entry) {
        return resolver.resolve(SqlElements.group(SqlLexer.tokenize(entry)), 0);
    }

    @Test
    void plainAndAliasedNamesResolveToTheName() {
        assertEquals(TableReference.table("orders"), resolve("orders"));
        assertEquals(TableReference.table("orders"), resolve("orders o"));
        assertEquals(TableReference.table("orders"), resolve("orders AS o"));
        assertEquals(TableReference.table("sales.orders"), resolve("sales.orders o"));
    }

    @Test
    void aliasedSubqueryResolvesToItsInnerTable() {
        TableReference ref = resolve("(SELECT id, name FROM table8 WHERE status = 'active') subquery");

        assertEquals("sub:table8", ref.getLabel());
        assertTrue(ref.isSubqueryDerived());
    }

    @Test
    void nestedDerivedTablesResolveToTheInnermostName() {
        assertEquals("sub:deep", resolve("(SELECT * FROM (SELECT * FROM deep) d1) d2").getLabel());
    }

    @Test
    void unresolvableSubqueryFallsBackToAlias() {
        assertEquals("sub:s", resolve("(SELECT 1) s").getLabel());
        assertEquals("sub:s", resolve("(SELECT 1) AS s").getLabel());
        assertEquals("sub:", resolve("(SELECT 1)").getLabel());
    }

    @Test
    void parenthesesWithoutSelectAreUnwrapped() {
        assertEquals(TableReference.table("t1"), resolve("(t1 JOIN t2 ON t1.id = t2.id)"));
    }

    @Test
    void lateralIsSkipped() {
        assertEquals("sub:x", resolve("LATERAL (SELECT * FROM x) l").getLabel());
    }

    @Test
    void emptySpanResolvesToNull() {
        assertNull(resolve("  "));
    }

    @Test
    void listResolvesEachEntryInOrder() {
        List<TableReference> refs = resolver.resolveList(
                SqlElements.group(SqlLexer.tokenize("b x, a, (SELECT 1 FROM z) q")), 0);

        List<String> labels = new ArrayList<>();
        for (TableReference r : refs) labels.add(r.getLabel());
        assertEquals(List.of("b", "a", "sub:z"), labels);
    }

    @Test
    void derivedTableNestingIsBounded() {
        TableReferenceResolver shallow = new TableReferenceResolver(1);

        RecursionLimitExceededException ex = assertThrows(RecursionLimitExceededException.class,
                () -> shallow.resolve(SqlElements.group(SqlLexer.tokenize("(SELECT * FROM (SELECT * FROM deep) d1) d2")), 0));
        assertEquals(2, ex.getDepth());
        assertEquals(1, ex.getLimit());
    }
}
