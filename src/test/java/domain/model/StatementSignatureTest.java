package domain.model;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class StatementSignatureTest {

    @Test
    void equalComponentsMeanEqualKeys() {
        StatementSignature a = new StatementSignature(List.of("t"), List.of(), "id = 9", null, List.of("id"));
        StatementSignature b = new StatementSignature(new ArrayList<>(List.of("t")), null, "id = 9", List.of(), List.of("id"));

        assertEquals(a, b);

        Map<StatementSignature, Integer> counts = new HashMap<>();
        counts.merge(a, 1, Integer::sum);
        counts.merge(b, 1, Integer::sum);
        assertEquals(1, counts.size());
        assertEquals(2, counts.get(a));
    }

    @Test
    void componentsAreImmutableCopies() {
        List<String> from = new ArrayList<>(List.of("t"));
        StatementSignature sig = new StatementSignature(from, null, null, null, null);
        from.add("u");

        assertEquals(List.of("t"), sig.getFromTables());
        assertEquals("", sig.getWhereCondition());
        assertThrows(UnsupportedOperationException.class, () -> sig.getFromTables().add("v"));
    }

    @Test
    void toStringIsTupleLike() {
        StatementSignature sig = new StatementSignature(
                List.of("a", "b"), List.of("c"), "x = 'X'", List.of(), List.of("d", "DESC"));

        assertEquals("(('a', 'b'), ('c',), 'x = \\'X\\'', (), ('d', 'DESC'))", sig.toString());
    }
}
