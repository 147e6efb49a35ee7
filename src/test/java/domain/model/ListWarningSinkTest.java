package domain.model;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ListWarningSinkTest {

    @Test
    void duplicatesAreCollectedOnce() {
        List<FingerprintWarning> out = new ArrayList<>();
        ListWarningSink sink = new ListWarningSink(out);
        StatementContext ctx = new StatementContext("in.sql", 3);

        sink.warn(FingerprintWarning.of(WarningCode.UNSUPPORTED_CONSTRUCT, ctx, "WITH clause", "offset=0"));
        sink.warn(FingerprintWarning.of(WarningCode.UNSUPPORTED_CONSTRUCT, ctx, "WITH clause", "offset=0"));
        sink.warn(FingerprintWarning.of(WarningCode.UNSUPPORTED_CONSTRUCT, new StatementContext("in.sql", 4), "WITH clause", "offset=0"));
        sink.warn(null);

        assertEquals(2, out.size());
        assertEquals(3, out.get(0).getLineNumber());
        assertEquals(4, out.get(1).getLineNumber());
    }

    @Test
    void noneSinkDropsEverything() {
        assertDoesNotThrow(() -> WarningSink.none().warn(
                FingerprintWarning.of(WarningCode.FINGERPRINT_ERROR, null, null, null)));
    }

    @Test
    void warningWithoutContextHasEmptySource() {
        FingerprintWarning w = FingerprintWarning.of(WarningCode.MALFORMED_INPUT, null, "empty statement", null);

        assertEquals("", w.getSource());
        assertEquals(0, w.getLineNumber());
        assertEquals("", w.getDetail());
        assertEquals("MALFORMED_INPUT :0 empty statement", w.toString());
    }
}
