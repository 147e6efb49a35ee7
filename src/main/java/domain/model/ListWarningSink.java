package domain.model;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * List-backed sink with de-duplication.
 *
 * <p>Deduplicated by (code|source|line|message|detail) so one statement hitting the same
 * issue in several nested levels yields a single row.</p>
 */
public final class ListWarningSink implements WarningSink {

    private final List<FingerprintWarning> target;
    private final Set<String> seen = new HashSet<>(256);

    public ListWarningSink(List<FingerprintWarning> target) {
        this.target = target;
    }

    private static String key(FingerprintWarning w) {
        return w.getCode().name() + "|"
                + w.getSource() + "|"
                + w.getLineNumber() + "|"
                + w.getMessage() + "|"
                + w.getDetail();
    }

    @Override
    public void warn(FingerprintWarning warning) {
        if (warning == null || target == null) return;
        if (seen.add(key(warning))) {
            target.add(warning);
        }
    }
}
