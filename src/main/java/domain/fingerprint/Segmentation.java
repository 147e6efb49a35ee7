package domain.fingerprint;

import domain.model.ClauseKind;
import domain.model.ClauseRegion;
import domain.model.SqlToken;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Clause regions of one statement level, in source order.
 *
 * <p>{@code terminator} is the top-level token that stopped the scan (a set operator or {@code ;}),
 * or null when the scan reached the end.</p>
 */
public final class Segmentation {

    private final List<ClauseRegion> regions;
    private final SqlToken terminator;

    Segmentation(List<ClauseRegion> regions, SqlToken terminator) {
        this.regions = Collections.unmodifiableList(new ArrayList<>(regions));
        this.terminator = terminator;
    }

    public List<ClauseRegion> getRegions() {
        return regions;
    }

    public SqlToken getTerminator() {
        return terminator;
    }

    public ClauseRegion first(ClauseKind kind) {
        for (ClauseRegion r : regions) {
            if (r.getKind() == kind) return r;
        }
        return null;
    }

    public List<ClauseRegion> all(ClauseKind kind) {
        List<ClauseRegion> out = new ArrayList<>();
        for (ClauseRegion r : regions) {
            if (r.getKind() == kind) out.add(r);
        }
        return out;
    }
}
