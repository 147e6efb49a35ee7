package domain.model;

import java.util.Collections;
import java.util.List;

/**
 * The elements between a top-level clause keyword and the next one.
 *
 * <p>{@code introducer} is the normalized keyword sequence that opened the region,
 * e.g. {@code FROM} or {@code LEFT OUTER JOIN}.</p>
 */
public final class ClauseRegion {

    private final ClauseKind kind;
    private final String introducer;
    private final List<SqlElement> elements;

    public ClauseRegion(ClauseKind kind, String introducer, List<SqlElement> elements) {
        this.kind = kind;
        this.introducer = introducer == null ? "" : introducer;
        this.elements = elements == null ? Collections.emptyList() : Collections.unmodifiableList(elements);
    }

    public ClauseKind getKind() {
        return kind;
    }

    public String getIntroducer() {
        return introducer;
    }

    public List<SqlElement> getElements() {
        return elements;
    }

    @Override
    public String toString() {
        return kind + "[" + introducer + "] " + elements.size() + " elements";
    }
}
