package domain.fingerprint;

import domain.model.ClauseKind;
import domain.model.ClauseRegion;
import domain.model.FingerprintWarning;
import domain.model.ParsedInfo;
import domain.model.SqlElement;
import domain.model.SqlToken;
import domain.model.StatementContext;
import domain.model.WarningCode;
import domain.model.WarningSink;

import java.util.List;

/**
 * One run of the pipeline over one statement, including every subquery it re-enters.
 *
 * <p>Created per call; holds only the caller's settings and warning target.</p>
 */
final class FingerprintPass {

    private final FingerprintOptions options;
    private final StatementContext ctx;
    private final WarningSink sink;
    private final TableReferenceResolver resolver;
    private final ConditionCanonicalizer canonicalizer;

    FingerprintPass(FingerprintOptions options, StatementContext ctx, WarningSink sink) {
        this.options = options == null ? FingerprintOptions.defaults() : options;
        this.ctx = ctx == null ? StatementContext.none() : ctx;
        this.sink = sink == null ? WarningSink.none() : sink;
        this.resolver = new TableReferenceResolver(this.options.getMaxSubqueryDepth());
        this.canonicalizer = new ConditionCanonicalizer(this, this.options);
    }

    ConditionCanonicalizer canonicalizer() {
        return canonicalizer;
    }

    /**
     * @param depth 0 for the statement itself, n for a subquery nested n levels deep
     */
    ParsedInfo parseLevel(List<SqlElement> elements, int depth) {
        int first = SqlElements.nextSignificant(elements, 0);
        if (first < 0) {
            warn(WarningCode.MALFORMED_INPUT, "empty statement", "");
            return ParsedInfo.empty();
        }

        SqlToken lead = SqlElements.asToken(elements.get(first));
        if (lead == null || !(lead.isKeyword("SELECT") || lead.isKeyword("WITH"))) {
            warn(WarningCode.MALFORMED_INPUT, "statement does not start with SELECT",
                    "offset=" + elements.get(first).getStartOffset() + (lead == null ? "" : ", token=" + lead.getText()));
            return ParsedInfo.empty();
        }
        if (lead.isKeyword("WITH")) {
            warn(WarningCode.UNSUPPORTED_CONSTRUCT, "WITH clause", "offset=" + lead.getStartOffset());
        }

        Segmentation seg = ClauseWalker.segment(elements);
        reportTerminator(elements, seg.getTerminator());

        List<String> from = ClauseExtractors.fromTables(seg, resolver, depth);
        List<String> join = ClauseExtractors.joinTables(seg, resolver, depth);

        ClauseRegion where = seg.first(ClauseKind.WHERE);
        String condition = (where == null) ? "" : canonicalizer.canonicalize(where.getElements(), depth);

        List<String> groupBy = ClauseExtractors.groupBy(seg, canonicalizer);
        List<String> orderBy = ClauseExtractors.orderBy(seg, canonicalizer, options.getOrderByStyle());

        return new ParsedInfo(from, join, condition, groupBy, orderBy);
    }

    private void reportTerminator(List<SqlElement> elements, SqlToken terminator) {
        if (terminator == null) return;
        if (terminator.isPunct(';')) {
            int at = elements.indexOf(terminator);
            if (SqlElements.nextSignificant(elements, at + 1) < 0) return; // trailing ';'
            warn(WarningCode.UNSUPPORTED_CONSTRUCT, "multiple statements; only the first is fingerprinted",
                    "offset=" + terminator.getStartOffset());
            return;
        }
        warn(WarningCode.UNSUPPORTED_CONSTRUCT, "set operation " + terminator.upper() + "; only the first SELECT is fingerprinted",
                "offset=" + terminator.getStartOffset());
    }

    void warn(WarningCode code, String message, String detail) {
        sink.warn(FingerprintWarning.of(code, ctx, message, detail));
    }
}
