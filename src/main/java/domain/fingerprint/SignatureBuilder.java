package domain.fingerprint;

import domain.model.ParsedInfo;
import domain.model.StatementSignature;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Assembles the comparable signature: table lists sorted (duplicates kept), everything else as extracted.
 */
public final class SignatureBuilder {

    private SignatureBuilder() {
    }

    public static StatementSignature build(
            List<String> fromTables,
            List<String> joinTables,
            String whereCondition,
            List<String> groupBy,
            List<String> orderBy
    ) {
        return new StatementSignature(sorted(fromTables), sorted(joinTables), whereCondition, groupBy, orderBy);
    }

    public static StatementSignature build(ParsedInfo info) {
        return build(info.getFromTables(), info.getJoinTables(), info.getWhereCondition(),
                info.getGroupBy(), info.getOrderBy());
    }

    private static List<String> sorted(List<String> in) {
        if (in == null) return Collections.emptyList();
        List<String> out = new ArrayList<>(in);
        Collections.sort(out);
        return out;
    }
}
