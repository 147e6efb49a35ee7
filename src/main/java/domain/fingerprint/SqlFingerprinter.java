package domain.fingerprint;

import domain.model.ParsedInfo;
import domain.model.SqlToken;
import domain.model.StatementContext;
import domain.model.StatementSignature;
import domain.model.WarningCode;
import domain.model.WarningSink;

import java.util.List;

/**
 * Entry point: SQL text to {@link ParsedInfo} / {@link StatementSignature}.
 *
 * <p>Immutable and stateless between calls, so one instance may be shared across threads.
 * Input that is not a SELECT yields {@link ParsedInfo#empty()} (and a MALFORMED_INPUT warning);
 * nesting beyond the configured depth throws
 * {@link domain.model.RecursionLimitExceededException}.</p>
 */
public final class SqlFingerprinter {

    private static final SqlFingerprinter DEFAULT = new SqlFingerprinter(FingerprintOptions.defaults());

    private final FingerprintOptions options;

    public SqlFingerprinter(FingerprintOptions options) {
        this.options = options == null ? FingerprintOptions.defaults() : options;
    }

    public static SqlFingerprinter withDefaults() {
        return DEFAULT;
    }

    public FingerprintOptions getOptions() {
        return options;
    }

    public ParsedInfo parse(String sql) {
        return parse(sql, StatementContext.none(), WarningSink.none());
    }

    public ParsedInfo parse(String sql, StatementContext ctx, WarningSink sink) {
        FingerprintPass pass = new FingerprintPass(options, ctx, sink);
        List<SqlToken> tokens = SqlLexer.tokenize(sql);
        if (!SqlElements.isBalanced(tokens)) {
            pass.warn(WarningCode.UNBALANCED_PARENTHESES, "unbalanced parentheses", "");
        }
        return pass.parseLevel(SqlElements.group(tokens), 0);
    }

    public StatementSignature fingerprint(String sql) {
        return SignatureBuilder.build(parse(sql));
    }

    public StatementSignature fingerprint(String sql, StatementContext ctx, WarningSink sink) {
        return SignatureBuilder.build(parse(sql, ctx, sink));
    }
}
