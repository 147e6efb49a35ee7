package domain.model;

/**
 * A single non-fatal finding emitted while fingerprinting.
 */
public final class FingerprintWarning {

    private final WarningCode code;
    private final String source;
    private final int lineNumber;
    private final String message;
    private final String detail;

    public FingerprintWarning(WarningCode code, String source, int lineNumber, String message, String detail) {
        this.code = code == null ? WarningCode.FINGERPRINT_ERROR : code;
        this.source = nullToEmpty(source);
        this.lineNumber = lineNumber;
        this.message = nullToEmpty(message);
        this.detail = nullToEmpty(detail);
    }

    public static FingerprintWarning of(WarningCode code, StatementContext ctx, String message, String detail) {
        StatementContext c = ctx == null ? StatementContext.none() : ctx;
        return new FingerprintWarning(code, c.getSource(), c.getLineNumber(), message, detail);
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }

    public WarningCode getCode() {
        return code;
    }

    public String getSource() {
        return source;
    }

    public int getLineNumber() {
        return lineNumber;
    }

    public String getMessage() {
        return message;
    }

    public String getDetail() {
        return detail;
    }

    @Override
    public String toString() {
        return code + " " + source + ":" + lineNumber + " " + message + (detail.isEmpty() ? "" : " (" + detail + ")");
    }
}
