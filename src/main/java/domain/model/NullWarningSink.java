package domain.model;

/** No-op warning sink. */
final class NullWarningSink implements WarningSink {

    static final NullWarningSink INSTANCE = new NullWarningSink();

    private NullWarningSink() {
    }

    @Override
    public void warn(FingerprintWarning warning) {
        // no-op
    }
}
