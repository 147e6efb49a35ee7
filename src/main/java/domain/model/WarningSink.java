package domain.model;

/**
 * Sink for fingerprint warnings.
 *
 * <p>The pipeline itself never logs; callers decide whether warnings are collected, printed or dropped.</p>
 */
public interface WarningSink {

    static WarningSink none() {
        return NullWarningSink.INSTANCE;
    }

    void warn(FingerprintWarning warning);
}
