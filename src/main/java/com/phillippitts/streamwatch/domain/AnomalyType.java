package com.phillippitts.streamwatch.domain;

/**
 * Kinds of health-check failures the watchdog can raise.
 *
 * <p>Kinds flagged as debounced are noisy by nature and are suppressed when they repeat
 * inside the configured debounce window. The others signal terminal-style failures and
 * are always dispatched.
 */
public enum AnomalyType {
    ZERO_BITRATE(Severity.ERROR, false),
    LOW_BITRATE(Severity.WARNING, true),
    BITRATE_FLUCTUATION(Severity.WARNING, true),
    CONNECTION_STUCK(Severity.CRITICAL, false),
    STREAMING_TIMEOUT(Severity.ERROR, false),
    ENCODER_ERROR(Severity.ERROR, false),
    CAMERA_DISCONNECTED(Severity.CRITICAL, false);

    private final Severity severity;
    private final boolean debounced;

    AnomalyType(Severity severity, boolean debounced) {
        this.severity = severity;
        this.debounced = debounced;
    }

    public Severity severity() {
        return severity;
    }

    public boolean isDebounced() {
        return debounced;
    }
}
