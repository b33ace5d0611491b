package com.phillippitts.streamwatch.domain;

/**
 * Severity attached to every {@link Anomaly}.
 *
 * <p>{@link #WARNING} is informational only; {@link #ERROR} and {@link #CRITICAL}
 * drive the session into reconnection.
 */
public enum Severity {
    WARNING,
    ERROR,
    CRITICAL;

    /** True for severities that require the session to be rebuilt. */
    public boolean requiresRecovery() {
        return this != WARNING;
    }
}
