package com.phillippitts.streamwatch.service.reconnect;

import java.time.Duration;
import java.time.Instant;

/**
 * Progress through consecutive reconnect failures.
 *
 * @param attempts       rebuilds fired since the last successful session
 * @param firstFailureAt when the current failure streak began (null when none)
 * @param lastDelay      most recently scheduled delay (zero when none)
 */
public record BackoffState(int attempts, Instant firstFailureAt, Duration lastDelay) {

    private static final BackoffState INITIAL = new BackoffState(0, null, Duration.ZERO);

    public BackoffState {
        if (attempts < 0) {
            throw new IllegalArgumentException("attempts must be >= 0, got: " + attempts);
        }
        lastDelay = lastDelay == null ? Duration.ZERO : lastDelay;
    }

    public static BackoffState initial() {
        return INITIAL;
    }

    /** Records a scheduled delay; starts the failure streak if none is running. */
    BackoffState scheduled(Instant now, Duration delay) {
        return new BackoffState(attempts, firstFailureAt == null ? now : firstFailureAt, delay);
    }

    /** Records that a rebuild actually fired. */
    BackoffState attempted() {
        return new BackoffState(attempts == Integer.MAX_VALUE ? attempts : attempts + 1, firstFailureAt, lastDelay);
    }
}
