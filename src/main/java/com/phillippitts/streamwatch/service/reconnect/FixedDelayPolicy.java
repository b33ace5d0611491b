package com.phillippitts.streamwatch.service.reconnect;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Same short delay before every rebuild, retrying forever.
 */
public final class FixedDelayPolicy implements ReconnectPolicy {

    public static final Duration DEFAULT_DELAY = Duration.ofSeconds(3);

    private final Duration delay;

    public FixedDelayPolicy(Duration delay) {
        Objects.requireNonNull(delay, "delay must not be null");
        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay must not be negative, got: " + delay);
        }
        this.delay = delay;
    }

    @Override
    public Optional<Duration> nextDelay(BackoffState state, Instant now) {
        return Optional.of(delay);
    }

    @Override
    public String toString() {
        return "FixedDelayPolicy[" + delay.toMillis() + "ms]";
    }
}
