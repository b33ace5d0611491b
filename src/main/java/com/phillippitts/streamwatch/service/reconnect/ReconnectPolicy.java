package com.phillippitts.streamwatch.service.reconnect;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Decides how long to wait before the next rebuild.
 */
public interface ReconnectPolicy {

    /**
     * @param state current backoff progress
     * @param now   current time
     * @return delay before the next rebuild, or empty when retrying should stop for good
     */
    Optional<Duration> nextDelay(BackoffState state, Instant now);
}
