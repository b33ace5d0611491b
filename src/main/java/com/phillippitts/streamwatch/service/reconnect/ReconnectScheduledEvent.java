package com.phillippitts.streamwatch.service.reconnect;

import java.time.Duration;
import java.time.Instant;

/**
 * Published whenever a rebuild is scheduled.
 *
 * @param reason  what triggered the reconnect
 * @param attempt zero-based attempt number the delay was computed for
 * @param delay   wait before the rebuild fires
 * @param at      when the reconnect was scheduled
 */
public record ReconnectScheduledEvent(String reason, int attempt, Duration delay, Instant at) {
    public ReconnectScheduledEvent {
        at = (at == null) ? Instant.now() : at;
    }
}
