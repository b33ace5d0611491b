package com.phillippitts.streamwatch.service.orchestration.event;

import com.phillippitts.streamwatch.domain.Anomaly;

import java.time.Instant;

/**
 * Emitted for every anomaly the watchdog delivers, recovery-triggering or not.
 *
 * @param anomaly the classified failure
 * @param at      when it was delivered
 */
public record AnomalyDetectedEvent(Anomaly anomaly, Instant at) {
    public AnomalyDetectedEvent {
        at = (at == null) ? Instant.now() : at;
    }
}
