package com.phillippitts.streamwatch.service.health;

import com.phillippitts.streamwatch.domain.SessionState;
import com.phillippitts.streamwatch.domain.WatchdogStats;
import com.phillippitts.streamwatch.service.orchestration.StreamOrchestrator;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for the stream session.
 *
 * <ul>
 *   <li>UP: idle, or streaming</li>
 *   <li>DEGRADED: preparing, connecting or reconnecting</li>
 *   <li>DOWN: the session is in Error</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health endpoint.
 */
@Component
public class StreamSessionHealthIndicator implements HealthIndicator {

    static final String DEGRADED = "DEGRADED";

    private final StreamOrchestrator orchestrator;

    public StreamSessionHealthIndicator(StreamOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Override
    public Health health() {
        SessionState state = orchestrator.currentState();
        WatchdogStats stats = orchestrator.watchdogStats();

        Health.Builder builder = switch (state.phase()) {
            case IDLE, STREAMING -> Health.up();
            case PREPARING, CONNECTING, RECONNECTING -> Health.status(DEGRADED);
            case ERROR -> Health.down();
        };

        builder.withDetail("state", state.statusText())
                .withDetail("runState", orchestrator.runState().name())
                .withDetail("watchdog", stats.running() ? "running" : "stopped")
                .withDetail("anomaliesDetected", stats.anomaliesDetected());
        if (stats.lastAnomalyType() != null) {
            builder.withDetail("lastAnomaly", stats.lastAnomalyType().name());
        }
        return builder.build();
    }
}
