package com.phillippitts.streamwatch.service.events;

import com.phillippitts.streamwatch.domain.SessionState;
import com.phillippitts.streamwatch.domain.Severity;
import com.phillippitts.streamwatch.domain.WatchdogStats;
import com.phillippitts.streamwatch.service.orchestration.StreamOrchestrator;
import com.phillippitts.streamwatch.service.orchestration.event.AnomalyDetectedEvent;
import com.phillippitts.streamwatch.service.orchestration.event.SessionStateChangedEvent;
import com.phillippitts.streamwatch.service.reconnect.ReconnectScheduledEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Operator-facing log lines for session problems. Throttled per kind to avoid log spam during a
 * reconnect storm.
 */
@Component
class SessionEventsListener {
    private static final Logger LOG = LogManager.getLogger(SessionEventsListener.class);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private static final Duration THROTTLE = Duration.ofMinutes(1);

    private final StreamOrchestrator orchestrator;
    private final Clock clock;

    SessionEventsListener(StreamOrchestrator orchestrator, Clock clock) {
        this.orchestrator = orchestrator;
        this.clock = clock;
    }

    @EventListener
    void onAnomaly(AnomalyDetectedEvent e) {
        String key = "anomaly-" + e.anomaly().type();
        if (!shouldLog(key)) {
            return;
        }
        if (e.anomaly().severity() == Severity.WARNING) {
            LOG.info("Stream quality warning: {}", e.anomaly().description());
        } else {
            LOG.warn("Stream anomaly ({}): {}. Check network and capture device.",
                    e.anomaly().severity(), e.anomaly().description());
        }
    }

    @EventListener
    void onStateChanged(SessionStateChangedEvent e) {
        if (!e.isPhaseChange() || !e.current().is(SessionState.Phase.ERROR)) {
            return;
        }
        if (shouldLog("error-" + e.current().message())) {
            LOG.warn("Stream session error: {}", e.current().message());
        }
    }

    @EventListener
    void onReconnectScheduled(ReconnectScheduledEvent e) {
        if (shouldLog("reconnect")) {
            LOG.warn("Stream reconnecting (attempt {}, in {}s): {}",
                    e.attempt() + 1, e.delay().toSeconds(), e.reason());
        }
    }

    /**
     * Logs a watchdog health summary every 60 seconds.
     */
    @Scheduled(fixedRate = 60_000, initialDelay = 60_000)
    void logHealthSummary() {
        WatchdogStats s = orchestrator.watchdogStats();
        LOG.info("Stream health: gate={}, state={}, watchdog={}, checks={}/{} (skipped {}), anomalies={}, "
                        + "bitrate={}bps (avg {}bps)",
                orchestrator.runState(),
                orchestrator.currentState().statusText(),
                s.running() ? "running" : "stopped",
                s.effectiveChecks(), s.totalChecks(), s.skippedChecks(),
                s.anomaliesDetected(),
                s.currentBitrate(), s.averageBitrate());
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = clock.instant();
        Instant prev = lastLog.get(key);
        if (prev == null || expired(prev, now)) {
            // Error keys carry free-form messages; keep only keys still inside their window
            lastLog.values().removeIf(t -> expired(t, now));
            lastLog.put(key, now);
            return true;
        }
        return false;
    }

    // Package-private for tests
    int trackedKeys() {
        return lastLog.size();
    }

    private static boolean expired(Instant logged, Instant now) {
        return Duration.between(logged, now).compareTo(THROTTLE) > 0;
    }
}
