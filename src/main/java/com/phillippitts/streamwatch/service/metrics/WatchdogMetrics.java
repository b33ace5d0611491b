package com.phillippitts.streamwatch.service.metrics;

import com.phillippitts.streamwatch.service.orchestration.StreamOrchestrator;
import com.phillippitts.streamwatch.service.orchestration.event.AnomalyDetectedEvent;
import com.phillippitts.streamwatch.service.orchestration.event.SessionStateChangedEvent;
import com.phillippitts.streamwatch.service.reconnect.ReconnectScheduledEvent;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Micrometer instrumentation for the watchdog and session lifecycle.
 *
 * <p>Provides:
 * <ul>
 *   <li>{@code streamwatch.watchdog.checks} - ticks by outcome (effective, skipped)</li>
 *   <li>{@code streamwatch.watchdog.bitrate} - latest bitrate sample (bps)</li>
 *   <li>{@code streamwatch.anomalies} - dispatched anomalies by type and severity</li>
 *   <li>{@code streamwatch.reconnects} - scheduled reconnect attempts</li>
 *   <li>{@code streamwatch.session.transitions} - phase changes by target phase</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/metrics.
 */
@Component
public class WatchdogMetrics {

    private static final String METRIC_PREFIX = "streamwatch";

    private final MeterRegistry registry;

    public WatchdogMetrics(MeterRegistry registry, StreamOrchestrator orchestrator) {
        this.registry = registry;
        FunctionCounter.builder(METRIC_PREFIX + ".watchdog.checks", orchestrator,
                        o -> o.watchdogStats().effectiveChecks())
                .description("Watchdog ticks evaluated while running")
                .tag("outcome", "effective")
                .register(registry);
        FunctionCounter.builder(METRIC_PREFIX + ".watchdog.checks", orchestrator,
                        o -> o.watchdogStats().skippedChecks())
                .description("Watchdog ticks skipped while stopped")
                .tag("outcome", "skipped")
                .register(registry);
        Gauge.builder(METRIC_PREFIX + ".watchdog.bitrate", orchestrator,
                        o -> o.watchdogStats().currentBitrate())
                .description("Latest observed bitrate in bits per second")
                .baseUnit("bits")
                .register(registry);
    }

    @EventListener
    public void onAnomaly(AnomalyDetectedEvent e) {
        Counter.builder(METRIC_PREFIX + ".anomalies")
                .description("Anomalies dispatched by the watchdog")
                .tag("type", e.anomaly().type().name())
                .tag("severity", e.anomaly().severity().name())
                .register(registry)
                .increment();
    }

    @EventListener
    public void onReconnectScheduled(ReconnectScheduledEvent e) {
        Counter.builder(METRIC_PREFIX + ".reconnects")
                .description("Reconnect attempts scheduled")
                .register(registry)
                .increment();
    }

    @EventListener
    public void onStateChanged(SessionStateChangedEvent e) {
        if (!e.isPhaseChange()) {
            return;
        }
        Counter.builder(METRIC_PREFIX + ".session.transitions")
                .description("Session phase changes")
                .tag("phase", e.current().phase().name())
                .register(registry)
                .increment();
    }
}
