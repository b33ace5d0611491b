package com.phillippitts.streamwatch.service.watchdog;

import com.phillippitts.streamwatch.domain.Anomaly;
import com.phillippitts.streamwatch.domain.AnomalyType;
import com.phillippitts.streamwatch.domain.WatchdogConfig;
import com.phillippitts.streamwatch.domain.WatchdogStats;
import com.phillippitts.streamwatch.service.orchestration.RunStateGate;
import com.phillippitts.streamwatch.service.session.SessionHandle;
import com.phillippitts.streamwatch.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Periodic health monitor for the live stream session.
 *
 * <p>A {@link TaskScheduler} fires every {@link WatchdogConfig#checkInterval()}; each firing only posts
 * {@link #tick()} onto the control executor, so checks are serialized with every other session-control
 * mutation. A tick does nothing but count itself while the {@link RunStateGate} is STOPPED.
 *
 * <p>While RUNNING a tick evaluates, in order:
 * <ul>
 *   <li>session presence (no handle: {@link Anomaly.CameraDisconnected})</li>
 *   <li>bitrate: first-sample timeout, sample age, continuous zero run, continuous low run, fluctuation</li>
 *   <li>connection: stuck transport, sample gap beyond the connection timeout</li>
 *   <li>encoder: capture inactive, or capturing without streaming</li>
 * </ul>
 * A check that throws is reported as {@link Anomaly.EncoderError}; the timer keeps running.
 *
 * <p>Before dispatch the gate is confirmed twice: once when the tick finalizes its findings and once
 * right before the {@link AnomalyListener} runs. A {@link #stop()} that lands between detection and
 * delivery therefore suppresses the callback.
 *
 * <p>Cumulative counters survive session restarts; on reaching {@code Long.MAX_VALUE} they are
 * reset to zero and the event is logged.
 */
public class StreamWatchdog {

    private static final Logger LOG = LogManager.getLogger(StreamWatchdog.class);

    static final int HISTORY_CAPACITY = 20;
    static final int FLUCTUATION_MIN_SAMPLES = 10;
    static final int FLUCTUATION_MIN_NONZERO = 5;

    private final RunStateGate gate;
    private final TaskScheduler scheduler;
    private final Executor controlExecutor;

    // Guards every field below except the volatile ones
    private final ReentrantLock lock = new ReentrantLock();

    private volatile AnomalyListener listener = anomaly -> { };
    private volatile WatchdogConfig config = WatchdogConfig.defaults();
    private volatile Clock clock = Clock.systemUTC();
    private volatile boolean running;
    private volatile long generation;
    // Bumped on every attach or detach; findings from an older session are not delivered
    private volatile long sessionEpoch;
    private volatile WatchdogStats stats = WatchdogStats.empty();
    private ScheduledFuture<?> timer;

    // Cumulative counters
    private long totalChecks;
    private long effectiveChecks;
    private long skippedChecks;
    private long anomaliesDetected;
    private Instant startTime;
    private Instant lastCheckTime;
    private Instant lastAnomalyTime;
    private AnomalyType lastAnomalyType;

    // Per-session detection state
    private SessionHandle session;
    private Instant sessionStart;
    private Instant lastBitrateUpdate;
    private long currentBitrate;
    private final Deque<Long> bitrateHistory = new ArrayDeque<>(HISTORY_CAPACITY);
    private Instant zeroBitrateSince;
    private Instant lowBitrateSince;
    private Instant connectionStuckSince;
    private final Map<AnomalyType, Instant> lastDispatched = new EnumMap<>(AnomalyType.class);

    public StreamWatchdog(RunStateGate gate, TaskScheduler scheduler, Executor controlExecutor) {
        this.gate = Objects.requireNonNull(gate, "gate must not be null");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
        this.controlExecutor = Objects.requireNonNull(controlExecutor, "controlExecutor must not be null");
    }

    public void setAnomalyListener(AnomalyListener listener) {
        this.listener = Objects.requireNonNull(listener, "listener must not be null");
    }

    /**
     * Starts the periodic timer. Idempotent: a second call while running is logged and ignored.
     *
     * <p>Per-session detection state is reset; cumulative counters are kept.
     */
    public void start(WatchdogConfig config, Clock clock) {
        Objects.requireNonNull(config, "config must not be null");
        Objects.requireNonNull(clock, "clock must not be null");
        lock.lock();
        try {
            if (running) {
                LOG.info("Watchdog already running; start ignored");
                return;
            }
            this.config = config;
            this.clock = clock;
            Instant now = clock.instant();
            if (startTime == null) {
                startTime = now;
            }
            resetMonitoringData(now);
            running = true;
            generation++;
            timer = scheduleTimer(config.checkInterval());
            publishStats();
            LOG.info("Watchdog started: interval={}s", config.checkInterval().toSeconds());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Cancels the timer and drops the session reference. Safe to call repeatedly.
     */
    public void stop() {
        lock.lock();
        try {
            if (!running) {
                return;
            }
            running = false;
            generation++;
            if (timer != null) {
                timer.cancel(false);
                timer = null;
            }
            session = null;
            publishStats();
            LOG.info("Watchdog stopped after {} checks ({} effective)", totalChecks, effectiveChecks);
        } finally {
            lock.unlock();
        }
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Records a throughput observation from the transport.
     *
     * <p>Samples that clear a threshold immediately reset the corresponding run timer.
     */
    public void onBitrateSample(long bps) {
        long value = Math.max(0, bps);
        lock.lock();
        try {
            Instant now = clock.instant();
            currentBitrate = value;
            lastBitrateUpdate = now;
            bitrateHistory.addLast(value);
            while (bitrateHistory.size() > HISTORY_CAPACITY) {
                bitrateHistory.removeFirst();
            }
            trackThresholdRuns(value, config, now);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Associates the live session (or none). Attaching a handle resets per-session detection state,
     * making now the baseline for every grace period.
     */
    public void setSessionHandle(SessionHandle handle) {
        lock.lock();
        try {
            this.session = handle;
            sessionEpoch++;
            if (handle != null) {
                resetMonitoringData(clock.instant());
                LOG.debug("Watchdog attached to new session");
            } else {
                LOG.debug("Watchdog detached from session");
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Replaces the configuration. Thresholds apply from the next tick on; running timers are not
     * recomputed. A changed check interval reschedules the timer.
     */
    public void updateConfig(WatchdogConfig newConfig) {
        Objects.requireNonNull(newConfig, "newConfig must not be null");
        lock.lock();
        try {
            WatchdogConfig previous = this.config;
            this.config = newConfig;
            if (running && !previous.checkInterval().equals(newConfig.checkInterval())) {
                if (timer != null) {
                    timer.cancel(false);
                }
                timer = scheduleTimer(newConfig.checkInterval());
                LOG.info("Watchdog interval changed to {}s", newConfig.checkInterval().toSeconds());
            }
        } finally {
            lock.unlock();
        }
    }

    public WatchdogConfig currentConfig() {
        return config;
    }

    /** Latest immutable snapshot; safe from any thread. */
    public WatchdogStats stats() {
        return stats;
    }

    /**
     * One health check. Normally driven by the timer on the control executor; tests call it directly.
     */
    public void tick() {
        List<Anomaly> accepted;
        long tickGeneration;
        long tickEpoch;
        lock.lock();
        try {
            if (!running) {
                return;
            }
            Instant now = clock.instant();
            countCheck(now);

            if (gate.isStopped()) {
                skippedChecks = saturatingIncrement(skippedChecks);
                LOG.trace("Run state STOPPED, skipping check #{}", totalChecks);
                publishStats();
                return;
            }
            effectiveChecks = saturatingIncrement(effectiveChecks);
            LOG.debug("Health check #{} (total {})", effectiveChecks, totalChecks);

            WatchdogConfig cfg = config;
            List<Anomaly> found = new ArrayList<>();
            SessionHandle handle = session;
            if (handle == null) {
                LOG.debug("No session attached while RUNNING");
                found.add(new Anomaly.CameraDisconnected());
            } else {
                if (cfg.bitrateMonitoringEnabled()) {
                    runCheck("bitrate", () -> checkBitrate(cfg, now, found), found);
                }
                if (cfg.connectionMonitoringEnabled()) {
                    runCheck("connection", () -> checkConnection(handle, cfg, now, found), found);
                }
                if (cfg.encoderMonitoringEnabled()) {
                    runCheck("encoder", () -> checkEncoder(handle, cfg, now, found), found);
                }
            }
            accepted = finalizeFindings(found, cfg, now);
            publishStats();
            tickGeneration = generation;
            tickEpoch = sessionEpoch;
        } finally {
            lock.unlock();
        }
        for (Anomaly anomaly : accepted) {
            dispatch(anomaly, tickGeneration, tickEpoch);
        }
    }

    /** Visible for tests */
    void forceTotalChecks(long value) {
        lock.lock();
        try {
            totalChecks = value;
        } finally {
            lock.unlock();
        }
    }

    private ScheduledFuture<?> scheduleTimer(Duration interval) {
        Instant first = Instant.now().plus(interval);
        return scheduler.scheduleAtFixedRate(() -> controlExecutor.execute(this::tick), first, interval);
    }

    private void countCheck(Instant now) {
        if (totalChecks == Long.MAX_VALUE) {
            LOG.warn("Check counter reached Long.MAX_VALUE; resetting cumulative counters");
            resetCounters(now);
        } else {
            totalChecks++;
        }
        lastCheckTime = now;
    }

    private void resetCounters(Instant now) {
        totalChecks = 0;
        effectiveChecks = 0;
        skippedChecks = 0;
        anomaliesDetected = 0;
        startTime = now;
    }

    private void resetMonitoringData(Instant now) {
        sessionStart = now;
        lastBitrateUpdate = null;
        currentBitrate = 0;
        bitrateHistory.clear();
        zeroBitrateSince = null;
        lowBitrateSince = null;
        connectionStuckSince = null;
        lastDispatched.clear();
    }

    private void runCheck(String name, Runnable check, List<Anomaly> found) {
        try {
            check.run();
        } catch (RuntimeException e) {
            LOG.warn("{} check failed: {}", name, e.toString());
            found.add(new Anomaly.EncoderError(name + " check failed: " + e.getMessage()));
        }
    }

    private void checkBitrate(WatchdogConfig cfg, Instant now, List<Anomaly> found) {
        Duration sinceStart = TimeUtils.elapsed(sessionStart, now);
        if (sinceStart.compareTo(cfg.startupGracePeriod()) <= 0) {
            LOG.trace("Bitrate check: in startup grace ({}ms)", sinceStart.toMillis());
            return;
        }
        if (lastBitrateUpdate == null) {
            if (sinceStart.compareTo(cfg.firstBitrateTimeout()) > 0) {
                LOG.warn("No bitrate received {}s after session start", sinceStart.toSeconds());
                found.add(new Anomaly.ZeroBitrate(sinceStart));
            }
            return;
        }
        Duration age = TimeUtils.elapsed(lastBitrateUpdate, now);
        if (age.compareTo(cfg.bitrateTimeout()) > 0) {
            found.add(new Anomaly.ZeroBitrate(age));
            return;
        }

        trackThresholdRuns(currentBitrate, cfg, now);
        if (zeroBitrateSince != null) {
            Duration zeroRun = TimeUtils.elapsed(zeroBitrateSince, now);
            if (zeroRun.compareTo(cfg.zeroBitrateDuration()) > 0) {
                found.add(new Anomaly.ZeroBitrate(zeroRun));
            }
            return;
        }
        if (lowBitrateSince != null) {
            Duration lowRun = TimeUtils.elapsed(lowBitrateSince, now);
            if (lowRun.compareTo(cfg.lowBitrateDuration()) > 0) {
                found.add(new Anomaly.LowBitrate(currentBitrate, cfg.minBitrateThresholdBps()));
            }
            return;
        }
        checkFluctuation(cfg, found);
    }

    private void checkFluctuation(WatchdogConfig cfg, List<Anomaly> found) {
        if (bitrateHistory.size() < FLUCTUATION_MIN_SAMPLES) {
            return;
        }
        List<Long> nonZero = new ArrayList<>(bitrateHistory.size());
        for (Long sample : bitrateHistory) {
            if (sample > 0) {
                nonZero.add(sample);
            }
        }
        if (nonZero.size() < FLUCTUATION_MIN_NONZERO) {
            return;
        }
        double mean = nonZero.stream().mapToLong(Long::longValue).average().orElse(0);
        if (mean <= 0) {
            return;
        }
        double variance = 0;
        for (long sample : nonZero) {
            double diff = sample - mean;
            variance += diff * diff;
        }
        variance /= nonZero.size();
        double coefficient = Math.sqrt(variance) / mean;
        if (coefficient > cfg.fluctuationThreshold()) {
            LOG.debug("Bitrate coefficient of variation {} above {}", coefficient, cfg.fluctuationThreshold());
            found.add(new Anomaly.BitrateFluctuation(variance));
        }
    }

    private void checkConnection(SessionHandle handle, WatchdogConfig cfg, Instant now, List<Anomaly> found) {
        Duration sinceStart = TimeUtils.elapsed(sessionStart, now);
        if (!handle.isStreaming()) {
            if (sinceStart.compareTo(cfg.connectionGracePeriod()) > 0) {
                if (connectionStuckSince == null) {
                    connectionStuckSince = now;
                    LOG.debug("Connection stuck detection started");
                } else {
                    Duration stuck = TimeUtils.elapsed(connectionStuckSince, now);
                    if (stuck.compareTo(cfg.connectionStuckDuration()) > 0) {
                        found.add(new Anomaly.ConnectionStuck(stuck));
                    }
                }
            }
            return;
        }
        connectionStuckSince = null;
        if (lastBitrateUpdate != null) {
            Duration gap = TimeUtils.elapsed(lastBitrateUpdate, now);
            if (gap.compareTo(cfg.connectionTimeout()) > 0) {
                found.add(new Anomaly.StreamingTimeout(gap));
            }
        }
    }

    private void checkEncoder(SessionHandle handle, WatchdogConfig cfg, Instant now, List<Anomaly> found) {
        if (TimeUtils.elapsed(sessionStart, now).compareTo(cfg.startupGracePeriod()) <= 0) {
            return;
        }
        if (!handle.isCapturing()) {
            found.add(new Anomaly.CameraDisconnected());
        } else if (!handle.isStreaming()) {
            found.add(new Anomaly.EncoderError("encoder not running"));
        }
    }

    /** Starts or clears the zero and low run timers for the given bitrate. */
    private void trackThresholdRuns(long bitrate, WatchdogConfig cfg, Instant now) {
        if (bitrate < cfg.zeroBitrateThresholdBps()) {
            if (zeroBitrateSince == null) {
                zeroBitrateSince = now;
            }
            lowBitrateSince = null;
        } else if (bitrate < cfg.minBitrateThresholdBps()) {
            zeroBitrateSince = null;
            if (lowBitrateSince == null) {
                lowBitrateSince = now;
            }
        } else {
            zeroBitrateSince = null;
            lowBitrateSince = null;
        }
    }

    /** First gate confirmation, debounce and bookkeeping. */
    private List<Anomaly> finalizeFindings(List<Anomaly> found, WatchdogConfig cfg, Instant now) {
        if (found.isEmpty()) {
            return List.of();
        }
        if (gate.isStopped()) {
            LOG.debug("Run state changed during check; dropping {} finding(s)", found.size());
            return List.of();
        }
        List<Anomaly> accepted = new ArrayList<>(found.size());
        for (Anomaly anomaly : found) {
            AnomalyType type = anomaly.type();
            if (type.isDebounced()) {
                Instant last = lastDispatched.get(type);
                if (last != null && TimeUtils.elapsed(last, now).compareTo(cfg.debounceInterval()) < 0) {
                    LOG.trace("Debounced {}", type);
                    continue;
                }
            }
            lastDispatched.put(type, now);
            if (anomaliesDetected == Long.MAX_VALUE) {
                LOG.warn("Anomaly counter reached Long.MAX_VALUE; resetting cumulative counters");
                resetCounters(now);
            }
            anomaliesDetected++;
            lastAnomalyTime = now;
            lastAnomalyType = type;
            logAnomaly(anomaly);
            accepted.add(anomaly);
        }
        return accepted;
    }

    private void dispatch(Anomaly anomaly, long tickGeneration, long tickEpoch) {
        controlExecutor.execute(() -> {
            if (!running || generation != tickGeneration || gate.isStopped()) {
                LOG.debug("Dropping {} after stop", anomaly.type());
                return;
            }
            if (sessionEpoch != tickEpoch) {
                LOG.debug("Dropping {} detected against a replaced session", anomaly.type());
                return;
            }
            try {
                listener.onAnomaly(anomaly);
            } catch (RuntimeException e) {
                LOG.error("Anomaly listener failed for {}: {}", anomaly.type(), e.toString(), e);
            }
        });
    }

    private static void logAnomaly(Anomaly anomaly) {
        switch (anomaly.severity()) {
            case WARNING -> LOG.warn("Anomaly [{}]: {}", anomaly.severity(), anomaly.description());
            case ERROR, CRITICAL -> LOG.error("Anomaly [{}]: {}", anomaly.severity(), anomaly.description());
        }
    }

    private void publishStats() {
        long average = 0;
        if (!bitrateHistory.isEmpty()) {
            long sum = 0;
            for (Long sample : bitrateHistory) {
                sum += sample;
            }
            average = sum / bitrateHistory.size();
        }
        stats = new WatchdogStats(running, startTime, totalChecks, effectiveChecks, skippedChecks,
                anomaliesDetected, lastCheckTime, currentBitrate, average, List.copyOf(bitrateHistory),
                lastAnomalyTime, lastAnomalyType);
    }

    private static long saturatingIncrement(long value) {
        return value == Long.MAX_VALUE ? value : value + 1;
    }
}
