package com.phillippitts.streamwatch.service.orchestration;

import com.phillippitts.streamwatch.domain.Anomaly;
import com.phillippitts.streamwatch.domain.CameraFacing;
import com.phillippitts.streamwatch.domain.SessionSettings;
import com.phillippitts.streamwatch.domain.SessionState;
import com.phillippitts.streamwatch.domain.StreamStats;
import com.phillippitts.streamwatch.domain.WatchdogConfig;
import com.phillippitts.streamwatch.domain.WatchdogStats;
import com.phillippitts.streamwatch.exception.InvalidEndpointException;
import com.phillippitts.streamwatch.exception.SessionStartException;
import com.phillippitts.streamwatch.service.orchestration.event.AnomalyDetectedEvent;
import com.phillippitts.streamwatch.service.orchestration.event.SessionStateChangedEvent;
import com.phillippitts.streamwatch.service.reconnect.BackoffState;
import com.phillippitts.streamwatch.service.reconnect.ReconnectCoordinator;
import com.phillippitts.streamwatch.service.reconnect.SessionRebuilder;
import com.phillippitts.streamwatch.service.session.SessionHandle;
import com.phillippitts.streamwatch.service.session.SessionHandleFactory;
import com.phillippitts.streamwatch.service.session.TransportListener;
import com.phillippitts.streamwatch.service.watchdog.AnomalyListener;
import com.phillippitts.streamwatch.service.watchdog.StreamWatchdog;
import com.phillippitts.streamwatch.util.LogSanitizer;
import com.phillippitts.streamwatch.util.TimeUtils;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.ApplicationEventPublisher;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Clock;
import java.time.Instant;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * Default {@link StreamOrchestrator}: owns the session state machine and wires the gate, watchdog,
 * reconnect coordinator and session engine together.
 *
 * <p><b>Threading:</b> every state mutation runs on the single-threaded control executor, including
 * watchdog ticks, anomaly delivery and transport callbacks. Engine calls that may block are handed to
 * the single-threaded engine executor, whose FIFO order guarantees a release always completes before
 * the following rebuild touches the device. Results come back to the control executor.
 *
 * <p><b>Stale callbacks:</b> each handle gets its own {@link TransportListener}; callbacks from a handle
 * that is no longer current are dropped.
 *
 * <p><b>Failure routing:</b>
 * <ul>
 *   <li>WARNING anomalies are published only</li>
 *   <li>ERROR/CRITICAL anomalies move to Reconnecting and schedule a rebuild (unless one is pending)</li>
 *   <li>transport failure or disconnect releases the session and records Error; the watchdog notices
 *       the missing session on its next tick and drives the reconnect</li>
 *   <li>authentication failure is terminal: gate STOPPED, no retry</li>
 * </ul>
 */
public class DefaultStreamOrchestrator implements StreamOrchestrator, AnomalyListener, SessionRebuilder {

    private static final Logger LOG = LogManager.getLogger(DefaultStreamOrchestrator.class);

    static final String MDC_SESSION_ID = "sessionId";
    private static final Set<String> SUPPORTED_SCHEMES = Set.of("rtmp", "rtmps", "srt");

    private final RunStateGate gate;
    private final StreamWatchdog watchdog;
    private final ReconnectCoordinator coordinator;
    private final SessionHandleFactory handleFactory;
    private final Executor controlExecutor;
    private final Executor engineExecutor;
    private final ApplicationEventPublisher publisher;
    private final Clock clock;
    private final WatchdogConfig initialWatchdogConfig;
    private final boolean watchdogEnabled;

    private volatile SessionState state = SessionState.idle();
    private volatile SessionSettings settings;
    private volatile boolean muted;
    private volatile boolean flashOn;
    private volatile SessionHandle handle;
    private volatile Instant streamingSince;
    private volatile long lastBitrate;
    private volatile String sessionId;
    private String endpoint;

    DefaultStreamOrchestrator(DefaultStreamOrchestratorBuilder b) {
        this.gate = Objects.requireNonNull(b.gate, "gate must not be null");
        this.watchdog = Objects.requireNonNull(b.watchdog, "watchdog must not be null");
        this.coordinator = Objects.requireNonNull(b.coordinator, "coordinator must not be null");
        this.handleFactory = Objects.requireNonNull(b.handleFactory, "handleFactory must not be null");
        this.controlExecutor = Objects.requireNonNull(b.controlExecutor, "controlExecutor must not be null");
        this.engineExecutor = Objects.requireNonNull(b.engineExecutor, "engineExecutor must not be null");
        this.publisher = Objects.requireNonNull(b.publisher, "publisher must not be null");
        this.clock = Objects.requireNonNull(b.clock, "clock must not be null");
        this.settings = Objects.requireNonNull(b.settings, "settings must not be null");
        this.initialWatchdogConfig = Objects.requireNonNull(b.watchdogConfig, "watchdogConfig must not be null");
        this.watchdogEnabled = b.watchdogEnabled;
        watchdog.setAnomalyListener(this);
        coordinator.setSessionRebuilder(this);
    }

    /** Starts the watchdog for the lifetime of the application. */
    @PostConstruct
    public void startWatchdog() {
        if (watchdogEnabled) {
            watchdog.start(initialWatchdogConfig, clock);
        } else {
            LOG.warn("Stream watchdog disabled by configuration; silent failures will not be recovered");
        }
    }

    @PreDestroy
    public void shutdown() {
        gate.setStopped();
        coordinator.cancelReconnect();
        watchdog.stop();
        SessionHandle h = handle;
        handle = null;
        if (h != null) {
            releaseOnEngine(h);
        }
        LOG.info("Orchestrator shut down");
    }

    // ---------------------------------------------------------------- control operations

    @Override
    public CompletableFuture<Void> start(String endpoint) {
        String target = validateEndpoint(endpoint);
        return runOnControl(() -> doStart(target));
    }

    @Override
    public CompletableFuture<Void> stop() {
        // Synchronous part: nothing may reconnect once stop() has returned
        gate.setStopped();
        coordinator.cancelReconnect();
        return runOnControl(this::doStop);
    }

    @Override
    public CompletableFuture<Void> updateSettings(SessionSettings newSettings) {
        Objects.requireNonNull(newSettings, "settings must not be null");
        return runOnControl(() -> {
            SessionSettings previous = settings;
            settings = newSettings;
            LOG.info("Settings updated: {}x{} {}kbps {}fps {}", newSettings.video().width(),
                    newSettings.video().height(), newSettings.video().bitrateKbps(), newSettings.video().fps(),
                    newSettings.facing());
            SessionHandle h = handle;
            if (h != null && gate.isRunning()
                    && previous.video().bitrateKbps() != newSettings.video().bitrateKbps()) {
                long bps = newSettings.video().bitrateBps();
                onEngine("setBitrate", () -> h.setBitrate(bps));
            }
        });
    }

    @Override
    public CompletableFuture<Void> setVideoBitrate(int bitrateKbps) {
        SessionSettings.Video v = settings.video();
        SessionSettings.Video updated = new SessionSettings.Video(v.width(), v.height(), bitrateKbps, v.fps(),
                v.codec(), v.keyframeIntervalSec(), v.rotation());
        return updateSettings(settings.withVideo(updated));
    }

    @Override
    public void updateWatchdogConfig(WatchdogConfig config) {
        watchdog.updateConfig(config);
        LOG.info("Watchdog configuration replaced");
    }

    @Override
    public CompletableFuture<Boolean> toggleMute() {
        return supplyOnControl(() -> {
            boolean newMuted = !muted;
            muted = newMuted;
            SessionHandle h = handle;
            if (h != null) {
                onEngine("setAudioMuted", () -> h.setAudioMuted(newMuted));
            }
            LOG.info("Audio {}", newMuted ? "muted" : "unmuted");
            return newMuted;
        });
    }

    @Override
    public CompletableFuture<Boolean> toggleFlash() {
        CompletableFuture<Boolean> result = new CompletableFuture<>();
        runOnControl(() -> {
            if (settings.facing() != CameraFacing.BACK) {
                LOG.info("Torch is only available on the back camera");
                result.complete(false);
                return;
            }
            boolean desired = !flashOn;
            SessionHandle h = handle;
            if (h == null) {
                flashOn = desired;
                result.complete(desired);
                return;
            }
            engineExecutor.execute(() -> {
                boolean applied = applyTorch(h, desired);
                runOnControl(() -> {
                    flashOn = applied;
                    result.complete(applied);
                });
            });
        }).exceptionally(ex -> {
            result.completeExceptionally(ex);
            return null;
        });
        return result;
    }

    @Override
    public CompletableFuture<CameraFacing> switchCamera() {
        return supplyOnControl(() -> {
            CameraFacing newFacing = settings.facing().opposite();
            settings = settings.withFacing(newFacing);
            flashOn = false;
            SessionHandle h = handle;
            if (h != null) {
                onEngine("switchFacing", h::switchFacing);
            }
            LOG.info("Camera switched to {}", newFacing);
            return newFacing;
        });
    }

    // ---------------------------------------------------------------- observers

    @Override
    public SessionState currentState() {
        return state;
    }

    @Override
    public WatchdogStats watchdogStats() {
        return watchdog.stats();
    }

    @Override
    public StreamStats streamStats() {
        Instant since = streamingSince;
        if (since == null) {
            return StreamStats.empty();
        }
        return new StreamStats(lastBitrate, TimeUtils.elapsed(since, clock.instant()));
    }

    @Override
    public SessionSettings currentSettings() {
        return settings;
    }

    @Override
    public RunState runState() {
        return gate.get();
    }

    @Override
    public boolean isMuted() {
        return muted;
    }

    @Override
    public boolean isFlashOn() {
        return flashOn;
    }

    @Override
    public CameraFacing currentFacing() {
        return settings.facing();
    }

    @Override
    public boolean isStreaming() {
        return state.is(SessionState.Phase.STREAMING);
    }

    // ---------------------------------------------------------------- watchdog and reconnect hooks

    @Override
    public void onAnomaly(Anomaly anomaly) {
        publisher.publishEvent(new AnomalyDetectedEvent(anomaly, clock.instant()));
        if (!anomaly.severity().requiresRecovery()) {
            LOG.info("Anomaly noted without recovery: {}", anomaly.description());
            return;
        }
        if (gate.isStopped()) {
            return;
        }
        if (coordinator.isReconnectPending()) {
            LOG.debug("Reconnect already pending; {} not rescheduled", anomaly.type());
            return;
        }
        transition(SessionState.reconnecting());
        coordinator.scheduleReconnect(anomaly.description());
    }

    @Override
    public void releaseSession() {
        SessionHandle h = handle;
        handle = null;
        watchdog.setSessionHandle(null);
        streamingSince = null;
        lastBitrate = 0;
        if (h != null) {
            releaseOnEngine(h);
        }
    }

    @Override
    public void rebuildSession() {
        if (gate.isStopped()) {
            return;
        }
        buildSession();
    }

    @Override
    public void onRetriesExhausted(String reason, BackoffState backoff) {
        gate.setStopped();
        transition(SessionState.error("Reconnect gave up after " + backoff.attempts() + " attempts: " + reason));
    }

    // ---------------------------------------------------------------- internals

    private void doStart(String target) {
        SessionState current = state;
        if (!current.is(SessionState.Phase.IDLE) && !current.is(SessionState.Phase.ERROR)) {
            LOG.info("Session already active ({}); start ignored", current.phase());
            return;
        }
        coordinator.reset();
        releaseSession();
        sessionId = UUID.randomUUID().toString().substring(0, 8);
        ThreadContext.put(MDC_SESSION_ID, sessionId);
        endpoint = target;
        gate.setRunning();
        LOG.info("Starting session towards {}", LogSanitizer.redactEndpoint(target));
        buildSession();
    }

    private void doStop() {
        coordinator.reset();
        releaseSession();
        transition(SessionState.idle());
        LOG.info("Session stopped");
        sessionId = null;
    }

    /** Creates a fresh handle and hands preparation to the engine executor. */
    private void buildSession() {
        transition(SessionState.preparing());
        BoundListener listener = new BoundListener();
        SessionHandle h = handleFactory.create(listener);
        listener.bind(h);
        handle = h;
        watchdog.setSessionHandle(h);
        SessionSettings s = settings;
        boolean mute = muted;
        String target = endpoint;
        engineExecutor.execute(() -> {
            try {
                prepareAndStart(h, s, mute, target);
                runOnControl(() -> onBuildStarted(h));
            } catch (RuntimeException e) {
                runOnControl(() -> onBuildFailed(h, e));
            }
        });
    }

    private static void prepareAndStart(SessionHandle h, SessionSettings s, boolean mute, String target) {
        SessionSettings.Video v = s.video();
        SessionSettings.Audio a = s.audio();
        h.setVideoCodec(v.codec());
        if (!h.prepareVideo(v.landscapeWidth(), v.landscapeHeight(), v.fps(), v.bitrateBps(),
                v.keyframeIntervalSec(), v.rotation().degrees())) {
            throw new SessionStartException("Video encoder rejected settings", "prepareVideo");
        }
        if (!h.prepareAudio(a.bitrateBps(), a.sampleRate(), a.stereo(), a.echoCanceler(), a.noiseSuppressor())) {
            LOG.warn("Audio preparation failed; continuing without audio");
        }
        h.setAudioMuted(mute);
        h.startCapture(s.facing());
        h.startTransport(target);
    }

    private void onBuildStarted(SessionHandle h) {
        if (h != handle) {
            return;
        }
        if (state.is(SessionState.Phase.PREPARING)) {
            transition(SessionState.connecting());
        }
    }

    private void onBuildFailed(SessionHandle h, RuntimeException e) {
        if (h != handle) {
            LOG.debug("Build failure from retired session ignored: {}", e.toString());
            return;
        }
        LOG.error("Session build failed: {}", e.getMessage(), e);
        releaseSession();
        transition(SessionState.error(e.getMessage()));
    }

    private void onConnected(SessionHandle h) {
        Instant now = clock.instant();
        if (!state.is(SessionState.Phase.STREAMING)) {
            streamingSince = now;
        }
        transition(SessionState.streaming(0));
        coordinator.onSessionEstablished();
        boolean mute = muted;
        boolean torch = flashOn && settings.facing() == CameraFacing.BACK;
        onEngine("restoreIntent", () -> {
            h.setAudioMuted(mute);
            if (torch && h.isTorchSupported()) {
                h.setTorchEnabled(true);
            }
        });
    }

    private void onTransportLost(String reason) {
        if (state.is(SessionState.Phase.ERROR)) {
            LOG.debug("Transport loss after error already recorded: {}", reason);
            return;
        }
        LOG.warn("Transport lost: {}", reason);
        releaseSession();
        transition(SessionState.error(reason));
    }

    private void onAuthError() {
        LOG.error("Authentication rejected by endpoint; stopping without retry");
        gate.setStopped();
        coordinator.cancelReconnect();
        releaseSession();
        transition(SessionState.error("Authentication failed"));
    }

    private void onBitrate(long bps) {
        lastBitrate = bps;
        watchdog.onBitrateSample(bps);
        if (state.is(SessionState.Phase.STREAMING)) {
            transition(SessionState.streaming(Math.max(0, bps)));
        }
    }

    private boolean applyTorch(SessionHandle h, boolean desired) {
        try {
            if (!h.isTorchSupported()) {
                LOG.info("Torch not supported by the active capture device");
                return false;
            }
            h.setTorchEnabled(desired);
            return desired;
        } catch (RuntimeException e) {
            LOG.warn("Torch toggle failed: {}", e.toString());
            return flashOn;
        }
    }

    /** Stores and publishes a new state; identical states are not republished. */
    private void transition(SessionState next) {
        SessionState previous = state;
        state = next;
        if (previous.equals(next)) {
            return;
        }
        if (previous.phase() != next.phase()) {
            LOG.info("Session {} -> {} ({})", previous.phase(), next.phase(), next.statusText());
        }
        publisher.publishEvent(new SessionStateChangedEvent(previous, next, clock.instant()));
    }

    private void releaseOnEngine(SessionHandle h) {
        engineExecutor.execute(() -> {
            releaseStep("stopTransport", h::stopTransport);
            releaseStep("stopCapture", h::stopCapture);
            releaseStep("release", h::release);
        });
    }

    private static void releaseStep(String step, Runnable action) {
        try {
            action.run();
        } catch (RuntimeException e) {
            LOG.warn("Release step {} failed: {}", step, e.toString());
        }
    }

    private void onEngine(String what, Runnable action) {
        engineExecutor.execute(() -> {
            try {
                action.run();
            } catch (RuntimeException e) {
                LOG.warn("Engine call {} failed: {}", what, e.toString());
            }
        });
    }

    private CompletableFuture<Void> runOnControl(Runnable action) {
        return CompletableFuture.runAsync(withSessionContext(action), controlExecutor);
    }

    private <T> CompletableFuture<T> supplyOnControl(Supplier<T> action) {
        return CompletableFuture.supplyAsync(() -> {
            String sid = sessionId;
            if (sid != null) {
                ThreadContext.put(MDC_SESSION_ID, sid);
            }
            try {
                return action.get();
            } finally {
                ThreadContext.remove(MDC_SESSION_ID);
            }
        }, controlExecutor);
    }

    private Runnable withSessionContext(Runnable action) {
        return () -> {
            String sid = sessionId;
            if (sid != null) {
                ThreadContext.put(MDC_SESSION_ID, sid);
            }
            try {
                action.run();
            } finally {
                ThreadContext.remove(MDC_SESSION_ID);
            }
        };
    }

    static String validateEndpoint(String endpoint) {
        if (endpoint == null || endpoint.isBlank()) {
            throw new InvalidEndpointException("endpoint must not be blank");
        }
        String trimmed = endpoint.trim();
        try {
            URI uri = new URI(trimmed);
            String scheme = uri.getScheme();
            if (scheme == null || !SUPPORTED_SCHEMES.contains(scheme.toLowerCase(Locale.ROOT))) {
                throw new InvalidEndpointException("unsupported scheme " + scheme + ", expected one of "
                        + SUPPORTED_SCHEMES);
            }
            if (uri.getHost() == null) {
                throw new InvalidEndpointException("missing host");
            }
        } catch (URISyntaxException e) {
            throw new InvalidEndpointException("malformed URL");
        }
        return trimmed;
    }

    /**
     * Transport callbacks for one handle. Everything is re-posted onto the control executor and
     * dropped there if the handle has been retired in the meantime.
     */
    private final class BoundListener implements TransportListener {

        private volatile SessionHandle owner;

        void bind(SessionHandle h) {
            this.owner = h;
        }

        @Override
        public void connectionStarted(String url) {
            LOG.debug("Transport connecting to {}", LogSanitizer.redactEndpoint(url));
        }

        @Override
        public void connectionSucceeded() {
            onCurrent(() -> onConnected(owner));
        }

        @Override
        public void connectionFailed(String reason) {
            onCurrent(() -> onTransportLost("Connection failed: " + reason));
        }

        @Override
        public void bitrateSample(long bps) {
            onCurrent(() -> onBitrate(bps));
        }

        @Override
        public void disconnected() {
            onCurrent(() -> onTransportLost("Disconnected"));
        }

        @Override
        public void authError() {
            onCurrent(DefaultStreamOrchestrator.this::onAuthError);
        }

        @Override
        public void authSucceeded() {
            LOG.debug("Authentication accepted");
        }

        private void onCurrent(Runnable action) {
            runOnControl(() -> {
                SessionHandle current = handle;
                if (current == null || owner != current) {
                    LOG.debug("Callback from retired session ignored");
                    return;
                }
                action.run();
            });
        }
    }
}
