package com.phillippitts.streamwatch.service.watchdog;

import com.phillippitts.streamwatch.domain.Anomaly;
import com.phillippitts.streamwatch.domain.AnomalyType;
import com.phillippitts.streamwatch.domain.WatchdogConfig;
import com.phillippitts.streamwatch.domain.WatchdogStats;
import com.phillippitts.streamwatch.service.orchestration.RunStateGate;
import com.phillippitts.streamwatch.service.session.SessionHandle;
import com.phillippitts.streamwatch.service.session.TransportListener;
import com.phillippitts.streamwatch.testutil.FakeSessionHandle;
import com.phillippitts.streamwatch.testutil.ManualTaskScheduler;
import com.phillippitts.streamwatch.testutil.MutableClock;
import com.phillippitts.streamwatch.testutil.QueuedExecutor;
import com.phillippitts.streamwatch.testutil.SyncExecutor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class StreamWatchdogTest {

    private RunStateGate gate;
    private ManualTaskScheduler scheduler;
    private MutableClock clock;
    private List<Anomaly> received;
    private FakeSessionHandle handle;

    @BeforeEach
    void setUp() {
        gate = new RunStateGate();
        gate.setRunning();
        scheduler = new ManualTaskScheduler();
        clock = new MutableClock();
        received = new CopyOnWriteArrayList<>();
        handle = new FakeSessionHandle(mock(TransportListener.class));
        handle.setCapturing(true);
        handle.setStreaming(true);
    }

    private StreamWatchdog startWatchdog(WatchdogConfig config) {
        StreamWatchdog watchdog = new StreamWatchdog(gate, scheduler, new SyncExecutor());
        watchdog.setAnomalyListener(received::add);
        watchdog.start(config, clock);
        watchdog.setSessionHandle(handle);
        return watchdog;
    }

    private List<AnomalyType> receivedTypes() {
        return received.stream().map(Anomaly::type).toList();
    }

    @Test
    void stoppedGateSkipsEveryTickAndNeverDispatches() {
        StreamWatchdog watchdog = startWatchdog(WatchdogConfig.defaults());
        watchdog.setSessionHandle(null);
        gate.setStopped();

        for (int i = 0; i < 50; i++) {
            clock.advanceSeconds(5);
            watchdog.tick();
        }

        WatchdogStats stats = watchdog.stats();
        assertThat(stats.totalChecks()).isEqualTo(50);
        assertThat(stats.skippedChecks()).isEqualTo(50);
        assertThat(stats.effectiveChecks()).isZero();
        assertThat(stats.anomaliesDetected()).isZero();
        assertThat(received).isEmpty();
    }

    @Test
    void missingSessionWhileRunningRaisesCameraDisconnected() {
        StreamWatchdog watchdog = startWatchdog(WatchdogConfig.defaults());
        watchdog.setSessionHandle(null);

        clock.advanceSeconds(5);
        watchdog.tick();

        assertThat(received).containsExactly(new Anomaly.CameraDisconnected());
        assertThat(received.get(0).description()).isEqualTo("Camera disconnected");
    }

    @Test
    void raisesZeroBitrateOnceFirstSampleNeverArrives() {
        StreamWatchdog watchdog = startWatchdog(WatchdogConfig.defaults());

        clock.advanceSeconds(12);
        watchdog.tick();
        assertThat(received).isEmpty();

        clock.advanceSeconds(4);
        watchdog.tick();

        assertThat(received).containsExactly(new Anomaly.ZeroBitrate(Duration.ofSeconds(16)));
        assertThat(received.get(0).description()).isEqualTo("Zero bitrate for 16s");
    }

    @Test
    void alternatingSubThresholdSamplesCountAsOneContinuousZeroRun() {
        WatchdogConfig config = WatchdogConfig.defaults().toBuilder()
                .startupGracePeriod(Duration.ZERO)
                .build();
        StreamWatchdog watchdog = startWatchdog(config);

        // 0 and 5000 bps are both below the 10 kbps zero threshold; run starts at t=5s
        for (int t = 5; t <= 35; t += 5) {
            clock.advanceSeconds(5);
            watchdog.onBitrateSample((t / 5) % 2 == 0 ? 0 : 5000);
            watchdog.tick();
            assertThat(received).as("no anomaly at t=%ds", t).isEmpty();
        }

        clock.advanceSeconds(5);
        watchdog.onBitrateSample(0);
        watchdog.tick();
        assertThat(received).containsExactly(new Anomaly.ZeroBitrate(Duration.ofSeconds(35)));
    }

    @Test
    void sampleAboveZeroThresholdResetsTheZeroRun() {
        WatchdogConfig config = WatchdogConfig.defaults().toBuilder()
                .startupGracePeriod(Duration.ZERO)
                .build();
        StreamWatchdog watchdog = startWatchdog(config);

        for (int i = 0; i < 6; i++) {
            clock.advanceSeconds(5);
            watchdog.onBitrateSample(0);
            watchdog.tick();
        }
        // 20 kbps clears the zero threshold (and starts a low run, which is not long enough to fire)
        clock.advanceSeconds(5);
        watchdog.onBitrateSample(20_000);
        watchdog.tick();

        // A new zero run needs the full duration again
        for (int i = 0; i < 7; i++) {
            watchdog.onBitrateSample(0);
            watchdog.tick();
            clock.advanceSeconds(5);
        }
        assertThat(receivedTypes()).doesNotContain(AnomalyType.ZERO_BITRATE);

        watchdog.onBitrateSample(0);
        watchdog.tick();
        assertThat(receivedTypes()).containsExactly(AnomalyType.ZERO_BITRATE);
    }

    @Test
    void lowBitrateIsDebouncedWithinTheWindow() {
        WatchdogConfig config = WatchdogConfig.defaults().toBuilder()
                .startupGracePeriod(Duration.ZERO)
                .build();
        StreamWatchdog watchdog = startWatchdog(config);

        // Low run starts at t=5s; fires at t=25s (20s > 15s), again at t=55s once 30s have passed
        for (int t = 5; t <= 60; t += 5) {
            clock.advanceSeconds(5);
            watchdog.onBitrateSample(50_000);
            watchdog.tick();
        }

        assertThat(received).containsExactly(
                new Anomaly.LowBitrate(50_000, 100_000),
                new Anomaly.LowBitrate(50_000, 100_000));
        assertThat(received.get(0).description()).isEqualTo("Low bitrate: 50 kbps (min 100 kbps)");
        assertThat(watchdog.stats().anomaliesDetected()).isEqualTo(2);
        assertThat(watchdog.stats().lastAnomalyType()).isEqualTo(AnomalyType.LOW_BITRATE);
    }

    @Test
    void configUpdateAppliesFromNextTickWithoutResettingElapsedRuns() {
        WatchdogConfig config = WatchdogConfig.defaults().toBuilder()
                .startupGracePeriod(Duration.ZERO)
                .build();
        StreamWatchdog watchdog = startWatchdog(config);

        for (int i = 0; i < 4; i++) {
            clock.advanceSeconds(5);
            watchdog.onBitrateSample(0);
            watchdog.tick();
        }
        assertThat(received).isEmpty();

        watchdog.updateConfig(config.toBuilder().zeroBitrateDuration(Duration.ofSeconds(10)).build());
        assertThat(received).isEmpty();

        clock.advanceSeconds(5);
        watchdog.onBitrateSample(0);
        watchdog.tick();

        // Run began at t=5s, so it is 20s old now
        assertThat(received).containsExactly(new Anomaly.ZeroBitrate(Duration.ofSeconds(20)));
    }

    @Test
    void counterOverflowResetsCumulativeCountersWithoutThrowing() {
        StreamWatchdog watchdog = startWatchdog(WatchdogConfig.defaults());
        watchdog.forceTotalChecks(Long.MAX_VALUE);

        assertThatCode(watchdog::tick).doesNotThrowAnyException();

        WatchdogStats afterReset = watchdog.stats();
        assertThat(afterReset.totalChecks()).isZero();
        assertThat(afterReset.effectiveChecks()).isEqualTo(1);
        assertThat(afterReset.skippedChecks()).isZero();
        assertThat(afterReset.anomaliesDetected()).isZero();
        assertThat(afterReset.startTime()).isEqualTo(clock.instant());

        watchdog.tick();
        assertThat(watchdog.stats().totalChecks()).isEqualTo(1);
        assertThat(watchdog.stats().effectiveChecks()).isEqualTo(2);
    }

    @Test
    void stopBetweenDetectionAndDispatchSuppressesCallback() {
        QueuedExecutor control = new QueuedExecutor();
        StreamWatchdog watchdog = new StreamWatchdog(gate, scheduler, control);
        watchdog.setAnomalyListener(received::add);
        watchdog.start(WatchdogConfig.defaults(), clock);

        clock.advanceSeconds(5);
        watchdog.tick();
        assertThat(control.pending()).isEqualTo(1);

        watchdog.stop();
        control.runAll();

        assertThat(received).isEmpty();
    }

    @Test
    void gateStoppedBetweenDetectionAndDispatchSuppressesCallback() {
        QueuedExecutor control = new QueuedExecutor();
        StreamWatchdog watchdog = new StreamWatchdog(gate, scheduler, control);
        watchdog.setAnomalyListener(received::add);
        watchdog.start(WatchdogConfig.defaults(), clock);

        clock.advanceSeconds(5);
        watchdog.tick();
        gate.setStopped();
        control.runAll();

        assertThat(received).isEmpty();
    }

    @Test
    void findingAgainstReplacedSessionIsNotDelivered() {
        QueuedExecutor control = new QueuedExecutor();
        StreamWatchdog watchdog = new StreamWatchdog(gate, scheduler, control);
        watchdog.setAnomalyListener(received::add);
        watchdog.start(WatchdogConfig.defaults(), clock);

        // No session attached: the tick queues CameraDisconnected
        watchdog.tick();
        assertThat(control.pending()).isEqualTo(1);

        // A new session is attached before the finding is delivered
        watchdog.setSessionHandle(handle);
        control.runAll();

        assertThat(received).isEmpty();
        assertThat(watchdog.stats().anomaliesDetected()).isEqualTo(1);
    }

    @Test
    void findingIsDeliveredWhenSessionUnchanged() {
        QueuedExecutor control = new QueuedExecutor();
        StreamWatchdog watchdog = new StreamWatchdog(gate, scheduler, control);
        watchdog.setAnomalyListener(received::add);
        watchdog.start(WatchdogConfig.defaults(), clock);

        watchdog.tick();
        control.runAll();

        assertThat(receivedTypes()).containsExactly(AnomalyType.CAMERA_DISCONNECTED);
    }

    @Test
    void throwingCheckBecomesEncoderErrorAndLoopContinues() {
        SessionHandle broken = mock(SessionHandle.class);
        when(broken.isStreaming()).thenThrow(new IllegalStateException("boom"));
        when(broken.isCapturing()).thenReturn(true);
        WatchdogConfig config = WatchdogConfig.defaults().toBuilder()
                .bitrateMonitoringEnabled(false)
                .encoderMonitoringEnabled(false)
                .build();
        StreamWatchdog watchdog = startWatchdog(config);
        watchdog.setSessionHandle(broken);

        clock.advanceSeconds(5);
        watchdog.tick();
        clock.advanceSeconds(5);
        watchdog.tick();

        assertThat(received).hasSize(2).allSatisfy(a -> {
            assertThat(a.type()).isEqualTo(AnomalyType.ENCODER_ERROR);
            assertThat(a.description()).isEqualTo("Encoder error: connection check failed: boom");
        });
        assertThat(watchdog.isRunning()).isTrue();
    }

    @Test
    void transportThatNeverGoesLiveIsReportedAsStuck() {
        handle.setStreaming(false);
        WatchdogConfig config = WatchdogConfig.defaults().toBuilder()
                .bitrateMonitoringEnabled(false)
                .encoderMonitoringEnabled(false)
                .build();
        StreamWatchdog watchdog = startWatchdog(config);

        // grace ends after 5s; stuck timer starts at t=10s and exceeds 10s at t=25s
        for (int t = 5; t <= 20; t += 5) {
            clock.advanceSeconds(5);
            watchdog.tick();
        }
        assertThat(received).isEmpty();

        clock.advanceSeconds(5);
        watchdog.tick();
        assertThat(received).containsExactly(new Anomaly.ConnectionStuck(Duration.ofSeconds(15)));
    }

    @Test
    void liveTransportWithoutSamplesTimesOut() {
        WatchdogConfig config = WatchdogConfig.defaults().toBuilder()
                .bitrateMonitoringEnabled(false)
                .build();
        StreamWatchdog watchdog = startWatchdog(config);
        watchdog.onBitrateSample(500_000);

        clock.advanceSeconds(60);
        watchdog.tick();
        assertThat(received).isEmpty();

        clock.advanceSeconds(1);
        watchdog.tick();
        assertThat(received).containsExactly(new Anomaly.StreamingTimeout(Duration.ofSeconds(61)));
        assertThat(received.get(0).description()).isEqualTo("Streaming timeout: no data for 61s");
    }

    @Test
    void capturingWithoutStreamingIsEncoderErrorAfterGrace() {
        handle.setStreaming(false);
        WatchdogConfig config = WatchdogConfig.defaults().toBuilder()
                .bitrateMonitoringEnabled(false)
                .connectionMonitoringEnabled(false)
                .build();
        StreamWatchdog watchdog = startWatchdog(config);

        clock.advanceSeconds(10);
        watchdog.tick();
        assertThat(received).isEmpty();

        clock.advanceSeconds(1);
        watchdog.tick();
        assertThat(received).containsExactly(new Anomaly.EncoderError("encoder not running"));
    }

    @Test
    void captureLossIsCameraDisconnected() {
        handle.setCapturing(false);
        WatchdogConfig config = WatchdogConfig.defaults().toBuilder()
                .bitrateMonitoringEnabled(false)
                .connectionMonitoringEnabled(false)
                .build();
        StreamWatchdog watchdog = startWatchdog(config);

        clock.advanceSeconds(11);
        watchdog.tick();

        assertThat(received).containsExactly(new Anomaly.CameraDisconnected());
        assertThat(received.get(0).severity().requiresRecovery()).isTrue();
    }

    @Test
    void unstableBitrateIsReportedAsFluctuation() {
        WatchdogConfig config = WatchdogConfig.defaults().toBuilder()
                .startupGracePeriod(Duration.ZERO)
                .build();
        StreamWatchdog watchdog = startWatchdog(config);

        for (int i = 0; i < 10; i++) {
            clock.advanceSeconds(1);
            watchdog.onBitrateSample(i % 2 == 0 ? 200_000 : 1_000_000);
        }
        watchdog.tick();

        assertThat(received).hasSize(1);
        Anomaly anomaly = received.get(0);
        assertThat(anomaly).isInstanceOf(Anomaly.BitrateFluctuation.class);
        // mean 600k, standard deviation 400k
        assertThat(((Anomaly.BitrateFluctuation) anomaly).variance()).isEqualTo(1.6e11);
    }

    @Test
    void steadyBitrateRaisesNothing() {
        WatchdogConfig config = WatchdogConfig.defaults().toBuilder()
                .startupGracePeriod(Duration.ZERO)
                .build();
        StreamWatchdog watchdog = startWatchdog(config);

        for (int i = 0; i < 30; i++) {
            clock.advanceSeconds(5);
            watchdog.onBitrateSample(2_000_000 + (i % 3) * 10_000);
            watchdog.tick();
        }

        assertThat(received).isEmpty();
        assertThat(watchdog.stats().effectiveChecks()).isEqualTo(30);
    }

    @Test
    void statsKeepOnlyTheLatestTwentySamples() {
        StreamWatchdog watchdog = startWatchdog(WatchdogConfig.defaults());

        for (int i = 1; i <= 25; i++) {
            watchdog.onBitrateSample(i * 1000L);
        }
        watchdog.tick();

        WatchdogStats stats = watchdog.stats();
        assertThat(stats.bitrateHistory()).hasSize(StreamWatchdog.HISTORY_CAPACITY);
        assertThat(stats.bitrateHistory().get(0)).isEqualTo(6000L);
        assertThat(stats.currentBitrate()).isEqualTo(25_000L);
        assertThat(stats.averageBitrate()).isEqualTo(15_500L);
    }

    @Test
    void startIsIdempotentAndStopCancelsTimer() {
        StreamWatchdog watchdog = startWatchdog(WatchdogConfig.defaults());
        watchdog.start(WatchdogConfig.defaults(), clock);

        assertThat(scheduler.active()).hasSize(1);
        assertThat(scheduler.active().get(0).period()).isEqualTo(Duration.ofSeconds(5));

        watchdog.stop();
        watchdog.stop();

        assertThat(watchdog.isRunning()).isFalse();
        assertThat(scheduler.active()).isEmpty();
        watchdog.tick();
        assertThat(watchdog.stats().totalChecks()).isZero();
    }

    @Test
    void changedIntervalReschedulesTimer() {
        StreamWatchdog watchdog = startWatchdog(WatchdogConfig.defaults());

        watchdog.updateConfig(WatchdogConfig.defaults().toBuilder().checkInterval(Duration.ofSeconds(2)).build());

        assertThat(scheduler.active()).hasSize(1);
        assertThat(scheduler.active().get(0).period()).isEqualTo(Duration.ofSeconds(2));
    }

    @Test
    void timerFiringTicksThroughControlExecutor() {
        QueuedExecutor control = new QueuedExecutor();
        StreamWatchdog watchdog = new StreamWatchdog(gate, scheduler, control);
        watchdog.start(WatchdogConfig.defaults(), clock);

        scheduler.fireAll();
        assertThat(watchdog.stats().totalChecks()).isZero();

        control.runAll();
        assertThat(watchdog.stats().totalChecks()).isEqualTo(1);
    }
}
