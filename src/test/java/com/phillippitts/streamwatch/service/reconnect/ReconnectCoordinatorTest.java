package com.phillippitts.streamwatch.service.reconnect;

import com.phillippitts.streamwatch.service.orchestration.RunStateGate;
import com.phillippitts.streamwatch.testutil.EventCapturingPublisher;
import com.phillippitts.streamwatch.testutil.ManualTaskScheduler;
import com.phillippitts.streamwatch.testutil.ManualTaskScheduler.ManualFuture;
import com.phillippitts.streamwatch.testutil.MutableClock;
import com.phillippitts.streamwatch.testutil.SyncExecutor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class ReconnectCoordinatorTest {

    private RunStateGate gate;
    private ManualTaskScheduler scheduler;
    private EventCapturingPublisher publisher;
    private MutableClock clock;
    private RecordingRebuilder rebuilder;

    @BeforeEach
    void setUp() {
        gate = new RunStateGate();
        gate.setRunning();
        scheduler = new ManualTaskScheduler();
        publisher = new EventCapturingPublisher();
        clock = new MutableClock();
        rebuilder = new RecordingRebuilder();
    }

    private ReconnectCoordinator coordinator(ReconnectPolicy policy) {
        ReconnectCoordinator c = new ReconnectCoordinator(gate, scheduler, new SyncExecutor(), policy, publisher, clock);
        c.setSessionRebuilder(rebuilder);
        return c;
    }

    @Test
    void releasesImmediatelyAndRebuildsWhenDelayElapses() {
        // Arrange
        ReconnectCoordinator coordinator = coordinator(new FixedDelayPolicy(Duration.ofSeconds(3)));

        // Act
        coordinator.scheduleReconnect("Zero bitrate for 35 seconds");

        // Assert
        assertThat(rebuilder.calls).containsExactly("release");
        assertThat(coordinator.isReconnectPending()).isTrue();
        assertThat(scheduler.active()).hasSize(1);

        ReconnectScheduledEvent event = publisher.eventsOfType(ReconnectScheduledEvent.class).get(0);
        assertThat(event.reason()).isEqualTo("Zero bitrate for 35 seconds");
        assertThat(event.attempt()).isZero();
        assertThat(event.delay()).isEqualTo(Duration.ofSeconds(3));
        assertThat(event.at()).isEqualTo(clock.instant());

        scheduler.fireAll();

        assertThat(rebuilder.calls).containsExactly("release", "rebuild");
        assertThat(coordinator.isReconnectPending()).isFalse();
        assertThat(coordinator.backoffState().attempts()).isEqualTo(1);
    }

    @Test
    void newScheduleRetiresThePendingOne() {
        ReconnectCoordinator coordinator = coordinator(new FixedDelayPolicy(Duration.ofSeconds(3)));

        coordinator.scheduleReconnect("first");
        ManualFuture first = scheduler.all().get(0);
        coordinator.scheduleReconnect("second");

        assertThat(first.isCancelled()).isTrue();
        assertThat(scheduler.active()).hasSize(1);

        // A task dequeued just before cancel landed must not rebuild
        first.runIgnoringCancel();
        assertThat(rebuilder.rebuilds()).isZero();

        scheduler.fireAll();
        assertThat(rebuilder.rebuilds()).isEqualTo(1);
    }

    @Test
    void attemptsOnlyCountRebuildsThatFired() {
        ReconnectCoordinator coordinator = coordinator(new FixedDelayPolicy(Duration.ofSeconds(3)));

        coordinator.scheduleReconnect("a");
        coordinator.scheduleReconnect("b");
        coordinator.scheduleReconnect("c");

        assertThat(coordinator.backoffState().attempts()).isZero();
        assertThat(publisher.eventsOfType(ReconnectScheduledEvent.class))
                .extracting(ReconnectScheduledEvent::attempt)
                .containsExactly(0, 0, 0);
    }

    @Test
    void cancelPreventsRebuildAndIsIdempotent() {
        ReconnectCoordinator coordinator = coordinator(new FixedDelayPolicy(Duration.ofSeconds(3)));
        coordinator.scheduleReconnect("lost");
        ManualFuture task = scheduler.all().get(0);

        coordinator.cancelReconnect();
        coordinator.cancelReconnect();

        assertThat(coordinator.isReconnectPending()).isFalse();
        task.runIgnoringCancel();
        assertThat(rebuilder.rebuilds()).isZero();
    }

    @Test
    void stoppingTheGateDuringTheDelayAbortsRebuild() {
        ReconnectCoordinator coordinator = coordinator(new FixedDelayPolicy(Duration.ofSeconds(3)));
        coordinator.scheduleReconnect("lost");

        gate.setStopped();
        scheduler.fireAll();

        assertThat(rebuilder.rebuilds()).isZero();
        assertThat(coordinator.isReconnectPending()).isFalse();
    }

    @Test
    void exhaustedPolicyReleasesAndReportsWithoutScheduling() {
        ReconnectCoordinator coordinator = coordinator((state, now) -> Optional.empty());

        coordinator.scheduleReconnect("Camera disconnected");

        assertThat(rebuilder.calls).containsExactly("release", "exhausted:Camera disconnected");
        assertThat(scheduler.all()).isEmpty();
        assertThat(coordinator.isReconnectPending()).isFalse();
        assertThat(publisher.eventsOfType(ReconnectScheduledEvent.class)).isEmpty();
    }

    @Test
    void givesUpOnceFailureStreakOutlastsRetryWindow() {
        ReconnectCoordinator coordinator = coordinator(
                new ExponentialBackoffPolicy(Duration.ofSeconds(1), Duration.ofHours(1), Duration.ofHours(1), false));

        coordinator.scheduleReconnect("first");
        scheduler.fireAll();
        clock.advance(Duration.ofHours(2));
        coordinator.scheduleReconnect("second");

        assertThat(rebuilder.calls).containsExactly("release", "rebuild", "release", "exhausted:second");
    }

    @Test
    void exponentialDelaysGrowWithFiredAttempts() {
        ReconnectCoordinator coordinator = coordinator(
                new ExponentialBackoffPolicy(Duration.ofSeconds(1), Duration.ofHours(1), Duration.ofDays(30), false));

        for (int i = 0; i < 4; i++) {
            coordinator.scheduleReconnect("attempt " + i);
            scheduler.fireAll();
        }

        assertThat(publisher.eventsOfType(ReconnectScheduledEvent.class))
                .extracting(ReconnectScheduledEvent::delay)
                .containsExactly(Duration.ofSeconds(1), Duration.ofSeconds(2), Duration.ofSeconds(4),
                        Duration.ofSeconds(8));
    }

    @Test
    void sessionEstablishedStartsFreshBackoff() {
        ReconnectCoordinator coordinator = coordinator(
                new ExponentialBackoffPolicy(Duration.ofSeconds(1), Duration.ofHours(1), Duration.ofDays(30), false));
        coordinator.scheduleReconnect("a");
        scheduler.fireAll();
        coordinator.scheduleReconnect("b");
        scheduler.fireAll();

        coordinator.onSessionEstablished();

        assertThat(coordinator.backoffState()).isEqualTo(BackoffState.initial());
        coordinator.scheduleReconnect("c");
        assertThat(publisher.eventsOfType(ReconnectScheduledEvent.class).get(2).delay())
                .isEqualTo(Duration.ofSeconds(1));
    }

    @Test
    void resetCancelsAndForgetsProgress() {
        ReconnectCoordinator coordinator = coordinator(new FixedDelayPolicy(Duration.ofSeconds(3)));
        coordinator.scheduleReconnect("a");
        scheduler.fireAll();
        coordinator.scheduleReconnect("b");

        coordinator.reset();

        assertThat(coordinator.isReconnectPending()).isFalse();
        assertThat(coordinator.backoffState().attempts()).isZero();
        assertThat(coordinator.backoffState().firstFailureAt()).isNull();
    }

    @Test
    void failedRebuildIsNotPropagated() {
        ReconnectCoordinator coordinator = coordinator(new FixedDelayPolicy(Duration.ofSeconds(3)));
        rebuilder.failRebuild = true;
        coordinator.scheduleReconnect("lost");

        scheduler.fireAll();

        assertThat(rebuilder.rebuilds()).isEqualTo(1);
        assertThat(coordinator.isReconnectPending()).isFalse();
    }

    @Test
    void failedReleaseStillSchedules() {
        ReconnectCoordinator coordinator = coordinator(new FixedDelayPolicy(Duration.ofSeconds(3)));
        rebuilder.failRelease = true;

        coordinator.scheduleReconnect("lost");

        assertThat(coordinator.isReconnectPending()).isTrue();
    }

    @Test
    void schedulingWithoutRebuilderIsRejected() {
        ReconnectCoordinator coordinator = new ReconnectCoordinator(gate, scheduler, new SyncExecutor(),
                new FixedDelayPolicy(Duration.ofSeconds(3)), publisher, clock);

        assertThatThrownBy(() -> coordinator.scheduleReconnect("lost"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("SessionRebuilder");
    }

    @Test
    void rebuildFiresOnRealSchedulerAfterDelay() {
        ThreadPoolTaskScheduler real = new ThreadPoolTaskScheduler();
        real.setPoolSize(1);
        real.setThreadNamePrefix("test-reconnect-");
        real.initialize();
        try {
            ReconnectCoordinator coordinator = new ReconnectCoordinator(gate, real, new SyncExecutor(),
                    new FixedDelayPolicy(Duration.ofMillis(50)), publisher, clock);
            coordinator.setSessionRebuilder(rebuilder);

            coordinator.scheduleReconnect("lost");

            await().atMost(Duration.ofSeconds(2)).until(() -> rebuilder.rebuilds() == 1);
            assertThat(coordinator.isReconnectPending()).isFalse();
        } finally {
            real.shutdown();
        }
    }

    private static final class RecordingRebuilder implements SessionRebuilder {
        final List<String> calls = new CopyOnWriteArrayList<>();
        volatile boolean failRebuild;
        volatile boolean failRelease;

        @Override
        public void releaseSession() {
            calls.add("release");
            if (failRelease) {
                throw new IllegalStateException("release failed");
            }
        }

        @Override
        public void rebuildSession() {
            calls.add("rebuild");
            if (failRebuild) {
                throw new IllegalStateException("rebuild failed");
            }
        }

        @Override
        public void onRetriesExhausted(String reason, BackoffState state) {
            calls.add("exhausted:" + reason);
        }

        int rebuilds() {
            List<String> copy = new ArrayList<>(calls);
            return (int) copy.stream().filter("rebuild"::equals).count();
        }
    }
}
