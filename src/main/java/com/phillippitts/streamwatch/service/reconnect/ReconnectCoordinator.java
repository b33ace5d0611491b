package com.phillippitts.streamwatch.service.reconnect;

import com.phillippitts.streamwatch.service.orchestration.RunStateGate;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Tears a failed session down and rebuilds it after a policy-defined delay.
 *
 * <p>At most one rebuild is pending at any time. Every schedule or cancel bumps a generation
 * counter; a delayed task whose generation is no longer current does nothing, so a
 * {@link #cancelReconnect()} followed by a new start can never race with a stale rebuild.
 *
 * <p>Sequence for {@link #scheduleReconnect(String)}:
 * <ol>
 *   <li>retire any pending task</li>
 *   <li>ask the policy for a delay; none means the retry window is exhausted</li>
 *   <li>release the session (best-effort)</li>
 *   <li>wait the delay on the scheduler, then hop onto the control executor</li>
 *   <li>abort silently if the gate was stopped meanwhile, otherwise rebuild</li>
 * </ol>
 *
 * <p>A failed rebuild is not rescheduled from here; the orchestrator records the failure and the
 * watchdog's next tick re-detects it.
 */
public class ReconnectCoordinator {

    private static final Logger LOG = LogManager.getLogger(ReconnectCoordinator.class);

    private final RunStateGate gate;
    private final TaskScheduler scheduler;
    private final Executor controlExecutor;
    private final ReconnectPolicy policy;
    private final ApplicationEventPublisher publisher;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private volatile SessionRebuilder rebuilder;
    private ScheduledFuture<?> pending;
    private long generation;
    private volatile BackoffState backoff = BackoffState.initial();

    public ReconnectCoordinator(RunStateGate gate,
                                TaskScheduler scheduler,
                                Executor controlExecutor,
                                ReconnectPolicy policy,
                                ApplicationEventPublisher publisher,
                                Clock clock) {
        this.gate = Objects.requireNonNull(gate, "gate must not be null");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
        this.controlExecutor = Objects.requireNonNull(controlExecutor, "controlExecutor must not be null");
        this.policy = Objects.requireNonNull(policy, "policy must not be null");
        this.publisher = Objects.requireNonNull(publisher, "publisher must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public void setSessionRebuilder(SessionRebuilder rebuilder) {
        this.rebuilder = Objects.requireNonNull(rebuilder, "rebuilder must not be null");
    }

    /**
     * Schedules a rebuild, replacing any pending one. Must be called on the control executor.
     */
    public void scheduleReconnect(String reason) {
        SessionRebuilder target = requireRebuilder();
        Instant now = clock.instant();
        Optional<Duration> next;
        BackoffState current;
        long taskGeneration;
        lock.lock();
        try {
            retirePendingLocked();
            next = policy.nextDelay(backoff, now);
            if (next.isPresent()) {
                backoff = backoff.scheduled(now, next.get());
            }
            current = backoff;
            taskGeneration = generation;
        } finally {
            lock.unlock();
        }

        if (next.isEmpty()) {
            LOG.error("Reconnect retry window exhausted after {} attempts since {}; giving up ({})",
                    current.attempts(), current.firstFailureAt(), reason);
            releaseQuietly(target);
            target.onRetriesExhausted(reason, current);
            return;
        }
        Duration delay = next.get();
        int attempt = current.attempts();

        LOG.warn("Scheduling reconnect #{} in {}ms: {}", attempt + 1, delay.toMillis(), reason);
        releaseQuietly(target);

        lock.lock();
        try {
            if (taskGeneration != generation) {
                // cancelled while releasing
                return;
            }
            pending = scheduler.schedule(() -> controlExecutor.execute(() -> fire(taskGeneration)),
                    Instant.now().plus(delay));
        } finally {
            lock.unlock();
        }
        publisher.publishEvent(new ReconnectScheduledEvent(reason, attempt, delay, now));
    }

    /**
     * Retires any pending rebuild. Idempotent and safe from any thread; once it returns no
     * previously scheduled rebuild will run.
     */
    public void cancelReconnect() {
        lock.lock();
        try {
            if (retirePendingLocked()) {
                LOG.info("Pending reconnect cancelled");
            }
        } finally {
            lock.unlock();
        }
    }

    /** The session reached streaming; the next failure starts a fresh backoff sequence. */
    public void onSessionEstablished() {
        if (backoff.attempts() > 0 || backoff.firstFailureAt() != null) {
            LOG.info("Session re-established after {} reconnect attempt(s)", backoff.attempts());
        }
        backoff = BackoffState.initial();
    }

    /** Cancels and forgets all backoff progress. */
    public void reset() {
        cancelReconnect();
        backoff = BackoffState.initial();
    }

    public boolean isReconnectPending() {
        lock.lock();
        try {
            return pending != null;
        } finally {
            lock.unlock();
        }
    }

    public BackoffState backoffState() {
        return backoff;
    }

    private void fire(long taskGeneration) {
        lock.lock();
        try {
            if (taskGeneration != generation || pending == null) {
                LOG.debug("Stale reconnect task ignored");
                return;
            }
            pending = null;
            backoff = backoff.attempted();
        } finally {
            lock.unlock();
        }
        if (gate.isStopped()) {
            LOG.info("Run state STOPPED during reconnect delay; rebuild aborted");
            return;
        }
        LOG.info("Reconnect attempt #{} firing", backoff.attempts());
        try {
            requireRebuilder().rebuildSession();
        } catch (RuntimeException e) {
            // Left for the next watchdog tick to re-detect
            LOG.error("Session rebuild failed: {}", e.toString(), e);
        }
    }

    /** @return true if a task was pending */
    private boolean retirePendingLocked() {
        generation++;
        if (pending == null) {
            return false;
        }
        pending.cancel(false);
        pending = null;
        return true;
    }

    private void releaseQuietly(SessionRebuilder target) {
        try {
            target.releaseSession();
        } catch (RuntimeException e) {
            LOG.warn("Session release failed during reconnect: {}", e.toString());
        }
    }

    private SessionRebuilder requireRebuilder() {
        SessionRebuilder r = rebuilder;
        if (r == null) {
            throw new IllegalStateException("No SessionRebuilder registered");
        }
        return r;
    }
}
