package com.phillippitts.streamwatch.service.orchestration;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Process-wide STOPPED/RUNNING flag read by the watchdog and the reconnect coordinator.
 *
 * <p>The gate answers "should anyone be monitoring or reconnecting right now", not whether the
 * session is healthy. All operations are lock-free and safe from any thread.
 */
public final class RunStateGate {

    private static final Logger LOG = LogManager.getLogger(RunStateGate.class);

    private final AtomicReference<RunState> state = new AtomicReference<>(RunState.STOPPED);

    public void set(RunState newState) {
        Objects.requireNonNull(newState, "newState must not be null");
        RunState previous = state.getAndSet(newState);
        if (previous != newState) {
            LOG.debug("Run state {} -> {}", previous, newState);
        }
    }

    public void setRunning() {
        set(RunState.RUNNING);
    }

    public void setStopped() {
        set(RunState.STOPPED);
    }

    public RunState get() {
        return state.get();
    }

    public boolean isRunning() {
        return state.get() == RunState.RUNNING;
    }

    public boolean isStopped() {
        return state.get() == RunState.STOPPED;
    }
}
