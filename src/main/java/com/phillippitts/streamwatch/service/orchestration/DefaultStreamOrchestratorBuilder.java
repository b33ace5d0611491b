package com.phillippitts.streamwatch.service.orchestration;

import com.phillippitts.streamwatch.domain.SessionSettings;
import com.phillippitts.streamwatch.domain.WatchdogConfig;
import com.phillippitts.streamwatch.service.reconnect.ReconnectCoordinator;
import com.phillippitts.streamwatch.service.session.SessionHandleFactory;
import com.phillippitts.streamwatch.service.watchdog.StreamWatchdog;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.util.concurrent.Executor;

/**
 * Builder for {@link DefaultStreamOrchestrator} to simplify construction with many dependencies.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * DefaultStreamOrchestrator orchestrator = DefaultStreamOrchestratorBuilder.builder()
 *     .gate(gate)
 *     .watchdog(watchdog)
 *     .coordinator(coordinator)
 *     .handleFactory(factory)
 *     .controlExecutor(controlExecutor)
 *     .engineExecutor(engineExecutor)
 *     .publisher(publisher)
 *     .settings(SessionSettings.defaults())
 *     .watchdogConfig(WatchdogConfig.defaults())
 *     .build();
 * }</pre>
 *
 * <p>{@code clock} defaults to the system UTC clock, {@code watchdogEnabled} to true. Every other
 * dependency is required; {@link #build()} fails fast with a {@link NullPointerException} naming
 * the missing one.
 */
public final class DefaultStreamOrchestratorBuilder {

    RunStateGate gate;
    StreamWatchdog watchdog;
    ReconnectCoordinator coordinator;
    SessionHandleFactory handleFactory;
    Executor controlExecutor;
    Executor engineExecutor;
    ApplicationEventPublisher publisher;
    Clock clock = Clock.systemUTC();
    SessionSettings settings;
    WatchdogConfig watchdogConfig;
    boolean watchdogEnabled = true;

    private DefaultStreamOrchestratorBuilder() {
        // Private constructor - use builder() factory method
    }

    public static DefaultStreamOrchestratorBuilder builder() {
        return new DefaultStreamOrchestratorBuilder();
    }

    public DefaultStreamOrchestratorBuilder gate(RunStateGate gate) {
        this.gate = gate;
        return this;
    }

    public DefaultStreamOrchestratorBuilder watchdog(StreamWatchdog watchdog) {
        this.watchdog = watchdog;
        return this;
    }

    public DefaultStreamOrchestratorBuilder coordinator(ReconnectCoordinator coordinator) {
        this.coordinator = coordinator;
        return this;
    }

    public DefaultStreamOrchestratorBuilder handleFactory(SessionHandleFactory handleFactory) {
        this.handleFactory = handleFactory;
        return this;
    }

    /**
     * Sets the control executor. Must execute tasks one at a time in submission order.
     *
     * @param controlExecutor single-threaded executor (required)
     * @return this builder
     */
    public DefaultStreamOrchestratorBuilder controlExecutor(Executor controlExecutor) {
        this.controlExecutor = controlExecutor;
        return this;
    }

    /**
     * Sets the engine executor for blocking engine calls. Must preserve submission order so that a
     * release always completes before the next build starts.
     *
     * @param engineExecutor single-threaded executor (required)
     * @return this builder
     */
    public DefaultStreamOrchestratorBuilder engineExecutor(Executor engineExecutor) {
        this.engineExecutor = engineExecutor;
        return this;
    }

    public DefaultStreamOrchestratorBuilder publisher(ApplicationEventPublisher publisher) {
        this.publisher = publisher;
        return this;
    }

    public DefaultStreamOrchestratorBuilder clock(Clock clock) {
        this.clock = clock;
        return this;
    }

    public DefaultStreamOrchestratorBuilder settings(SessionSettings settings) {
        this.settings = settings;
        return this;
    }

    public DefaultStreamOrchestratorBuilder watchdogConfig(WatchdogConfig watchdogConfig) {
        this.watchdogConfig = watchdogConfig;
        return this;
    }

    public DefaultStreamOrchestratorBuilder watchdogEnabled(boolean watchdogEnabled) {
        this.watchdogEnabled = watchdogEnabled;
        return this;
    }

    public DefaultStreamOrchestrator build() {
        return new DefaultStreamOrchestrator(this);
    }
}
