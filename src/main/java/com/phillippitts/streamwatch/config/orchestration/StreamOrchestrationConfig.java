package com.phillippitts.streamwatch.config.orchestration;

import com.phillippitts.streamwatch.config.properties.FfmpegProperties;
import com.phillippitts.streamwatch.config.properties.ReconnectProperties;
import com.phillippitts.streamwatch.config.properties.StreamProperties;
import com.phillippitts.streamwatch.config.properties.WatchdogProperties;
import com.phillippitts.streamwatch.service.orchestration.DefaultStreamOrchestrator;
import com.phillippitts.streamwatch.service.orchestration.DefaultStreamOrchestratorBuilder;
import com.phillippitts.streamwatch.service.orchestration.RunStateGate;
import com.phillippitts.streamwatch.service.reconnect.ExponentialBackoffPolicy;
import com.phillippitts.streamwatch.service.reconnect.FixedDelayPolicy;
import com.phillippitts.streamwatch.service.reconnect.ReconnectCoordinator;
import com.phillippitts.streamwatch.service.reconnect.ReconnectPolicy;
import com.phillippitts.streamwatch.service.session.SessionHandleFactory;
import com.phillippitts.streamwatch.service.session.ffmpeg.FfmpegSessionHandleFactory;
import com.phillippitts.streamwatch.service.watchdog.StreamWatchdog;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.Executor;

/**
 * Wires the gate, watchdog, reconnect coordinator and session engine into the orchestrator.
 *
 * <p>The watchdog and the coordinator share the control executor with the orchestrator so that
 * every state mutation is serialized on one thread.
 */
@Configuration
public class StreamOrchestrationConfig {

    private static final Logger LOG = LogManager.getLogger(StreamOrchestrationConfig.class);

    private final Executor controlExecutor;
    private final TaskScheduler watchdogScheduler;

    public StreamOrchestrationConfig(@Qualifier("controlExecutor") Executor controlExecutor,
                                     @Qualifier("watchdogScheduler") TaskScheduler watchdogScheduler) {
        this.controlExecutor = controlExecutor;
        this.watchdogScheduler = watchdogScheduler;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RunStateGate runStateGate() {
        return new RunStateGate();
    }

    @Bean
    public StreamWatchdog streamWatchdog(RunStateGate gate) {
        return new StreamWatchdog(gate, watchdogScheduler, controlExecutor);
    }

    /**
     * Reconnect delay policy selected by {@code stream.reconnect.policy}.
     */
    @Bean
    public ReconnectPolicy reconnectPolicy(ReconnectProperties props) {
        ReconnectPolicy policy = switch (props.getPolicy()) {
            case FIXED -> new FixedDelayPolicy(Duration.ofMillis(props.getFixedDelayMs()));
            case EXPONENTIAL -> new ExponentialBackoffPolicy(
                    Duration.ofMillis(props.getBaseDelayMs()),
                    Duration.ofMillis(props.getMaxDelayMs()),
                    Duration.ofHours(props.getMaxRetryWindowHours()),
                    props.isJitterEnabled());
        };
        LOG.info("Reconnect policy: {}", policy);
        return policy;
    }

    @Bean
    public ReconnectCoordinator reconnectCoordinator(RunStateGate gate,
                                                     ReconnectPolicy policy,
                                                     ApplicationEventPublisher publisher,
                                                     Clock clock) {
        return new ReconnectCoordinator(gate, watchdogScheduler, controlExecutor, policy, publisher, clock);
    }

    @Bean
    public SessionHandleFactory sessionHandleFactory(FfmpegProperties ffmpegProperties) {
        return new FfmpegSessionHandleFactory(ffmpegProperties);
    }

    @Bean
    public DefaultStreamOrchestrator streamOrchestrator(RunStateGate gate,
                                                        StreamWatchdog watchdog,
                                                        ReconnectCoordinator coordinator,
                                                        SessionHandleFactory handleFactory,
                                                        @Qualifier("engineExecutor") Executor engineExecutor,
                                                        ApplicationEventPublisher publisher,
                                                        Clock clock,
                                                        StreamProperties streamProperties,
                                                        WatchdogProperties watchdogProperties) {
        return DefaultStreamOrchestratorBuilder.builder()
                .gate(gate)
                .watchdog(watchdog)
                .coordinator(coordinator)
                .handleFactory(handleFactory)
                .controlExecutor(controlExecutor)
                .engineExecutor(engineExecutor)
                .publisher(publisher)
                .clock(clock)
                .settings(streamProperties.toSettings())
                .watchdogConfig(watchdogProperties.toConfig())
                .watchdogEnabled(watchdogProperties.isEnabled())
                .build();
    }
}
