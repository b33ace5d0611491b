package com.phillippitts.streamwatch.config;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Exposes queue depth and throughput of the control and engine executors via Micrometer.
 *
 * <p>Metrics ({@code <pool>} is {@code control} or {@code engine}):
 * <ul>
 *   <li>stream.pool.&lt;pool&gt;.active - tasks currently executing (0 or 1)</li>
 *   <li>stream.pool.&lt;pool&gt;.queued - tasks waiting</li>
 *   <li>stream.pool.&lt;pool&gt;.completed - cumulative completed tasks</li>
 * </ul>
 * A growing {@code stream.pool.engine.queued} means the engine is blocking on a device or process.
 */
@Configuration
public class ThreadPoolMetricsConfig {

    private static final Logger LOG = LogManager.getLogger(ThreadPoolMetricsConfig.class);

    @Bean
    public MeterBinder streamExecutorMetrics(@Qualifier("controlExecutor") ThreadPoolTaskExecutor controlExecutor,
                                             @Qualifier("engineExecutor") ThreadPoolTaskExecutor engineExecutor) {
        return registry -> {
            bind(registry, "control", controlExecutor.getThreadPoolExecutor());
            bind(registry, "engine", engineExecutor.getThreadPoolExecutor());
            LOG.info("Executor metrics registered: stream.pool.* available via /actuator/metrics");
        };
    }

    private static void bind(MeterRegistry registry, String pool,
                             ThreadPoolExecutor executor) {
        String prefix = "stream.pool." + pool;
        Gauge.builder(prefix + ".active", executor, ThreadPoolExecutor::getActiveCount)
                .description("Tasks executing on the " + pool + " executor")
                .register(registry);
        Gauge.builder(prefix + ".queued", executor, e -> e.getQueue().size())
                .description("Tasks waiting on the " + pool + " executor")
                .register(registry);
        Gauge.builder(prefix + ".completed", executor, ThreadPoolExecutor::getCompletedTaskCount)
                .description("Cumulative tasks completed by the " + pool + " executor")
                .register(registry);
    }
}
