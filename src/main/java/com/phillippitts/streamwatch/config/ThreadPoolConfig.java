package com.phillippitts.streamwatch.config;

import com.phillippitts.streamwatch.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.Map;

/**
 * Configuration for the executors that drive session control.
 *
 * <p>Both executors are single-threaded and FIFO:
 * <ul>
 *   <li>{@code controlExecutor} - serializes every state mutation (control calls, watchdog ticks,
 *       transport callbacks, reconnect firings)</li>
 *   <li>{@code engineExecutor} - runs blocking engine calls; a release is always finished before
 *       the next build starts</li>
 * </ul>
 * The {@code watchdogScheduler} only keeps time; scheduled work hops onto the control executor.
 *
 * <p>MDC propagation: Copies Log4j2 ThreadContext (MDC) from the submitting thread to the worker
 * thread so request and session IDs survive the hop.
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    @Bean(name = "controlExecutor")
    public ThreadPoolTaskExecutor controlExecutor() {
        return serialExecutor(threadPoolProperties.getControl());
    }

    @Bean(name = "engineExecutor")
    public ThreadPoolTaskExecutor engineExecutor() {
        return serialExecutor(threadPoolProperties.getEngine());
    }

    /**
     * Timer for watchdog ticks and delayed reconnects. Also picked up by {@code @Scheduled} methods.
     */
    @Bean(name = "watchdogScheduler")
    public ThreadPoolTaskScheduler watchdogScheduler() {
        ThreadPoolProperties.SchedulerProperties props = threadPoolProperties.getScheduler();
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(props.getPoolSize());
        scheduler.setThreadNamePrefix(props.getThreadNamePrefix());
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        return scheduler;
    }

    private static ThreadPoolTaskExecutor serialExecutor(ThreadPoolProperties.SerialPoolProperties props) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        // Ordering is part of the contract: never more than one thread
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        executor.setTaskDecorator(mdcPropagatingDecorator());
        return executor;
    }

    static TaskDecorator mdcPropagatingDecorator() {
        return runnable -> {
            Map<String, String> contextMap = ThreadContext.getImmutableContext();
            return () -> {
                Map<String, String> previous = ThreadContext.getImmutableContext();
                try {
                    if (contextMap != null && !contextMap.isEmpty()) {
                        ThreadContext.putAll(contextMap);
                    }
                    runnable.run();
                } finally {
                    ThreadContext.clearAll();
                    if (previous != null && !previous.isEmpty()) {
                        ThreadContext.putAll(previous);
                    }
                }
            };
        };
    }
}
