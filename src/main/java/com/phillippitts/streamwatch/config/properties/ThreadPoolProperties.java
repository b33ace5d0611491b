package com.phillippitts.streamwatch.config.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for thread pools.
 *
 * <p>The control and engine executors are always single-threaded (ordering is part of their
 * contract), so only naming and queue bounds are tuneable for them. The scheduler that drives the
 * watchdog timer and delayed reconnects can be sized.
 */
@ConfigurationProperties(prefix = "threadpool")
@Validated
public class ThreadPoolProperties {

    @Valid
    private SerialPoolProperties control = new SerialPoolProperties("control-");

    @Valid
    private SerialPoolProperties engine = new SerialPoolProperties("engine-");

    @Valid
    private SchedulerProperties scheduler = new SchedulerProperties();

    public SerialPoolProperties getControl() {
        return control;
    }

    public void setControl(SerialPoolProperties control) {
        this.control = control;
    }

    public SerialPoolProperties getEngine() {
        return engine;
    }

    public void setEngine(SerialPoolProperties engine) {
        this.engine = engine;
    }

    public SchedulerProperties getScheduler() {
        return scheduler;
    }

    public void setScheduler(SchedulerProperties scheduler) {
        this.scheduler = scheduler;
    }

    /**
     * Single-threaded executor configuration.
     */
    public static class SerialPoolProperties {
        @Min(value = 1, message = "Queue capacity must be at least 1")
        private int queueCapacity = 1000;
        private String threadNamePrefix;

        public SerialPoolProperties() {
            this("serial-");
        }

        SerialPoolProperties(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
        }

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }

        public String getThreadNamePrefix() {
            return threadNamePrefix;
        }

        public void setThreadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
        }
    }

    /**
     * Watchdog/reconnect scheduler configuration.
     */
    public static class SchedulerProperties {
        @Min(value = 1, message = "Scheduler pool size must be at least 1")
        private int poolSize = 2;
        private String threadNamePrefix = "watchdog-";

        public int getPoolSize() {
            return poolSize;
        }

        public void setPoolSize(int poolSize) {
            this.poolSize = poolSize;
        }

        public String getThreadNamePrefix() {
            return threadNamePrefix;
        }

        public void setThreadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
        }
    }
}
