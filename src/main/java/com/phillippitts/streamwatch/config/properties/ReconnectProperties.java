package com.phillippitts.streamwatch.config.properties;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for automatic reconnection.
 * Binds to properties prefixed with "stream.reconnect".
 *
 * <p>FIXED waits {@code fixed-delay-ms} before every attempt and never gives up. EXPONENTIAL
 * doubles from {@code base-delay-ms} up to {@code max-delay-ms} and gives up once a failure
 * streak outlasts {@code max-retry-window-hours}.
 */
@ConfigurationProperties(prefix = "stream.reconnect")
@Validated
public class ReconnectProperties {

    public enum Policy {
        FIXED,
        EXPONENTIAL
    }

    @NotNull(message = "Reconnect policy must be set")
    private Policy policy = Policy.FIXED;

    @Positive(message = "Fixed delay must be positive")
    private long fixedDelayMs = 3000;

    @Positive(message = "Base delay must be positive")
    private long baseDelayMs = 1000;

    @Positive(message = "Max delay must be positive")
    private long maxDelayMs = 3_600_000;

    @Positive(message = "Max retry window must be positive")
    private long maxRetryWindowHours = 720;

    /** Adds up to 25% random spread to exponential delays. */
    private boolean jitterEnabled = true;

    public Policy getPolicy() {
        return policy;
    }

    public void setPolicy(Policy policy) {
        this.policy = policy;
    }

    public long getFixedDelayMs() {
        return fixedDelayMs;
    }

    public void setFixedDelayMs(long fixedDelayMs) {
        this.fixedDelayMs = fixedDelayMs;
    }

    public long getBaseDelayMs() {
        return baseDelayMs;
    }

    public void setBaseDelayMs(long baseDelayMs) {
        this.baseDelayMs = baseDelayMs;
    }

    public long getMaxDelayMs() {
        return maxDelayMs;
    }

    public void setMaxDelayMs(long maxDelayMs) {
        this.maxDelayMs = maxDelayMs;
    }

    public long getMaxRetryWindowHours() {
        return maxRetryWindowHours;
    }

    public void setMaxRetryWindowHours(long maxRetryWindowHours) {
        this.maxRetryWindowHours = maxRetryWindowHours;
    }

    public boolean isJitterEnabled() {
        return jitterEnabled;
    }

    public void setJitterEnabled(boolean jitterEnabled) {
        this.jitterEnabled = jitterEnabled;
    }
}
