package com.phillippitts.streamwatch.config.properties;

import com.phillippitts.streamwatch.domain.WatchdogConfig;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration properties for the stream watchdog.
 * Binds to properties prefixed with "stream.watchdog"; durations are in milliseconds.
 *
 * <p>Converted to an immutable {@link WatchdogConfig} via {@link #toConfig()}.
 */
@ConfigurationProperties(prefix = "stream.watchdog")
@Validated
public class WatchdogProperties {

    /** Enable/disable the watchdog timer globally. */
    private boolean enabled = true;

    @Min(value = 100, message = "Check interval must be at least 100ms")
    private long checkIntervalMs = WatchdogConfig.DEFAULT_CHECK_INTERVAL.toMillis();

    @PositiveOrZero(message = "Startup grace period must be >= 0")
    private long startupGracePeriodMs = WatchdogConfig.DEFAULT_STARTUP_GRACE_PERIOD.toMillis();

    @Positive(message = "First bitrate timeout must be positive")
    private long firstBitrateTimeoutMs = WatchdogConfig.DEFAULT_FIRST_BITRATE_TIMEOUT.toMillis();

    @Positive(message = "Bitrate timeout must be positive")
    private long bitrateTimeoutMs = WatchdogConfig.DEFAULT_BITRATE_TIMEOUT.toMillis();

    @PositiveOrZero(message = "Zero bitrate threshold must be >= 0")
    private long zeroBitrateThresholdBps = WatchdogConfig.DEFAULT_ZERO_BITRATE_THRESHOLD_BPS;

    @PositiveOrZero(message = "Zero bitrate duration must be >= 0")
    private long zeroBitrateDurationMs = WatchdogConfig.DEFAULT_ZERO_BITRATE_DURATION.toMillis();

    @PositiveOrZero(message = "Minimum bitrate threshold must be >= 0")
    private long minBitrateThresholdBps = WatchdogConfig.DEFAULT_MIN_BITRATE_THRESHOLD_BPS;

    @PositiveOrZero(message = "Low bitrate duration must be >= 0")
    private long lowBitrateDurationMs = WatchdogConfig.DEFAULT_LOW_BITRATE_DURATION.toMillis();

    @PositiveOrZero(message = "Connection grace period must be >= 0")
    private long connectionGracePeriodMs = WatchdogConfig.DEFAULT_CONNECTION_GRACE_PERIOD.toMillis();

    @PositiveOrZero(message = "Connection stuck duration must be >= 0")
    private long connectionStuckDurationMs = WatchdogConfig.DEFAULT_CONNECTION_STUCK_DURATION.toMillis();

    @Positive(message = "Connection timeout must be positive")
    private long connectionTimeoutMs = WatchdogConfig.DEFAULT_CONNECTION_TIMEOUT.toMillis();

    @PositiveOrZero(message = "Debounce interval must be >= 0")
    private long debounceIntervalMs = WatchdogConfig.DEFAULT_DEBOUNCE_INTERVAL.toMillis();

    /** Coefficient of variation above which the bitrate is considered unstable. */
    @DecimalMin(value = "0.0", inclusive = false, message = "Fluctuation threshold must be positive")
    private double fluctuationThreshold = WatchdogConfig.DEFAULT_FLUCTUATION_THRESHOLD;

    private boolean bitrateMonitoringEnabled = true;
    private boolean connectionMonitoringEnabled = true;
    private boolean encoderMonitoringEnabled = true;

    /**
     * Builds the immutable watchdog configuration.
     *
     * @throws IllegalArgumentException if the values are inconsistent (e.g. min threshold below zero threshold)
     */
    public WatchdogConfig toConfig() {
        return WatchdogConfig.builder()
                .checkInterval(Duration.ofMillis(checkIntervalMs))
                .startupGracePeriod(Duration.ofMillis(startupGracePeriodMs))
                .firstBitrateTimeout(Duration.ofMillis(firstBitrateTimeoutMs))
                .bitrateTimeout(Duration.ofMillis(bitrateTimeoutMs))
                .zeroBitrateThresholdBps(zeroBitrateThresholdBps)
                .zeroBitrateDuration(Duration.ofMillis(zeroBitrateDurationMs))
                .minBitrateThresholdBps(minBitrateThresholdBps)
                .lowBitrateDuration(Duration.ofMillis(lowBitrateDurationMs))
                .connectionGracePeriod(Duration.ofMillis(connectionGracePeriodMs))
                .connectionStuckDuration(Duration.ofMillis(connectionStuckDurationMs))
                .connectionTimeout(Duration.ofMillis(connectionTimeoutMs))
                .debounceInterval(Duration.ofMillis(debounceIntervalMs))
                .fluctuationThreshold(fluctuationThreshold)
                .bitrateMonitoringEnabled(bitrateMonitoringEnabled)
                .connectionMonitoringEnabled(connectionMonitoringEnabled)
                .encoderMonitoringEnabled(encoderMonitoringEnabled)
                .build();
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public long getCheckIntervalMs() {
        return checkIntervalMs;
    }

    public void setCheckIntervalMs(long checkIntervalMs) {
        this.checkIntervalMs = checkIntervalMs;
    }

    public long getStartupGracePeriodMs() {
        return startupGracePeriodMs;
    }

    public void setStartupGracePeriodMs(long startupGracePeriodMs) {
        this.startupGracePeriodMs = startupGracePeriodMs;
    }

    public long getFirstBitrateTimeoutMs() {
        return firstBitrateTimeoutMs;
    }

    public void setFirstBitrateTimeoutMs(long firstBitrateTimeoutMs) {
        this.firstBitrateTimeoutMs = firstBitrateTimeoutMs;
    }

    public long getBitrateTimeoutMs() {
        return bitrateTimeoutMs;
    }

    public void setBitrateTimeoutMs(long bitrateTimeoutMs) {
        this.bitrateTimeoutMs = bitrateTimeoutMs;
    }

    public long getZeroBitrateThresholdBps() {
        return zeroBitrateThresholdBps;
    }

    public void setZeroBitrateThresholdBps(long zeroBitrateThresholdBps) {
        this.zeroBitrateThresholdBps = zeroBitrateThresholdBps;
    }

    public long getZeroBitrateDurationMs() {
        return zeroBitrateDurationMs;
    }

    public void setZeroBitrateDurationMs(long zeroBitrateDurationMs) {
        this.zeroBitrateDurationMs = zeroBitrateDurationMs;
    }

    public long getMinBitrateThresholdBps() {
        return minBitrateThresholdBps;
    }

    public void setMinBitrateThresholdBps(long minBitrateThresholdBps) {
        this.minBitrateThresholdBps = minBitrateThresholdBps;
    }

    public long getLowBitrateDurationMs() {
        return lowBitrateDurationMs;
    }

    public void setLowBitrateDurationMs(long lowBitrateDurationMs) {
        this.lowBitrateDurationMs = lowBitrateDurationMs;
    }

    public long getConnectionGracePeriodMs() {
        return connectionGracePeriodMs;
    }

    public void setConnectionGracePeriodMs(long connectionGracePeriodMs) {
        this.connectionGracePeriodMs = connectionGracePeriodMs;
    }

    public long getConnectionStuckDurationMs() {
        return connectionStuckDurationMs;
    }

    public void setConnectionStuckDurationMs(long connectionStuckDurationMs) {
        this.connectionStuckDurationMs = connectionStuckDurationMs;
    }

    public long getConnectionTimeoutMs() {
        return connectionTimeoutMs;
    }

    public void setConnectionTimeoutMs(long connectionTimeoutMs) {
        this.connectionTimeoutMs = connectionTimeoutMs;
    }

    public long getDebounceIntervalMs() {
        return debounceIntervalMs;
    }

    public void setDebounceIntervalMs(long debounceIntervalMs) {
        this.debounceIntervalMs = debounceIntervalMs;
    }

    public double getFluctuationThreshold() {
        return fluctuationThreshold;
    }

    public void setFluctuationThreshold(double fluctuationThreshold) {
        this.fluctuationThreshold = fluctuationThreshold;
    }

    public boolean isBitrateMonitoringEnabled() {
        return bitrateMonitoringEnabled;
    }

    public void setBitrateMonitoringEnabled(boolean bitrateMonitoringEnabled) {
        this.bitrateMonitoringEnabled = bitrateMonitoringEnabled;
    }

    public boolean isConnectionMonitoringEnabled() {
        return connectionMonitoringEnabled;
    }

    public void setConnectionMonitoringEnabled(boolean connectionMonitoringEnabled) {
        this.connectionMonitoringEnabled = connectionMonitoringEnabled;
    }

    public boolean isEncoderMonitoringEnabled() {
        return encoderMonitoringEnabled;
    }

    public void setEncoderMonitoringEnabled(boolean encoderMonitoringEnabled) {
        this.encoderMonitoringEnabled = encoderMonitoringEnabled;
    }
}
