package com.phillippitts.streamwatch.domain;

import java.time.Duration;
import java.util.Objects;

/**
 * Thresholds and switches for the stream watchdog.
 *
 * <p>Immutable; a replacement supplied at runtime takes effect on the next tick.
 *
 * @param checkInterval               time between ticks
 * @param startupGracePeriod          no bitrate checks until the session is this old
 * @param firstBitrateTimeout         raise ZeroBitrate when no sample ever arrived after this long
 * @param bitrateTimeout              raise ZeroBitrate when the last sample is older than this
 * @param zeroBitrateThresholdBps     samples below this count as zero
 * @param zeroBitrateDuration         continuous zero run that raises ZeroBitrate
 * @param minBitrateThresholdBps      samples below this (and not zero) count as low
 * @param lowBitrateDuration          continuous low run that raises LowBitrate
 * @param connectionGracePeriod       no stuck tracking until the session is this old
 * @param connectionStuckDuration     not-live run that raises ConnectionStuck
 * @param connectionTimeout           sample gap that raises StreamingTimeout
 * @param debounceInterval            suppression window for debounced kinds
 * @param fluctuationThreshold        coefficient of variation above which fluctuation is raised
 * @param bitrateMonitoringEnabled    run bitrate checks
 * @param connectionMonitoringEnabled run connection checks
 * @param encoderMonitoringEnabled    run encoder/capture checks
 */
public record WatchdogConfig(
        Duration checkInterval,
        Duration startupGracePeriod,
        Duration firstBitrateTimeout,
        Duration bitrateTimeout,
        long zeroBitrateThresholdBps,
        Duration zeroBitrateDuration,
        long minBitrateThresholdBps,
        Duration lowBitrateDuration,
        Duration connectionGracePeriod,
        Duration connectionStuckDuration,
        Duration connectionTimeout,
        Duration debounceInterval,
        double fluctuationThreshold,
        boolean bitrateMonitoringEnabled,
        boolean connectionMonitoringEnabled,
        boolean encoderMonitoringEnabled
) {

    public static final Duration DEFAULT_CHECK_INTERVAL = Duration.ofSeconds(5);
    public static final Duration DEFAULT_STARTUP_GRACE_PERIOD = Duration.ofSeconds(10);
    public static final Duration DEFAULT_FIRST_BITRATE_TIMEOUT = Duration.ofSeconds(15);
    public static final Duration DEFAULT_BITRATE_TIMEOUT = Duration.ofSeconds(30);
    public static final long DEFAULT_ZERO_BITRATE_THRESHOLD_BPS = 10_000;
    public static final Duration DEFAULT_ZERO_BITRATE_DURATION = Duration.ofSeconds(30);
    public static final long DEFAULT_MIN_BITRATE_THRESHOLD_BPS = 100_000;
    public static final Duration DEFAULT_LOW_BITRATE_DURATION = Duration.ofSeconds(15);
    public static final Duration DEFAULT_CONNECTION_GRACE_PERIOD = Duration.ofSeconds(5);
    public static final Duration DEFAULT_CONNECTION_STUCK_DURATION = Duration.ofSeconds(10);
    public static final Duration DEFAULT_CONNECTION_TIMEOUT = Duration.ofSeconds(60);
    public static final Duration DEFAULT_DEBOUNCE_INTERVAL = Duration.ofSeconds(30);
    public static final double DEFAULT_FLUCTUATION_THRESHOLD = 0.5;

    public WatchdogConfig {
        requirePositive(checkInterval, "checkInterval");
        requireNonNegative(startupGracePeriod, "startupGracePeriod");
        requirePositive(firstBitrateTimeout, "firstBitrateTimeout");
        requirePositive(bitrateTimeout, "bitrateTimeout");
        requireNonNegative(zeroBitrateDuration, "zeroBitrateDuration");
        requireNonNegative(lowBitrateDuration, "lowBitrateDuration");
        requireNonNegative(connectionGracePeriod, "connectionGracePeriod");
        requireNonNegative(connectionStuckDuration, "connectionStuckDuration");
        requirePositive(connectionTimeout, "connectionTimeout");
        requireNonNegative(debounceInterval, "debounceInterval");
        if (zeroBitrateThresholdBps < 0) {
            throw new IllegalArgumentException("zeroBitrateThresholdBps must be >= 0");
        }
        if (minBitrateThresholdBps < zeroBitrateThresholdBps) {
            throw new IllegalArgumentException("minBitrateThresholdBps must be >= zeroBitrateThresholdBps");
        }
        if (fluctuationThreshold <= 0) {
            throw new IllegalArgumentException("fluctuationThreshold must be positive");
        }
    }

    public static WatchdogConfig defaults() {
        return new WatchdogConfig(
                DEFAULT_CHECK_INTERVAL,
                DEFAULT_STARTUP_GRACE_PERIOD,
                DEFAULT_FIRST_BITRATE_TIMEOUT,
                DEFAULT_BITRATE_TIMEOUT,
                DEFAULT_ZERO_BITRATE_THRESHOLD_BPS,
                DEFAULT_ZERO_BITRATE_DURATION,
                DEFAULT_MIN_BITRATE_THRESHOLD_BPS,
                DEFAULT_LOW_BITRATE_DURATION,
                DEFAULT_CONNECTION_GRACE_PERIOD,
                DEFAULT_CONNECTION_STUCK_DURATION,
                DEFAULT_CONNECTION_TIMEOUT,
                DEFAULT_DEBOUNCE_INTERVAL,
                DEFAULT_FLUCTUATION_THRESHOLD,
                true, true, true);
    }

    public static Builder builder() {
        return new Builder(defaults());
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    private static void requirePositive(Duration d, String name) {
        Objects.requireNonNull(d, name + " must not be null");
        if (d.isNegative() || d.isZero()) {
            throw new IllegalArgumentException(name + " must be positive, got: " + d);
        }
    }

    private static void requireNonNegative(Duration d, String name) {
        Objects.requireNonNull(d, name + " must not be null");
        if (d.isNegative()) {
            throw new IllegalArgumentException(name + " must not be negative, got: " + d);
        }
    }

    /** Fluent builder seeded from an existing config. */
    public static final class Builder {
        private Duration checkInterval;
        private Duration startupGracePeriod;
        private Duration firstBitrateTimeout;
        private Duration bitrateTimeout;
        private long zeroBitrateThresholdBps;
        private Duration zeroBitrateDuration;
        private long minBitrateThresholdBps;
        private Duration lowBitrateDuration;
        private Duration connectionGracePeriod;
        private Duration connectionStuckDuration;
        private Duration connectionTimeout;
        private Duration debounceInterval;
        private double fluctuationThreshold;
        private boolean bitrateMonitoringEnabled;
        private boolean connectionMonitoringEnabled;
        private boolean encoderMonitoringEnabled;

        private Builder(WatchdogConfig from) {
            this.checkInterval = from.checkInterval;
            this.startupGracePeriod = from.startupGracePeriod;
            this.firstBitrateTimeout = from.firstBitrateTimeout;
            this.bitrateTimeout = from.bitrateTimeout;
            this.zeroBitrateThresholdBps = from.zeroBitrateThresholdBps;
            this.zeroBitrateDuration = from.zeroBitrateDuration;
            this.minBitrateThresholdBps = from.minBitrateThresholdBps;
            this.lowBitrateDuration = from.lowBitrateDuration;
            this.connectionGracePeriod = from.connectionGracePeriod;
            this.connectionStuckDuration = from.connectionStuckDuration;
            this.connectionTimeout = from.connectionTimeout;
            this.debounceInterval = from.debounceInterval;
            this.fluctuationThreshold = from.fluctuationThreshold;
            this.bitrateMonitoringEnabled = from.bitrateMonitoringEnabled;
            this.connectionMonitoringEnabled = from.connectionMonitoringEnabled;
            this.encoderMonitoringEnabled = from.encoderMonitoringEnabled;
        }

        public Builder checkInterval(Duration v) {
            this.checkInterval = v;
            return this;
        }

        public Builder startupGracePeriod(Duration v) {
            this.startupGracePeriod = v;
            return this;
        }

        public Builder firstBitrateTimeout(Duration v) {
            this.firstBitrateTimeout = v;
            return this;
        }

        public Builder bitrateTimeout(Duration v) {
            this.bitrateTimeout = v;
            return this;
        }

        public Builder zeroBitrateThresholdBps(long v) {
            this.zeroBitrateThresholdBps = v;
            return this;
        }

        public Builder zeroBitrateDuration(Duration v) {
            this.zeroBitrateDuration = v;
            return this;
        }

        public Builder minBitrateThresholdBps(long v) {
            this.minBitrateThresholdBps = v;
            return this;
        }

        public Builder lowBitrateDuration(Duration v) {
            this.lowBitrateDuration = v;
            return this;
        }

        public Builder connectionGracePeriod(Duration v) {
            this.connectionGracePeriod = v;
            return this;
        }

        public Builder connectionStuckDuration(Duration v) {
            this.connectionStuckDuration = v;
            return this;
        }

        public Builder connectionTimeout(Duration v) {
            this.connectionTimeout = v;
            return this;
        }

        public Builder debounceInterval(Duration v) {
            this.debounceInterval = v;
            return this;
        }

        public Builder fluctuationThreshold(double v) {
            this.fluctuationThreshold = v;
            return this;
        }

        public Builder bitrateMonitoringEnabled(boolean v) {
            this.bitrateMonitoringEnabled = v;
            return this;
        }

        public Builder connectionMonitoringEnabled(boolean v) {
            this.connectionMonitoringEnabled = v;
            return this;
        }

        public Builder encoderMonitoringEnabled(boolean v) {
            this.encoderMonitoringEnabled = v;
            return this;
        }

        public WatchdogConfig build() {
            return new WatchdogConfig(checkInterval, startupGracePeriod, firstBitrateTimeout, bitrateTimeout,
                    zeroBitrateThresholdBps, zeroBitrateDuration, minBitrateThresholdBps, lowBitrateDuration,
                    connectionGracePeriod, connectionStuckDuration, connectionTimeout, debounceInterval,
                    fluctuationThreshold, bitrateMonitoringEnabled, connectionMonitoringEnabled,
                    encoderMonitoringEnabled);
        }
    }
}
