package com.phillippitts.streamwatch.domain;

import java.time.Duration;
import java.util.Locale;
import java.util.Objects;

/**
 * A classified health-check failure raised by the watchdog.
 *
 * <p>Each variant is an immutable record. Severity comes from {@link AnomalyType} and the
 * human-readable description is derived only from the record's own fields, so two equal
 * anomalies always render the same text.
 */
public interface Anomaly {

    AnomalyType type();

    String description();

    default Severity severity() {
        return type().severity();
    }

    /**
     * No usable throughput for the given duration.
     *
     * @param duration how long the bitrate has been missing or below the zero threshold
     */
    record ZeroBitrate(Duration duration) implements Anomaly {
        public ZeroBitrate {
            Objects.requireNonNull(duration, "duration must not be null");
        }

        @Override
        public AnomalyType type() {
            return AnomalyType.ZERO_BITRATE;
        }

        @Override
        public String description() {
            return "Zero bitrate for " + duration.toSeconds() + "s";
        }
    }

    /**
     * Throughput above zero but under the configured minimum.
     *
     * @param currentBps observed bitrate in bits per second
     * @param thresholdBps configured minimum in bits per second
     */
    record LowBitrate(long currentBps, long thresholdBps) implements Anomaly {
        @Override
        public AnomalyType type() {
            return AnomalyType.LOW_BITRATE;
        }

        @Override
        public String description() {
            return "Low bitrate: " + currentBps / 1000 + " kbps (min " + thresholdBps / 1000 + " kbps)";
        }
    }

    /**
     * Unstable throughput.
     *
     * @param variance population variance (bps squared) of the recent nonzero samples; detection compares
     *                 their coefficient of variation against the configured threshold
     */
    record BitrateFluctuation(double variance) implements Anomaly {
        @Override
        public AnomalyType type() {
            return AnomalyType.BITRATE_FLUCTUATION;
        }

        @Override
        public String description() {
            return String.format(Locale.ROOT, "Bitrate fluctuation: variance %.2f", variance);
        }
    }

    /**
     * Transport has reported not-live for longer than the stuck threshold.
     *
     * @param duration how long the connection has been stuck
     */
    record ConnectionStuck(Duration duration) implements Anomaly {
        public ConnectionStuck {
            Objects.requireNonNull(duration, "duration must not be null");
        }

        @Override
        public AnomalyType type() {
            return AnomalyType.CONNECTION_STUCK;
        }

        @Override
        public String description() {
            return "Connection stuck for " + duration.toSeconds() + "s";
        }
    }

    /**
     * Bitrate samples stopped arriving for longer than the connection timeout.
     *
     * @param duration time since the last sample
     */
    record StreamingTimeout(Duration duration) implements Anomaly {
        public StreamingTimeout {
            Objects.requireNonNull(duration, "duration must not be null");
        }

        @Override
        public AnomalyType type() {
            return AnomalyType.STREAMING_TIMEOUT;
        }

        @Override
        public String description() {
            return "Streaming timeout: no data for " + duration.toSeconds() + "s";
        }
    }

    /**
     * Encoder not running, or a health check itself failed.
     *
     * @param message short cause
     */
    record EncoderError(String message) implements Anomaly {
        public EncoderError {
            Objects.requireNonNull(message, "message must not be null");
        }

        @Override
        public AnomalyType type() {
            return AnomalyType.ENCODER_ERROR;
        }

        @Override
        public String description() {
            return "Encoder error: " + message;
        }
    }

    /** Capture device inactive or no session attached. */
    record CameraDisconnected() implements Anomaly {
        @Override
        public AnomalyType type() {
            return AnomalyType.CAMERA_DISCONNECTED;
        }

        @Override
        public String description() {
            return "Camera disconnected";
        }
    }
}
