package com.phillippitts.streamwatch.service.reconnect;

import com.phillippitts.streamwatch.util.TimeUtils;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Exponential backoff: {@code min(base * 2^attempts, maxDelay)}, plus up to 25% jitter (still clamped
 * to {@code maxDelay}). Gives up once the failure streak is older than {@code maxRetryWindow}.
 */
public final class ExponentialBackoffPolicy implements ReconnectPolicy {

    public static final Duration DEFAULT_MAX_DELAY = Duration.ofHours(1);
    public static final Duration DEFAULT_MAX_RETRY_WINDOW = Duration.ofDays(30);
    static final double MAX_JITTER_FRACTION = 0.25;

    private final Duration baseDelay;
    private final Duration maxDelay;
    private final Duration maxRetryWindow;
    private final boolean jitterEnabled;
    private final DoubleSupplier random;

    public ExponentialBackoffPolicy(Duration baseDelay, Duration maxDelay, Duration maxRetryWindow,
                                    boolean jitterEnabled) {
        this(baseDelay, maxDelay, maxRetryWindow, jitterEnabled, () -> ThreadLocalRandom.current().nextDouble());
    }

    ExponentialBackoffPolicy(Duration baseDelay, Duration maxDelay, Duration maxRetryWindow,
                             boolean jitterEnabled, DoubleSupplier random) {
        this.baseDelay = Objects.requireNonNull(baseDelay, "baseDelay must not be null");
        this.maxDelay = Objects.requireNonNull(maxDelay, "maxDelay must not be null");
        this.maxRetryWindow = Objects.requireNonNull(maxRetryWindow, "maxRetryWindow must not be null");
        this.random = Objects.requireNonNull(random, "random must not be null");
        if (baseDelay.isNegative() || baseDelay.isZero()) {
            throw new IllegalArgumentException("baseDelay must be positive, got: " + baseDelay);
        }
        if (maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must be >= baseDelay");
        }
        if (maxRetryWindow.isNegative() || maxRetryWindow.isZero()) {
            throw new IllegalArgumentException("maxRetryWindow must be positive, got: " + maxRetryWindow);
        }
        this.jitterEnabled = jitterEnabled;
    }

    @Override
    public Optional<Duration> nextDelay(BackoffState state, Instant now) {
        if (state.firstFailureAt() != null
                && TimeUtils.elapsed(state.firstFailureAt(), now).compareTo(maxRetryWindow) > 0) {
            return Optional.empty();
        }
        Duration delay = backoffFor(state.attempts());
        if (jitterEnabled) {
            long jitterMillis = (long) (delay.toMillis() * MAX_JITTER_FRACTION * random.getAsDouble());
            delay = delay.plusMillis(jitterMillis);
            if (delay.compareTo(maxDelay) > 0) {
                delay = maxDelay;
            }
        }
        return Optional.of(delay);
    }

    /**
     * Delay without jitter for the given attempt count.
     */
    public Duration backoffFor(int attempts) {
        if (attempts < 0) {
            throw new IllegalArgumentException("attempts must be >= 0, got: " + attempts);
        }
        long base = baseDelay.toMillis();
        long max = maxDelay.toMillis();
        // Shifting past the point where base * 2^n exceeds max would overflow; max wins anyway
        if (attempts >= Long.numberOfLeadingZeros(base) - 1) {
            return maxDelay;
        }
        long candidate = base << attempts;
        return candidate >= max ? maxDelay : Duration.ofMillis(candidate);
    }

    @Override
    public String toString() {
        return "ExponentialBackoffPolicy[base=" + baseDelay.toMillis() + "ms, max=" + maxDelay.toMillis()
                + "ms, window=" + maxRetryWindow.toHours() + "h, jitter=" + jitterEnabled + "]";
    }
}
