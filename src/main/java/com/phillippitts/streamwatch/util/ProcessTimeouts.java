package com.phillippitts.streamwatch.util;

import java.time.Duration;

/**
 * Standard timeout values for engine process and thread management.
 *
 * <p>Used by {@link com.phillippitts.streamwatch.service.session.ffmpeg.FfmpegSessionHandle}
 * for subprocess and reader-thread lifecycle.
 */
public final class ProcessTimeouts {

    /** Timeout for stream reader threads during cleanup (best-effort, daemon threads). */
    public static final Duration READER_CLEANUP_TIMEOUT = Duration.ofMillis(100);

    /**
     * Timeout for graceful process shutdown via {@link Process#destroy()}.
     *
     * <p>ffmpeg flushes the FLV trailer on SIGTERM; 2s is enough for typical muxers.
     */
    public static final Duration GRACEFUL_SHUTDOWN_TIMEOUT = Duration.ofMillis(2000);

    /** Timeout for forceful process termination via {@link Process#destroyForcibly()}. */
    public static final Duration FORCEFUL_SHUTDOWN_TIMEOUT = Duration.ofMillis(1000);

    /** Upper bound for waiting on the control loop in blocking REST calls. */
    public static final Duration CONTROL_CALL_TIMEOUT = Duration.ofSeconds(10);

    private ProcessTimeouts() {
        // Utility class - prevent instantiation
    }
}
