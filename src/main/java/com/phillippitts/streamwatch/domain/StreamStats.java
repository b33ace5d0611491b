package com.phillippitts.streamwatch.domain;

import java.time.Duration;

/**
 * Live throughput figures for observers.
 *
 * @param bitrate    latest bitrate in bits per second
 * @param streamTime time since the session reached streaming
 */
public record StreamStats(long bitrate, Duration streamTime) {

    private static final StreamStats EMPTY = new StreamStats(0, Duration.ZERO);

    public static StreamStats empty() {
        return EMPTY;
    }
}
