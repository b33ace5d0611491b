package com.phillippitts.streamwatch.domain;

import java.time.Instant;
import java.util.List;

/**
 * Immutable snapshot of watchdog counters, published after every tick.
 *
 * @param running            whether the watchdog timer is active
 * @param startTime          when counting began (null before the first start)
 * @param totalChecks        every tick, gated or not
 * @param effectiveChecks    ticks evaluated while the gate was RUNNING
 * @param skippedChecks      ticks skipped because the gate was STOPPED
 * @param anomaliesDetected  anomalies that passed gate confirmation and debounce
 * @param lastCheckTime      time of the latest tick (null if none)
 * @param currentBitrate     latest bitrate sample in bits per second
 * @param averageBitrate     mean of the bitrate history
 * @param bitrateHistory     up to 20 most recent samples, oldest first
 * @param lastAnomalyTime    time of the last dispatched anomaly (null if none)
 * @param lastAnomalyType    kind of the last dispatched anomaly (null if none)
 */
public record WatchdogStats(
        boolean running,
        Instant startTime,
        long totalChecks,
        long effectiveChecks,
        long skippedChecks,
        long anomaliesDetected,
        Instant lastCheckTime,
        long currentBitrate,
        long averageBitrate,
        List<Long> bitrateHistory,
        Instant lastAnomalyTime,
        AnomalyType lastAnomalyType
) {

    public WatchdogStats {
        bitrateHistory = bitrateHistory == null ? List.of() : List.copyOf(bitrateHistory);
    }

    public static WatchdogStats empty() {
        return new WatchdogStats(false, null, 0, 0, 0, 0, null, 0, 0, List.of(), null, null);
    }
}
