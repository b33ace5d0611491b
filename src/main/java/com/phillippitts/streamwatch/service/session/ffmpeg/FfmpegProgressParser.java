package com.phillippitts.streamwatch.service.session.ffmpeg;

import java.util.Locale;
import java.util.Optional;

/**
 * Incremental parser for ffmpeg {@code -progress} key=value output.
 *
 * <p>ffmpeg writes one block per reporting period, terminated by {@code progress=continue}
 * (or {@code progress=end} on exit). Each completed block yields one {@link Block}; its bitrate is
 * the last {@code bitrate=} value seen in the block, converted to bits per second
 * ({@code N/A} counts as zero).
 *
 * <p>Not thread-safe; owned by a single reader thread.
 */
final class FfmpegProgressParser {

    record Block(long bitrateBps, boolean end) {
    }

    private long pendingBitrateBps;

    Optional<Block> accept(String line) {
        if (line == null) {
            return Optional.empty();
        }
        int eq = line.indexOf('=');
        if (eq <= 0) {
            return Optional.empty();
        }
        String key = line.substring(0, eq).trim();
        String value = line.substring(eq + 1).trim();
        switch (key) {
            case "bitrate" -> pendingBitrateBps = parseBitrate(value);
            case "progress" -> {
                Block block = new Block(pendingBitrateBps, "end".equals(value));
                pendingBitrateBps = 0;
                return Optional.of(block);
            }
            default -> {
                // other keys (frame, fps, total_size, out_time_ms, speed) are not needed
            }
        }
        return Optional.empty();
    }

    /**
     * Parses values such as {@code 2483.7kbits/s}. Returns 0 for N/A or unparseable input.
     */
    static long parseBitrate(String value) {
        String v = value.toLowerCase(Locale.ROOT);
        double multiplier;
        String number;
        if (v.endsWith("kbits/s")) {
            multiplier = 1_000d;
            number = v.substring(0, v.length() - "kbits/s".length());
        } else if (v.endsWith("mbits/s")) {
            multiplier = 1_000_000d;
            number = v.substring(0, v.length() - "mbits/s".length());
        } else if (v.endsWith("bits/s")) {
            multiplier = 1d;
            number = v.substring(0, v.length() - "bits/s".length());
        } else {
            return 0;
        }
        try {
            double parsed = Double.parseDouble(number.trim());
            return parsed <= 0 ? 0 : Math.round(parsed * multiplier);
        } catch (NumberFormatException e) {
            return 0;
        }
    }
}
