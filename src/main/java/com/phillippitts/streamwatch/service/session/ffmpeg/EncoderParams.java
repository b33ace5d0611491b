package com.phillippitts.streamwatch.service.session.ffmpeg;

/**
 * Encoder parameters captured by the prepare calls and replayed on every process launch.
 */
final class EncoderParams {

    private EncoderParams() {
    }

    record Video(int width, int height, int fps, long bitrateBps, int keyframeIntervalSec, int rotationDeg) {

        Video withBitrate(long newBitrateBps) {
            return new Video(width, height, fps, newBitrateBps, keyframeIntervalSec, rotationDeg);
        }

        int gopSize() {
            return Math.max(1, fps * keyframeIntervalSec);
        }
    }

    record Audio(int bitrateBps, int sampleRate, boolean stereo, boolean noiseSuppress) {
    }
}
