package com.phillippitts.streamwatch.domain;

import java.util.Objects;

/**
 * Everything needed to build one stream session from scratch.
 *
 * @param video  encoder settings
 * @param audio  audio capture and encoder settings
 * @param facing which capture device to open
 */
public record SessionSettings(Video video, Audio audio, CameraFacing facing) {

    public SessionSettings {
        Objects.requireNonNull(video, "video must not be null");
        Objects.requireNonNull(audio, "audio must not be null");
        Objects.requireNonNull(facing, "facing must not be null");
    }

    public static SessionSettings defaults() {
        return new SessionSettings(
                new Video(1920, 1080, 4000, 30, VideoCodec.H264, 2, VideoRotation.AUTO),
                new Audio(44100, true, 128, false, false),
                CameraFacing.BACK);
    }

    public SessionSettings withVideo(Video newVideo) {
        return new SessionSettings(newVideo, audio, facing);
    }

    public SessionSettings withFacing(CameraFacing newFacing) {
        return new SessionSettings(video, audio, newFacing);
    }

    /**
     * @param width               frame width in pixels
     * @param height              frame height in pixels
     * @param bitrateKbps         target video bitrate in kbps
     * @param fps                 frames per second
     * @param codec               encoder
     * @param keyframeIntervalSec seconds between keyframes
     * @param rotation            output rotation
     */
    public record Video(int width, int height, int bitrateKbps, int fps, VideoCodec codec,
                        int keyframeIntervalSec, VideoRotation rotation) {

        public Video {
            if (width <= 0 || height <= 0) {
                throw new IllegalArgumentException("Resolution must be positive, got: " + width + "x" + height);
            }
            if (bitrateKbps <= 0) {
                throw new IllegalArgumentException("Video bitrate must be positive, got: " + bitrateKbps);
            }
            if (fps <= 0) {
                throw new IllegalArgumentException("FPS must be positive, got: " + fps);
            }
            if (keyframeIntervalSec <= 0) {
                throw new IllegalArgumentException("Keyframe interval must be positive, got: " + keyframeIntervalSec);
            }
            Objects.requireNonNull(codec, "codec must not be null");
            Objects.requireNonNull(rotation, "rotation must not be null");
        }

        public long bitrateBps() {
            return bitrateKbps * 1000L;
        }

        /** Width of the landscape frame (the larger dimension). */
        public int landscapeWidth() {
            return Math.max(width, height);
        }

        /** Height of the landscape frame (the smaller dimension). */
        public int landscapeHeight() {
            return Math.min(width, height);
        }
    }

    /**
     * @param sampleRate      sample rate in Hz
     * @param stereo          two channels when true
     * @param bitrateKbps     target audio bitrate in kbps
     * @param echoCanceler    request acoustic echo cancellation
     * @param noiseSuppressor request noise suppression
     */
    public record Audio(int sampleRate, boolean stereo, int bitrateKbps,
                        boolean echoCanceler, boolean noiseSuppressor) {

        public Audio {
            if (sampleRate <= 0) {
                throw new IllegalArgumentException("Sample rate must be positive, got: " + sampleRate);
            }
            if (bitrateKbps <= 0) {
                throw new IllegalArgumentException("Audio bitrate must be positive, got: " + bitrateKbps);
            }
        }

        public int bitrateBps() {
            return bitrateKbps * 1000;
        }
    }
}
