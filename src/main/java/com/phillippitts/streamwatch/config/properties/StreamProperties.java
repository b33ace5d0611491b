package com.phillippitts.streamwatch.config.properties;

import com.phillippitts.streamwatch.domain.CameraFacing;
import com.phillippitts.streamwatch.domain.SessionSettings;
import com.phillippitts.streamwatch.domain.VideoCodec;
import com.phillippitts.streamwatch.domain.VideoRotation;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Startup session settings. Binds to properties prefixed with "stream.settings".
 *
 * <p>Example application.properties:
 * <pre>
 * stream.settings.video.width=1280
 * stream.settings.video.height=720
 * stream.settings.video.bitrate-kbps=2500
 * stream.settings.audio.sample-rate=48000
 * stream.settings.facing=FRONT
 * </pre>
 */
@ConfigurationProperties(prefix = "stream.settings")
@Validated
public class StreamProperties {

    @Valid
    private VideoProperties video = new VideoProperties();

    @Valid
    private AudioProperties audio = new AudioProperties();

    @NotNull(message = "Camera facing must be set")
    private CameraFacing facing = CameraFacing.BACK;

    public SessionSettings toSettings() {
        return new SessionSettings(
                new SessionSettings.Video(video.width, video.height, video.bitrateKbps, video.fps,
                        video.codec, video.keyframeIntervalSec, video.rotation),
                new SessionSettings.Audio(audio.sampleRate, audio.stereo, audio.bitrateKbps,
                        audio.echoCanceler, audio.noiseSuppressor),
                facing);
    }

    public VideoProperties getVideo() {
        return video;
    }

    public void setVideo(VideoProperties video) {
        this.video = video;
    }

    public AudioProperties getAudio() {
        return audio;
    }

    public void setAudio(AudioProperties audio) {
        this.audio = audio;
    }

    public CameraFacing getFacing() {
        return facing;
    }

    public void setFacing(CameraFacing facing) {
        this.facing = facing;
    }

    /**
     * Video encoder defaults.
     */
    public static class VideoProperties {
        @Positive(message = "Video width must be positive")
        private int width = 1920;

        @Positive(message = "Video height must be positive")
        private int height = 1080;

        @Positive(message = "Video bitrate must be positive")
        private int bitrateKbps = 4000;

        @Min(value = 1, message = "FPS must be at least 1")
        @Max(value = 120, message = "FPS must be at most 120")
        private int fps = 30;

        @NotNull(message = "Video codec must be set")
        private VideoCodec codec = VideoCodec.H264;

        @Positive(message = "Keyframe interval must be positive")
        private int keyframeIntervalSec = 2;

        @NotNull(message = "Video rotation must be set")
        private VideoRotation rotation = VideoRotation.AUTO;

        public int getWidth() {
            return width;
        }

        public void setWidth(int width) {
            this.width = width;
        }

        public int getHeight() {
            return height;
        }

        public void setHeight(int height) {
            this.height = height;
        }

        public int getBitrateKbps() {
            return bitrateKbps;
        }

        public void setBitrateKbps(int bitrateKbps) {
            this.bitrateKbps = bitrateKbps;
        }

        public int getFps() {
            return fps;
        }

        public void setFps(int fps) {
            this.fps = fps;
        }

        public VideoCodec getCodec() {
            return codec;
        }

        public void setCodec(VideoCodec codec) {
            this.codec = codec;
        }

        public int getKeyframeIntervalSec() {
            return keyframeIntervalSec;
        }

        public void setKeyframeIntervalSec(int keyframeIntervalSec) {
            this.keyframeIntervalSec = keyframeIntervalSec;
        }

        public VideoRotation getRotation() {
            return rotation;
        }

        public void setRotation(VideoRotation rotation) {
            this.rotation = rotation;
        }
    }

    /**
     * Audio capture defaults.
     */
    public static class AudioProperties {
        @Positive(message = "Sample rate must be positive")
        private int sampleRate = 44100;

        private boolean stereo = true;

        @Positive(message = "Audio bitrate must be positive")
        private int bitrateKbps = 128;

        private boolean echoCanceler;

        private boolean noiseSuppressor;

        public int getSampleRate() {
            return sampleRate;
        }

        public void setSampleRate(int sampleRate) {
            this.sampleRate = sampleRate;
        }

        public boolean isStereo() {
            return stereo;
        }

        public void setStereo(boolean stereo) {
            this.stereo = stereo;
        }

        public int getBitrateKbps() {
            return bitrateKbps;
        }

        public void setBitrateKbps(int bitrateKbps) {
            this.bitrateKbps = bitrateKbps;
        }

        public boolean isEchoCanceler() {
            return echoCanceler;
        }

        public void setEchoCanceler(boolean echoCanceler) {
            this.echoCanceler = echoCanceler;
        }

        public boolean isNoiseSuppressor() {
            return noiseSuppressor;
        }

        public void setNoiseSuppressor(boolean noiseSuppressor) {
            this.noiseSuppressor = noiseSuppressor;
        }
    }
}
