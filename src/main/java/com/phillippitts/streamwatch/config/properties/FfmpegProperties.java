package com.phillippitts.streamwatch.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the ffmpeg-backed session engine.
 * Binds to properties prefixed with "stream.ffmpeg".
 *
 * <p>Example application.properties:
 * <pre>
 * stream.ffmpeg.binary-path=/usr/bin/ffmpeg
 * stream.ffmpeg.input-format=v4l2
 * stream.ffmpeg.back-device=/dev/video0
 * stream.ffmpeg.front-device=/dev/video1
 * stream.ffmpeg.audio-format=alsa
 * stream.ffmpeg.audio-device=default
 * stream.ffmpeg.output-format=flv
 * </pre>
 *
 * <p>Leave {@code audio-device} blank to stream video only.
 */
@ConfigurationProperties(prefix = "stream.ffmpeg")
@Validated
public class FfmpegProperties {

    @NotBlank(message = "ffmpeg binary path must not be blank")
    private String binaryPath = "ffmpeg";

    /** Demuxer for the camera, e.g. v4l2, avfoundation, dshow. */
    @NotBlank(message = "Input format must not be blank")
    private String inputFormat = "v4l2";

    @NotBlank(message = "Back camera device must not be blank")
    private String backDevice = "/dev/video0";

    @NotBlank(message = "Front camera device must not be blank")
    private String frontDevice = "/dev/video1";

    private String audioFormat = "alsa";

    private String audioDevice = "default";

    @NotBlank(message = "Output format must not be blank")
    private String outputFormat = "flv";

    /** x264/x265 preset. */
    @NotBlank(message = "Encoder preset must not be blank")
    private String preset = "veryfast";

    /** Maximum stderr characters retained for failure diagnostics. */
    @Positive(message = "Stderr tail size must be positive")
    private int stderrTailChars = 4096;

    public String getBinaryPath() {
        return binaryPath;
    }

    public void setBinaryPath(String binaryPath) {
        this.binaryPath = binaryPath;
    }

    public String getInputFormat() {
        return inputFormat;
    }

    public void setInputFormat(String inputFormat) {
        this.inputFormat = inputFormat;
    }

    public String getBackDevice() {
        return backDevice;
    }

    public void setBackDevice(String backDevice) {
        this.backDevice = backDevice;
    }

    public String getFrontDevice() {
        return frontDevice;
    }

    public void setFrontDevice(String frontDevice) {
        this.frontDevice = frontDevice;
    }

    public String getAudioFormat() {
        return audioFormat;
    }

    public void setAudioFormat(String audioFormat) {
        this.audioFormat = audioFormat;
    }

    public String getAudioDevice() {
        return audioDevice;
    }

    public void setAudioDevice(String audioDevice) {
        this.audioDevice = audioDevice;
    }

    public boolean isAudioConfigured() {
        return audioDevice != null && !audioDevice.isBlank()
                && audioFormat != null && !audioFormat.isBlank();
    }

    public String getOutputFormat() {
        return outputFormat;
    }

    public void setOutputFormat(String outputFormat) {
        this.outputFormat = outputFormat;
    }

    public String getPreset() {
        return preset;
    }

    public void setPreset(String preset) {
        this.preset = preset;
    }

    public int getStderrTailChars() {
        return stderrTailChars;
    }

    public void setStderrTailChars(int stderrTailChars) {
        this.stderrTailChars = stderrTailChars;
    }
}
