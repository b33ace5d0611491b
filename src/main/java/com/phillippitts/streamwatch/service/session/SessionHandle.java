package com.phillippitts.streamwatch.service.session;

import com.phillippitts.streamwatch.domain.CameraFacing;
import com.phillippitts.streamwatch.domain.VideoCodec;

/**
 * Capability interface over the external capture, encode and transport engine.
 *
 * <p>A handle represents exactly one session. It is never reused: after {@link #release()}
 * the orchestrator asks {@link SessionHandleFactory} for a fresh one. Calls may block briefly
 * and are always issued from the engine executor, never from the control loop.
 *
 * <p>Transport events are reported asynchronously through the {@link TransportListener} the
 * handle was created with.
 */
public interface SessionHandle {

    /** Selects the video encoder; called before {@link #prepareVideo}. */
    void setVideoCodec(VideoCodec codec);

    /**
     * Configures the video encoder.
     *
     * @return false if the engine rejects the parameters
     */
    boolean prepareVideo(int width, int height, int fps, long bitrateBps, int keyframeIntervalSec, int rotationDeg);

    /**
     * Configures the audio encoder.
     *
     * @return false if the engine rejects the parameters
     */
    boolean prepareAudio(int bitrateBps, int sampleRate, boolean stereo, boolean echoCancel, boolean noiseSuppress);

    void startCapture(CameraFacing facing);

    void startTransport(String url);

    void stopTransport();

    void stopCapture();

    /** Frees every engine resource. Must tolerate being called in any state, repeatedly. */
    void release();

    boolean isStreaming();

    boolean isCapturing();

    /** Adjusts the live video bitrate. */
    void setBitrate(long bps);

    void switchFacing();

    void setAudioMuted(boolean muted);

    /** True when the active capture device has a controllable torch. */
    boolean isTorchSupported();

    void setTorchEnabled(boolean enabled);

    boolean isTorchEnabled();
}
