package com.phillippitts.streamwatch.service.orchestration;

import com.phillippitts.streamwatch.domain.CameraFacing;
import com.phillippitts.streamwatch.domain.SessionSettings;
import com.phillippitts.streamwatch.domain.SessionState;
import com.phillippitts.streamwatch.domain.StreamStats;
import com.phillippitts.streamwatch.domain.WatchdogConfig;
import com.phillippitts.streamwatch.domain.WatchdogStats;

import java.util.concurrent.CompletableFuture;

/**
 * Public entry point for controlling and observing the stream session.
 *
 * <p>Mutating operations are queued onto the single control executor and complete their future once
 * applied there. Observer getters read published values and never block.
 */
public interface StreamOrchestrator {

    /**
     * Starts a session towards the given endpoint. Ignored when a session is already active.
     *
     * @param endpoint stream target, e.g. {@code rtmp://host/app/key}
     * @throws com.phillippitts.streamwatch.exception.InvalidEndpointException if the endpoint is unusable
     */
    CompletableFuture<Void> start(String endpoint);

    /**
     * Stops the session. The gate is STOPPED and pending reconnects are cancelled before this
     * returns; the future completes once resources are released and the state is Idle.
     */
    CompletableFuture<Void> stop();

    /** Replaces session settings; the video bitrate is applied to a live session immediately. */
    CompletableFuture<Void> updateSettings(SessionSettings settings);

    /** Convenience for changing only the video bitrate. */
    CompletableFuture<Void> setVideoBitrate(int bitrateKbps);

    /** Replaces watchdog thresholds; effective from the next tick. */
    void updateWatchdogConfig(WatchdogConfig config);

    /** @return new mute flag */
    CompletableFuture<Boolean> toggleMute();

    /** @return new torch flag; stays false on the front camera or without torch support */
    CompletableFuture<Boolean> toggleFlash();

    /** @return facing after the switch */
    CompletableFuture<CameraFacing> switchCamera();

    SessionState currentState();

    WatchdogStats watchdogStats();

    StreamStats streamStats();

    SessionSettings currentSettings();

    RunState runState();

    boolean isMuted();

    boolean isFlashOn();

    CameraFacing currentFacing();

    boolean isStreaming();
}
