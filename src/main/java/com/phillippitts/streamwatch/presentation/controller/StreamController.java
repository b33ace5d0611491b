package com.phillippitts.streamwatch.presentation.controller;

import com.phillippitts.streamwatch.domain.CameraFacing;
import com.phillippitts.streamwatch.domain.SessionSettings;
import com.phillippitts.streamwatch.domain.SessionState;
import com.phillippitts.streamwatch.domain.StreamStats;
import com.phillippitts.streamwatch.domain.VideoCodec;
import com.phillippitts.streamwatch.domain.VideoRotation;
import com.phillippitts.streamwatch.domain.WatchdogStats;
import com.phillippitts.streamwatch.exception.ControlTimeoutException;
import com.phillippitts.streamwatch.exception.StreamWatchException;
import com.phillippitts.streamwatch.service.orchestration.StreamOrchestrator;
import com.phillippitts.streamwatch.util.ProcessTimeouts;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Control and observer endpoints for the stream session.
 *
 * <p>Control calls wait for the control loop to apply them, bounded by
 * {@link ProcessTimeouts#CONTROL_CALL_TIMEOUT}. A started session is reported as accepted (202);
 * progress towards Streaming is visible through {@code GET /api/stream/status}.
 */
@RestController
@RequestMapping("/api/stream")
class StreamController {

    private static final Logger LOG = LogManager.getLogger(StreamController.class);

    private final StreamOrchestrator orchestrator;

    StreamController(StreamOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @GetMapping("/status")
    StatusResponse status() {
        return StatusResponse.from(orchestrator);
    }

    @GetMapping("/watchdog")
    WatchdogStats watchdog() {
        return orchestrator.watchdogStats();
    }

    @PostMapping("/start")
    ResponseEntity<StatusResponse> start(@Valid @RequestBody StartRequest request) {
        await("start", orchestrator.start(request.endpoint()));
        return ResponseEntity.accepted().body(StatusResponse.from(orchestrator));
    }

    @PostMapping("/stop")
    StatusResponse stop() {
        await("stop", orchestrator.stop());
        return StatusResponse.from(orchestrator);
    }

    @PutMapping("/settings")
    SessionSettings updateSettings(@Valid @RequestBody SettingsRequest request) {
        SessionSettings settings = request.toSettings(orchestrator.currentFacing());
        await("updateSettings", orchestrator.updateSettings(settings));
        return orchestrator.currentSettings();
    }

    @PostMapping("/mute")
    Map<String, Boolean> toggleMute() {
        return Map.of("muted", await("toggleMute", orchestrator.toggleMute()));
    }

    @PostMapping("/flash")
    Map<String, Boolean> toggleFlash() {
        return Map.of("flashOn", await("toggleFlash", orchestrator.toggleFlash()));
    }

    @PostMapping("/camera/switch")
    Map<String, CameraFacing> switchCamera() {
        return Map.of("facing", await("switchCamera", orchestrator.switchCamera()));
    }

    private static <T> T await(String operation, CompletableFuture<T> future) {
        try {
            return future.get(ProcessTimeouts.CONTROL_CALL_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            LOG.warn("Control operation {} timed out", operation);
            throw new ControlTimeoutException(operation, ProcessTimeouts.CONTROL_CALL_TIMEOUT);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            throw new StreamWatchException("Control operation '" + operation + "' failed", cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StreamWatchException("Interrupted while waiting for '" + operation + "'", e);
        }
    }

    record StartRequest(@NotBlank(message = "endpoint must not be blank") String endpoint) {
    }

    /**
     * Full settings replacement. A missing {@code facing} keeps the current camera.
     */
    record SettingsRequest(@Valid @NotNull VideoRequest video,
                           @Valid @NotNull AudioRequest audio,
                           CameraFacing facing) {

        SessionSettings toSettings(CameraFacing currentFacing) {
            return new SessionSettings(
                    new SessionSettings.Video(video.width(), video.height(), video.bitrateKbps(), video.fps(),
                            video.codec() == null ? VideoCodec.H264 : video.codec(),
                            video.keyframeIntervalSec(),
                            video.rotation() == null ? VideoRotation.AUTO : video.rotation()),
                    new SessionSettings.Audio(audio.sampleRate(), audio.stereo(), audio.bitrateKbps(),
                            audio.echoCanceler(), audio.noiseSuppressor()),
                    facing == null ? currentFacing : facing);
        }
    }

    record VideoRequest(@Positive int width,
                        @Positive int height,
                        @Positive int bitrateKbps,
                        @Min(1) @Max(120) int fps,
                        VideoCodec codec,
                        @Positive int keyframeIntervalSec,
                        VideoRotation rotation) {
    }

    record AudioRequest(@Positive int sampleRate,
                        boolean stereo,
                        @Positive int bitrateKbps,
                        boolean echoCanceler,
                        boolean noiseSuppressor) {
    }

    record StatusResponse(String phase,
                          String status,
                          long bitrateBps,
                          long streamTimeSeconds,
                          String runState,
                          boolean muted,
                          boolean flashOn,
                          CameraFacing facing) {

        static StatusResponse from(StreamOrchestrator o) {
            SessionState state = o.currentState();
            StreamStats stats = o.streamStats();
            return new StatusResponse(state.phase().name(), state.statusText(), stats.bitrate(),
                    stats.streamTime().toSeconds(), o.runState().name(), o.isMuted(), o.isFlashOn(),
                    o.currentFacing());
        }
    }
}
