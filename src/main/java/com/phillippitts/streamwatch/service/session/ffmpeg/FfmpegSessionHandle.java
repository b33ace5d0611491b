package com.phillippitts.streamwatch.service.session.ffmpeg;

import com.phillippitts.streamwatch.config.properties.FfmpegProperties;
import com.phillippitts.streamwatch.domain.CameraFacing;
import com.phillippitts.streamwatch.domain.VideoCodec;
import com.phillippitts.streamwatch.exception.EngineUnavailableException;
import com.phillippitts.streamwatch.exception.SessionStartException;
import com.phillippitts.streamwatch.service.session.SessionHandle;
import com.phillippitts.streamwatch.service.session.TransportListener;
import com.phillippitts.streamwatch.util.LogSanitizer;
import com.phillippitts.streamwatch.util.ProcessTimeouts;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.regex.Pattern;

/**
 * {@link SessionHandle} that captures, encodes and publishes through one external ffmpeg process.
 *
 * <p>Lifecycle mapping:
 * <ul>
 *   <li>prepare/startCapture only record parameters; the process is launched by {@link #startTransport}</li>
 *   <li>the first {@code -progress} block means the muxer is writing, reported as connectionSucceeded</li>
 *   <li>every further block is reported as a bitrate sample</li>
 *   <li>an exit that was not requested is reported as authError (401/403 in stderr), disconnected
 *       (after a successful connection) or connectionFailed</li>
 * </ul>
 *
 * <p>ffmpeg cannot change encoder or input parameters on a running process, so a bitrate, mute or
 * facing change while live relaunches the process. Torch control is not available.
 */
public final class FfmpegSessionHandle implements SessionHandle {

    private static final Logger LOG = LogManager.getLogger(FfmpegSessionHandle.class);

    private static final Pattern AUTH_FAILURE =
            Pattern.compile("(?i)(\\b401\\b|\\b403\\b|unauthori[sz]ed|forbidden|authentication failed)");

    private final FfmpegProperties props;
    private final ProcessFactory processFactory;
    private final FfmpegCommandBuilder commandBuilder;
    private final TransportListener listener;

    private final AtomicReference<Run> current = new AtomicReference<>();

    private volatile EncoderParams.Video video;
    private volatile EncoderParams.Audio audio;
    private volatile VideoCodec codec = VideoCodec.H264;
    private volatile CameraFacing facing = CameraFacing.BACK;
    private volatile boolean muted;
    private volatile boolean capturing;
    private volatile boolean released;
    private volatile String url;

    /**
     * One launched ffmpeg process and its reader threads.
     */
    private static final class Run {
        final Process process;
        final StderrTail stderr;
        final FfmpegProgressParser parser = new FfmpegProgressParser();
        volatile Thread progressReader;
        volatile Thread stderrReader;
        volatile boolean connected;
        volatile boolean stopping;

        Run(Process process, int stderrTailChars) {
            this.process = process;
            this.stderr = new StderrTail(stderrTailChars);
        }
    }

    FfmpegSessionHandle(FfmpegProperties props, ProcessFactory processFactory, TransportListener listener) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.processFactory = Objects.requireNonNull(processFactory, "processFactory must not be null");
        this.listener = Objects.requireNonNull(listener, "listener must not be null");
        this.commandBuilder = new FfmpegCommandBuilder(props);
    }

    @Override
    public void setVideoCodec(VideoCodec codec) {
        this.codec = Objects.requireNonNull(codec, "codec must not be null");
    }

    @Override
    public boolean prepareVideo(int width, int height, int fps, long bitrateBps,
                                int keyframeIntervalSec, int rotationDeg) {
        if (width <= 0 || height <= 0 || fps <= 0 || bitrateBps <= 0 || keyframeIntervalSec <= 0) {
            LOG.warn("Rejecting video parameters {}x{}@{} bitrate={} keyframe={}s",
                    width, height, fps, bitrateBps, keyframeIntervalSec);
            return false;
        }
        this.video = new EncoderParams.Video(width, height, fps, bitrateBps, keyframeIntervalSec, rotationDeg);
        LOG.debug("Video prepared: {}x{}@{} {}bps codec={}", width, height, fps, bitrateBps, codec);
        return true;
    }

    @Override
    public boolean prepareAudio(int bitrateBps, int sampleRate, boolean stereo,
                                boolean echoCancel, boolean noiseSuppress) {
        if (!props.isAudioConfigured()) {
            LOG.info("No audio device configured; session will carry video only");
            return false;
        }
        if (bitrateBps <= 0 || sampleRate <= 0) {
            LOG.warn("Rejecting audio parameters bitrate={} sampleRate={}", bitrateBps, sampleRate);
            return false;
        }
        if (echoCancel) {
            LOG.debug("Echo cancellation is not available in the ffmpeg engine; ignoring");
        }
        this.audio = new EncoderParams.Audio(bitrateBps, sampleRate, stereo, noiseSuppress);
        return true;
    }

    @Override
    public void startCapture(CameraFacing facing) {
        ensureNotReleased();
        if (video == null) {
            throw new SessionStartException("Video must be prepared before capture", "startCapture");
        }
        this.facing = Objects.requireNonNull(facing, "facing must not be null");
        this.capturing = true;
        LOG.debug("Capture armed on {} camera", facing);
    }

    @Override
    public void startTransport(String url) {
        ensureNotReleased();
        Objects.requireNonNull(url, "url must not be null");
        if (!capturing) {
            throw new SessionStartException("Capture must be started before transport", "startTransport");
        }
        if (current.get() != null) {
            LOG.debug("Transport already running; ignoring start");
            return;
        }
        this.url = url;
        launch();
    }

    @Override
    public void stopTransport() {
        Run run = current.getAndSet(null);
        if (run == null) {
            return;
        }
        run.stopping = true;
        destroyProcess(run.process);
        joinQuietly(run.progressReader, ProcessTimeouts.READER_CLEANUP_TIMEOUT);
        joinQuietly(run.stderrReader, ProcessTimeouts.READER_CLEANUP_TIMEOUT);
        LOG.debug("Transport stopped");
    }

    @Override
    public void stopCapture() {
        capturing = false;
    }

    /**
     * Idempotent cleanup of any running process and reader threads.
     */
    @Override
    public void release() {
        stopTransport();
        capturing = false;
        released = true;
    }

    @Override
    public boolean isStreaming() {
        Run run = current.get();
        return run != null && run.connected && run.process.isAlive();
    }

    @Override
    public boolean isCapturing() {
        return capturing && !released;
    }

    @Override
    public void setBitrate(long bps) {
        EncoderParams.Video v = video;
        if (v == null || bps <= 0 || v.bitrateBps() == bps) {
            return;
        }
        this.video = v.withBitrate(bps);
        relaunchIfLive("bitrate change to " + bps + "bps");
    }

    @Override
    public void switchFacing() {
        this.facing = facing.opposite();
        relaunchIfLive("camera switch to " + facing);
    }

    @Override
    public void setAudioMuted(boolean muted) {
        if (this.muted == muted) {
            return;
        }
        this.muted = muted;
        if (audio != null) {
            relaunchIfLive(muted ? "mute" : "unmute");
        }
    }

    @Override
    public boolean isTorchSupported() {
        return false;
    }

    @Override
    public void setTorchEnabled(boolean enabled) {
        LOG.debug("Torch control not supported by the ffmpeg engine; ignoring request enabled={}", enabled);
    }

    @Override
    public boolean isTorchEnabled() {
        return false;
    }

    /** Visible for tests */
    CameraFacing currentFacing() {
        return facing;
    }

    private void launch() {
        List<String> command = commandBuilder.build(url, video, audio, codec, facing, muted);
        listener.connectionStarted(url);
        Process process;
        try {
            process = processFactory.start(command);
        } catch (IOException e) {
            throw new EngineUnavailableException(props.getBinaryPath(), e);
        }
        Run run = new Run(process, props.getStderrTailChars());
        current.set(run);
        run.stderrReader = startReader(() -> collectStderr(run), "ffmpeg-err");
        run.progressReader = startReader(() -> readProgress(run), "ffmpeg-progress");
        LOG.info("ffmpeg launched: facing={} target={}", facing, LogSanitizer.redactEndpoint(url));
    }

    private void relaunchIfLive(String reason) {
        if (current.get() == null || url == null || released) {
            return;
        }
        LOG.info("Relaunching ffmpeg to apply {}", reason);
        stopTransport();
        launch();
    }

    private void readProgress(Run run) {
        try (BufferedReader br = new BufferedReader(
                new InputStreamReader(run.process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = br.readLine()) != null) {
                run.parser.accept(line).ifPresent(block -> onProgress(run, block));
            }
        } catch (IOException e) {
            LOG.debug("Progress reader stopped: {}", e.toString());
        }
        onExit(run);
    }

    private void onProgress(Run run, FfmpegProgressParser.Block block) {
        if (run.stopping || current.get() != run) {
            return;
        }
        if (!run.connected) {
            run.connected = true;
            listener.connectionSucceeded();
        }
        if (!block.end()) {
            listener.bitrateSample(block.bitrateBps());
        }
    }

    private void onExit(Run run) {
        int exitCode = awaitExit(run.process);
        joinQuietly(run.stderrReader, ProcessTimeouts.READER_CLEANUP_TIMEOUT);
        if (run.stopping || !current.compareAndSet(run, null)) {
            LOG.debug("ffmpeg exited after requested stop (code={})", exitCode);
            return;
        }
        String stderrTail = run.stderr.toString();
        LOG.warn("ffmpeg exited unexpectedly code={} connected={} stderr={}",
                exitCode, run.connected, LogSanitizer.truncate(stderrTail, 512));
        if (AUTH_FAILURE.matcher(stderrTail).find()) {
            listener.authError();
        } else if (run.connected) {
            listener.disconnected();
        } else {
            listener.connectionFailed("ffmpeg exited with code " + exitCode);
        }
    }

    private void collectStderr(Run run) {
        try (BufferedReader br = new BufferedReader(
                new InputStreamReader(run.process.getErrorStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = br.readLine()) != null) {
                run.stderr.append(line);
                LOG.trace("ffmpeg: {}", line);
            }
        } catch (IOException e) {
            LOG.debug("Stderr reader stopped: {}", e.toString());
        }
    }

    private static int awaitExit(Process process) {
        try {
            if (process.waitFor(ProcessTimeouts.GRACEFUL_SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
                return process.exitValue();
            }
            // stdout closed but process lingers; make sure it goes away
            destroyProcess(process);
            return -1;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return -1;
        }
    }

    private static Thread startReader(Runnable body, String name) {
        Thread thread = new Thread(body, name);
        thread.setDaemon(true);
        thread.start();
        return thread;
    }

    private static void joinQuietly(Thread thread, Duration timeout) {
        if (thread == null || thread == Thread.currentThread()) {
            return;
        }
        try {
            thread.join(timeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void destroyProcess(Process process) {
        try {
            process.destroy();
            boolean exited = process.waitFor(ProcessTimeouts.GRACEFUL_SHUTDOWN_TIMEOUT.toMillis(),
                    TimeUnit.MILLISECONDS);
            if (!exited && process.isAlive()) {
                process.destroyForcibly();
                process.waitFor(ProcessTimeouts.FORCEFUL_SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
                if (process.isAlive()) {
                    LOG.warn("ffmpeg still alive after destroyForcibly");
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while destroying ffmpeg");
        } catch (RuntimeException e) {
            LOG.warn("Error destroying ffmpeg: {}", e.toString());
        }
    }

    private void ensureNotReleased() {
        if (released) {
            throw new IllegalStateException("Session handle already released");
        }
    }

    /**
     * Keeps the last {@code max} characters of stderr for failure diagnostics.
     */
    private static final class StderrTail {
        private final int max;
        private final StringBuilder sb = new StringBuilder();

        StderrTail(int max) {
            this.max = max;
        }

        synchronized void append(String line) {
            if (!sb.isEmpty()) {
                sb.append('\n');
            }
            sb.append(line);
            int overflow = sb.length() - max;
            if (overflow > 0) {
                sb.delete(0, overflow);
            }
        }

        @Override
        public synchronized String toString() {
            return sb.toString();
        }
    }
}
