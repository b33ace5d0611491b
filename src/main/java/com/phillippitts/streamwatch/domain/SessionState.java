package com.phillippitts.streamwatch.domain;

import java.util.Objects;

/**
 * Observable state of the stream session, owned by the orchestrator.
 *
 * <p>Only {@link Phase#STREAMING} carries a bitrate and only {@link Phase#ERROR} carries a
 * message; use the static factories rather than the canonical constructor.
 *
 * @param phase   current phase
 * @param bitrate last reported bitrate in bits per second (streaming only, else 0)
 * @param message failure reason (error only, else empty)
 */
public record SessionState(Phase phase, long bitrate, String message) {

    public enum Phase { IDLE, PREPARING, CONNECTING, STREAMING, RECONNECTING, ERROR }

    private static final SessionState IDLE = new SessionState(Phase.IDLE, 0, "");
    private static final SessionState PREPARING = new SessionState(Phase.PREPARING, 0, "");
    private static final SessionState CONNECTING = new SessionState(Phase.CONNECTING, 0, "");
    private static final SessionState RECONNECTING = new SessionState(Phase.RECONNECTING, 0, "");

    public SessionState {
        Objects.requireNonNull(phase, "phase must not be null");
        Objects.requireNonNull(message, "message must not be null");
        if (bitrate < 0) {
            throw new IllegalArgumentException("bitrate must be >= 0, got: " + bitrate);
        }
        if (phase != Phase.STREAMING && bitrate != 0) {
            throw new IllegalArgumentException("bitrate only applies to STREAMING, got phase " + phase);
        }
        if (phase != Phase.ERROR && !message.isEmpty()) {
            throw new IllegalArgumentException("message only applies to ERROR, got phase " + phase);
        }
    }

    public static SessionState idle() {
        return IDLE;
    }

    public static SessionState preparing() {
        return PREPARING;
    }

    public static SessionState connecting() {
        return CONNECTING;
    }

    public static SessionState streaming(long bitrate) {
        return new SessionState(Phase.STREAMING, bitrate, "");
    }

    public static SessionState reconnecting() {
        return RECONNECTING;
    }

    public static SessionState error(String message) {
        return new SessionState(Phase.ERROR, 0, message == null || message.isBlank() ? "unknown error" : message);
    }

    public boolean is(Phase candidate) {
        return phase == candidate;
    }

    /** Human-readable status line for observers. */
    public String statusText() {
        return switch (phase) {
            case IDLE -> "Ready";
            case PREPARING -> "Preparing...";
            case CONNECTING -> "Connecting...";
            case STREAMING -> "Streaming: " + bitrate / 1000 + " kbps";
            case RECONNECTING -> "Reconnecting...";
            case ERROR -> "Error: " + message;
        };
    }
}
