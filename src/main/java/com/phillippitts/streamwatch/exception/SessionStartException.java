package com.phillippitts.streamwatch.exception;

/**
 * Thrown when the media engine fails to prepare or start a session.
 * The orchestrator turns this into an {@code Error} session state; it never escapes the control loop.
 */
public class SessionStartException extends StreamWatchException {

    private final String stage;

    public SessionStartException(String message, String stage) {
        super(message + " (stage: " + stage + ")");
        this.stage = stage;
    }

    public SessionStartException(String message, String stage, Throwable cause) {
        super(message + " (stage: " + stage + ")", cause);
        this.stage = stage;
    }

    /** Build stage that failed, e.g. "prepareVideo" or "startTransport". */
    public String getStage() {
        return stage;
    }
}
