package com.phillippitts.streamwatch.exception;

/**
 * Thrown when a stream target endpoint is missing or not a supported URL.
 */
public class InvalidEndpointException extends StreamWatchException {

    private final String reason;

    public InvalidEndpointException(String reason) {
        super("Invalid stream endpoint: " + reason);
        this.reason = reason;
    }

    public String getReason() {
        return reason;
    }
}
