package com.phillippitts.streamwatch.exception;

import java.time.Duration;

/**
 * Thrown when a control call is not applied by the control loop within the allowed time.
 */
public class ControlTimeoutException extends StreamWatchException {

    private final String operation;

    public ControlTimeoutException(String operation, Duration timeout) {
        super("Control operation '" + operation + "' not applied within " + timeout.toMillis() + "ms");
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
