package com.phillippitts.streamwatch.exception;

/**
 * Thrown when the external media engine cannot be launched at all (binary missing or not executable).
 */
public class EngineUnavailableException extends StreamWatchException {

    private final String binaryPath;

    public EngineUnavailableException(String binaryPath, Throwable cause) {
        super("Media engine unavailable at path: " + binaryPath, cause);
        this.binaryPath = binaryPath;
    }

    public String getBinaryPath() {
        return binaryPath;
    }
}
