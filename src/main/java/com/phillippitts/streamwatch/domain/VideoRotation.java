package com.phillippitts.streamwatch.domain;

/**
 * Output rotation. {@link #AUTO} leaves the frame as captured.
 */
public enum VideoRotation {
    AUTO(0),
    ROTATION_0(0),
    ROTATION_90(90),
    ROTATION_180(180),
    ROTATION_270(270);

    private final int degrees;

    VideoRotation(int degrees) {
        this.degrees = degrees;
    }

    public int degrees() {
        return degrees;
    }
}
