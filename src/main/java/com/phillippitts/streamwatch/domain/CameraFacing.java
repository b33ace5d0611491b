package com.phillippitts.streamwatch.domain;

/** Capture device orientation. Torch is only available on {@link #BACK}. */
public enum CameraFacing {
    BACK,
    FRONT;

    public CameraFacing opposite() {
        return this == BACK ? FRONT : BACK;
    }
}
