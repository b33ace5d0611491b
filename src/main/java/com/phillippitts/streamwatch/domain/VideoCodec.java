package com.phillippitts.streamwatch.domain;

public enum VideoCodec {
    H264("libx264"),
    H265("libx265");

    private final String encoderName;

    VideoCodec(String encoderName) {
        this.encoderName = encoderName;
    }

    /** Encoder name understood by ffmpeg's {@code -c:v}. */
    public String encoderName() {
        return encoderName;
    }
}
