package com.phillippitts.streamwatch.service.session.ffmpeg;

import com.phillippitts.streamwatch.config.properties.FfmpegProperties;
import com.phillippitts.streamwatch.service.session.SessionHandle;
import com.phillippitts.streamwatch.service.session.SessionHandleFactory;
import com.phillippitts.streamwatch.service.session.TransportListener;

import java.util.Objects;

/**
 * Production {@link SessionHandleFactory}: one {@link FfmpegSessionHandle} per session build.
 */
public final class FfmpegSessionHandleFactory implements SessionHandleFactory {

    private final FfmpegProperties props;
    private final ProcessFactory processFactory;

    public FfmpegSessionHandleFactory(FfmpegProperties props) {
        this(props, new DefaultProcessFactory());
    }

    FfmpegSessionHandleFactory(FfmpegProperties props, ProcessFactory processFactory) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.processFactory = Objects.requireNonNull(processFactory, "processFactory must not be null");
    }

    @Override
    public SessionHandle create(TransportListener listener) {
        return new FfmpegSessionHandle(props, processFactory, listener);
    }
}
