package com.phillippitts.streamwatch.service.session.ffmpeg;

import java.io.IOException;
import java.util.List;

/**
 * Default production implementation of {@link ProcessFactory} using {@link ProcessBuilder}.
 */
final class DefaultProcessFactory implements ProcessFactory {

    @Override
    public Process start(List<String> command) throws IOException {
        ProcessBuilder pb = new ProcessBuilder(command);
        // stdout carries -progress output, stderr carries diagnostics; read them separately
        pb.redirectErrorStream(false);
        pb.redirectInput(ProcessBuilder.Redirect.PIPE);
        return pb.start();
    }
}
