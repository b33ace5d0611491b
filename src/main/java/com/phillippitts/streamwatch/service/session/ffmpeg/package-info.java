/**
 * ffmpeg-backed implementation of the session engine.
 *
 * <p>The process is started through a package-private {@code ProcessFactory} so tests can supply
 * fake processes with scripted {@code -progress} output and exit codes. Progress lines on stdout
 * become bitrate samples; stderr is kept as a bounded tail for diagnostics and auth detection.
 */
package com.phillippitts.streamwatch.service.session.ffmpeg;
