/**
 * Seam between the supervision core and the media engine.
 *
 * <p>{@link com.phillippitts.streamwatch.service.session.SessionHandle} is the only way the core
 * touches capture or transport. The default implementation drives an ffmpeg process (see the
 * {@code ffmpeg} subpackage); tests substitute in-memory fakes.
 */
package com.phillippitts.streamwatch.service.session;
