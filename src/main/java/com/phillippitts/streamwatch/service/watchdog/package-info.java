/**
 * Periodic stream health monitoring.
 *
 * <h2>Overview</h2>
 * <p>{@link com.phillippitts.streamwatch.service.watchdog.StreamWatchdog StreamWatchdog} ticks on a
 * fixed interval and inspects the live session for silent failures: bitrate that never arrives or
 * drops to zero, a transport stuck before going live, and capture or encoder that stopped. Findings
 * are reported to an {@link com.phillippitts.streamwatch.service.watchdog.AnomalyListener AnomalyListener};
 * the watchdog itself never tears anything down.
 *
 * <h2>Checks and thresholds</h2>
 * <ul>
 *   <li><strong>ZeroBitrate</strong> (ERROR) - no sample within {@code firstBitrateTimeout}, last
 *       sample older than {@code bitrateTimeout}, or a zero run longer than {@code zeroBitrateDuration}</li>
 *   <li><strong>LowBitrate</strong> (WARNING, debounced) - low run longer than {@code lowBitrateDuration}</li>
 *   <li><strong>BitrateFluctuation</strong> (WARNING, debounced) - coefficient of variation above
 *       {@code fluctuationThreshold} over the recent history</li>
 *   <li><strong>ConnectionStuck</strong> (CRITICAL) - not live for longer than {@code connectionStuckDuration}</li>
 *   <li><strong>StreamingTimeout</strong> (ERROR) - live but no sample for {@code connectionTimeout}</li>
 *   <li><strong>EncoderError</strong> (ERROR) - capturing without streaming, or a check threw</li>
 *   <li><strong>CameraDisconnected</strong> (CRITICAL) - no session attached, or capture stopped</li>
 * </ul>
 *
 * <h2>Gating</h2>
 * <p>Nothing is evaluated while the run-state gate is STOPPED; such ticks are counted as skipped.
 * The gate is re-read before findings are finalized and again right before the listener is called.
 *
 * <h2>Configuration</h2>
 * <p>Prefix {@code stream.watchdog}; see
 * {@link com.phillippitts.streamwatch.config.properties.WatchdogProperties WatchdogProperties}.
 */
package com.phillippitts.streamwatch.service.watchdog;
