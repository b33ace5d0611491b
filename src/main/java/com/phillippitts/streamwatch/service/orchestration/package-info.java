/**
 * Session orchestration: the run-state gate and the session state machine.
 *
 * <p>{@link com.phillippitts.streamwatch.service.orchestration.DefaultStreamOrchestrator} is the only
 * writer of {@link com.phillippitts.streamwatch.domain.SessionState}. It receives three kinds of input,
 * all serialized on the control executor:
 * <ul>
 *   <li>user commands (start, stop, settings, mute, torch, camera)</li>
 *   <li>transport callbacks from the current {@link com.phillippitts.streamwatch.service.session.SessionHandle}</li>
 *   <li>anomalies from the {@link com.phillippitts.streamwatch.service.watchdog.StreamWatchdog}</li>
 * </ul>
 *
 * <p>Transition summary:
 * <pre>
 * Idle/Error --start--> Preparing --engine ready--> Connecting --connected--> Streaming(bitrate)
 * Preparing --engine failure--> Error
 * Connecting/Streaming --transport failed/disconnected--> Error (watchdog re-detects and reconnects)
 * any running --ERROR/CRITICAL anomaly--> Reconnecting --rebuild--> Preparing ...
 * any --stop--> Idle
 * </pre>
 */
package com.phillippitts.streamwatch.service.orchestration;
