/**
 * REST API controllers for HTTP endpoints.
 *
 * <p>Current Endpoints ({@code StreamController}, base path {@code /api/stream}):
 * <ul>
 *   <li>{@code GET /status} - session phase, bitrate, stream time and intent flags</li>
 *   <li>{@code GET /watchdog} - watchdog counters and bitrate history</li>
 *   <li>{@code POST /start} - start streaming to {@code {"endpoint": "rtmp://..."}}</li>
 *   <li>{@code POST /stop} - stop streaming; no reconnect happens afterwards</li>
 *   <li>{@code PUT /settings} - replace session settings</li>
 *   <li>{@code POST /mute}, {@code POST /flash}, {@code POST /camera/switch} - toggles</li>
 * </ul>
 *
 * @see com.phillippitts.streamwatch.presentation.exception.GlobalExceptionHandler
 */
package com.phillippitts.streamwatch.presentation.controller;
