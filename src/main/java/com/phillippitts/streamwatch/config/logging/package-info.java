/**
 * Logging infrastructure and MDC (Mapped Diagnostic Context) configuration.
 *
 * <p>MDC Keys:
 * <ul>
 *   <li>{@code requestId} - Unique identifier for each HTTP request (UUID format)</li>
 *   <li>{@code sessionId} - Short identifier of the stream session, set on the control executor</li>
 * </ul>
 *
 * <p>Log Format:
 * <pre>
 * 2026-10-17 15:42:32.529 [control-1] [requestId] [sessionId] LEVEL logger.name - message
 * </pre>
 *
 * @see com.phillippitts.streamwatch.config.logging.MdcFilter
 */
package com.phillippitts.streamwatch.config.logging;
