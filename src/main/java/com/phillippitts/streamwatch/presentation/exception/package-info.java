/**
 * Global exception handling for REST API responses.
 *
 * <p>Exception Mapping:
 * <ul>
 *   <li>{@link com.phillippitts.streamwatch.exception.InvalidEndpointException} → 400 Bad Request</li>
 *   <li>Bean Validation failures and malformed bodies → 400 Bad Request</li>
 *   <li>{@link com.phillippitts.streamwatch.exception.EngineUnavailableException},
 *       {@link com.phillippitts.streamwatch.exception.SessionStartException} → 503 Service Unavailable</li>
 *   <li>{@link com.phillippitts.streamwatch.exception.ControlTimeoutException} → 503 Service Unavailable (retry)</li>
 *   <li>{@code Exception} (catch-all) → 500 Internal Server Error</li>
 * </ul>
 *
 * <p>Response Format:
 * <pre>
 * {
 *   "errorCode": "InvalidEndpointException",
 *   "message": "Invalid stream endpoint",
 *   "details": "missing host",
 *   "timestamp": "2026-10-17T15:42:32.529Z"
 * }
 * </pre>
 *
 * <p>Stream endpoints carry credentials in their path; they are never echoed back or logged in full.
 */
package com.phillippitts.streamwatch.presentation.exception;
