/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.streamwatch.exception.StreamWatchException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.streamwatch.exception.InvalidEndpointException} - Thrown when
 *       a start request carries a blank or unsupported target URL</li>
 *   <li>{@link com.phillippitts.streamwatch.exception.SessionStartException} - Thrown inside the
 *       control loop when the engine fails to prepare or start</li>
 *   <li>{@link com.phillippitts.streamwatch.exception.EngineUnavailableException} - Thrown when
 *       the engine process cannot be launched</li>
 * </ul>
 *
 * <p>The watchdog and reconnect coordinator never throw across their boundaries; failures there are
 * represented as anomalies or session states. These exceptions only surface at the REST boundary,
 * where {@code GlobalExceptionHandler} maps them to HTTP status codes.
 *
 * @see com.phillippitts.streamwatch.presentation.exception.GlobalExceptionHandler
 */
package com.phillippitts.streamwatch.exception;
