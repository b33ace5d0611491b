/**
 * Delayed session rebuilds after a failure.
 *
 * <p>{@link com.phillippitts.streamwatch.service.reconnect.ReconnectCoordinator ReconnectCoordinator}
 * keeps at most one pending rebuild. The delay comes from a
 * {@link com.phillippitts.streamwatch.service.reconnect.ReconnectPolicy ReconnectPolicy}: a fixed short
 * delay, or exponential backoff with jitter bounded by a retry window.
 */
package com.phillippitts.streamwatch.service.reconnect;
