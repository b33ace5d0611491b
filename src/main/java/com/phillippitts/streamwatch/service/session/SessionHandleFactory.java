package com.phillippitts.streamwatch.service.session;

/**
 * Creates a fresh {@link SessionHandle} for every session build.
 */
@FunctionalInterface
public interface SessionHandleFactory {

    /**
     * @param listener receives transport callbacks for this handle only
     * @return new, unprepared handle
     */
    SessionHandle create(TransportListener listener);
}
