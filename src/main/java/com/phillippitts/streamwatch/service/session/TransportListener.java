package com.phillippitts.streamwatch.service.session;

/**
 * Callbacks raised by a {@link SessionHandle}'s transport.
 *
 * <p>Implementations must be cheap and non-blocking; the orchestrator's listener only posts
 * work onto the control loop. Callbacks may arrive on any thread.
 */
public interface TransportListener {

    void connectionStarted(String url);

    void connectionSucceeded();

    void connectionFailed(String reason);

    void bitrateSample(long bps);

    void disconnected();

    void authError();

    void authSucceeded();
}
