package com.phillippitts.streamwatch.service.reconnect;

/**
 * Session teardown and construction, supplied by the orchestrator.
 * Both methods are invoked on the control executor.
 */
public interface SessionRebuilder {

    /** Best-effort release of every session resource. Must not throw. */
    void releaseSession();

    /** Builds a new session against the last known endpoint. */
    void rebuildSession();

    /** Called when the policy gives up; the session must move to a terminal error state. */
    void onRetriesExhausted(String reason, BackoffState state);
}
