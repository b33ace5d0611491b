package com.phillippitts.streamwatch.service.orchestration.event;

import com.phillippitts.streamwatch.domain.SessionState;

import java.time.Instant;

/**
 * Emitted whenever the session state changes, including bitrate updates while streaming.
 *
 * @param previous state before the change
 * @param current  state after the change
 * @param at       when the change happened
 */
public record SessionStateChangedEvent(SessionState previous, SessionState current, Instant at) {
    public SessionStateChangedEvent {
        at = (at == null) ? Instant.now() : at;
    }

    /** True when the phase differs; false for a bitrate refresh within Streaming. */
    public boolean isPhaseChange() {
        return previous == null || previous.phase() != current.phase();
    }
}
