package com.phillippitts.streamwatch.service.orchestration;

/**
 * Whether a stream session is intended to be live.
 */
public enum RunState {
    STOPPED,
    RUNNING
}
