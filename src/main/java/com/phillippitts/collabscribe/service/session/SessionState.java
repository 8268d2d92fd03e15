package com.phillippitts.collabscribe.service.session;

/**
 * Lifecycle of a transcription session. A session never returns to {@link #IDLE}; starting again
 * after {@link #STOPPED} opens a fresh session with empty state.
 */
public enum SessionState {
    IDLE,
    ACTIVE,
    STOPPED
}
