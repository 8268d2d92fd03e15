package com.phillippitts.collabscribe.service.session;

/**
 * Failures reported by session coordinator operations.
 */
public enum SessionError {
    /** Speech recognition capability unavailable or denied. */
    NOT_AUTHORIZED("Speech recognition not authorized"),
    /** Operation requires an active session, or no session context exists. */
    NO_ACTIVE_SESSION("No active collaboration session"),
    /** Audio intake collaborator failed to initialize. */
    AUDIO_PIPELINE_FAILURE("Audio pipeline initialization failed"),
    /** Participant is not on the session roster. */
    UNKNOWN_PARTICIPANT("Participant is not part of the session"),
    /** A session is already active. */
    SESSION_ALREADY_ACTIVE("Transcription already active");

    private final String description;

    SessionError(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }
}
