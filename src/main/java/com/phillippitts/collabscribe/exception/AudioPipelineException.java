package com.phillippitts.collabscribe.exception;

/**
 * Thrown by an audio intake collaborator that cannot initialize (device busy, permissions, etc.).
 */
public class AudioPipelineException extends CollabScribeException {

    private final String reason;

    public AudioPipelineException(String reason) {
        super("Audio pipeline failure: " + reason);
        this.reason = reason;
    }

    public AudioPipelineException(String reason, Throwable cause) {
        super("Audio pipeline failure: " + reason, cause);
        this.reason = reason;
    }

    public String getReason() {
        return reason;
    }
}
