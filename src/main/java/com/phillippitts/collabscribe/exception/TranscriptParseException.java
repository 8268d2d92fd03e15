package com.phillippitts.collabscribe.exception;

/**
 * Thrown when an exported JSON transcript cannot be read back into segments.
 */
public class TranscriptParseException extends CollabScribeException {

    public TranscriptParseException(String message) {
        super(message);
    }

    public TranscriptParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
