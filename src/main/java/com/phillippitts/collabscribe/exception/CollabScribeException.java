package com.phillippitts.collabscribe.exception;

/**
 * Base exception for all collab-scribe application-specific errors.
 * All domain exceptions extend this class to enable centralized error handling.
 */
public class CollabScribeException extends RuntimeException {

    public CollabScribeException(String message) {
        super(message);
    }

    public CollabScribeException(String message, Throwable cause) {
        super(message, cause);
    }

    public CollabScribeException(Throwable cause) {
        super(cause);
    }
}
