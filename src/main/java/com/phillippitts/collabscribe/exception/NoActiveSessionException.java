package com.phillippitts.collabscribe.exception;

/**
 * Thrown at the REST boundary when an operation needs a session ledger but none has been started.
 * The coordinator itself reports this condition as a result value, never as an exception.
 */
public class NoActiveSessionException extends CollabScribeException {

    private final String operation;

    public NoActiveSessionException(String operation) {
        super("No active transcription session for operation: " + operation);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
