package com.phillippitts.collabscribe.presentation.exception;

import com.phillippitts.collabscribe.exception.NoActiveSessionException;
import com.phillippitts.collabscribe.exception.TranscriptParseException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;

/**
 * Global exception handler for REST API boundary.
 *
 * Converts domain exceptions to HTTP responses with appropriate status codes.
 * Logs errors for monitoring while protecting transcript content and internals from clients.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * Operation needs a session that was never started (HTTP 409).
     */
    @ExceptionHandler(NoActiveSessionException.class)
    ResponseEntity<ApiError> handleNoActiveSession(NoActiveSessionException ex) {
        LOG.info("Rejected {}: no active session", ex.getOperation());
        return ResponseEntity
            .status(HttpStatus.CONFLICT)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "No active collaboration session",
                "Open a room and start transcription first",
                Instant.now()
            ));
    }

    /**
     * Client error - transcript JSON could not be read (HTTP 400).
     */
    @ExceptionHandler(TranscriptParseException.class)
    ResponseEntity<ApiError> handleTranscriptParse(TranscriptParseException ex) {
        LOG.warn("Transcript parse failed: {}", ex.getMessage());
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Invalid transcript",
                ex.getMessage(),
                Instant.now()
            ));
    }

    /**
     * Client error - invalid argument or request body (HTTP 400).
     */
    @ExceptionHandler({IllegalArgumentException.class,
            MethodArgumentNotValidException.class,
            HttpMessageNotReadableException.class})
    ResponseEntity<ApiError> handleBadRequest(Exception ex) {
        LOG.warn("Bad request: {}", ex.getClass().getSimpleName());
        String details = ex instanceof IllegalArgumentException ? ex.getMessage() : "Malformed or invalid request body";
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError(
                "BadRequest",
                "Invalid request",
                details,
                Instant.now()
            ));
    }

    /**
     * Catch-all for unexpected errors (HTTP 500).
     */
    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        LOG.error("Unexpected error", ex);
        return ResponseEntity
            .status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ApiError(
                "InternalServerError",
                "An unexpected error occurred",
                "Please contact support with request ID",
                Instant.now()
            ));
    }

    /**
     * Standardized error response for API clients.
     */
    private record ApiError(
        String errorCode,
        String message,
        String details,
        Instant timestamp
    ) {}
}
