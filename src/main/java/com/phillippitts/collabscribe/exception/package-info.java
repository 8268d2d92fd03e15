/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.collabscribe.exception.CollabScribeException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.collabscribe.exception.NoActiveSessionException} - REST-side
 *       signal that no session ledger exists yet</li>
 *   <li>{@link com.phillippitts.collabscribe.exception.AudioPipelineException} - Thrown by the
 *       audio intake collaborator when it fails to start</li>
 *   <li>{@link com.phillippitts.collabscribe.exception.TranscriptParseException} - Thrown when a
 *       JSON transcript cannot be parsed</li>
 * </ul>
 *
 * <p>Session lifecycle failures are not thrown across the coordinator boundary; they are
 * reported as {@code SessionResult} values. These exceptions map to HTTP status codes via
 * {@code GlobalExceptionHandler}.
 *
 * @see com.phillippitts.collabscribe.presentation.exception.GlobalExceptionHandler
 * @since 1.0
 */
package com.phillippitts.collabscribe.exception;
