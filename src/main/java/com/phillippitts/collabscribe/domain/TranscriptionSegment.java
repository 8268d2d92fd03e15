package com.phillippitts.collabscribe.domain;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * One attributed span of transcribed speech within a collaborative session.
 *
 * <p>Interim segments ({@code isFinal == false}) are replaced as the speaker keeps talking;
 * final segments are immutable and permanently appended to the session ledger. All segments of
 * one utterance share the same {@code id}.
 *
 * @param id              unique segment identifier (stable across one utterance)
 * @param participantId   participant the speech is attributed to
 * @param participantName display name at the time of transcription
 * @param content         transcribed text
 * @param startTime       session-relative start in seconds
 * @param endTime         session-relative end in seconds (never before {@code startTime})
 * @param confidence      recognizer confidence between 0.0 and 1.0
 * @param isFinal         whether the segment has been committed
 * @param language        language tag, e.g. {@code en-US}
 * @param createdAt       wall-clock creation time
 * @param sessionId       session the segment belongs to
 */
public record TranscriptionSegment(
        UUID id,
        String participantId,
        String participantName,
        String content,
        double startTime,
        double endTime,
        double confidence,
        boolean isFinal,
        String language,
        Instant createdAt,
        UUID sessionId
) {

    public static final String DEFAULT_LANGUAGE = "en-US";

    /**
     * Compact constructor with validation.
     *
     * @throws NullPointerException if an identifier, text or timestamp is null
     * @throws IllegalArgumentException if a time is not finite, the time range is inverted or confidence
     *         is out of range
     */
    public TranscriptionSegment {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(participantId, "participantId must not be null");
        Objects.requireNonNull(participantName, "participantName must not be null");
        Objects.requireNonNull(content, "content must not be null");
        Objects.requireNonNull(createdAt, "createdAt must not be null");
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        if (!Double.isFinite(startTime) || !Double.isFinite(endTime)) {
            throw new IllegalArgumentException(
                    "Segment times must be finite, got: " + startTime + ".." + endTime);
        }
        if (startTime < 0.0) {
            throw new IllegalArgumentException("startTime must not be negative, got: " + startTime);
        }
        if (endTime < startTime) {
            throw new IllegalArgumentException(
                    "endTime must not precede startTime, got: " + startTime + ".." + endTime);
        }
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException(
                    "Confidence must be between 0.0 and 1.0, got: " + confidence);
        }
        if (language == null || language.isBlank()) {
            language = DEFAULT_LANGUAGE;
        }
    }

    /** Duration of the segment in seconds. */
    public double duration() {
        return endTime - startTime;
    }

    /**
     * Returns a committed copy of this segment. Already-final segments are returned as is.
     */
    public TranscriptionSegment asFinal() {
        if (isFinal) {
            return this;
        }
        return new TranscriptionSegment(id, participantId, participantName, content, startTime, endTime,
                confidence, true, language, createdAt, sessionId);
    }
}
