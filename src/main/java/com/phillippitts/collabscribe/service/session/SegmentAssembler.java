package com.phillippitts.collabscribe.service.session;

import com.phillippitts.collabscribe.domain.TranscriptionSegment;

import java.util.Objects;
import java.util.UUID;

/**
 * Builds segments from a participant's open utterance.
 *
 * <p>Interim and final segments of one utterance share its id and start time; the end time is the
 * session-relative time at which the segment is built.
 */
public final class SegmentAssembler {

    private final String language;
    private final double interimConfidence;

    public SegmentAssembler(String language, double interimConfidence) {
        this.language = Objects.requireNonNull(language, "language must not be null");
        if (interimConfidence < 0.0 || interimConfidence > 1.0) {
            throw new IllegalArgumentException(
                    "interimConfidence must be between 0.0 and 1.0, got: " + interimConfidence);
        }
        this.interimConfidence = interimConfidence;
    }

    /**
     * Interim segment carrying the buffered text at the configured flat confidence.
     */
    public TranscriptionSegment interim(TranscriptionSession session, ParticipantState state) {
        return build(session, state, state.interimBuffer(), interimConfidence, false);
    }

    /**
     * Final segment for the open utterance (opened at "now" when the recognizer sent no partials).
     *
     * @param confidence already clamped to [0, 1]
     */
    public TranscriptionSegment finalSegment(TranscriptionSession session, ParticipantState state,
                                             String text, double confidence) {
        return build(session, state, text, confidence, true);
    }

    /**
     * Final segment for an interim already in the ledger whose utterance is no longer tracked by the
     * participant state; the interim's id and start time carry over.
     */
    public TranscriptionSegment finalFromInterim(TranscriptionSession session, TranscriptionSegment interim,
                                                 String text, double confidence) {
        double end = Math.max(interim.startTime(), session.elapsedSeconds());
        return new TranscriptionSegment(interim.id(), interim.participantId(), interim.participantName(), text,
                interim.startTime(), end, confidence, true, interim.language(), session.now(),
                session.sessionId());
    }

    public double interimConfidence() {
        return interimConfidence;
    }

    private TranscriptionSegment build(TranscriptionSession session, ParticipantState state,
                                       String text, double confidence, boolean isFinal) {
        double now = session.elapsedSeconds();
        UUID id = state.utteranceId(now);
        double start = state.utteranceStart();
        double end = Math.max(start, now);
        return new TranscriptionSegment(id, state.participantId(), state.displayName(), text,
                start, end, confidence, isFinal, language, session.now(), session.sessionId());
    }
}
