package com.phillippitts.collabscribe.service.recognition;

import com.phillippitts.collabscribe.domain.TranscriptionSegment;
import com.phillippitts.collabscribe.service.metrics.DiagnosticKind;
import com.phillippitts.collabscribe.service.metrics.TranscriptionDiagnostics;
import com.phillippitts.collabscribe.service.session.ParticipantState;
import com.phillippitts.collabscribe.service.session.SegmentAssembler;
import com.phillippitts.collabscribe.service.session.TranscriptionSession;
import com.phillippitts.collabscribe.service.session.event.SegmentFinalizedEvent;
import com.phillippitts.collabscribe.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.util.Objects;
import java.util.Optional;

/**
 * Applies recognition events to session state.
 *
 * <p>Partials only update the participant's interim buffer; the flush scheduler decides when that
 * text becomes visible in the ledger. Finals replace and commit the participant's active segment in
 * one ledger call, clear the buffer and publish {@link SegmentFinalizedEvent}.
 *
 * <p><b>Threading:</b> every method must run on the session command queue.
 *
 * <p><b>Error Handling:</b> nothing here throws for bad input. Events for unknown or paused
 * participants and blank text are dropped; out-of-range confidence is clamped. Each case is
 * recorded in {@link TranscriptionDiagnostics}.
 */
public class RecognitionEventProcessor {

    private static final Logger LOG = LogManager.getLogger(RecognitionEventProcessor.class);
    private static final int PREVIEW_CHARS = 32;

    private final SegmentAssembler assembler;
    private final TranscriptionDiagnostics diagnostics;
    private final ApplicationEventPublisher publisher;

    public RecognitionEventProcessor(SegmentAssembler assembler,
                                     TranscriptionDiagnostics diagnostics,
                                     ApplicationEventPublisher publisher) {
        this.assembler = Objects.requireNonNull(assembler, "assembler must not be null");
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics must not be null");
        this.publisher = Objects.requireNonNull(publisher, "publisher must not be null");
    }

    /**
     * Buffers a partial hypothesis.
     *
     * @return {@code true} if the event was accepted
     */
    public boolean onPartial(TranscriptionSession session, String participantId, String text, double confidence) {
        Optional<ParticipantState> accepted = accept(session, participantId, text);
        if (accepted.isEmpty()) {
            return false;
        }
        clampConfidence(confidence);
        ParticipantState state = accepted.get();
        state.bufferPartial(text, session.elapsedSeconds());
        LOG.trace("Partial for {}: '{}'", participantId, LogSanitizer.preview(text, PREVIEW_CHARS));
        return true;
    }

    /**
     * Commits the participant's utterance as a final segment.
     *
     * @return the committed segment, or empty if the event was dropped
     */
    public Optional<TranscriptionSegment> onFinal(TranscriptionSession session, String participantId,
                                                  String text, double confidence) {
        Optional<ParticipantState> accepted = accept(session, participantId, text);
        if (accepted.isEmpty()) {
            return Optional.empty();
        }
        ParticipantState state = accepted.get();
        TranscriptionSegment segment =
                assembler.finalSegment(session, state, text, clampConfidence(confidence));
        return Optional.of(commit(session, state, segment));
    }

    /**
     * Commits whatever the participant has in flight: buffered text that was never flushed, or the
     * last interim segment in the ledger. Used when a session stops, a participant pauses or leaves.
     * The committed segment keeps the utterance's id and start time even when the participant state
     * no longer tracks it.
     *
     * @return the committed segment, or empty when nothing was pending
     */
    public Optional<TranscriptionSegment> drainPending(TranscriptionSession session, ParticipantState state) {
        Optional<TranscriptionSegment> active = session.ledger().activeSegment(state.participantId());
        String content = state.hasBufferedText()
                ? state.interimBuffer()
                : active.map(TranscriptionSegment::content).orElse("");
        if (content.isBlank()) {
            if (active.isPresent() || state.hasOpenUtterance()) {
                LOG.warn("Discarding empty pending utterance for {}", state.participantId());
                diagnostics.record(DiagnosticKind.INCONSISTENT_STATE);
            }
            state.clearUtterance();
            return Optional.empty();
        }
        double confidence = active.map(TranscriptionSegment::confidence).orElse(assembler.interimConfidence());
        TranscriptionSegment segment = !state.hasOpenUtterance() && active.isPresent()
                ? assembler.finalFromInterim(session, active.get(), content, confidence)
                : assembler.finalSegment(session, state, content, confidence);
        return Optional.of(commit(session, state, segment));
    }

    private TranscriptionSegment commit(TranscriptionSession session, ParticipantState state,
                                        TranscriptionSegment segment) {
        TranscriptionSegment committed = session.ledger().commit(state.participantId(), segment);
        state.clearUtterance();
        diagnostics.incrementFinalized();
        LOG.debug("Finalized segment {} for {} [{}..{}] conf={}", committed.id(), committed.participantId(),
                committed.startTime(), committed.endTime(), committed.confidence());
        publisher.publishEvent(new SegmentFinalizedEvent(committed, session.now()));
        return committed;
    }

    private Optional<ParticipantState> accept(TranscriptionSession session, String participantId, String text) {
        if (session == null) {
            diagnostics.record(DiagnosticKind.NO_ACTIVE_SESSION);
            LOG.debug("Dropping recognition event for {}: no active session", participantId);
            return Optional.empty();
        }
        Optional<ParticipantState> state =
                participantId == null ? Optional.empty() : session.participant(participantId);
        if (state.isEmpty()) {
            diagnostics.record(DiagnosticKind.UNKNOWN_PARTICIPANT);
            LOG.debug("Dropping recognition event for unknown participant {}", participantId);
            return Optional.empty();
        }
        if (!state.get().isMicEnabled()) {
            diagnostics.record(DiagnosticKind.MIC_DISABLED);
            LOG.debug("Dropping recognition event for paused participant {}", participantId);
            return Optional.empty();
        }
        if (text == null || text.isBlank()) {
            diagnostics.record(DiagnosticKind.EMPTY_TEXT);
            return Optional.empty();
        }
        return state;
    }

    private double clampConfidence(double confidence) {
        if (Double.isNaN(confidence)) {
            diagnostics.record(DiagnosticKind.CONFIDENCE_CLAMPED);
            return 0.0;
        }
        if (confidence < 0.0 || confidence > 1.0) {
            diagnostics.record(DiagnosticKind.CONFIDENCE_CLAMPED);
            return Math.max(0.0, Math.min(1.0, confidence));
        }
        return confidence;
    }
}
