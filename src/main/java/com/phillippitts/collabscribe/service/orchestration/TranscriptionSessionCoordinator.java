package com.phillippitts.collabscribe.service.orchestration;

import com.phillippitts.collabscribe.domain.ExportFormat;
import com.phillippitts.collabscribe.domain.SessionSummary;
import com.phillippitts.collabscribe.domain.TranscriptionSegment;
import com.phillippitts.collabscribe.service.ledger.SegmentQuery;
import com.phillippitts.collabscribe.service.recognition.RecognitionEventSink;
import com.phillippitts.collabscribe.service.session.SessionResult;
import com.phillippitts.collabscribe.service.session.SessionState;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Owns the lifecycle of the collaborative transcription session and its shared transcript.
 *
 * <p>The session moves {@code IDLE -> ACTIVE -> STOPPED}; a stopped session may be followed by a new
 * one but never returns to idle. Within an active session each participant is independently
 * enabled or paused.
 *
 * <p><b>Thread Safety:</b> implementations serialize every mutation of the transcript and the
 * participant registry; all methods may be called from any thread.
 *
 * <p><b>Error Handling:</b> lifecycle operations report failures through {@link SessionResult}
 * instead of throwing. Recognition events that cannot be applied are dropped and counted.
 *
 * <p><b>Usage Example:</b>
 * <pre>{@code
 * SessionResult started = coordinator.start();
 * if (started.isSuccess()) {
 *     coordinator.onPartial("alice", "I think", 0.8);
 *     coordinator.onFinal("alice", "I think we should proceed", 0.93);
 *     coordinator.stop();
 *     String srt = coordinator.export(ExportFormat.SRT);
 * }
 * }</pre>
 *
 * @since 1.0
 */
public interface TranscriptionSessionCoordinator extends RecognitionEventSink {

    /**
     * Starts transcribing the collaboration session currently open in the directory.
     *
     * <p>Fails with {@code SESSION_ALREADY_ACTIVE}, {@code NOT_AUTHORIZED}, {@code NO_ACTIVE_SESSION}
     * (no open room) or {@code AUDIO_PIPELINE_FAILURE}; a failed start leaves the state unchanged.
     *
     * @return the started session id, or the failure
     */
    SessionResult start();

    /**
     * Stops the active session: force-finalizes every pending utterance, freezes the transcript and
     * produces the session summary. Never fails: with no active session it is a successful no-op.
     *
     * @return the stopped session id; when idle, the last stopped session id or {@code null} if
     *         none has run
     */
    SessionResult stop();

    /**
     * Disables a participant's microphone.
     *
     * <p>Pausing commits: the participant's pending utterance is finalized into the transcript
     * (publishing {@code SegmentFinalizedEvent}) before the mic goes off, and is not resumed later.
     * Recognition events for the participant are dropped until {@link #resume(String)}.
     */
    SessionResult pause(String participantId);

    /**
     * Re-enables a participant's microphone with an empty buffer. A participant whose mic is
     * already on is left untouched, open utterance included.
     */
    SessionResult resume(String participantId);

    /**
     * Enqueues one flush tick. The periodic scheduler calls the same path.
     */
    void flushInterimBuffers();

    /**
     * Merges a segment replicated from a remote peer into the transcript.
     */
    void ingestRemoteSegment(TranscriptionSegment segment);

    SessionState state();

    Optional<UUID> currentSessionId();

    /**
     * Registered participants of the current session, in registration order.
     */
    List<String> participantIds();

    boolean isMicEnabled(String participantId);

    /**
     * Buffered partial text of a participant, empty when the participant is unknown.
     */
    Optional<String> interimBuffer(String participantId);

    /**
     * All segments of the current (or last) session in startTime order.
     */
    List<TranscriptionSegment> segments();

    List<TranscriptionSegment> query(SegmentQuery query);

    List<TranscriptionSegment> segmentsFor(String participantId);

    /**
     * Segments lying entirely within {@code [start, end]} session seconds.
     */
    List<TranscriptionSegment> segmentsBetween(double start, double end);

    List<TranscriptionSegment> search(String text);

    String export(ExportFormat format);

    /**
     * Summary of the most recently stopped session.
     */
    Optional<SessionSummary> lastSummary();
}
