package com.phillippitts.collabscribe.service.orchestration;

import com.phillippitts.collabscribe.domain.CollaborationSession;
import com.phillippitts.collabscribe.domain.ExportFormat;
import com.phillippitts.collabscribe.domain.Participant;
import com.phillippitts.collabscribe.domain.SessionSummary;
import com.phillippitts.collabscribe.domain.TranscriptionSegment;
import com.phillippitts.collabscribe.exception.AudioPipelineException;
import com.phillippitts.collabscribe.service.export.TranscriptExporter;
import com.phillippitts.collabscribe.service.flush.BufferFlushScheduler;
import com.phillippitts.collabscribe.service.ledger.SegmentLedger;
import com.phillippitts.collabscribe.service.ledger.SegmentQuery;
import com.phillippitts.collabscribe.service.metrics.DiagnosticKind;
import com.phillippitts.collabscribe.service.metrics.TranscriptionDiagnostics;
import com.phillippitts.collabscribe.service.recognition.RecognitionEventProcessor;
import com.phillippitts.collabscribe.service.roster.ParticipantJoinedEvent;
import com.phillippitts.collabscribe.service.roster.ParticipantLeftEvent;
import com.phillippitts.collabscribe.service.session.ParticipantState;
import com.phillippitts.collabscribe.service.session.SessionCommandQueue;
import com.phillippitts.collabscribe.service.session.SessionError;
import com.phillippitts.collabscribe.service.session.SessionResult;
import com.phillippitts.collabscribe.service.session.SessionState;
import com.phillippitts.collabscribe.service.session.SessionStateMachine;
import com.phillippitts.collabscribe.service.session.TranscriptionSession;
import com.phillippitts.collabscribe.service.session.event.SegmentFinalizedEvent;
import com.phillippitts.collabscribe.service.session.event.SessionStartedEvent;
import com.phillippitts.collabscribe.service.session.event.SessionStoppedEvent;
import com.phillippitts.collabscribe.service.session.event.SessionSummaryGeneratedEvent;
import com.phillippitts.collabscribe.service.session.event.TranscriptionPausedEvent;
import com.phillippitts.collabscribe.service.session.event.TranscriptionResumedEvent;
import com.phillippitts.collabscribe.service.summary.SessionSummarizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.event.EventListener;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletionException;
import java.util.function.Supplier;

/**
 * Default {@link TranscriptionSessionCoordinator} built on a {@link SessionCommandQueue}.
 *
 * <p><b>Serialization:</b> recognition events, flush ticks, pause/resume, roster changes, remote
 * segments and start/stop are all commands on one queue. Lifecycle operations wait for their
 * command to complete; recognition events and ticks are fire-and-forget. Reads of the transcript go
 * straight to the ledger, which is internally locked.
 *
 * <p><b>State Management:</b> the {@link SessionStateMachine} records whether a session is active.
 * The last {@link TranscriptionSession} stays readable after stop so its frozen transcript can
 * still be queried and exported.
 *
 * <p><b>Logging:</b> commands run with {@code sessionId} in the Log4j2 {@link ThreadContext}.
 *
 * @since 1.0
 */
public class DefaultTranscriptionSessionCoordinator implements TranscriptionSessionCoordinator {

    private static final Logger LOG = LogManager.getLogger(DefaultTranscriptionSessionCoordinator.class);
    static final String MDC_SESSION_ID = "sessionId";

    private final SessionCommandQueue queue;
    private final SessionStateMachine stateMachine = new SessionStateMachine();
    private final RecognitionEventProcessor processor;
    private final BufferFlushScheduler flushScheduler;
    private final SessionSummarizer summarizer;
    private final TranscriptExporter exporter;
    private final SessionCollaborators collaborators;
    private final TranscriptionDiagnostics diagnostics;
    private final ApplicationEventPublisher publisher;
    private final Clock clock;

    private volatile TranscriptionSession current;
    private volatile SessionSummary lastSummary;

    /**
     * Constructs a coordinator.
     *
     * @throws NullPointerException if any parameter is null
     */
    public DefaultTranscriptionSessionCoordinator(SessionCommandQueue queue,
                                                  RecognitionEventProcessor processor,
                                                  BufferFlushScheduler flushScheduler,
                                                  SessionSummarizer summarizer,
                                                  TranscriptExporter exporter,
                                                  SessionCollaborators collaborators,
                                                  TranscriptionDiagnostics diagnostics,
                                                  ApplicationEventPublisher publisher,
                                                  Clock clock) {
        this.queue = Objects.requireNonNull(queue, "queue must not be null");
        this.processor = Objects.requireNonNull(processor, "processor must not be null");
        this.flushScheduler = Objects.requireNonNull(flushScheduler, "flushScheduler must not be null");
        this.summarizer = Objects.requireNonNull(summarizer, "summarizer must not be null");
        this.exporter = Objects.requireNonNull(exporter, "exporter must not be null");
        this.collaborators = Objects.requireNonNull(collaborators, "collaborators must not be null");
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics must not be null");
        this.publisher = Objects.requireNonNull(publisher, "publisher must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    // ---- lifecycle -------------------------------------------------------------------------

    @Override
    public SessionResult start() {
        return await(this::doStart);
    }

    private SessionResult doStart() {
        if (stateMachine.isActive()) {
            LOG.warn("start() ignored: session {} already active", stateMachine.getSessionId());
            return SessionResult.failure(SessionError.SESSION_ALREADY_ACTIVE);
        }
        if (!collaborators.getAuthorizer().isAuthorized()) {
            LOG.warn("start() refused: speech recognition not authorized");
            return SessionResult.failure(SessionError.NOT_AUTHORIZED);
        }
        Optional<CollaborationSession> context = collaborators.getDirectory().currentSession();
        if (context.isEmpty()) {
            LOG.warn("start() refused: no collaboration session open");
            return SessionResult.failure(SessionError.NO_ACTIVE_SESSION);
        }
        CollaborationSession room = context.get();
        try {
            collaborators.getAudioPipeline().start(room.id());
        } catch (AudioPipelineException e) {
            LOG.error("Audio pipeline failed to start for session {}: {}", room.id(), e.getReason(), e);
            return SessionResult.failure(SessionError.AUDIO_PIPELINE_FAILURE);
        }

        TranscriptionSession session = new TranscriptionSession(room.id(), room.roomName(), clock);
        for (Participant participant : room.participants()) {
            session.register(participant);
        }
        if (!stateMachine.activate(room.id())) {
            collaborators.getAudioPipeline().stop();
            return SessionResult.failure(SessionError.SESSION_ALREADY_ACTIVE);
        }
        current = session;
        lastSummary = null;
        collaborators.getAudioIntake().reset();
        flushScheduler.start(this::flushInterimBuffers);

        withSessionContext(session.sessionId(), () ->
                LOG.info("Transcription started for room '{}' with {} participant(s)",
                        room.roomName(), session.participants().size()));
        publisher.publishEvent(new SessionStartedEvent(session.sessionId(), session.roomName(),
                session.participantIds(), session.startedAt()));
        return SessionResult.ok(session.sessionId());
    }

    @Override
    public SessionResult stop() {
        return await(this::doStop);
    }

    private SessionResult doStop() {
        UUID stopped = stateMachine.stop();
        TranscriptionSession session = current;
        if (stopped == null || session == null) {
            UUID last = session == null ? null : session.sessionId();
            LOG.debug("stop() called with no active session; nothing to do (last session: {})", last);
            return SessionResult.ok(last);
        }
        flushScheduler.stop();
        try {
            collaborators.getAudioPipeline().stop();
        } catch (RuntimeException e) {
            LOG.warn("Audio pipeline failed to stop cleanly: {}", e.toString());
        }

        withSessionContext(stopped, () -> {
            drainAll(session);
            session.ledger().freeze();
            SessionSummary summary = summarizer.summarize(stopped, session.ledger().all(),
                    session.startedAt(), session.participantIds());
            lastSummary = summary;
            LOG.info("Transcription stopped: {} segment(s), {}s", session.ledger().size(),
                    String.format("%.1f", summary.totalDuration()));
            publisher.publishEvent(new SessionStoppedEvent(stopped, session.ledger().size(), session.now()));
            publisher.publishEvent(new SessionSummaryGeneratedEvent(summary));
        });
        return SessionResult.ok(stopped);
    }

    private void drainAll(TranscriptionSession session) {
        for (ParticipantState state : session.participants()) {
            processor.drainPending(session, state);
        }
        // interim slots written by remote peers have no local participant state
        SegmentLedger ledger = session.ledger();
        for (String participantId : ledger.activeParticipants()) {
            ledger.finalize(participantId).ifPresent(segment -> {
                diagnostics.incrementFinalized();
                publisher.publishEvent(new SegmentFinalizedEvent(segment, session.now()));
            });
        }
    }

    @Override
    public SessionResult pause(String participantId) {
        return await(() -> onActiveParticipant(participantId, (session, state) -> {
            if (!state.isMicEnabled()) {
                return SessionResult.ok(session.sessionId());
            }
            processor.drainPending(session, state);
            state.setMicEnabled(false);
            LOG.info("Paused transcription for {}", participantId);
            publisher.publishEvent(new TranscriptionPausedEvent(session.sessionId(), participantId, session.now()));
            return SessionResult.ok(session.sessionId());
        }));
    }

    @Override
    public SessionResult resume(String participantId) {
        return await(() -> onActiveParticipant(participantId, (session, state) -> {
            if (state.isMicEnabled()) {
                return SessionResult.ok(session.sessionId());
            }
            state.clearUtterance();
            state.setMicEnabled(true);
            LOG.info("Resumed transcription for {}", participantId);
            publisher.publishEvent(new TranscriptionResumedEvent(session.sessionId(), participantId, session.now()));
            return SessionResult.ok(session.sessionId());
        }));
    }

    private SessionResult onActiveParticipant(String participantId, ParticipantCommand command) {
        TranscriptionSession session = activeSession();
        if (session == null) {
            return SessionResult.failure(SessionError.NO_ACTIVE_SESSION);
        }
        Optional<ParticipantState> state = participantId == null
                ? Optional.empty()
                : session.participant(participantId);
        if (state.isEmpty()) {
            LOG.debug("Unknown participant {}", participantId);
            return SessionResult.failure(SessionError.UNKNOWN_PARTICIPANT);
        }
        return inSessionContext(session.sessionId(), () -> command.apply(session, state.get()));
    }

    // ---- event intake ----------------------------------------------------------------------

    @Override
    public void onPartial(String participantId, String text, double confidence) {
        queue.submit(() -> {
            TranscriptionSession session = activeSession();
            runInSession(session, () -> processor.onPartial(session, participantId, text, confidence));
        });
    }

    @Override
    public void onFinal(String participantId, String text, double confidence) {
        queue.submit(() -> {
            TranscriptionSession session = activeSession();
            runInSession(session, () -> processor.onFinal(session, participantId, text, confidence));
        });
    }

    @Override
    public void flushInterimBuffers() {
        queue.submit(() -> {
            TranscriptionSession session = activeSession();
            if (session != null) {
                withSessionContext(session.sessionId(), () -> flushScheduler.flush(session));
            }
        });
    }

    @Override
    public void ingestRemoteSegment(TranscriptionSegment segment) {
        Objects.requireNonNull(segment, "segment must not be null");
        queue.submit(() -> {
            TranscriptionSession session = activeSession();
            if (session == null) {
                diagnostics.record(DiagnosticKind.NO_ACTIVE_SESSION);
                return;
            }
            if (!session.sessionId().equals(segment.sessionId())) {
                diagnostics.record(DiagnosticKind.FOREIGN_SESSION);
                LOG.debug("Dropping remote segment {} for foreign session {}", segment.id(), segment.sessionId());
                return;
            }
            withSessionContext(session.sessionId(), () -> mergeRemote(session.ledger(), segment));
        });
    }

    private void mergeRemote(SegmentLedger ledger, TranscriptionSegment segment) {
        if (ledger.containsCommitted(segment.id())) {
            LOG.debug("Remote segment {} already committed; ignoring", segment.id());
            return;
        }
        String participantId = segment.participantId();
        if (!segment.isFinal()) {
            ledger.replaceActive(participantId, segment);
            return;
        }
        boolean replacesActive = ledger.activeSegment(participantId)
                .map(active -> active.id().equals(segment.id()))
                .orElse(false);
        if (replacesActive) {
            ledger.commit(participantId, segment);
        } else {
            ledger.append(segment);
        }
    }

    /**
     * Seeds state for a participant who joined the running session.
     */
    @EventListener
    public void onParticipantJoined(ParticipantJoinedEvent event) {
        queue.submit(() -> {
            TranscriptionSession session = activeSession();
            if (session != null && session.sessionId().equals(event.sessionId())) {
                session.register(event.participant());
                LOG.info("Participant {} joined session {}", event.participant().id(), session.sessionId());
            }
        });
    }

    /**
     * Finalizes and retires a participant who left the running session.
     */
    @EventListener
    public void onParticipantLeft(ParticipantLeftEvent event) {
        queue.submit(() -> {
            TranscriptionSession session = activeSession();
            if (session == null || !session.sessionId().equals(event.sessionId())) {
                return;
            }
            session.participant(event.participantId()).ifPresent(state ->
                    withSessionContext(session.sessionId(), () -> {
                        processor.drainPending(session, state);
                        session.retire(event.participantId());
                        collaborators.getAudioIntake().forget(event.participantId());
                        LOG.info("Participant {} left session {}", event.participantId(), session.sessionId());
                    }));
        });
    }

    // ---- queries ---------------------------------------------------------------------------

    @Override
    public SessionState state() {
        return stateMachine.getState();
    }

    @Override
    public Optional<UUID> currentSessionId() {
        TranscriptionSession session = current;
        return session == null ? Optional.empty() : Optional.of(session.sessionId());
    }

    @Override
    public List<String> participantIds() {
        return await(() -> {
            TranscriptionSession session = current;
            return session == null ? List.<String>of() : session.participantIds();
        });
    }

    @Override
    public boolean isMicEnabled(String participantId) {
        return await(() -> {
            TranscriptionSession session = current;
            return session != null && session.participant(participantId)
                    .map(ParticipantState::isMicEnabled)
                    .orElse(false);
        });
    }

    @Override
    public Optional<String> interimBuffer(String participantId) {
        return await(() -> {
            TranscriptionSession session = current;
            return session == null
                    ? Optional.<String>empty()
                    : session.participant(participantId).map(ParticipantState::interimBuffer);
        });
    }

    @Override
    public List<TranscriptionSegment> segments() {
        TranscriptionSession session = current;
        return session == null ? List.of() : session.ledger().all();
    }

    @Override
    public List<TranscriptionSegment> query(SegmentQuery query) {
        Objects.requireNonNull(query, "query must not be null");
        TranscriptionSession session = current;
        return session == null ? List.of() : session.ledger().query(query);
    }

    @Override
    public List<TranscriptionSegment> segmentsFor(String participantId) {
        return query(SegmentQuery.builder().participants(Set.of(participantId)).build());
    }

    @Override
    public List<TranscriptionSegment> segmentsBetween(double start, double end) {
        if (end < start) {
            throw new IllegalArgumentException("end must not precede start, got: " + start + ".." + end);
        }
        return query(SegmentQuery.builder().from(start).to(end).build());
    }

    @Override
    public List<TranscriptionSegment> search(String text) {
        return query(SegmentQuery.builder().text(text).build());
    }

    @Override
    public String export(ExportFormat format) {
        return exporter.export(segments(), format);
    }

    @Override
    public Optional<SessionSummary> lastSummary() {
        return Optional.ofNullable(lastSummary);
    }

    public TranscriptionDiagnostics diagnostics() {
        return diagnostics;
    }

    // ---- helpers ---------------------------------------------------------------------------

    private TranscriptionSession activeSession() {
        TranscriptionSession session = current;
        if (session == null || !stateMachine.isSessionActive(session.sessionId())) {
            return null;
        }
        return session;
    }

    private void runInSession(TranscriptionSession session, Runnable command) {
        if (session == null) {
            command.run();
            return;
        }
        withSessionContext(session.sessionId(), command);
    }

    private static void withSessionContext(UUID sessionId, Runnable command) {
        inSessionContext(sessionId, () -> {
            command.run();
            return null;
        });
    }

    private static <T> T inSessionContext(UUID sessionId, Supplier<T> command) {
        String previous = ThreadContext.get(MDC_SESSION_ID);
        ThreadContext.put(MDC_SESSION_ID, sessionId.toString());
        try {
            return command.get();
        } finally {
            if (previous == null) {
                ThreadContext.remove(MDC_SESSION_ID);
            } else {
                ThreadContext.put(MDC_SESSION_ID, previous);
            }
        }
    }

    private <T> T await(Supplier<T> command) {
        try {
            return queue.call(command).join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
    }

    @FunctionalInterface
    private interface ParticipantCommand {
        SessionResult apply(TranscriptionSession session, ParticipantState state);
    }
}
