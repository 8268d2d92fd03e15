package com.phillippitts.collabscribe.service.orchestration;

import com.phillippitts.collabscribe.domain.ExportFormat;
import com.phillippitts.collabscribe.domain.Participant;
import com.phillippitts.collabscribe.domain.SessionSummary;
import com.phillippitts.collabscribe.domain.TranscriptionSegment;
import com.phillippitts.collabscribe.exception.AudioPipelineException;
import com.phillippitts.collabscribe.service.audio.AudioIntakeService;
import com.phillippitts.collabscribe.service.audio.AudioPipeline;
import com.phillippitts.collabscribe.service.export.SegmentJsonCodec;
import com.phillippitts.collabscribe.service.export.TranscriptExporter;
import com.phillippitts.collabscribe.service.flush.BufferFlushScheduler;
import com.phillippitts.collabscribe.service.metrics.DiagnosticKind;
import com.phillippitts.collabscribe.service.metrics.TranscriptionDiagnostics;
import com.phillippitts.collabscribe.service.quality.QualityMonitor;
import com.phillippitts.collabscribe.service.quality.ThresholdQualityClassifier;
import com.phillippitts.collabscribe.service.recognition.RecognitionEventProcessor;
import com.phillippitts.collabscribe.service.roster.InMemorySessionDirectory;
import com.phillippitts.collabscribe.service.roster.ParticipantJoinedEvent;
import com.phillippitts.collabscribe.service.roster.ParticipantLeftEvent;
import com.phillippitts.collabscribe.service.session.SegmentAssembler;
import com.phillippitts.collabscribe.service.session.SessionCommandQueue;
import com.phillippitts.collabscribe.service.session.SessionError;
import com.phillippitts.collabscribe.service.session.SessionResult;
import com.phillippitts.collabscribe.service.session.SessionState;
import com.phillippitts.collabscribe.service.session.event.InterimSegmentFlushedEvent;
import com.phillippitts.collabscribe.service.session.event.SegmentFinalizedEvent;
import com.phillippitts.collabscribe.service.session.event.SessionStartedEvent;
import com.phillippitts.collabscribe.service.session.event.SessionStoppedEvent;
import com.phillippitts.collabscribe.service.session.event.SessionSummaryGeneratedEvent;
import com.phillippitts.collabscribe.service.session.event.TranscriptionPausedEvent;
import com.phillippitts.collabscribe.service.session.event.TranscriptionResumedEvent;
import com.phillippitts.collabscribe.service.speaker.SimpleVoiceFeatureExtractor;
import com.phillippitts.collabscribe.service.speaker.SpeakerProfileMatcher;
import com.phillippitts.collabscribe.service.summary.SessionSummarizer;
import com.phillippitts.collabscribe.testutil.EventCapturingPublisher;
import com.phillippitts.collabscribe.testutil.MutableClock;
import com.phillippitts.collabscribe.testutil.SyncExecutor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

/**
 * Unit tests for {@link DefaultTranscriptionSessionCoordinator}.
 *
 * <p>Commands run synchronously on the caller through {@link SyncExecutor}; the flush timer is a
 * mock, so ticks are driven explicitly with {@code flushInterimBuffers()}.
 */
class DefaultTranscriptionSessionCoordinatorTest {

    private MutableClock clock;
    private EventCapturingPublisher publisher;
    private TranscriptionDiagnostics diagnostics;
    private InMemorySessionDirectory directory;
    private TaskScheduler taskScheduler;
    private AudioPipeline audioPipeline;
    private boolean authorized;
    private DefaultTranscriptionSessionCoordinator coordinator;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-03-02T10:00:00Z");
        publisher = new EventCapturingPublisher();
        diagnostics = TranscriptionDiagnostics.inMemory();
        directory = new InMemorySessionDirectory(publisher, clock);
        taskScheduler = mock(TaskScheduler.class);
        audioPipeline = mock(AudioPipeline.class);
        authorized = true;

        SegmentAssembler assembler = new SegmentAssembler("en-US", 0.8);
        QualityMonitor qualityMonitor = new QualityMonitor(100, new ThresholdQualityClassifier(),
                publisher, diagnostics, clock);
        AudioIntakeService audioIntake = new AudioIntakeService(qualityMonitor,
                new SpeakerProfileMatcher(3, 0.7, diagnostics), new SimpleVoiceFeatureExtractor(), publisher, clock);
        SessionCollaborators collaborators =
                new SessionCollaborators(() -> authorized, audioPipeline, directory, audioIntake);

        coordinator = new DefaultTranscriptionSessionCoordinator(
                new SessionCommandQueue(new SyncExecutor()),
                new RecognitionEventProcessor(assembler, diagnostics, publisher),
                new BufferFlushScheduler(taskScheduler, Duration.ofSeconds(1), assembler, diagnostics, publisher),
                new SessionSummarizer(clock),
                new TranscriptExporter(new SegmentJsonCodec()),
                collaborators,
                diagnostics,
                publisher,
                clock);
    }

    private UUID openRoomAndStart() {
        directory.open("Design review", List.of(new Participant("alice", "Alice"), new Participant("bob", "Bob")));
        SessionResult result = coordinator.start();
        assertThat(result.isSuccess()).isTrue();
        return result.sessionId();
    }

    private void advanceSeconds(long seconds) {
        clock.advance(Duration.ofSeconds(seconds));
    }

    // ---- start -----------------------------------------------------------------------------

    @Test
    void shouldStartSessionForOpenRoom() {
        UUID roomId = directory.open("Design review",
                List.of(new Participant("alice", "Alice"), new Participant("bob", "Bob"))).id();

        SessionResult result = coordinator.start();

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.sessionId()).isEqualTo(roomId);
        assertThat(coordinator.state()).isEqualTo(SessionState.ACTIVE);
        assertThat(coordinator.participantIds()).containsExactly("alice", "bob");
        assertThat(coordinator.isMicEnabled("alice")).isTrue();
        assertThat(coordinator.segments()).isEmpty();
        assertThat(publisher.eventsOf(SessionStartedEvent.class)).hasSize(1);
        verify(audioPipeline).start(roomId);
        verify(taskScheduler).scheduleAtFixedRate(any(Runnable.class), eq(Duration.ofSeconds(1)));
    }

    @Test
    void shouldRejectSecondStartWhileActive() {
        openRoomAndStart();

        SessionResult second = coordinator.start();

        assertThat(second.isSuccess()).isFalse();
        assertThat(second.error()).isEqualTo(SessionError.SESSION_ALREADY_ACTIVE);
        assertThat(coordinator.state()).isEqualTo(SessionState.ACTIVE);
    }

    @Test
    void shouldReportNotAuthorizedWithoutTouchingPipeline() {
        directory.open("Design review", List.of(new Participant("alice", "Alice")));
        authorized = false;

        SessionResult result = coordinator.start();

        assertThat(result.error()).isEqualTo(SessionError.NOT_AUTHORIZED);
        assertThat(result.message()).isEqualTo("Speech recognition not authorized");
        assertThat(coordinator.state()).isEqualTo(SessionState.IDLE);
        verify(audioPipeline, never()).start(any());
    }

    @Test
    void shouldReportNoActiveSessionWhenNoRoomIsOpen() {
        SessionResult result = coordinator.start();

        assertThat(result.error()).isEqualTo(SessionError.NO_ACTIVE_SESSION);
        assertThat(coordinator.state()).isEqualTo(SessionState.IDLE);
    }

    @Test
    void shouldReportAudioPipelineFailureAndStayIdle() {
        directory.open("Design review", List.of(new Participant("alice", "Alice")));
        doThrow(new AudioPipelineException("device busy")).when(audioPipeline).start(any());

        SessionResult result = coordinator.start();

        assertThat(result.error()).isEqualTo(SessionError.AUDIO_PIPELINE_FAILURE);
        assertThat(coordinator.state()).isEqualTo(SessionState.IDLE);
        assertThat(publisher.eventsOf(SessionStartedEvent.class)).isEmpty();
    }

    // ---- recognition flow ------------------------------------------------------------------

    @Test
    void shouldReplaceInterimWithSingleFinalSegment() {
        openRoomAndStart();
        advanceSeconds(2);
        coordinator.onPartial("alice", "I think", 0.8);
        advanceSeconds(1);

        coordinator.flushInterimBuffers();

        List<TranscriptionSegment> afterFlush = coordinator.segments();
        assertThat(afterFlush).hasSize(1);
        TranscriptionSegment interim = afterFlush.get(0);
        assertThat(interim.isFinal()).isFalse();
        assertThat(interim.content()).isEqualTo("I think");
        assertThat(interim.confidence()).isEqualTo(0.8);
        assertThat(publisher.eventsOf(InterimSegmentFlushedEvent.class)).hasSize(1);

        advanceSeconds(2);
        coordinator.onFinal("alice", "I think we should proceed", 0.93);

        List<TranscriptionSegment> afterFinal = coordinator.segments();
        assertThat(afterFinal).hasSize(1);
        TranscriptionSegment committed = afterFinal.get(0);
        assertThat(committed.isFinal()).isTrue();
        assertThat(committed.content()).isEqualTo("I think we should proceed");
        assertThat(committed.confidence()).isEqualTo(0.93);
        assertThat(committed.id()).isEqualTo(interim.id());
        assertThat(committed.startTime()).isEqualTo(2.0);
        assertThat(committed.endTime()).isEqualTo(5.0);
        assertThat(committed.participantName()).isEqualTo("Alice");
        assertThat(coordinator.interimBuffer("alice")).contains("");
        assertThat(publisher.eventsOf(SegmentFinalizedEvent.class))
                .extracting(SegmentFinalizedEvent::segment)
                .containsExactly(committed);
    }

    @Test
    void shouldKeepAtMostOneInterimSegmentPerParticipant() {
        openRoomAndStart();

        for (int i = 1; i <= 5; i++) {
            advanceSeconds(1);
            coordinator.onPartial("alice", "word ".repeat(i).trim(), 0.5);
            coordinator.flushInterimBuffers();

            List<TranscriptionSegment> interims = coordinator.segmentsFor("alice").stream()
                    .filter(segment -> !segment.isFinal())
                    .toList();
            assertThat(interims).hasSize(1);
            assertThat(interims.get(0).content()).isEqualTo("word ".repeat(i).trim());
        }
    }

    @Test
    void shouldStartFinalWithoutPartialAtNow() {
        openRoomAndStart();
        advanceSeconds(7);

        coordinator.onFinal("bob", "Agreed", 0.9);

        TranscriptionSegment segment = coordinator.segments().get(0);
        assertThat(segment.startTime()).isEqualTo(7.0);
        assertThat(segment.endTime()).isEqualTo(7.0);
    }

    @Test
    void shouldOrderOverlappingSpeakersByStartTime() {
        openRoomAndStart();
        advanceSeconds(10);
        coordinator.onPartial("bob", "Let me", 0.7);
        advanceSeconds(1);
        coordinator.onPartial("alice", "Sure", 0.7);
        advanceSeconds(1);
        coordinator.onFinal("bob", "Let me check the numbers", 0.9);
        advanceSeconds(1);
        coordinator.onFinal("alice", "Sure, go ahead", 0.85);

        List<TranscriptionSegment> all = coordinator.segments();

        assertThat(all).extracting(TranscriptionSegment::participantId).containsExactly("bob", "alice");
        assertThat(all).extracting(TranscriptionSegment::startTime).containsExactly(10.0, 11.0);
        assertThat(all).extracting(TranscriptionSegment::endTime).containsExactly(12.0, 13.0);
    }

    @Test
    void shouldDropEventsForUnknownParticipant() {
        openRoomAndStart();

        coordinator.onFinal("mallory", "hello", 0.9);

        assertThat(coordinator.segments()).isEmpty();
        assertThat(diagnostics.count(DiagnosticKind.UNKNOWN_PARTICIPANT)).isEqualTo(1);
    }

    @Test
    void shouldDropBlankText() {
        openRoomAndStart();

        coordinator.onPartial("alice", "   ", 0.9);
        coordinator.onFinal("alice", "", 0.9);

        assertThat(coordinator.segments()).isEmpty();
        assertThat(diagnostics.count(DiagnosticKind.EMPTY_TEXT)).isEqualTo(2);
    }

    @Test
    void shouldClampOutOfRangeConfidence() {
        openRoomAndStart();

        coordinator.onFinal("alice", "Loud and clear", 1.4);

        assertThat(coordinator.segments().get(0).confidence()).isEqualTo(1.0);
        assertThat(diagnostics.count(DiagnosticKind.CONFIDENCE_CLAMPED)).isEqualTo(1);
    }

    @Test
    void shouldDropEventsWhenNoSessionIsActive() {
        coordinator.onFinal("alice", "too early", 0.9);

        assertThat(coordinator.segments()).isEmpty();
        assertThat(diagnostics.count(DiagnosticKind.NO_ACTIVE_SESSION)).isEqualTo(1);
    }

    // ---- pause / resume --------------------------------------------------------------------

    @Test
    void shouldDropFinalForPausedParticipant() {
        openRoomAndStart();

        SessionResult paused = coordinator.pause("bob");
        coordinator.onFinal("bob", "ignored", 0.9);

        assertThat(paused.isSuccess()).isTrue();
        assertThat(coordinator.segmentsFor("bob")).isEmpty();
        assertThat(coordinator.isMicEnabled("bob")).isFalse();
        assertThat(diagnostics.count(DiagnosticKind.MIC_DISABLED)).isEqualTo(1);
        assertThat(publisher.eventsOf(TranscriptionPausedEvent.class))
                .extracting(TranscriptionPausedEvent::participantId)
                .containsExactly("bob");
    }

    @Test
    void shouldFinalizePendingUtteranceOnPause() {
        openRoomAndStart();
        advanceSeconds(1);
        coordinator.onPartial("alice", "before the break", 0.6);
        advanceSeconds(1);

        coordinator.pause("alice");

        List<TranscriptionSegment> alice = coordinator.segmentsFor("alice");
        assertThat(alice).hasSize(1);
        assertThat(alice.get(0).isFinal()).isTrue();
        assertThat(alice.get(0).content()).isEqualTo("before the break");
        assertThat(coordinator.interimBuffer("alice")).contains("");
    }

    @Test
    void shouldResumeWithEmptyBuffer() {
        openRoomAndStart();
        coordinator.pause("alice");

        SessionResult resumed = coordinator.resume("alice");
        coordinator.onPartial("alice", "fresh start", 0.7);

        assertThat(resumed.isSuccess()).isTrue();
        assertThat(coordinator.isMicEnabled("alice")).isTrue();
        assertThat(coordinator.interimBuffer("alice")).contains("fresh start");
        assertThat(publisher.eventsOf(TranscriptionResumedEvent.class)).hasSize(1);
    }

    @Test
    void shouldKeepOpenUtteranceWhenResumingEnabledMic() {
        openRoomAndStart();
        coordinator.onPartial("alice", "hello there", 0.7);
        advanceSeconds(2);
        coordinator.flushInterimBuffers();
        TranscriptionSegment interim = coordinator.segmentsFor("alice").get(0);

        SessionResult resumed = coordinator.resume("alice");
        advanceSeconds(5);
        coordinator.stop();

        assertThat(resumed.isSuccess()).isTrue();
        assertThat(publisher.eventsOf(TranscriptionResumedEvent.class)).isEmpty();
        assertThat(coordinator.segmentsFor("alice"))
                .singleElement()
                .satisfies(segment -> {
                    assertThat(segment.isFinal()).isTrue();
                    assertThat(segment.id()).isEqualTo(interim.id());
                    assertThat(segment.startTime()).isEqualTo(0.0);
                    assertThat(segment.endTime()).isEqualTo(7.0);
                    assertThat(segment.content()).isEqualTo("hello there");
                });
    }

    @Test
    void shouldReportUnknownParticipantOnPause() {
        openRoomAndStart();

        assertThat(coordinator.pause("mallory").error()).isEqualTo(SessionError.UNKNOWN_PARTICIPANT);
    }

    @Test
    void shouldReportNoActiveSessionOnPauseWhenIdle() {
        assertThat(coordinator.pause("alice").error()).isEqualTo(SessionError.NO_ACTIVE_SESSION);
        assertThat(coordinator.resume("alice").error()).isEqualTo(SessionError.NO_ACTIVE_SESSION);
    }

    // ---- stop ------------------------------------------------------------------------------

    @Test
    void shouldForceFinalizeBufferedTextOnStop() {
        openRoomAndStart();
        advanceSeconds(3);
        coordinator.onPartial("alice", "unfinished thought", 0.6);
        advanceSeconds(1);

        SessionResult stopped = coordinator.stop();

        assertThat(stopped.isSuccess()).isTrue();
        List<TranscriptionSegment> alice = coordinator.segmentsFor("alice");
        assertThat(alice).hasSize(1);
        assertThat(alice.get(0).isFinal()).isTrue();
        assertThat(alice.get(0).content()).isEqualTo("unfinished thought");
        assertThat(alice.get(0).startTime()).isEqualTo(3.0);
        assertThat(alice.get(0).confidence()).isEqualTo(0.8);
    }

    @Test
    void shouldFinalizeLatestBufferRatherThanStaleInterimOnStop() {
        openRoomAndStart();
        coordinator.onPartial("alice", "we could", 0.6);
        coordinator.flushInterimBuffers();
        coordinator.onPartial("alice", "we could ship friday", 0.6);

        coordinator.stop();

        assertThat(coordinator.segments())
                .singleElement()
                .satisfies(segment -> {
                    assertThat(segment.isFinal()).isTrue();
                    assertThat(segment.content()).isEqualTo("we could ship friday");
                });
    }

    @Test
    void shouldFreezeTranscriptAndSummarizeOnStop() {
        UUID sessionId = openRoomAndStart();
        advanceSeconds(1);
        coordinator.onPartial("bob", "one two", 0.9);
        advanceSeconds(2);
        coordinator.onFinal("bob", "one two three", 0.9);
        advanceSeconds(5);

        coordinator.stop();
        coordinator.onFinal("bob", "after stop", 0.9);

        assertThat(coordinator.state()).isEqualTo(SessionState.STOPPED);
        assertThat(coordinator.segments()).hasSize(1);
        assertThat(diagnostics.count(DiagnosticKind.NO_ACTIVE_SESSION)).isEqualTo(1);
        verify(audioPipeline).stop();

        SessionSummary summary = coordinator.lastSummary().orElseThrow();
        assertThat(summary.sessionId()).isEqualTo(sessionId);
        assertThat(summary.totalDuration()).isCloseTo(8.0, within(1e-9));
        assertThat(summary.statsFor("bob").wordCount()).isEqualTo(3);
        assertThat(summary.statsFor("bob").totalSpeakingTime()).isCloseTo(2.0, within(1e-9));
        assertThat(summary.participantStats()).containsKeys("alice", "bob");
        assertThat(summary.statsFor("alice").segmentCount()).isZero();
        assertThat(publisher.eventsOf(SessionStoppedEvent.class)).hasSize(1);
        assertThat(publisher.eventsOf(SessionSummaryGeneratedEvent.class)).hasSize(1);
    }

    @Test
    void shouldTreatStopWhenIdleAsSuccessfulNoOp() {
        SessionResult result = coordinator.stop();

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.sessionId()).isNull();
        assertThat(coordinator.state()).isEqualTo(SessionState.IDLE);
        assertThat(publisher.eventsOf(SessionStoppedEvent.class)).isEmpty();
    }

    @Test
    void shouldReturnLastSessionIdWhenStoppingTwice() {
        UUID sessionId = openRoomAndStart();
        coordinator.stop();

        SessionResult again = coordinator.stop();

        assertThat(again.isSuccess()).isTrue();
        assertThat(again.sessionId()).isEqualTo(sessionId);
        assertThat(coordinator.state()).isEqualTo(SessionState.STOPPED);
        assertThat(publisher.eventsOf(SessionStoppedEvent.class)).hasSize(1);
        assertThat(publisher.eventsOf(SessionSummaryGeneratedEvent.class)).hasSize(1);
    }

    @Test
    void shouldStartFreshSessionAfterStop() {
        openRoomAndStart();
        coordinator.onFinal("alice", "first meeting", 0.9);
        coordinator.stop();
        UUID nextRoom = directory.open("Follow-up", List.of(new Participant("carol", "Carol"))).id();

        SessionResult restarted = coordinator.start();

        assertThat(restarted.sessionId()).isEqualTo(nextRoom);
        assertThat(coordinator.state()).isEqualTo(SessionState.ACTIVE);
        assertThat(coordinator.segments()).isEmpty();
        assertThat(coordinator.participantIds()).containsExactly("carol");
        assertThat(coordinator.lastSummary()).isEmpty();
    }

    // ---- roster ----------------------------------------------------------------------------

    @Test
    void shouldSeedParticipantWhoJoinsMidSession() {
        openRoomAndStart();
        directory.join(new Participant("carol", "Carol"));
        ParticipantJoinedEvent joined = publisher.eventsOf(ParticipantJoinedEvent.class).get(0);

        coordinator.onParticipantJoined(joined);
        coordinator.onFinal("carol", "Sorry I'm late", 0.9);

        assertThat(coordinator.participantIds()).containsExactly("alice", "bob", "carol");
        assertThat(coordinator.segmentsFor("carol")).hasSize(1);
    }

    @Test
    void shouldFinalizeAndRetireParticipantWhoLeaves() {
        openRoomAndStart();
        coordinator.onPartial("alice", "I have to drop", 0.7);
        directory.leave("alice");
        ParticipantLeftEvent left = publisher.eventsOf(ParticipantLeftEvent.class).get(0);

        coordinator.onParticipantLeft(left);
        coordinator.onFinal("alice", "late event", 0.9);

        assertThat(coordinator.participantIds()).containsExactly("bob");
        assertThat(coordinator.segmentsFor("alice"))
                .extracting(TranscriptionSegment::content)
                .containsExactly("I have to drop");
        assertThat(diagnostics.count(DiagnosticKind.UNKNOWN_PARTICIPANT)).isEqualTo(1);
    }

    // ---- remote segments -------------------------------------------------------------------

    private TranscriptionSegment remote(UUID sessionId, UUID id, double start, double end, boolean isFinal) {
        return new TranscriptionSegment(id, "dave", "Dave", "remote words", start, end, 0.9, isFinal,
                "en-US", clock.instant(), sessionId);
    }

    @Test
    void shouldMergeLateRemoteSegmentInStartTimeOrder() {
        UUID sessionId = openRoomAndStart();
        advanceSeconds(5);
        coordinator.onFinal("alice", "local words", 0.9);

        coordinator.ingestRemoteSegment(remote(sessionId, UUID.randomUUID(), 1.0, 2.0, true));

        assertThat(coordinator.segments())
                .extracting(TranscriptionSegment::participantId)
                .containsExactly("dave", "alice");
    }

    @Test
    void shouldIgnoreDuplicateRemoteFinal() {
        UUID sessionId = openRoomAndStart();
        TranscriptionSegment segment = remote(sessionId, UUID.randomUUID(), 1.0, 2.0, true);

        coordinator.ingestRemoteSegment(segment);
        coordinator.ingestRemoteSegment(segment);

        assertThat(coordinator.segments()).hasSize(1);
    }

    @Test
    void shouldCommitRemoteInterimWhenItsFinalArrives() {
        UUID sessionId = openRoomAndStart();
        UUID utterance = UUID.randomUUID();

        coordinator.ingestRemoteSegment(remote(sessionId, utterance, 1.0, 1.5, false));
        coordinator.ingestRemoteSegment(remote(sessionId, utterance, 1.0, 3.0, true));

        assertThat(coordinator.segments())
                .singleElement()
                .satisfies(segment -> {
                    assertThat(segment.isFinal()).isTrue();
                    assertThat(segment.endTime()).isEqualTo(3.0);
                });
    }

    @Test
    void shouldFinalizeDanglingRemoteInterimOnStop() {
        UUID sessionId = openRoomAndStart();
        coordinator.ingestRemoteSegment(remote(sessionId, UUID.randomUUID(), 1.0, 1.5, false));

        coordinator.stop();

        assertThat(coordinator.segments()).singleElement().matches(TranscriptionSegment::isFinal);
    }

    @Test
    void shouldDropRemoteSegmentFromForeignSession() {
        openRoomAndStart();

        coordinator.ingestRemoteSegment(remote(UUID.randomUUID(), UUID.randomUUID(), 1.0, 2.0, true));

        assertThat(coordinator.segments()).isEmpty();
        assertThat(diagnostics.count(DiagnosticKind.FOREIGN_SESSION)).isEqualTo(1);
    }

    // ---- queries and export ----------------------------------------------------------------

    @Test
    void shouldAnswerConvenienceQueries() {
        openRoomAndStart();
        advanceSeconds(1);
        coordinator.onFinal("alice", "Budget review first", 0.9);
        advanceSeconds(10);
        coordinator.onPartial("bob", "Then the", 0.9);
        advanceSeconds(2);
        coordinator.onFinal("bob", "Then the roadmap", 0.6);

        assertThat(coordinator.segmentsFor("bob")).extracting(TranscriptionSegment::content)
                .containsExactly("Then the roadmap");
        assertThat(coordinator.segmentsBetween(0.0, 5.0)).extracting(TranscriptionSegment::participantId)
                .containsExactly("alice");
        assertThat(coordinator.search("ROADMAP")).hasSize(1);
        assertThat(coordinator.search("alice")).hasSize(1);
        assertThat(coordinator.search(" ")).hasSize(2);
    }

    @Test
    void shouldExportCurrentTranscript() {
        openRoomAndStart();
        advanceSeconds(65);
        coordinator.onFinal("alice", "Hello everyone", 0.9);

        String text = coordinator.export(ExportFormat.TEXT);

        assertThat(text).isEqualTo("# Collaboration Session Transcription\n\n[01:05] **Alice**: Hello everyone\n\n");
    }
}
