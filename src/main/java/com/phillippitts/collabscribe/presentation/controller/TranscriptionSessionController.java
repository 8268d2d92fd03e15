package com.phillippitts.collabscribe.presentation.controller;

import com.phillippitts.collabscribe.domain.CollaborationSession;
import com.phillippitts.collabscribe.domain.ExportFormat;
import com.phillippitts.collabscribe.domain.Participant;
import com.phillippitts.collabscribe.domain.SessionSummary;
import com.phillippitts.collabscribe.domain.TranscriptionSegment;
import com.phillippitts.collabscribe.exception.NoActiveSessionException;
import com.phillippitts.collabscribe.presentation.dto.AudioSampleRequest;
import com.phillippitts.collabscribe.presentation.dto.OpenRoomRequest;
import com.phillippitts.collabscribe.presentation.dto.ParticipantRequest;
import com.phillippitts.collabscribe.presentation.dto.RecognitionEventRequest;
import com.phillippitts.collabscribe.service.audio.AudioIntakeService;
import com.phillippitts.collabscribe.service.export.SegmentJsonCodec;
import com.phillippitts.collabscribe.service.ledger.SegmentQuery;
import com.phillippitts.collabscribe.service.orchestration.TranscriptionSessionCoordinator;
import com.phillippitts.collabscribe.service.quality.QualityMonitor;
import com.phillippitts.collabscribe.service.roster.InMemorySessionDirectory;
import com.phillippitts.collabscribe.service.session.SessionResult;
import jakarta.validation.Valid;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * REST adapter over the transcription core.
 *
 * <p>Recognition and audio intake return 202: events are queued, not applied, when the call
 * returns. Lifecycle calls map {@link SessionResult} failures onto HTTP statuses.
 */
@RestController
@RequestMapping("/api/session")
class TranscriptionSessionController {

    private static final Logger LOG = LogManager.getLogger(TranscriptionSessionController.class);

    private final TranscriptionSessionCoordinator coordinator;
    private final InMemorySessionDirectory directory;
    private final AudioIntakeService audioIntake;
    private final QualityMonitor qualityMonitor;
    private final SegmentJsonCodec jsonCodec;

    TranscriptionSessionController(TranscriptionSessionCoordinator coordinator,
                                   InMemorySessionDirectory directory,
                                   AudioIntakeService audioIntake,
                                   QualityMonitor qualityMonitor,
                                   SegmentJsonCodec jsonCodec) {
        this.coordinator = coordinator;
        this.directory = directory;
        this.audioIntake = audioIntake;
        this.qualityMonitor = qualityMonitor;
        this.jsonCodec = jsonCodec;
    }

    // ---- room and roster -------------------------------------------------------------------

    @PostMapping("/room")
    ResponseEntity<CollaborationSession> openRoom(@Valid @RequestBody OpenRoomRequest request) {
        List<Participant> participants = request.participants().stream()
                .map(ParticipantRequest::toParticipant)
                .toList();
        CollaborationSession room = directory.open(request.name(), participants);
        return ResponseEntity.status(HttpStatus.CREATED).body(room);
    }

    @PostMapping("/room/participants")
    ResponseEntity<Void> join(@Valid @RequestBody ParticipantRequest request) {
        if (!directory.join(request.toParticipant())) {
            throw new NoActiveSessionException("join");
        }
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping("/room/participants/{participantId}")
    ResponseEntity<Void> leave(@PathVariable String participantId) {
        return directory.leave(participantId)
                ? ResponseEntity.noContent().build()
                : ResponseEntity.notFound().build();
    }

    // ---- lifecycle -------------------------------------------------------------------------

    @PostMapping("/start")
    ResponseEntity<Map<String, Object>> start() {
        return toResponse(coordinator.start());
    }

    @PostMapping("/stop")
    ResponseEntity<Map<String, Object>> stop() {
        return toResponse(coordinator.stop());
    }

    @PostMapping("/participants/{participantId}/pause")
    ResponseEntity<Map<String, Object>> pause(@PathVariable String participantId) {
        return toResponse(coordinator.pause(participantId));
    }

    @PostMapping("/participants/{participantId}/resume")
    ResponseEntity<Map<String, Object>> resume(@PathVariable String participantId) {
        return toResponse(coordinator.resume(participantId));
    }

    // ---- intake ----------------------------------------------------------------------------

    @PostMapping("/recognition")
    ResponseEntity<Void> recognition(@Valid @RequestBody RecognitionEventRequest event) {
        if (event.finalResult()) {
            coordinator.onFinal(event.participantId(), event.text(), event.confidence());
        } else {
            coordinator.onPartial(event.participantId(), event.text(), event.confidence());
        }
        return ResponseEntity.accepted().build();
    }

    @PostMapping("/audio")
    ResponseEntity<Void> audio(@Valid @RequestBody AudioSampleRequest sample) {
        if (sample.samples() != null) {
            audioIntake.onAudioFrame(sample.participantId(), sample.samples());
        } else if (sample.levelDb() != null) {
            audioIntake.onAudioSample(sample.participantId(), sample.levelDb(), sample.features());
        } else {
            throw new IllegalArgumentException("Audio sample needs either levelDb or samples");
        }
        return ResponseEntity.accepted().build();
    }

    @PostMapping(path = "/segments/remote", consumes = MediaType.APPLICATION_JSON_VALUE)
    ResponseEntity<Void> ingestRemote(@RequestBody String body) {
        List<TranscriptionSegment> segments = jsonCodec.read(body);
        segments.forEach(coordinator::ingestRemoteSegment);
        LOG.debug("Queued {} remote segment(s)", segments.size());
        return ResponseEntity.accepted().build();
    }

    // ---- queries ---------------------------------------------------------------------------

    @GetMapping(path = "/segments", produces = MediaType.APPLICATION_JSON_VALUE)
    ResponseEntity<String> segments(@RequestParam(required = false) String q,
                                    @RequestParam(required = false) Double from,
                                    @RequestParam(required = false) Double to,
                                    @RequestParam(required = false) Set<String> participant,
                                    @RequestParam(required = false) Double minConfidence,
                                    @RequestParam(defaultValue = "false") boolean finalOnly) {
        requireSession("segments");
        SegmentQuery query = SegmentQuery.builder()
                .text(q)
                .from(from)
                .to(to)
                .participants(participant)
                .minConfidence(minConfidence)
                .finalOnly(finalOnly)
                .build();
        return ResponseEntity.ok(jsonCodec.write(coordinator.query(query)));
    }

    @GetMapping("/export")
    ResponseEntity<String> export(@RequestParam(defaultValue = "text") String format) {
        ExportFormat exportFormat = ExportFormat.fromName(format);
        requireSession("export");
        MediaType type = exportFormat == ExportFormat.JSON ? MediaType.APPLICATION_JSON : MediaType.TEXT_PLAIN;
        return ResponseEntity.ok().contentType(type).body(coordinator.export(exportFormat));
    }

    @GetMapping("/summary")
    ResponseEntity<SessionSummary> summary() {
        return coordinator.lastSummary()
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/quality")
    ResponseEntity<Map<String, Object>> quality() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("tier", qualityMonitor.currentTier().name());
        body.put("samples", qualityMonitor.sampleCount());
        if (qualityMonitor.sampleCount() > 0) {
            body.put("averageLevelDb", qualityMonitor.averageLevel());
        }
        return ResponseEntity.ok(body);
    }

    private void requireSession(String operation) {
        if (coordinator.currentSessionId().isEmpty()) {
            throw new NoActiveSessionException(operation);
        }
    }

    private static ResponseEntity<Map<String, Object>> toResponse(SessionResult result) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", result.isSuccess());
        body.put("message", result.message());
        if (result.isSuccess()) {
            // idle stop succeeds without a session id when no session has run yet
            body.put("sessionId", result.sessionId() == null ? null : result.sessionId().toString());
            return ResponseEntity.ok(body);
        }
        body.put("error", result.error().name());
        HttpStatus status = switch (result.error()) {
            case NOT_AUTHORIZED -> HttpStatus.FORBIDDEN;
            case AUDIO_PIPELINE_FAILURE -> HttpStatus.SERVICE_UNAVAILABLE;
            case UNKNOWN_PARTICIPANT -> HttpStatus.NOT_FOUND;
            case NO_ACTIVE_SESSION, SESSION_ALREADY_ACTIVE -> HttpStatus.CONFLICT;
        };
        return ResponseEntity.status(status).body(body);
    }
}
