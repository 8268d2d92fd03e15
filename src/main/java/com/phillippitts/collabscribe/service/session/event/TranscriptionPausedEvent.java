package com.phillippitts.collabscribe.service.session.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Published when a participant's microphone is paused for transcription.
 */
public record TranscriptionPausedEvent(UUID sessionId, String participantId, Instant at) { }
