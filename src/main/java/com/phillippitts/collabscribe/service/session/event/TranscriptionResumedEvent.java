package com.phillippitts.collabscribe.service.session.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Published when a paused participant's microphone is resumed.
 */
public record TranscriptionResumedEvent(UUID sessionId, String participantId, Instant at) { }
