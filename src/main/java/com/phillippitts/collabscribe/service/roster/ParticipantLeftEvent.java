package com.phillippitts.collabscribe.service.roster;

import java.time.Instant;
import java.util.UUID;

/**
 * Published when a participant leaves the current collaboration session.
 */
public record ParticipantLeftEvent(UUID sessionId, String participantId, Instant at) { }
