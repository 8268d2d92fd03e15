package com.phillippitts.collabscribe.service.roster;

import com.phillippitts.collabscribe.domain.Participant;

import java.time.Instant;
import java.util.UUID;

/**
 * Published when a participant joins the current collaboration session.
 */
public record ParticipantJoinedEvent(UUID sessionId, Participant participant, Instant at) { }
