package com.phillippitts.collabscribe.service.session.event;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Published once a session is active and accepting recognition events.
 *
 * @param sessionId started session
 * @param roomName room the session belongs to
 * @param participantIds participants seeded at start
 * @param at start time
 */
public record SessionStartedEvent(UUID sessionId, String roomName, List<String> participantIds, Instant at) { }
