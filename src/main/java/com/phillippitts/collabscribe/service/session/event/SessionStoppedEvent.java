package com.phillippitts.collabscribe.service.session.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Published after a session stopped and its ledger was frozen.
 *
 * @param sessionId stopped session
 * @param segmentCount segments in the frozen ledger
 * @param at stop time
 */
public record SessionStoppedEvent(UUID sessionId, int segmentCount, Instant at) { }
