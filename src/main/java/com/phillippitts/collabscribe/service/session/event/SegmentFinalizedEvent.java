package com.phillippitts.collabscribe.service.session.event;

import com.phillippitts.collabscribe.domain.TranscriptionSegment;

import java.time.Instant;

/**
 * Emitted for every segment committed to the ledger, ready for replication to remote peers.
 *
 * @param segment the committed segment
 * @param at when it was committed
 */
public record SegmentFinalizedEvent(TranscriptionSegment segment, Instant at) { }
