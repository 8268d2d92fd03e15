package com.phillippitts.collabscribe.service.session.event;

import com.phillippitts.collabscribe.domain.TranscriptionSegment;

import java.time.Instant;

/**
 * Emitted when a flush tick materializes buffered partial text as an interim segment.
 * Consumers replace any earlier interim segment carrying the same id.
 *
 * @param segment the interim segment
 * @param at when the flush happened
 */
public record InterimSegmentFlushedEvent(TranscriptionSegment segment, Instant at) { }
