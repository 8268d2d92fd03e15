package com.phillippitts.collabscribe.domain;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Analytics produced once when a session stops.
 *
 * @param sessionId        summarized session
 * @param totalDuration    seconds between session start and summarization
 * @param participantStats stats keyed by participant id (insertion ordered)
 * @param generatedAt      wall-clock time of summarization
 */
public record SessionSummary(
        UUID sessionId,
        double totalDuration,
        Map<String, ParticipantStats> participantStats,
        Instant generatedAt
) {

    public SessionSummary {
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        Objects.requireNonNull(generatedAt, "generatedAt must not be null");
        participantStats = participantStats == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(participantStats));
    }

    public ParticipantStats statsFor(String participantId) {
        return participantStats.getOrDefault(participantId, ParticipantStats.empty(participantId));
    }
}
