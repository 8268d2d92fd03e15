package com.phillippitts.collabscribe.domain;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class SessionSummaryTest {

    private static final Instant GENERATED = Instant.parse("2026-03-02T10:02:05Z");

    @Test
    void shouldDefaultMissingParticipantStatsToZero() {
        SessionSummary summary = new SessionSummary(UUID.randomUUID(), 12.0, null, GENERATED);

        assertThat(summary.statsFor("bob")).isEqualTo(ParticipantStats.empty("bob"));
        assertThat(summary.participantStats()).isEmpty();
    }

    @Test
    void shouldSnapshotParticipantStats() {
        Map<String, ParticipantStats> stats = new HashMap<>();
        stats.put("alice", new ParticipantStats("alice", 4.0, 9, 0.9, 2));
        SessionSummary summary = new SessionSummary(UUID.randomUUID(), 30.0, stats, GENERATED);

        stats.clear();

        assertThat(summary.statsFor("alice").wordCount()).isEqualTo(9);
    }
}
