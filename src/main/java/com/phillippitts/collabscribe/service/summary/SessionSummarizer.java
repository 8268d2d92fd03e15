package com.phillippitts.collabscribe.service.summary;

import com.phillippitts.collabscribe.domain.ParticipantStats;
import com.phillippitts.collabscribe.domain.SessionSummary;
import com.phillippitts.collabscribe.domain.TranscriptionSegment;
import com.phillippitts.collabscribe.util.TokenizerUtil;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Aggregates a ledger snapshot into per-participant statistics.
 *
 * <p>Only final segments count. Participants on the roster who never produced a final segment get
 * zeroed statistics; participants seen only in the ledger (remote peers) are included as well.
 *
 * <p>Stateless apart from the clock, so safe to call from any thread.
 */
public class SessionSummarizer {

    private final Clock clock;

    public SessionSummarizer(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Summarizes a frozen ledger snapshot.
     *
     * @param sessionId session being summarized
     * @param segments ledger contents in startTime order
     * @param sessionStart wall-clock time the session started
     * @param roster participant ids registered with the session
     * @return summary stamped with the current time
     */
    public SessionSummary summarize(UUID sessionId,
                                    List<TranscriptionSegment> segments,
                                    Instant sessionStart,
                                    Collection<String> roster) {
        Objects.requireNonNull(segments, "segments must not be null");
        Objects.requireNonNull(sessionStart, "sessionStart must not be null");
        Instant now = clock.instant();

        Map<String, List<TranscriptionSegment>> byParticipant = new LinkedHashMap<>();
        if (roster != null) {
            roster.forEach(id -> byParticipant.put(id, new ArrayList<>()));
        }
        for (TranscriptionSegment segment : segments) {
            if (segment.isFinal()) {
                byParticipant.computeIfAbsent(segment.participantId(), id -> new ArrayList<>()).add(segment);
            }
        }

        Map<String, ParticipantStats> stats = new LinkedHashMap<>();
        byParticipant.forEach((id, finals) -> stats.put(id, statsFor(id, finals)));

        double totalDuration = Math.max(0.0, Duration.between(sessionStart, now).toNanos() / 1_000_000_000.0);
        return new SessionSummary(sessionId, totalDuration, stats, now);
    }

    static ParticipantStats statsFor(String participantId, List<TranscriptionSegment> finals) {
        if (finals.isEmpty()) {
            return ParticipantStats.empty(participantId);
        }
        double speakingTime = 0.0;
        double confidenceSum = 0.0;
        int words = 0;
        for (TranscriptionSegment segment : finals) {
            speakingTime += segment.duration();
            confidenceSum += segment.confidence();
            words += TokenizerUtil.countWords(segment.content());
        }
        return new ParticipantStats(participantId, speakingTime, words,
                confidenceSum / finals.size(), finals.size());
    }
}
