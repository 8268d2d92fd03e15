package com.phillippitts.collabscribe.domain;

/**
 * Per-participant speaking statistics computed from final segments.
 *
 * @param participantId     participant the stats belong to
 * @param totalSpeakingTime sum of segment durations in seconds
 * @param wordCount         whitespace-separated tokens across all segments
 * @param averageConfidence mean confidence, 0 when the participant has no segments
 * @param segmentCount      number of final segments
 */
public record ParticipantStats(
        String participantId,
        double totalSpeakingTime,
        int wordCount,
        double averageConfidence,
        int segmentCount
) {

    public static ParticipantStats empty(String participantId) {
        return new ParticipantStats(participantId, 0.0, 0, 0.0, 0);
    }
}
