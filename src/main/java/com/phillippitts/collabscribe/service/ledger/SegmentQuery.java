package com.phillippitts.collabscribe.service.ledger;

import com.phillippitts.collabscribe.domain.TranscriptionSegment;

import java.util.Locale;
import java.util.Set;

/**
 * Combinable ledger filter. Every criterion left unset matches all segments; set criteria are
 * combined with logical AND.
 *
 * <p><b>Usage:</b>
 * <pre>
 * SegmentQuery query = SegmentQuery.builder()
 *         .text("proceed")
 *         .participants(Set.of("alice"))
 *         .minConfidence(0.5)
 *         .finalOnly(true)
 *         .build();
 * </pre>
 *
 * @param text          case-insensitive substring matched against content or participant name
 * @param from          inclusive lower bound on {@code startTime} (seconds), or null
 * @param to            inclusive upper bound on {@code endTime} (seconds), or null
 * @param participantIds participant ids to keep; empty keeps everyone
 * @param minConfidence minimum confidence, or null
 * @param finalOnly     keep only final segments
 */
public record SegmentQuery(
        String text,
        Double from,
        Double to,
        Set<String> participantIds,
        Double minConfidence,
        boolean finalOnly
) {

    public static final SegmentQuery ALL = builder().build();

    public SegmentQuery {
        participantIds = participantIds == null ? Set.of() : Set.copyOf(participantIds);
        text = (text == null || text.isBlank()) ? null : text;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Evaluates this filter against one segment.
     */
    public boolean matches(TranscriptionSegment segment) {
        if (finalOnly && !segment.isFinal()) {
            return false;
        }
        if (!participantIds.isEmpty() && !participantIds.contains(segment.participantId())) {
            return false;
        }
        if (from != null && segment.startTime() < from) {
            return false;
        }
        if (to != null && segment.endTime() > to) {
            return false;
        }
        if (minConfidence != null && segment.confidence() < minConfidence) {
            return false;
        }
        if (text != null) {
            String needle = text.toLowerCase(Locale.ROOT);
            return segment.content().toLowerCase(Locale.ROOT).contains(needle)
                    || segment.participantName().toLowerCase(Locale.ROOT).contains(needle);
        }
        return true;
    }

    /**
     * Fluent builder for {@link SegmentQuery}.
     */
    public static final class Builder {
        private String text;
        private Double from;
        private Double to;
        private Set<String> participantIds = Set.of();
        private Double minConfidence;
        private boolean finalOnly;

        private Builder() {
        }

        public Builder text(String text) {
            this.text = text;
            return this;
        }

        public Builder from(Double from) {
            this.from = from;
            return this;
        }

        public Builder to(Double to) {
            this.to = to;
            return this;
        }

        public Builder participants(Set<String> participantIds) {
            this.participantIds = participantIds;
            return this;
        }

        public Builder minConfidence(Double minConfidence) {
            this.minConfidence = minConfidence;
            return this;
        }

        public Builder finalOnly(boolean finalOnly) {
            this.finalOnly = finalOnly;
            return this;
        }

        public SegmentQuery build() {
            return new SegmentQuery(text, from, to, participantIds, minConfidence, finalOnly);
        }
    }
}
