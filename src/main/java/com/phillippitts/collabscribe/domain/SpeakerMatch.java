package com.phillippitts.collabscribe.domain;

import java.util.Objects;

/**
 * Result of matching a feature vector against known speaker profiles.
 *
 * @param speakerId  best matching speaker, or {@link #UNKNOWN_SPEAKER}
 * @param confidence similarity of the best candidate (0.0 - 1.0)
 */
public record SpeakerMatch(String speakerId, double confidence) {

    public static final String UNKNOWN_SPEAKER = "unknown";

    public SpeakerMatch {
        Objects.requireNonNull(speakerId, "speakerId must not be null");
    }

    public static SpeakerMatch unknown(double confidence) {
        return new SpeakerMatch(UNKNOWN_SPEAKER, confidence);
    }

    public boolean isKnown() {
        return !UNKNOWN_SPEAKER.equals(speakerId);
    }
}
