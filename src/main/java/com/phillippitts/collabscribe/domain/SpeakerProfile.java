package com.phillippitts.collabscribe.domain;

import java.util.Arrays;
import java.util.Objects;

/**
 * Moving-average voice profile of one speaker.
 *
 * <p>The feature vector is defensively copied on the way in and out; records compare arrays by
 * reference, so {@code equals} is overridden to compare contents.
 *
 * @param speakerId     participant the profile belongs to
 * @param confidence    confidence of the last successful match (0 until matched)
 * @param featureVector fixed-length feature vector, e.g. {pitch, energy, spectralCentroid}
 */
public record SpeakerProfile(String speakerId, double confidence, double[] featureVector) {

    public SpeakerProfile {
        Objects.requireNonNull(speakerId, "speakerId must not be null");
        Objects.requireNonNull(featureVector, "featureVector must not be null");
        featureVector = featureVector.clone();
    }

    @Override
    public double[] featureVector() {
        return featureVector.clone();
    }

    /**
     * Blends {@code incoming} into this profile with a simple moving average.
     *
     * @throws IllegalArgumentException if the vector lengths differ
     */
    public SpeakerProfile blend(double[] incoming) {
        if (incoming.length != featureVector.length) {
            throw new IllegalArgumentException("Feature length mismatch: expected "
                    + featureVector.length + ", got " + incoming.length);
        }
        double[] merged = new double[featureVector.length];
        for (int i = 0; i < merged.length; i++) {
            merged[i] = (featureVector[i] + incoming[i]) / 2.0;
        }
        return new SpeakerProfile(speakerId, confidence, merged);
    }

    public SpeakerProfile withConfidence(double newConfidence) {
        return new SpeakerProfile(speakerId, newConfidence, featureVector);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SpeakerProfile other)) {
            return false;
        }
        return Double.compare(confidence, other.confidence) == 0
                && speakerId.equals(other.speakerId)
                && Arrays.equals(featureVector, other.featureVector);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(speakerId, confidence) + Arrays.hashCode(featureVector);
    }

    @Override
    public String toString() {
        return "SpeakerProfile[speakerId=" + speakerId + ", confidence=" + confidence
                + ", featureVector=" + Arrays.toString(featureVector) + "]";
    }
}
