package com.phillippitts.collabscribe.service.speaker;

import com.phillippitts.collabscribe.domain.SpeakerMatch;
import com.phillippitts.collabscribe.domain.SpeakerProfile;
import com.phillippitts.collabscribe.service.metrics.DiagnosticKind;
import com.phillippitts.collabscribe.service.metrics.TranscriptionDiagnostics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-participant moving-average voice profiles with a confidence-scored lookup.
 *
 * <p>{@link #observe} seeds a profile from the first vector and afterwards averages
 * {@code (old + incoming) / 2}. {@link #match} scores every profile by normalized inverse distance
 * {@code 1 - |a - b| / (|a| + |b|)} and reports the best one when it reaches the threshold.
 *
 * <p>This is a coarse heuristic. Its results annotate transcripts; they never decide attribution.
 *
 * <p><b>Thread Safety:</b> profiles live in a {@link ConcurrentHashMap} and each update is a single
 * atomic {@code compute}, so concurrent frames for one speaker never lose an update.
 */
public class SpeakerProfileMatcher {

    private static final Logger LOG = LogManager.getLogger(SpeakerProfileMatcher.class);

    private final Map<String, SpeakerProfile> profiles = new ConcurrentHashMap<>();
    private final int featureLength;
    private final double threshold;
    private final TranscriptionDiagnostics diagnostics;

    public SpeakerProfileMatcher(int featureLength, double threshold, TranscriptionDiagnostics diagnostics) {
        if (featureLength <= 0) {
            throw new IllegalArgumentException("featureLength must be positive, got: " + featureLength);
        }
        if (threshold < 0.0 || threshold > 1.0) {
            throw new IllegalArgumentException("threshold must be between 0.0 and 1.0, got: " + threshold);
        }
        this.featureLength = featureLength;
        this.threshold = threshold;
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics must not be null");
    }

    /**
     * Folds a feature vector into the participant's profile.
     *
     * @param participantId speaker the frame came from
     * @param featureVector features of one frame
     * @return {@code true} if the vector was accepted
     */
    public boolean observe(String participantId, double[] featureVector) {
        Objects.requireNonNull(participantId, "participantId must not be null");
        if (!isUsable(featureVector)) {
            diagnostics.record(DiagnosticKind.INVALID_AUDIO_SAMPLE);
            LOG.debug("Ignoring unusable feature vector for participant {}", participantId);
            return false;
        }
        profiles.compute(participantId, (id, existing) -> existing == null
                ? new SpeakerProfile(id, 0.0, featureVector)
                : existing.blend(featureVector));
        return true;
    }

    /**
     * Finds the known speaker closest to {@code featureVector}.
     *
     * @param featureVector features of the frame to identify
     * @return best match at or above the threshold, otherwise an unknown match carrying the best score
     */
    public SpeakerMatch match(double[] featureVector) {
        if (!isUsable(featureVector)) {
            diagnostics.record(DiagnosticKind.INVALID_AUDIO_SAMPLE);
            return SpeakerMatch.unknown(0.0);
        }
        String bestId = null;
        double bestScore = 0.0;
        for (SpeakerProfile profile : profiles.values()) {
            double score = similarity(profile.featureVector(), featureVector);
            if (bestId == null || score > bestScore) {
                bestId = profile.speakerId();
                bestScore = score;
            }
        }
        if (bestId == null || bestScore < threshold) {
            return SpeakerMatch.unknown(bestScore);
        }
        double confidence = bestScore;
        profiles.computeIfPresent(bestId, (id, profile) -> profile.withConfidence(confidence));
        return new SpeakerMatch(bestId, confidence);
    }

    public Optional<SpeakerProfile> profile(String participantId) {
        return Optional.ofNullable(profiles.get(participantId));
    }

    public List<SpeakerProfile> profiles() {
        return List.copyOf(profiles.values());
    }

    /**
     * Drops the participant's profile, e.g. when they leave the room.
     */
    public void forget(String participantId) {
        profiles.remove(participantId);
    }

    public void reset() {
        profiles.clear();
    }

    /**
     * Normalized inverse distance in [0, 1]; identical vectors score 1.
     */
    static double similarity(double[] a, double[] b) {
        double distance = 0.0;
        double normA = 0.0;
        double normB = 0.0;
        for (int i = 0; i < a.length; i++) {
            double diff = a[i] - b[i];
            distance += diff * diff;
            normA += a[i] * a[i];
            normB += b[i] * b[i];
        }
        double scale = Math.sqrt(normA) + Math.sqrt(normB);
        if (scale == 0.0) {
            return 1.0;
        }
        return Math.max(0.0, 1.0 - Math.sqrt(distance) / scale);
    }

    private boolean isUsable(double[] vector) {
        if (vector == null || vector.length != featureLength) {
            return false;
        }
        for (double v : vector) {
            if (!Double.isFinite(v)) {
                return false;
            }
        }
        return true;
    }
}
