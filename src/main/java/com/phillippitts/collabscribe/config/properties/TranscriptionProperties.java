package com.phillippitts.collabscribe.config.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration properties for the collaborative transcription core.
 *
 * <p>Defaults mirror the behavior of the live-session transcriber: one flush per second, interim
 * segments at a flat 0.8 confidence, a 100-sample quality window and a 0.7 speaker match threshold.
 */
@Validated
@ConfigurationProperties(prefix = "transcription")
public class TranscriptionProperties {

    /** Language tag stamped on locally produced segments. */
    @NotBlank
    private String language = "en-US";

    @Valid
    private Flush flush = new Flush();

    @Valid
    private Quality quality = new Quality();

    @Valid
    private Speaker speaker = new Speaker();

    @Valid
    private Recognition recognition = new Recognition();

    public String getLanguage() {
        return language;
    }

    public void setLanguage(String language) {
        this.language = language;
    }

    public Flush getFlush() {
        return flush;
    }

    public void setFlush(Flush flush) {
        this.flush = flush;
    }

    public Quality getQuality() {
        return quality;
    }

    public void setQuality(Quality quality) {
        this.quality = quality;
    }

    public Speaker getSpeaker() {
        return speaker;
    }

    public void setSpeaker(Speaker speaker) {
        this.speaker = speaker;
    }

    public Recognition getRecognition() {
        return recognition;
    }

    public void setRecognition(Recognition recognition) {
        this.recognition = recognition;
    }

    /**
     * Interim buffer flush settings.
     */
    public static class Flush {
        /** Period between interim flush ticks. */
        @NotNull
        private Duration interval = Duration.ofSeconds(1);

        /** Flat confidence assigned to interim segments. */
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double interimConfidence = 0.8;

        public Duration getInterval() {
            return interval;
        }

        public void setInterval(Duration interval) {
            this.interval = interval;
        }

        public double getInterimConfidence() {
            return interimConfidence;
        }

        public void setInterimConfidence(double interimConfidence) {
            this.interimConfidence = interimConfidence;
        }
    }

    /**
     * Audio quality monitor settings.
     */
    public static class Quality {
        /** Number of level samples kept in the sliding window. */
        @Min(1)
        @Max(10_000)
        private int windowSize = 100;

        public int getWindowSize() {
            return windowSize;
        }

        public void setWindowSize(int windowSize) {
            this.windowSize = windowSize;
        }
    }

    /**
     * Speaker profile matcher settings.
     */
    public static class Speaker {
        /** Minimum similarity for a profile to count as a match. */
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double matchThreshold = 0.7;

        /** Expected length of every feature vector. */
        @Min(1)
        private int featureLength = 3;

        public double getMatchThreshold() {
            return matchThreshold;
        }

        public void setMatchThreshold(double matchThreshold) {
            this.matchThreshold = matchThreshold;
        }

        public int getFeatureLength() {
            return featureLength;
        }

        public void setFeatureLength(int featureLength) {
            this.featureLength = featureLength;
        }
    }

    /**
     * Speech recognition capability settings.
     */
    public static class Recognition {
        /** Whether the host granted access to the speech recognizer. */
        private boolean authorized = true;

        public boolean isAuthorized() {
            return authorized;
        }

        public void setAuthorized(boolean authorized) {
            this.authorized = authorized;
        }
    }
}
