package com.phillippitts.collabscribe.service.audio;

import com.phillippitts.collabscribe.domain.SpeakerMatch;
import com.phillippitts.collabscribe.service.quality.QualityMonitor;
import com.phillippitts.collabscribe.service.speaker.FeatureExtractor;
import com.phillippitts.collabscribe.service.speaker.SpeakerIdentifiedEvent;
import com.phillippitts.collabscribe.service.speaker.SpeakerProfileMatcher;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.util.Objects;

/**
 * Entry point for per-participant audio side channels.
 *
 * <p>Routes level readings to the {@link QualityMonitor} and feature vectors to the
 * {@link SpeakerProfileMatcher}. Neither affects segment ordering, so this service never joins the
 * session command queue and may be called from any audio thread.
 */
public class AudioIntakeService {

    private final QualityMonitor qualityMonitor;
    private final SpeakerProfileMatcher speakerMatcher;
    private final FeatureExtractor featureExtractor;
    private final ApplicationEventPublisher publisher;
    private final Clock clock;

    public AudioIntakeService(QualityMonitor qualityMonitor,
                              SpeakerProfileMatcher speakerMatcher,
                              FeatureExtractor featureExtractor,
                              ApplicationEventPublisher publisher,
                              Clock clock) {
        this.qualityMonitor = Objects.requireNonNull(qualityMonitor, "qualityMonitor must not be null");
        this.speakerMatcher = Objects.requireNonNull(speakerMatcher, "speakerMatcher must not be null");
        this.featureExtractor = Objects.requireNonNull(featureExtractor, "featureExtractor must not be null");
        this.publisher = Objects.requireNonNull(publisher, "publisher must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Accepts a pre-analyzed sample from the intake collaborator.
     *
     * @param participantId channel the sample came from
     * @param levelDb level in dBFS
     * @param featureVector voice features, or null when the collaborator computed none
     */
    public void onAudioSample(String participantId, double levelDb, double[] featureVector) {
        qualityMonitor.record(levelDb);
        if (featureVector != null) {
            speakerMatcher.observe(participantId, featureVector);
        }
    }

    /**
     * Analyzes a raw frame and routes the derived level and features.
     *
     * @param participantId channel the frame came from
     * @param samples mono float samples in [-1, 1]
     */
    public void onAudioFrame(String participantId, float[] samples) {
        onAudioSample(participantId, AudioLevelMeter.levelDb(samples), featureExtractor.extract(samples));
    }

    /**
     * Matches a raw frame against known speaker profiles. Publishes a
     * {@link SpeakerIdentifiedEvent} when a known speaker matches.
     *
     * @param channelParticipantId channel the frame came from
     * @param samples mono float samples in [-1, 1]
     * @return match result, possibly unknown
     */
    public SpeakerMatch identify(String channelParticipantId, float[] samples) {
        return identify(channelParticipantId, featureExtractor.extract(samples));
    }

    /**
     * Matches a feature vector against known speaker profiles.
     *
     * @see #identify(String, float[])
     */
    public SpeakerMatch identify(String channelParticipantId, double[] featureVector) {
        SpeakerMatch match = speakerMatcher.match(featureVector);
        if (match.isKnown()) {
            publisher.publishEvent(new SpeakerIdentifiedEvent(channelParticipantId, match, clock.instant()));
        }
        return match;
    }

    /**
     * Clears both side channels at the start of a new session.
     */
    public void reset() {
        qualityMonitor.reset();
        speakerMatcher.reset();
    }

    public void forget(String participantId) {
        speakerMatcher.forget(participantId);
    }
}
