package com.phillippitts.collabscribe.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.phillippitts.collabscribe.config.properties.TranscriptionProperties;
import com.phillippitts.collabscribe.service.audio.AudioIntakeService;
import com.phillippitts.collabscribe.service.audio.AudioPipeline;
import com.phillippitts.collabscribe.service.audio.NoopAudioPipeline;
import com.phillippitts.collabscribe.service.export.SegmentJsonCodec;
import com.phillippitts.collabscribe.service.export.TranscriptExporter;
import com.phillippitts.collabscribe.service.flush.BufferFlushScheduler;
import com.phillippitts.collabscribe.service.metrics.TranscriptionDiagnostics;
import com.phillippitts.collabscribe.service.orchestration.DefaultTranscriptionSessionCoordinator;
import com.phillippitts.collabscribe.service.orchestration.SessionCollaborators;
import com.phillippitts.collabscribe.service.orchestration.TranscriptionSessionCoordinator;
import com.phillippitts.collabscribe.service.quality.QualityClassifier;
import com.phillippitts.collabscribe.service.quality.QualityMonitor;
import com.phillippitts.collabscribe.service.quality.ThresholdQualityClassifier;
import com.phillippitts.collabscribe.service.recognition.RecognitionAuthorizer;
import com.phillippitts.collabscribe.service.recognition.RecognitionEventProcessor;
import com.phillippitts.collabscribe.service.roster.InMemorySessionDirectory;
import com.phillippitts.collabscribe.service.session.SegmentAssembler;
import com.phillippitts.collabscribe.service.session.SessionCommandQueue;
import com.phillippitts.collabscribe.service.speaker.FeatureExtractor;
import com.phillippitts.collabscribe.service.speaker.SimpleVoiceFeatureExtractor;
import com.phillippitts.collabscribe.service.speaker.SpeakerProfileMatcher;
import com.phillippitts.collabscribe.service.summary.SessionSummarizer;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.util.concurrent.Executor;

/**
 * Wires the transcription core explicitly.
 *
 * <p>The recognizer authorization check, the audio pipeline, the quality classifier and the
 * feature extractor are strategy beans; declare your own bean of the same type to replace the
 * default.
 */
@Configuration
public class TranscriptionConfig {

    private final TranscriptionProperties properties;
    private final ApplicationEventPublisher publisher;

    public TranscriptionConfig(TranscriptionProperties properties, ApplicationEventPublisher publisher) {
        this.properties = properties;
        this.publisher = publisher;
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Authorization driven by {@code transcription.recognition.authorized}.
     */
    @Bean
    @ConditionalOnMissingBean
    public RecognitionAuthorizer recognitionAuthorizer() {
        boolean authorized = properties.getRecognition().isAuthorized();
        return () -> authorized;
    }

    @Bean
    @ConditionalOnMissingBean
    public AudioPipeline audioPipeline() {
        return new NoopAudioPipeline();
    }

    @Bean
    @ConditionalOnMissingBean
    public QualityClassifier qualityClassifier() {
        return new ThresholdQualityClassifier();
    }

    @Bean
    @ConditionalOnMissingBean
    public FeatureExtractor featureExtractor() {
        return new SimpleVoiceFeatureExtractor();
    }

    @Bean
    public QualityMonitor qualityMonitor(QualityClassifier classifier,
                                         TranscriptionDiagnostics diagnostics,
                                         Clock clock) {
        return new QualityMonitor(properties.getQuality().getWindowSize(), classifier, publisher,
                diagnostics, clock);
    }

    @Bean
    public SpeakerProfileMatcher speakerProfileMatcher(FeatureExtractor featureExtractor,
                                                       TranscriptionDiagnostics diagnostics) {
        int featureLength = properties.getSpeaker().getFeatureLength();
        if (featureLength != featureExtractor.featureLength()) {
            throw new IllegalStateException("transcription.speaker.feature-length=" + featureLength
                    + " does not match the feature extractor (" + featureExtractor.featureLength() + ")");
        }
        return new SpeakerProfileMatcher(featureLength, properties.getSpeaker().getMatchThreshold(), diagnostics);
    }

    @Bean
    public AudioIntakeService audioIntakeService(QualityMonitor qualityMonitor,
                                                 SpeakerProfileMatcher speakerProfileMatcher,
                                                 FeatureExtractor featureExtractor,
                                                 Clock clock) {
        return new AudioIntakeService(qualityMonitor, speakerProfileMatcher, featureExtractor, publisher, clock);
    }

    @Bean
    public InMemorySessionDirectory sessionDirectory(Clock clock) {
        return new InMemorySessionDirectory(publisher, clock);
    }

    @Bean
    public SegmentAssembler segmentAssembler() {
        return new SegmentAssembler(properties.getLanguage(), properties.getFlush().getInterimConfidence());
    }

    @Bean
    public SessionCommandQueue sessionCommandQueue(@Qualifier("sessionCommandExecutor") Executor executor) {
        return new SessionCommandQueue(executor);
    }

    @Bean
    public RecognitionEventProcessor recognitionEventProcessor(SegmentAssembler assembler,
                                                               TranscriptionDiagnostics diagnostics) {
        return new RecognitionEventProcessor(assembler, diagnostics, publisher);
    }

    @Bean
    public BufferFlushScheduler bufferFlushScheduler(@Qualifier("flushTaskScheduler") TaskScheduler scheduler,
                                                     SegmentAssembler assembler,
                                                     TranscriptionDiagnostics diagnostics) {
        return new BufferFlushScheduler(scheduler, properties.getFlush().getInterval(), assembler,
                diagnostics, publisher);
    }

    @Bean
    public SessionSummarizer sessionSummarizer(Clock clock) {
        return new SessionSummarizer(clock);
    }

    @Bean
    public SegmentJsonCodec segmentJsonCodec(ObjectMapper objectMapper) {
        return new SegmentJsonCodec(objectMapper);
    }

    @Bean
    public TranscriptExporter transcriptExporter(SegmentJsonCodec segmentJsonCodec) {
        return new TranscriptExporter(segmentJsonCodec);
    }

    @Bean
    public TranscriptionSessionCoordinator transcriptionSessionCoordinator(
            SessionCommandQueue queue,
            RecognitionEventProcessor processor,
            BufferFlushScheduler flushScheduler,
            SessionSummarizer summarizer,
            TranscriptExporter exporter,
            RecognitionAuthorizer authorizer,
            AudioPipeline audioPipeline,
            InMemorySessionDirectory directory,
            AudioIntakeService audioIntake,
            TranscriptionDiagnostics diagnostics,
            Clock clock) {
        SessionCollaborators collaborators =
                new SessionCollaborators(authorizer, audioPipeline, directory, audioIntake);
        return new DefaultTranscriptionSessionCoordinator(queue, processor, flushScheduler, summarizer,
                exporter, collaborators, diagnostics, publisher, clock);
    }
}
