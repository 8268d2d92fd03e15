package com.phillippitts.collabscribe.service.quality;

import com.phillippitts.collabscribe.domain.QualityTier;
import com.phillippitts.collabscribe.service.metrics.DiagnosticKind;
import com.phillippitts.collabscribe.service.metrics.TranscriptionDiagnostics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.util.Objects;

/**
 * Rolling audio-quality classifier.
 *
 * <p>Keeps the most recent level samples in a bounded window and classifies the window average
 * through a {@link QualityClassifier}. A {@link QualityTierChangedEvent} is published whenever the
 * tier differs from the previously reported one.
 *
 * <p>Levels are expected in dBFS. Values outside [{@value #MIN_LEVEL_DB}, {@value #MAX_LEVEL_DB}]
 * are clamped (silence produces negative infinity); NaN samples are dropped. Both are recorded as
 * diagnostics.
 *
 * <p><b>Thread Safety:</b> runs outside the session command queue. The window has its own lock and
 * tier bookkeeping is synchronized on the monitor.
 */
public class QualityMonitor {

    private static final Logger LOG = LogManager.getLogger(QualityMonitor.class);

    public static final double MIN_LEVEL_DB = -160.0;
    public static final double MAX_LEVEL_DB = 0.0;

    /** Tier reported before any sample arrives. */
    static final QualityTier INITIAL_TIER = QualityTier.GOOD;

    private final LevelWindow window;
    private final QualityClassifier classifier;
    private final ApplicationEventPublisher publisher;
    private final TranscriptionDiagnostics diagnostics;
    private final Clock clock;

    private QualityTier lastTier = INITIAL_TIER;

    public QualityMonitor(int windowSize,
                          QualityClassifier classifier,
                          ApplicationEventPublisher publisher,
                          TranscriptionDiagnostics diagnostics,
                          Clock clock) {
        this.window = new LevelWindow(windowSize);
        this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
        this.publisher = Objects.requireNonNull(publisher, "publisher must not be null");
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Records one audio level sample.
     *
     * @param levelDb level in dBFS
     */
    public void record(double levelDb) {
        if (Double.isNaN(levelDb)) {
            diagnostics.record(DiagnosticKind.INVALID_AUDIO_SAMPLE);
            LOG.debug("Dropping NaN audio level sample");
            return;
        }
        double level = levelDb;
        if (level < MIN_LEVEL_DB || level > MAX_LEVEL_DB) {
            level = Math.max(MIN_LEVEL_DB, Math.min(MAX_LEVEL_DB, level));
            diagnostics.record(DiagnosticKind.LEVEL_CLAMPED);
        }
        window.add(level);
        publishIfChanged();
    }

    /**
     * Classifies the current window.
     *
     * @return current tier; {@link QualityTier#GOOD} until the first sample arrives
     */
    public QualityTier currentTier() {
        double average = window.average();
        return Double.isNaN(average) ? INITIAL_TIER : classifier.classify(average);
    }

    /**
     * Window average in dBFS, or NaN when no samples were recorded.
     */
    public double averageLevel() {
        return window.average();
    }

    public int sampleCount() {
        return window.size();
    }

    /**
     * Empties the window at the start of a new session.
     */
    public synchronized void reset() {
        window.clear();
        lastTier = INITIAL_TIER;
    }

    private synchronized void publishIfChanged() {
        double average = window.average();
        QualityTier current = classifier.classify(average);
        if (current == lastTier) {
            return;
        }
        QualityTier previous = lastTier;
        lastTier = current;
        LOG.debug("Transcription quality changed {} -> {} (avg={} dB)", previous, current, average);
        publisher.publishEvent(new QualityTierChangedEvent(previous, current, average, clock.instant()));
    }
}
