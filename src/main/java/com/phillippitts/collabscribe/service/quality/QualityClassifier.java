package com.phillippitts.collabscribe.service.quality;

import com.phillippitts.collabscribe.domain.QualityTier;

/**
 * Strategy that maps an average audio level to a {@link QualityTier}.
 *
 * <p>Implementations must be stateless and thread-safe. A voice-activity or SNR model can be
 * plugged in here without touching the monitor or the session coordinator.
 */
@FunctionalInterface
public interface QualityClassifier {

    /**
     * Classifies an average level.
     *
     * @param averageLevelDb window average in dBFS
     * @return quality tier for that level
     */
    QualityTier classify(double averageLevelDb);
}
