package com.phillippitts.collabscribe.service.quality;

import com.phillippitts.collabscribe.domain.QualityTier;

/**
 * Fixed-threshold classifier: above -20 dB is excellent, above -30 good, above -40 fair,
 * anything else poor. No hysteresis; noisy input may flip tiers on every sample.
 */
public final class ThresholdQualityClassifier implements QualityClassifier {

    static final double EXCELLENT_ABOVE_DB = -20.0;
    static final double GOOD_ABOVE_DB = -30.0;
    static final double FAIR_ABOVE_DB = -40.0;

    @Override
    public QualityTier classify(double averageLevelDb) {
        if (averageLevelDb > EXCELLENT_ABOVE_DB) {
            return QualityTier.EXCELLENT;
        }
        if (averageLevelDb > GOOD_ABOVE_DB) {
            return QualityTier.GOOD;
        }
        if (averageLevelDb > FAIR_ABOVE_DB) {
            return QualityTier.FAIR;
        }
        return QualityTier.POOR;
    }
}
