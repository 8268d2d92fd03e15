package com.phillippitts.collabscribe.domain;

/**
 * Coarse transcription quality derived from recent audio levels.
 */
public enum QualityTier {
    EXCELLENT,
    GOOD,
    FAIR,
    POOR
}
