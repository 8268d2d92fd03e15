package com.phillippitts.collabscribe.service.quality;

import com.phillippitts.collabscribe.domain.QualityTier;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

class ThresholdQualityClassifierTest {

    private final ThresholdQualityClassifier classifier = new ThresholdQualityClassifier();

    @ParameterizedTest
    @CsvSource({
            "0.0, EXCELLENT",
            "-19.9, EXCELLENT",
            "-20.0, GOOD",
            "-25.0, GOOD",
            "-30.0, FAIR",
            "-39.9, FAIR",
            "-40.0, POOR",
            "-160.0, POOR"
    })
    void shouldClassifyByStrictThresholds(double levelDb, QualityTier expected) {
        assertThat(classifier.classify(levelDb)).isEqualTo(expected);
    }
}
