package com.phillippitts.collabscribe.service.speaker;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class SimpleVoiceFeatureExtractorTest {

    private final SimpleVoiceFeatureExtractor extractor = new SimpleVoiceFeatureExtractor();

    @Test
    void shouldReturnZeroVectorForEmptyFrame() {
        assertThat(extractor.extract(new float[0])).containsExactly(0.0, 0.0, 0.0);
        assertThat(extractor.extract(null)).hasSize(extractor.featureLength());
    }

    @Test
    void shouldDerivePitchEnergyAndCentroid() {
        double[] features = extractor.extract(new float[] {0.5f, -0.5f, 0.5f, -0.5f});

        assertThat(features).hasSize(3);
        assertThat(features[0]).isCloseTo(500.0, within(1e-6));
        assertThat(features[1]).isCloseTo(0.25, within(1e-9));
        assertThat(features[2]).isCloseTo(1.5, within(1e-9));
    }

    @Test
    void shouldWeightCentroidTowardLoudSamples() {
        double[] features = extractor.extract(new float[] {0.0f, 0.0f, 0.0f, 1.0f});

        assertThat(features[2]).isEqualTo(3.0);
    }
}
