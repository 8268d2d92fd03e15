package com.phillippitts.collabscribe.domain;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SpeakerProfileTest {

    @Test
    void shouldCopyFeatureVectorOnTheWayInAndOut() {
        double[] features = {1.0, 2.0, 3.0};
        SpeakerProfile profile = new SpeakerProfile("alice", 0.0, features);

        features[0] = 99.0;
        profile.featureVector()[1] = 99.0;

        assertThat(profile.featureVector()).containsExactly(1.0, 2.0, 3.0);
    }

    @Test
    void shouldBlendWithSimpleMovingAverage() {
        SpeakerProfile profile = new SpeakerProfile("alice", 0.4, new double[] {2.0, 4.0});

        SpeakerProfile blended = profile.blend(new double[] {4.0, 8.0});

        assertThat(blended.featureVector()).containsExactly(3.0, 6.0);
        assertThat(blended.confidence()).isEqualTo(0.4);
    }

    @Test
    void shouldRejectBlendOfDifferentLength() {
        SpeakerProfile profile = new SpeakerProfile("alice", 0.0, new double[] {1.0, 2.0});

        assertThatThrownBy(() -> profile.blend(new double[] {1.0}))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldCompareFeatureVectorsByContent() {
        SpeakerProfile a = new SpeakerProfile("alice", 0.5, new double[] {1.0, 2.0});
        SpeakerProfile b = new SpeakerProfile("alice", 0.5, new double[] {1.0, 2.0});

        assertThat(a).isEqualTo(b).hasSameHashCodeAs(b);
        assertThat(a).isNotEqualTo(a.withConfidence(0.9));
    }
}
