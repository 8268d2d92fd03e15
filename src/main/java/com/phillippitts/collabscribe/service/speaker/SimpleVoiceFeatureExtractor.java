package com.phillippitts.collabscribe.service.speaker;

/**
 * Coarse voice features: {pitch, energy, spectralCentroid}.
 *
 * <p>None of these are true acoustic measurements:
 * <ol>
 *   <li>pitch - RMS amplitude scaled by 1000</li>
 *   <li>energy - mean squared amplitude</li>
 *   <li>spectralCentroid - amplitude-weighted mean sample index of the frame</li>
 * </ol>
 * They are good enough to tell a loud close talker from a quiet distant one, nothing more.
 *
 * @since 1.0
 */
public final class SimpleVoiceFeatureExtractor implements FeatureExtractor {

    static final int FEATURE_LENGTH = 3;
    private static final double PITCH_SCALE = 1000.0;

    @Override
    public double[] extract(float[] samples) {
        if (samples == null || samples.length == 0) {
            return new double[FEATURE_LENGTH];
        }
        double energy = energy(samples);
        return new double[] {Math.sqrt(energy) * PITCH_SCALE, energy, spectralCentroid(samples)};
    }

    @Override
    public int featureLength() {
        return FEATURE_LENGTH;
    }

    private static double energy(float[] samples) {
        double sumSquares = 0.0;
        for (float sample : samples) {
            sumSquares += (double) sample * sample;
        }
        return sumSquares / samples.length;
    }

    private static double spectralCentroid(float[] samples) {
        double weightedSum = 0.0;
        double magnitudeSum = 0.0;
        for (int i = 0; i < samples.length; i++) {
            double magnitude = Math.abs(samples[i]);
            weightedSum += i * magnitude;
            magnitudeSum += magnitude;
        }
        return magnitudeSum > 0 ? weightedSum / magnitudeSum : 0.0;
    }
}
