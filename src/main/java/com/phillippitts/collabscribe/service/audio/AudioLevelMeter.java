package com.phillippitts.collabscribe.service.audio;

/**
 * Converts float PCM frames to a level in dBFS.
 *
 * <p><b>Algorithm:</b> mean absolute amplitude of the frame, then {@code 20 * log10(mean)}.
 * A silent or empty frame yields negative infinity; the quality monitor clamps it.
 *
 * <p><b>Audio Format:</b> mono float samples normalized to [-1, 1].
 *
 * @since 1.0
 */
public final class AudioLevelMeter {

    private AudioLevelMeter() {
        // Utility class
    }

    /**
     * Computes the level of one frame.
     *
     * @param samples mono float samples (may be null or empty)
     * @return level in dBFS, {@link Double#NEGATIVE_INFINITY} for silence
     */
    public static double levelDb(float[] samples) {
        if (samples == null || samples.length == 0) {
            return Double.NEGATIVE_INFINITY;
        }
        double sum = 0.0;
        for (float sample : samples) {
            sum += Math.abs(sample);
        }
        return 20.0 * Math.log10(sum / samples.length);
    }
}
