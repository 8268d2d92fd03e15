package com.phillippitts.collabscribe.service.speaker;

/**
 * Strategy that turns one audio frame into a fixed-length voice feature vector.
 *
 * <p>Implementations must be stateless and thread-safe, and must always return vectors of
 * {@link #featureLength()} elements. A diarization embedding model can replace the default
 * heuristic here without touching the matcher contract.
 */
public interface FeatureExtractor {

    /**
     * Extracts features from mono float samples in [-1, 1].
     *
     * @param samples audio frame (may be empty)
     * @return feature vector of length {@link #featureLength()}
     */
    double[] extract(float[] samples);

    /**
     * Number of elements in every vector returned by {@link #extract(float[])}.
     */
    int featureLength();
}
