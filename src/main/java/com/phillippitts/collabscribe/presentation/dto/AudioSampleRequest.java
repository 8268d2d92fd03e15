package com.phillippitts.collabscribe.presentation.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * Audio side-channel reading. Either a pre-computed level (with optional features) or a raw frame.
 *
 * @param levelDb level in dBFS, ignored when {@code samples} is present
 * @param features voice feature vector, or null
 * @param samples raw mono frame in [-1, 1], or null
 */
public record AudioSampleRequest(
        @NotBlank String participantId,
        Double levelDb,
        double[] features,
        float[] samples
) {
}
