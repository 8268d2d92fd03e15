package com.phillippitts.collabscribe.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * One recognizer result. Out-of-range confidence is clamped by the core, not rejected here.
 *
 * @param finalResult {@code true} for a final result, {@code false} for a partial hypothesis
 */
public record RecognitionEventRequest(
        @NotBlank String participantId,
        @NotNull String text,
        double confidence,
        boolean finalResult
) {
}
