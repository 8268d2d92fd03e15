package com.phillippitts.collabscribe.presentation.dto;

import com.phillippitts.collabscribe.domain.Participant;
import jakarta.validation.constraints.NotBlank;

/**
 * Roster entry sent by a client.
 */
public record ParticipantRequest(@NotBlank String id, String displayName) {

    public Participant toParticipant() {
        return new Participant(id, displayName);
    }
}
