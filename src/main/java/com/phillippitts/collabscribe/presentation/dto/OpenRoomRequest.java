package com.phillippitts.collabscribe.presentation.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;

import java.util.List;

public record OpenRoomRequest(@NotBlank String name, @Valid List<ParticipantRequest> participants) {

    public OpenRoomRequest {
        participants = participants == null ? List.of() : List.copyOf(participants);
    }
}
