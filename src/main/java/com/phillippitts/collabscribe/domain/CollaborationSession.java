package com.phillippitts.collabscribe.domain;

import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Session context supplied by the room/roster collaborator.
 *
 * @param id           session identifier stamped on every segment
 * @param roomName     human-readable room name
 * @param participants participants known when the context was read
 */
public record CollaborationSession(UUID id, String roomName, List<Participant> participants) {

    public CollaborationSession {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(roomName, "roomName must not be null");
        participants = participants == null ? List.of() : List.copyOf(participants);
    }
}
