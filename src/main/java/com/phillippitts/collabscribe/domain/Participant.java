package com.phillippitts.collabscribe.domain;

import java.util.Objects;

/**
 * Roster entry of a collaborative session.
 *
 * @param id          stable participant identifier
 * @param displayName name rendered in transcripts; falls back to the id when blank
 */
public record Participant(String id, String displayName) {

    public Participant {
        Objects.requireNonNull(id, "id must not be null");
        if (id.isBlank()) {
            throw new IllegalArgumentException("id must not be blank");
        }
        if (displayName == null || displayName.isBlank()) {
            displayName = id;
        }
    }
}
