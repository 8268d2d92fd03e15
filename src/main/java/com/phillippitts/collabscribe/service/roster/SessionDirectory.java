package com.phillippitts.collabscribe.service.roster;

import com.phillippitts.collabscribe.domain.CollaborationSession;

import java.util.Optional;

/**
 * Room/roster collaborator that knows the current collaboration session.
 *
 * <p>Roster changes are announced as {@link ParticipantJoinedEvent} and
 * {@link ParticipantLeftEvent} application events.
 */
public interface SessionDirectory {

    /**
     * Returns the session context the local participant is in, if any.
     *
     * @return current session with a snapshot of its roster
     */
    Optional<CollaborationSession> currentSession();
}
