package com.phillippitts.collabscribe.service.roster;

import com.phillippitts.collabscribe.domain.CollaborationSession;
import com.phillippitts.collabscribe.domain.Participant;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Session directory fed by roster notifications from the room transport.
 *
 * <p>Holds at most one open room. Joins and leaves update the roster and publish the matching
 * application event so an active transcription session can seed or retire participant state.
 */
public class InMemorySessionDirectory implements SessionDirectory {

    private static final Logger LOG = LogManager.getLogger(InMemorySessionDirectory.class);

    private final Lock lock = new ReentrantLock();
    private final ApplicationEventPublisher publisher;
    private final Clock clock;

    private UUID sessionId;
    private String roomName;
    private final Map<String, Participant> roster = new LinkedHashMap<>();

    public InMemorySessionDirectory(ApplicationEventPublisher publisher, Clock clock) {
        this.publisher = Objects.requireNonNull(publisher, "publisher must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Opens a room, replacing any previously open one.
     *
     * @param name room name
     * @param participants initial roster
     * @return the opened session context
     */
    public CollaborationSession open(String name, List<Participant> participants) {
        Objects.requireNonNull(name, "name must not be null");
        lock.lock();
        try {
            sessionId = UUID.randomUUID();
            roomName = name;
            roster.clear();
            if (participants != null) {
                for (Participant participant : participants) {
                    roster.put(participant.id(), participant);
                }
            }
            LOG.info("Opened room {} (session={}, participants={})", name, sessionId, roster.size());
            return snapshot();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Closes the current room. Later lookups report no session.
     */
    public void close() {
        lock.lock();
        try {
            if (sessionId != null) {
                LOG.info("Closed room {} (session={})", roomName, sessionId);
            }
            sessionId = null;
            roomName = null;
            roster.clear();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Adds or renames a participant and publishes {@link ParticipantJoinedEvent}.
     *
     * @return {@code false} when no room is open
     */
    public boolean join(Participant participant) {
        Objects.requireNonNull(participant, "participant must not be null");
        UUID current;
        lock.lock();
        try {
            if (sessionId == null) {
                LOG.warn("Join for {} ignored: no open room", participant.id());
                return false;
            }
            roster.put(participant.id(), participant);
            current = sessionId;
        } finally {
            lock.unlock();
        }
        publisher.publishEvent(new ParticipantJoinedEvent(current, participant, clock.instant()));
        return true;
    }

    /**
     * Removes a participant and publishes {@link ParticipantLeftEvent}.
     *
     * @return {@code false} when no room is open or the participant was not on the roster
     */
    public boolean leave(String participantId) {
        UUID current;
        lock.lock();
        try {
            if (sessionId == null || roster.remove(participantId) == null) {
                return false;
            }
            current = sessionId;
        } finally {
            lock.unlock();
        }
        publisher.publishEvent(new ParticipantLeftEvent(current, participantId, clock.instant()));
        return true;
    }

    @Override
    public Optional<CollaborationSession> currentSession() {
        lock.lock();
        try {
            return sessionId == null ? Optional.empty() : Optional.of(snapshot());
        } finally {
            lock.unlock();
        }
    }

    private CollaborationSession snapshot() {
        return new CollaborationSession(sessionId, roomName, new ArrayList<>(roster.values()));
    }
}
