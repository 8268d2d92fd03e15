package com.phillippitts.collabscribe.service.session;

import com.phillippitts.collabscribe.domain.Participant;
import com.phillippitts.collabscribe.service.ledger.SegmentLedger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * State of one collaborative session: its ledger, participant registry and start time.
 *
 * <p>The ledger is safe to read from any thread. The participant registry is confined to the
 * session command queue.
 */
public final class TranscriptionSession {

    private final UUID sessionId;
    private final String roomName;
    private final Instant startedAt;
    private final Clock clock;
    private final SegmentLedger ledger = new SegmentLedger();
    private final Map<String, ParticipantState> participants = new LinkedHashMap<>();

    public TranscriptionSession(UUID sessionId, String roomName, Clock clock) {
        this.sessionId = Objects.requireNonNull(sessionId, "sessionId must not be null");
        this.roomName = Objects.requireNonNull(roomName, "roomName must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.startedAt = clock.instant();
    }

    public UUID sessionId() {
        return sessionId;
    }

    public String roomName() {
        return roomName;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public SegmentLedger ledger() {
        return ledger;
    }

    /**
     * Seconds elapsed since the session started, never negative.
     */
    public double elapsedSeconds() {
        Duration elapsed = Duration.between(startedAt, clock.instant());
        return Math.max(0.0, elapsed.toNanos() / 1_000_000_000.0);
    }

    public Instant now() {
        return clock.instant();
    }

    /**
     * Registers a participant with mic enabled and an empty buffer. A participant that is already
     * registered keeps its state and only picks up the new display name.
     *
     * @return the participant's state
     */
    public ParticipantState register(Participant participant) {
        ParticipantState existing = participants.get(participant.id());
        if (existing != null) {
            existing.rename(participant.displayName());
            return existing;
        }
        ParticipantState state = new ParticipantState(participant.id(), participant.displayName());
        participants.put(participant.id(), state);
        return state;
    }

    public Optional<ParticipantState> participant(String participantId) {
        return Optional.ofNullable(participants.get(participantId));
    }

    public Optional<ParticipantState> retire(String participantId) {
        return Optional.ofNullable(participants.remove(participantId));
    }

    public Collection<ParticipantState> participants() {
        return Collections.unmodifiableCollection(participants.values());
    }

    public List<String> participantIds() {
        return List.copyOf(participants.keySet());
    }
}
