package com.phillippitts.collabscribe.service.session;

import java.util.Objects;
import java.util.UUID;

/**
 * Mutable per-participant state of an active session.
 *
 * <p>Confined to the session command queue: only commands running on that queue read or write it,
 * so it carries no synchronization of its own.
 */
public final class ParticipantState {

    private final String participantId;
    private String displayName;
    private boolean micEnabled = true;
    private String interimBuffer = "";
    private UUID utteranceId;
    private double utteranceStart = Double.NaN;

    public ParticipantState(String participantId, String displayName) {
        this.participantId = Objects.requireNonNull(participantId, "participantId must not be null");
        this.displayName = displayName == null || displayName.isBlank() ? participantId : displayName;
    }

    public String participantId() {
        return participantId;
    }

    public String displayName() {
        return displayName;
    }

    void rename(String newDisplayName) {
        if (newDisplayName != null && !newDisplayName.isBlank()) {
            this.displayName = newDisplayName;
        }
    }

    public boolean isMicEnabled() {
        return micEnabled;
    }

    public void setMicEnabled(boolean micEnabled) {
        this.micEnabled = micEnabled;
    }

    public String interimBuffer() {
        return interimBuffer;
    }

    /**
     * Replaces the buffered partial text, opening a new utterance at {@code now} if none is open.
     *
     * @param text latest partial hypothesis
     * @param now session-relative seconds
     */
    public void bufferPartial(String text, double now) {
        if (utteranceId == null) {
            utteranceId = UUID.randomUUID();
            utteranceStart = now;
        }
        interimBuffer = text;
    }

    /**
     * Id shared by every segment of the open utterance; opens an utterance if needed.
     */
    public UUID utteranceId(double now) {
        if (utteranceId == null) {
            utteranceId = UUID.randomUUID();
            utteranceStart = now;
        }
        return utteranceId;
    }

    /**
     * Session-relative start of the open utterance, or NaN when none is open.
     */
    public double utteranceStart() {
        return utteranceStart;
    }

    public boolean hasOpenUtterance() {
        return utteranceId != null;
    }

    public boolean hasBufferedText() {
        return !interimBuffer.isEmpty();
    }

    /**
     * Closes the open utterance and empties the buffer.
     */
    public void clearUtterance() {
        interimBuffer = "";
        utteranceId = null;
        utteranceStart = Double.NaN;
    }
}
