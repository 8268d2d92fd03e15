package com.phillippitts.collabscribe.service.session;

import java.util.UUID;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Thread-safe state machine for the transcription session lifecycle.
 *
 * <p>Ensures only one session is active at a time. Uses explicit locking so state can be read
 * from any thread while transitions happen on the session command queue.
 *
 * <p><b>State Transitions:</b>
 * <pre>
 * IDLE    → ACTIVE  (via activate)
 * STOPPED → ACTIVE  (via activate, new session)
 * ACTIVE  → STOPPED (via stop)
 * </pre>
 *
 * @since 1.0
 */
public final class SessionStateMachine {

    private final Lock lock = new ReentrantLock();
    private SessionState state = SessionState.IDLE;
    private UUID sessionId;

    /**
     * Attempts to activate a session.
     *
     * @param newSessionId identifier of the session being started
     * @return {@code true} if the session became active,
     *         {@code false} if another session is already active
     * @throws NullPointerException if newSessionId is null
     */
    public boolean activate(UUID newSessionId) {
        if (newSessionId == null) {
            throw new NullPointerException("sessionId cannot be null");
        }
        lock.lock();
        try {
            if (state == SessionState.ACTIVE) {
                return false;
            }
            state = SessionState.ACTIVE;
            sessionId = newSessionId;
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stops the active session.
     *
     * @return the stopped session id, or {@code null} if no session was active
     */
    public UUID stop() {
        lock.lock();
        try {
            if (state != SessionState.ACTIVE) {
                return null;
            }
            state = SessionState.STOPPED;
            return sessionId;
        } finally {
            lock.unlock();
        }
    }

    public SessionState getState() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the id of the current or most recently stopped session.
     *
     * @return session id, or {@code null} before the first session
     */
    public UUID getSessionId() {
        lock.lock();
        try {
            return sessionId;
        } finally {
            lock.unlock();
        }
    }

    public boolean isActive() {
        lock.lock();
        try {
            return state == SessionState.ACTIVE;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Checks if a specific session is currently active.
     *
     * @param candidate session ID to check
     * @return {@code true} if the given session is active
     */
    public boolean isSessionActive(UUID candidate) {
        if (candidate == null) {
            return false;
        }
        lock.lock();
        try {
            return state == SessionState.ACTIVE && candidate.equals(sessionId);
        } finally {
            lock.unlock();
        }
    }
}
