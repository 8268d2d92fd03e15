package com.phillippitts.collabscribe.service.session;

import java.util.Objects;
import java.util.UUID;

/**
 * Outcome of a session coordinator operation.
 *
 * @param sessionId session the operation applied to (null when none applied)
 * @param error failure reason, or null on success
 */
public record SessionResult(UUID sessionId, SessionError error) {

    public static SessionResult ok(UUID sessionId) {
        return new SessionResult(sessionId, null);
    }

    public static SessionResult failure(SessionError error) {
        return new SessionResult(null, Objects.requireNonNull(error, "error must not be null"));
    }

    public boolean isSuccess() {
        return error == null;
    }

    public String message() {
        return error == null ? "ok" : error.description();
    }
}
