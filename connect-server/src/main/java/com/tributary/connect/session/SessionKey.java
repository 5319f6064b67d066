package com.tributary.connect.session;

import java.util.Objects;

/**
 * Identifies an execution context: the principal and the client's session id.
 */
public record SessionKey(String userId, String sessionId) {

    public SessionKey {
        Objects.requireNonNull(userId, "userId must not be null");
        Objects.requireNonNull(sessionId, "sessionId must not be null");
    }

    @Override
    public String toString() {
        return userId + "/" + sessionId;
    }
}
