package latch.core.model.session;

import java.util.Optional;

/**
 * Event fired when sessions are revoked.
 *
 * <p>Carries either a single session ID or the username of a principal whose
 * sessions were all removed. Observers holding per-session resources use
 * {@link #appliesTo(String, String)} to decide whether to release them.
 *
 * @param sessionId the revoked session, for single-session revocation
 * @param username  the principal, for logout-everywhere
 */
public record SessionInvalidatedEvent(Optional<String> sessionId, Optional<String> username) {

    public static SessionInvalidatedEvent forSession(String sessionId) {
        return new SessionInvalidatedEvent(Optional.of(sessionId), Optional.empty());
    }

    public static SessionInvalidatedEvent forPrincipal(String username) {
        return new SessionInvalidatedEvent(Optional.empty(), Optional.of(username));
    }

    public boolean appliesTo(String targetSessionId, String targetUsername) {
        if (sessionId.isPresent() && sessionId.get().equals(targetSessionId)) {
            return true;
        }
        return username.isPresent() && username.get().equals(targetUsername);
    }
}
