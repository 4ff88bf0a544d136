package latch.core.service.session;

import java.util.Objects;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Event;

import org.jboss.logging.Logger;

import latch.core.model.principal.Authenticator;
import latch.core.model.principal.Principal;
import latch.core.model.session.SessionInvalidatedEvent;
import latch.core.port.out.SessionRegistry;

/**
 * Revokes sessions and notifies observers.
 *
 * <p>Every revocation fires a {@link SessionInvalidatedEvent} asynchronously so
 * that holders of per-session resources can release them.
 *
 * <p>The principal's lock and the registry's lock are never held together:
 * {@link #logoutEverywhere} logs the principal out before touching the registry.
 */
@ApplicationScoped
public class SessionLifecycleService {

    private static final Logger LOG = Logger.getLogger(SessionLifecycleService.class);

    private final Event<SessionInvalidatedEvent> sessionInvalidatedEvent;

    public SessionLifecycleService(Event<SessionInvalidatedEvent> sessionInvalidatedEvent) {
        this.sessionInvalidatedEvent = sessionInvalidatedEvent;
    }

    /**
     * Revoke a single session. Unknown IDs are a no-op apart from the event.
     *
     * @param registry  registry holding the session
     * @param sessionId session identifier
     */
    public <P> void revoke(SessionRegistry<P> registry, String sessionId) {
        Objects.requireNonNull(registry, "registry");
        Objects.requireNonNull(sessionId, "sessionId");
        registry.removeSession(sessionId);
        LOG.debugf("Revoked session: %s", sessionId);
        sessionInvalidatedEvent.fireAsync(SessionInvalidatedEvent.forSession(sessionId));
    }

    /**
     * Log the principal out and remove every session mapped to it.
     *
     * @param registry  registry holding the sessions
     * @param principal principal to log out
     * @return number of sessions removed
     */
    public <P extends Principal & Authenticator> int logoutEverywhere(SessionRegistry<P> registry, P principal) {
        Objects.requireNonNull(registry, "registry");
        Objects.requireNonNull(principal, "principal");

        principal.logout();
        final var removed = registry.removeSessionsFor(principal);
        LOG.infof("Logged out %s everywhere, %d sessions removed", principal.username(), removed);
        sessionInvalidatedEvent.fireAsync(SessionInvalidatedEvent.forPrincipal(principal.username()));
        return removed;
    }
}
