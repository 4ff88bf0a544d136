package latch.core.service.session;

import java.util.Objects;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import latch.core.config.SessionConfig;
import latch.core.model.principal.Authenticator;
import latch.core.model.principal.Principal;
import latch.core.model.session.IssuanceResult;
import latch.core.port.in.SessionIssuance;
import latch.core.port.out.SessionRegistry;

/**
 * Authenticates principals and registers sessions for them.
 *
 * <p>The registry is passed in by the caller, so the service holds no session
 * state of its own. A rejected credential produces no registry mutation.
 */
@ApplicationScoped
public class SessionIssuanceService implements SessionIssuance {

    private static final Logger LOG = Logger.getLogger(SessionIssuanceService.class);

    private final SessionIdStrategy idStrategy;

    @Inject
    public SessionIssuanceService(SessionConfig config) {
        this(SessionIdStrategy.fromConfig(config));
    }

    public SessionIssuanceService(SessionIdStrategy idStrategy) {
        this.idStrategy = Objects.requireNonNull(idStrategy, "idStrategy");
    }

    @Override
    public <P extends Principal & Authenticator> IssuanceResult authenticateAndCreateSession(
            P principal, String username, String password, SessionRegistry<P> registry) {
        Objects.requireNonNull(principal, "principal");
        Objects.requireNonNull(registry, "registry");

        if (!principal.authenticate(username, password)) {
            LOG.infof("Authentication rejected for %s", username);
            return IssuanceResult.rejected();
        }

        final var sessionId = idStrategy.sessionIdFor(username);
        registry.createSession(sessionId, principal);
        LOG.infof("Session issued for %s (%s)", username, principal.role());
        LOG.debugf("Issued session ID: %s", sessionId);
        return IssuanceResult.issued(sessionId);
    }
}
