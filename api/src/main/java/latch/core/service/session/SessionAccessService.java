package latch.core.service.session;

import java.util.Objects;

import jakarta.enterprise.context.ApplicationScoped;

import org.jboss.logging.Logger;

import latch.core.model.common.StatusCode;
import latch.core.model.principal.PermissionHolder;
import latch.core.model.session.IssuanceResult;
import latch.core.port.out.SessionRegistry;

/**
 * Maps session outcomes onto {@link StatusCode}.
 *
 * <p>Used by transports layered over the session core so that every negative
 * outcome surfaces as a specific status rather than a generic failure.
 */
@ApplicationScoped
public class SessionAccessService {

    private static final Logger LOG = Logger.getLogger(SessionAccessService.class);

    /**
     * Status for an issuance attempt.
     */
    public StatusCode statusOf(IssuanceResult result) {
        return result.success() ? StatusCode.SUCCESS : StatusCode.UNAUTHORIZED;
    }

    /**
     * Status for a session lookup.
     *
     * @return SUCCESS if the session exists, NOT_FOUND otherwise
     */
    public <P> StatusCode lookup(SessionRegistry<P> registry, String sessionId) {
        Objects.requireNonNull(registry, "registry");
        return registry.getSession(sessionId).isPresent() ? StatusCode.SUCCESS : StatusCode.NOT_FOUND;
    }

    /**
     * Decide whether the principal behind a session holds a permission.
     *
     * <p>Principals that carry no permissions at all are always forbidden.
     *
     * @param registry   registry holding the session
     * @param sessionId  session identifier
     * @param permission required permission
     * @return NOT_FOUND, FORBIDDEN or SUCCESS
     */
    public <P> StatusCode authorize(SessionRegistry<P> registry, String sessionId, String permission) {
        Objects.requireNonNull(registry, "registry");
        final var principal = registry.getSession(sessionId);
        if (principal.isEmpty()) {
            return StatusCode.NOT_FOUND;
        }

        if (principal.get() instanceof PermissionHolder holder && holder.hasPermission(permission)) {
            return StatusCode.SUCCESS;
        }

        LOG.debugf("Permission %s denied for session %s", permission, sessionId);
        return StatusCode.FORBIDDEN;
    }
}
