package latch.core.port.in;

import latch.core.model.principal.Authenticator;
import latch.core.model.principal.Principal;
import latch.core.model.session.IssuanceResult;
import latch.core.port.out.SessionRegistry;

/**
 * Inbound port for authenticating a principal and issuing a session.
 *
 * <p>The type bound restricts callers to principals that implement
 * {@link Authenticator}; any other type is rejected by the compiler.
 */
public interface SessionIssuance {

    /**
     * Authenticate the principal and, on success, register a session for it.
     *
     * <p>A rejected credential returns {@link IssuanceResult#rejected()} and
     * leaves the registry untouched. There is no retry.
     *
     * @param principal principal to authenticate
     * @param username  presented username
     * @param password  presented password
     * @param registry  registry receiving the session
     * @param <P>       principal type
     * @return the issued session ID, or a rejection
     */
    <P extends Principal & Authenticator> IssuanceResult authenticateAndCreateSession(
            P principal, String username, String password, SessionRegistry<P> registry);
}
