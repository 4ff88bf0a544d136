package latch.core.port.out;

import java.util.Optional;

/**
 * Outbound port for the store mapping session IDs to principals.
 *
 * <p>There is one registry per principal type for the life of the process.
 * Implementations must serialize every operation so that each call observes a
 * consistent key space. No atomicity is promised across calls: a
 * {@link #getSession(String)} followed by a {@link #removeSession(String)}
 * from another caller may interleave.
 *
 * <p>Principals are stored by reference. The same principal may be mapped
 * under several session IDs.
 *
 * @param <P> principal type held by this registry
 */
public interface SessionRegistry<P> {

    /**
     * Map a session ID to a principal, replacing any existing mapping.
     *
     * @param sessionId session identifier, not validated for format
     * @param principal principal to associate
     */
    void createSession(String sessionId, P principal);

    /**
     * Look up the principal for a session ID.
     *
     * @param sessionId session identifier
     * @return the principal, or empty if no such session exists
     */
    Optional<P> getSession(String sessionId);

    /**
     * Remove a session. Removing an unknown ID is a no-op.
     *
     * @param sessionId session identifier
     */
    void removeSession(String sessionId);

    /**
     * Remove every session mapped to the given principal instance in one step.
     *
     * @param principal principal whose sessions are removed
     * @return number of sessions removed
     */
    int removeSessionsFor(P principal);

    /**
     * Number of active sessions.
     */
    int sessionCount();

    /**
     * Principal type this registry was created for.
     */
    Class<P> principalType();
}
