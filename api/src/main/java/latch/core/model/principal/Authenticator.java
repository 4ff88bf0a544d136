package latch.core.model.principal;

/**
 * Capability of verifying credentials and tracking per-principal login state.
 *
 * <p>Implementations must tolerate concurrent calls on the same instance. A
 * rejected credential is a normal outcome and is reported as {@code false},
 * never as an exception.
 */
public interface Authenticator {

    /**
     * Verify the supplied credentials.
     *
     * @param username the username being presented
     * @param password the password being presented
     * @return true if the credentials are accepted
     */
    boolean authenticate(String username, String password);

    /**
     * Clear any ephemeral authentication state.
     *
     * <p>Calling this when already logged out is a no-op.
     */
    void logout();
}
