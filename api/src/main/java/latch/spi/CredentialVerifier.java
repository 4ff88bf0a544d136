package latch.spi;

/**
 * Service Provider Interface for the credential backend.
 *
 * <p>Principals consult this interface to check a presented password. Storage
 * and hashing of credentials belong to the implementation; the built-in
 * in-memory verifier is meant for development and tests only.
 *
 * <h2>Implementation Requirements</h2>
 * <ul>
 *   <li>A mismatched or unknown credential MUST be reported as {@code false}</li>
 *   <li>An unreachable or failing backend MUST throw
 *   {@link CredentialBackendException} rather than return {@code false}</li>
 *   <li>Implementations MUST be thread-safe</li>
 * </ul>
 *
 * @see latch.adapter.out.credential.memory.InMemoryCredentialVerifier
 */
public interface CredentialVerifier {

    /**
     * Check a password for a username.
     *
     * @param username the principal's username
     * @param password the presented password
     * @return true if the password matches the stored credential
     * @throws CredentialBackendException if the backend cannot answer
     */
    boolean verify(String username, String password);
}
