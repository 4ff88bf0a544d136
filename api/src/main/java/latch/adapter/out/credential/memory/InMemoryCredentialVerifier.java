package latch.adapter.out.credential.memory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import jakarta.enterprise.context.ApplicationScoped;

import org.jboss.logging.Logger;

import latch.spi.CredentialVerifier;

/**
 * In-memory implementation of CredentialVerifier.
 *
 * <p>This implementation is intended for development and testing only.
 * Credentials are held in plain form and lost on restart. Comparison is
 * constant-time.
 */
@ApplicationScoped
public class InMemoryCredentialVerifier implements CredentialVerifier {

    private static final Logger LOG = Logger.getLogger(InMemoryCredentialVerifier.class);

    private final ConcurrentMap<String, byte[]> credentials = new ConcurrentHashMap<>();

    /**
     * Register or replace the password for a username.
     */
    public void register(String username, String password) {
        if (username == null || username.isBlank()) {
            throw new IllegalArgumentException("Username cannot be null or blank");
        }
        if (password == null) {
            throw new IllegalArgumentException("Password cannot be null");
        }
        credentials.put(username, password.getBytes(StandardCharsets.UTF_8));
        LOG.debugf("Credential registered for %s", username);
    }

    /**
     * Remove the credential for a username. Unknown usernames are ignored.
     */
    public void unregister(String username) {
        if (username != null && credentials.remove(username) != null) {
            LOG.debugf("Credential removed for %s", username);
        }
    }

    @Override
    public boolean verify(String username, String password) {
        if (username == null || password == null) {
            return false;
        }
        final var stored = credentials.get(username);
        if (stored == null) {
            return false;
        }
        return MessageDigest.isEqual(stored, password.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Return the number of registered credentials (for testing).
     */
    public int getCredentialCount() {
        return credentials.size();
    }
}
