package latch.core.model.principal;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

import org.jboss.logging.Logger;

import latch.spi.CredentialBackendException;
import latch.spi.CredentialVerifier;

/**
 * Base class for principals that authenticate against a {@link CredentialVerifier}.
 *
 * <p>Each instance owns one lock. Authentication state, the failure counter and
 * any mutable state added by subclasses are read and written only while holding
 * it. Subclasses guard their own fields with {@link #lock}.
 */
public abstract class AbstractPrincipal implements Principal, Authenticator {

    private static final Logger LOG = Logger.getLogger(AbstractPrincipal.class);

    private final String username;
    private final int id;
    private final CredentialVerifier credentialVerifier;
    private final LockoutPolicy lockoutPolicy;

    protected final ReentrantLock lock = new ReentrantLock();

    private boolean authenticated;
    private Instant authenticatedAt;
    private int consecutiveFailures;

    protected AbstractPrincipal(
            String username, int id, CredentialVerifier credentialVerifier, LockoutPolicy lockoutPolicy) {
        if (username == null || username.isBlank()) {
            throw new IllegalArgumentException("Username cannot be null or blank");
        }
        this.username = username;
        this.id = id;
        this.credentialVerifier = Objects.requireNonNull(credentialVerifier, "credentialVerifier");
        this.lockoutPolicy = lockoutPolicy != null ? lockoutPolicy : LockoutPolicy.disabled();
    }

    @Override
    public final String username() {
        return username;
    }

    @Override
    public final int id() {
        return id;
    }

    @Override
    public boolean authenticate(String username, String password) {
        lock.lock();
        try {
            if (lockoutPolicy.isLockedOut(consecutiveFailures)) {
                LOG.debugf("Authentication refused for %s: locked out after %d failures", this.username,
                        consecutiveFailures);
                return false;
            }

            if (!this.username.equals(username) || password == null || !validatePassword(password)) {
                consecutiveFailures++;
                authenticated = false;
                if (lockoutPolicy.isLockedOut(consecutiveFailures)) {
                    LOG.warnf("Principal %s locked out after %d failed attempts", this.username,
                            consecutiveFailures);
                }
                return false;
            }

            consecutiveFailures = 0;
            authenticated = true;
            authenticatedAt = Instant.now();
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void logout() {
        lock.lock();
        try {
            if (authenticated) {
                LOG.debugf("Principal %s logged out", username);
            }
            authenticated = false;
            authenticatedAt = null;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Whether the last authentication succeeded and no logout happened since.
     */
    public boolean isAuthenticated() {
        lock.lock();
        try {
            return authenticated;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Instant of the last successful authentication, empty when logged out.
     */
    public Optional<Instant> authenticatedAt() {
        lock.lock();
        try {
            return Optional.ofNullable(authenticatedAt);
        } finally {
            lock.unlock();
        }
    }

    public boolean isLockedOut() {
        lock.lock();
        try {
            return lockoutPolicy.isLockedOut(consecutiveFailures);
        } finally {
            lock.unlock();
        }
    }

    public int consecutiveFailures() {
        lock.lock();
        try {
            return consecutiveFailures;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Clear the failure counter, lifting any lockout.
     */
    public void resetLockout() {
        lock.lock();
        try {
            consecutiveFailures = 0;
        } finally {
            lock.unlock();
        }
    }

    private boolean validatePassword(String password) {
        try {
            return credentialVerifier.verify(username, password);
        } catch (CredentialBackendException e) {
            LOG.warnf("Credential backend failed while authenticating %s: %s", username, e.getMessage());
            throw e;
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[username=" + username + ", id=" + id + ", role=" + role() + "]";
    }
}
