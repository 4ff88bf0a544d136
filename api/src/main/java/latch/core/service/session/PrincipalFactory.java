package latch.core.service.session;

import jakarta.enterprise.context.ApplicationScoped;

import latch.core.config.AuthLockoutConfig;
import latch.core.model.principal.AdminPrincipal;
import latch.core.model.principal.LockoutPolicy;
import latch.core.model.principal.UserPrincipal;
import latch.spi.CredentialVerifier;

/**
 * Creates principals wired to the configured credential backend and lockout policy.
 */
@ApplicationScoped
public class PrincipalFactory {

    private final CredentialVerifier credentialVerifier;
    private final LockoutPolicy lockoutPolicy;

    public PrincipalFactory(CredentialVerifier credentialVerifier, AuthLockoutConfig lockoutConfig) {
        this.credentialVerifier = credentialVerifier;
        this.lockoutPolicy = lockoutConfig.enabled()
                ? LockoutPolicy.afterFailures(lockoutConfig.maxFailedAttempts())
                : LockoutPolicy.disabled();
    }

    public AdminPrincipal admin(String username, int id) {
        return new AdminPrincipal(username, id, credentialVerifier, lockoutPolicy);
    }

    public UserPrincipal user(String username, int id) {
        return new UserPrincipal(username, id, credentialVerifier, lockoutPolicy);
    }

    public LockoutPolicy lockoutPolicy() {
        return lockoutPolicy;
    }
}
