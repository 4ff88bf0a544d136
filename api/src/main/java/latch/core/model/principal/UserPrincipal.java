package latch.core.model.principal;

import latch.spi.CredentialVerifier;

/**
 * Regular principal with no permissions of its own.
 */
public final class UserPrincipal extends AbstractPrincipal {

    public static final String ROLE = "USER";

    public UserPrincipal(String username, int id, CredentialVerifier credentialVerifier) {
        this(username, id, credentialVerifier, LockoutPolicy.disabled());
    }

    public UserPrincipal(String username, int id, CredentialVerifier credentialVerifier, LockoutPolicy lockoutPolicy) {
        super(username, id, credentialVerifier, lockoutPolicy);
    }

    @Override
    public String role() {
        return ROLE;
    }
}
