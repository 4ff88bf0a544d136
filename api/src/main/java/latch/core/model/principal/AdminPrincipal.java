package latch.core.model.principal;

import java.util.ArrayList;
import java.util.List;

import latch.spi.CredentialVerifier;

/**
 * Administrative principal carrying an ordered list of permissions.
 *
 * <p>Permissions are appended in insertion order and duplicates are kept.
 * Appends and reads share the principal's lock with authentication, so
 * {@link #permissions()} reflects every append that happened before it.
 */
public final class AdminPrincipal extends AbstractPrincipal implements PermissionHolder {

    public static final String ROLE = "ADMIN";

    private final List<String> permissions = new ArrayList<>();

    public AdminPrincipal(String username, int id, CredentialVerifier credentialVerifier) {
        this(username, id, credentialVerifier, LockoutPolicy.disabled());
    }

    public AdminPrincipal(String username, int id, CredentialVerifier credentialVerifier, LockoutPolicy lockoutPolicy) {
        super(username, id, credentialVerifier, lockoutPolicy);
    }

    @Override
    public String role() {
        return ROLE;
    }

    /**
     * Append a permission.
     *
     * @param permission permission string, e.g. {@code sessions.revoke}
     * @throws IllegalArgumentException if the permission is null or blank
     */
    public void addPermission(String permission) {
        if (permission == null || permission.isBlank()) {
            throw new IllegalArgumentException("Permission cannot be null or blank");
        }
        lock.lock();
        try {
            permissions.add(permission);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<String> permissions() {
        lock.lock();
        try {
            return List.copyOf(permissions);
        } finally {
            lock.unlock();
        }
    }
}
