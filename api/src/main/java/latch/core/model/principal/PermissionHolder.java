package latch.core.model.principal;

import java.util.List;

/**
 * A principal that carries an ordered list of permission strings.
 */
public interface PermissionHolder {

    /** Wildcard permission that grants everything. */
    String ALL = "*";

    /**
     * Snapshot of the permissions in insertion order.
     *
     * @return an immutable copy; later additions are not reflected
     */
    List<String> permissions();

    /**
     * Check whether a permission is held, either directly or through {@link #ALL}.
     *
     * @param permission the permission to look for
     * @return true if granted; a null permission is never granted
     */
    default boolean hasPermission(String permission) {
        if (permission == null) {
            return false;
        }
        final var held = permissions();
        return held.contains(ALL) || held.contains(permission);
    }
}
