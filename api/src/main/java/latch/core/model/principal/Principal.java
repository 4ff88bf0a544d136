package latch.core.model.principal;

/**
 * An identity that can hold a role.
 *
 * <p>The username and id of a principal never change after construction.
 * Principals are shared by reference: a session registry and any other
 * holder may point at the same instance.
 */
public interface Principal {

    /**
     * Username, unique within a deployment.
     */
    String username();

    /**
     * Numeric identifier.
     */
    int id();

    /**
     * Fixed role label for this kind of principal (e.g. {@code ADMIN}).
     */
    String role();
}
