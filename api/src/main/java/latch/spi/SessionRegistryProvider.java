package latch.spi;

import java.util.Optional;

import org.eclipse.microprofile.health.HealthCheckResponse;

import latch.core.port.out.SessionRegistry;

/**
 * Service Provider Interface for session registry backends.
 *
 * <p>Platform teams implement this interface to keep sessions somewhere other
 * than process memory. Implementations are discovered via CDI and selected by
 * {@code latch.session.storage.provider}, falling back to the highest priority
 * available provider.
 *
 * <h2>Implementation Requirements</h2>
 * <ul>
 *   <li>Every registry operation MUST be serialized per registry instance</li>
 *   <li>{@link #createRegistry(Class)} is called at most once per principal type;
 *   the caller caches the result</li>
 *   <li>Principals MUST be returned by reference, not copied</li>
 * </ul>
 *
 * <h2>Example</h2>
 * <pre>{@code
 * @ApplicationScoped
 * public class StripedSessionRegistryProvider implements SessionRegistryProvider {
 *     @Override
 *     public String name() { return "striped"; }
 *
 *     @Override
 *     public int priority() { return 50; }
 *
 *     @Override
 *     public boolean isAvailable() { return true; }
 *
 *     @Override
 *     public <P> SessionRegistry<P> createRegistry(Class<P> principalType) {
 *         return new StripedSessionRegistry<>(principalType);
 *     }
 *
 *     @Override
 *     public Optional<HealthCheckResponse> healthCheck() { return Optional.empty(); }
 * }
 * }</pre>
 */
public interface SessionRegistryProvider {

    /**
     * Return the provider name for configuration selection.
     *
     * @return provider name (e.g., "memory")
     */
    String name();

    /**
     * Return the provider priority for automatic selection.
     *
     * <p>Higher priority providers are preferred when several are available.
     * The built-in memory provider uses 0.
     *
     * @return priority value (higher = more preferred)
     */
    int priority();

    /**
     * Check if this provider is available and ready to use.
     *
     * @return true if the provider can be used
     */
    boolean isAvailable();

    /**
     * Create the registry for one principal type.
     *
     * @param principalType principal type the registry holds
     * @param <P>           principal type
     * @return a new, empty registry
     */
    <P> SessionRegistry<P> createRegistry(Class<P> principalType);

    /**
     * Report the health of this backend.
     *
     * @return health check response, or empty if not supported
     */
    Optional<HealthCheckResponse> healthCheck();
}
