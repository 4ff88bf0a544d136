package latch.core.service.session;

import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import jakarta.enterprise.context.ApplicationScoped;

import org.jboss.logging.Logger;

import latch.core.port.out.SessionRegistry;

/**
 * Type-indexed table of session registries.
 *
 * <p>Holds exactly one registry per principal type. The registry for a type is
 * created lazily by the first caller asking for it; every later caller, on any
 * thread, receives the same instance. As an application-scoped bean the
 * directory lives for the whole process.
 */
@ApplicationScoped
public class SessionRegistryDirectory {

    private static final Logger LOG = Logger.getLogger(SessionRegistryDirectory.class);

    private final SessionRegistryProviderSelector providerSelector;
    private final ConcurrentMap<Class<?>, SessionRegistry<?>> registries = new ConcurrentHashMap<>();

    public SessionRegistryDirectory(SessionRegistryProviderSelector providerSelector) {
        this.providerSelector = providerSelector;
    }

    /**
     * Get the registry for a principal type, creating it on first access.
     *
     * @param principalType principal type
     * @param <P>           principal type
     * @return the single registry for that type
     */
    @SuppressWarnings("unchecked")
    public <P> SessionRegistry<P> registryFor(Class<P> principalType) {
        Objects.requireNonNull(principalType, "principalType");
        return (SessionRegistry<P>) registries.computeIfAbsent(principalType, this::createRegistry);
    }

    /**
     * Registries created so far.
     */
    public Collection<SessionRegistry<?>> registries() {
        return List.copyOf(registries.values());
    }

    private SessionRegistry<?> createRegistry(Class<?> principalType) {
        final var provider = providerSelector.getSelectedProvider();
        LOG.infof("Creating session registry for %s from provider: %s", principalType.getSimpleName(), provider.name());
        return provider.createRegistry(principalType);
    }
}
