package latch.core.service.session;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.StreamSupport;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;

import io.quarkus.runtime.StartupEvent;
import org.jboss.logging.Logger;

import latch.core.config.SessionConfig;
import latch.spi.SessionRegistryProvider;

/**
 * Selects the session registry backend.
 *
 * <p>Discovers available providers via CDI and selects the appropriate one
 * based on configuration and availability.
 *
 * <p>Selection order:
 * <ol>
 *   <li>Configured provider (latch.session.storage.provider)</li>
 *   <li>Highest priority available provider</li>
 * </ol>
 */
@ApplicationScoped
public class SessionRegistryProviderSelector {

    private static final Logger LOG = Logger.getLogger(SessionRegistryProviderSelector.class);

    private final Iterable<SessionRegistryProvider> providers;
    private final String configuredProvider;

    private SessionRegistryProvider selectedProvider;

    @Inject
    public SessionRegistryProviderSelector(Instance<SessionRegistryProvider> providers, SessionConfig config) {
        this(providers, config.storage().provider());
    }

    public SessionRegistryProviderSelector(Iterable<SessionRegistryProvider> providers, String configuredProvider) {
        this.providers = providers;
        this.configuredProvider = configuredProvider;
    }

    /**
     * Select the provider at startup so that misconfiguration fails fast.
     */
    void onStart(@Observes StartupEvent event) {
        LOG.infof("Session registry provider initialized: %s", getSelectedProvider().name());
    }

    /**
     * Get the selected provider, selecting it on first use.
     *
     * @return selected provider
     * @throws IllegalStateException if no provider is available
     */
    public synchronized SessionRegistryProvider getSelectedProvider() {
        if (selectedProvider == null) {
            selectedProvider = selectProvider();
        }
        return selectedProvider;
    }

    /**
     * Get all available providers (for health checks).
     *
     * @return list of available providers
     */
    public List<SessionRegistryProvider> getAvailableProviders() {
        return StreamSupport.stream(providers.spliterator(), false)
                .filter(SessionRegistryProvider::isAvailable)
                .toList();
    }

    private SessionRegistryProvider selectProvider() {
        List<SessionRegistryProvider> availableProviders = getAvailableProviders().stream()
                .sorted(Comparator.comparingInt(SessionRegistryProvider::priority)
                        .reversed())
                .toList();

        LOG.debugf(
                "Available session registry providers: %s",
                availableProviders.stream().map(SessionRegistryProvider::name).toList());

        Optional<SessionRegistryProvider> configured = availableProviders.stream()
                .filter(p -> p.name().equals(configuredProvider))
                .findFirst();

        if (configured.isPresent()) {
            LOG.infof("Using configured session registry provider: %s", configuredProvider);
            return configured.get();
        }

        if (availableProviders.isEmpty()) {
            throw new IllegalStateException("No session registry providers available");
        }

        SessionRegistryProvider provider = availableProviders.get(0);
        LOG.warnf(
                "Configured session registry provider '%s' is not available, falling back to %s (priority: %d)",
                configuredProvider,
                provider.name(),
                provider.priority());
        return provider;
    }
}
