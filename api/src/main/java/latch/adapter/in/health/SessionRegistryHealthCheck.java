package latch.adapter.in.health;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.HealthCheckResponseBuilder;
import org.eclipse.microprofile.health.Readiness;

import latch.core.service.session.SessionRegistryDirectory;
import latch.core.service.session.SessionRegistryProviderSelector;
import latch.spi.SessionRegistryProvider;

/**
 * Readiness check for the session registry backend.
 *
 * <p>Reports the selected provider, the active session count of every
 * registry created so far, and the provider's own health data under
 * {@code backend.*}. DOWN when no provider can be selected or the provider
 * reports DOWN.
 */
@Readiness
@ApplicationScoped
public class SessionRegistryHealthCheck implements HealthCheck {

    private final SessionRegistryProviderSelector providerSelector;
    private final SessionRegistryDirectory directory;

    @Inject
    public SessionRegistryHealthCheck(
            SessionRegistryProviderSelector providerSelector, SessionRegistryDirectory directory) {
        this.providerSelector = providerSelector;
        this.directory = directory;
    }

    @Override
    public HealthCheckResponse call() {
        HealthCheckResponseBuilder builder = HealthCheckResponse.builder().name("session-registry");
        final SessionRegistryProvider provider;
        try {
            provider = providerSelector.getSelectedProvider();
        } catch (IllegalStateException e) {
            return builder.withData("error", e.getMessage()).down().build();
        }
        builder.withData("provider", provider.name());

        for (var registry : directory.registries()) {
            builder.withData(
                    "sessions." + registry.principalType().getSimpleName(), registry.sessionCount());
        }

        final var providerHealth = provider.healthCheck();
        if (providerHealth.isEmpty()) {
            return builder.up().build();
        }
        copyData(providerHealth.get(), builder);
        return builder.status(providerHealth.get().getStatus() == HealthCheckResponse.Status.UP)
                .build();
    }

    private static void copyData(HealthCheckResponse response, HealthCheckResponseBuilder builder) {
        response.getData().ifPresent(data -> data.forEach((key, value) -> {
            final var name = "backend." + key;
            if (value instanceof Boolean b) {
                builder.withData(name, b);
            } else if (value instanceof Number n) {
                builder.withData(name, n.longValue());
            } else {
                builder.withData(name, String.valueOf(value));
            }
        }));
    }
}
