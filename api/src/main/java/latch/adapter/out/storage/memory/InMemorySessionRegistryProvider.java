package latch.adapter.out.storage.memory;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

import jakarta.enterprise.context.ApplicationScoped;

import org.eclipse.microprofile.health.HealthCheckResponse;
import org.jboss.logging.Logger;

import latch.core.port.out.SessionRegistry;
import latch.spi.SessionRegistryProvider;

/**
 * In-memory session registry provider.
 *
 * <p>This provider is always available and is the default backend.
 *
 * <p><strong>Warning:</strong> In-memory sessions are local to one process.
 * Sticky routing is required when running several instances.
 */
@ApplicationScoped
public class InMemorySessionRegistryProvider implements SessionRegistryProvider {

    private static final Logger LOG = Logger.getLogger(InMemorySessionRegistryProvider.class);
    private static final int PRIORITY = 0;

    private final AtomicBoolean warningLogged = new AtomicBoolean(false);
    private final List<InMemorySessionRegistry<?>> registries = new CopyOnWriteArrayList<>();

    @Override
    public String name() {
        return "memory";
    }

    @Override
    public int priority() {
        return PRIORITY;
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public <P> SessionRegistry<P> createRegistry(Class<P> principalType) {
        if (warningLogged.compareAndSet(false, true)) {
            LOG.warn("Session registry is in-memory only; sessions are not shared across instances");
        }

        final var registry = new InMemorySessionRegistry<>(principalType);
        registries.add(registry);
        return registry;
    }

    @Override
    public Optional<HealthCheckResponse> healthCheck() {
        return Optional.of(HealthCheckResponse.named("session-registry-memory")
                .up()
                .withData("type", "in-memory")
                .withData("registries", registries.size())
                .withData("sessions", totalSessions())
                .build());
    }

    long totalSessions() {
        return registries.stream().mapToLong(SessionRegistry::sessionCount).sum();
    }
}
