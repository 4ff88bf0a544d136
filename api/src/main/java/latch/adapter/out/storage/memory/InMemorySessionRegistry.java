package latch.adapter.out.storage.memory;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

import org.jboss.logging.Logger;

import latch.core.port.out.SessionRegistry;

/**
 * In-memory implementation of SessionRegistry.
 *
 * <p>A single lock guards the whole key space and is held only for the map
 * operation itself. Sessions are lost on restart and not shared across
 * instances.
 *
 * @param <P> principal type held by this registry
 */
public class InMemorySessionRegistry<P> implements SessionRegistry<P> {

    private static final Logger LOG = Logger.getLogger(InMemorySessionRegistry.class);

    private final Class<P> principalType;
    private final Map<String, P> sessions = new HashMap<>();
    private final ReentrantLock lock = new ReentrantLock();

    public InMemorySessionRegistry(Class<P> principalType) {
        this.principalType = Objects.requireNonNull(principalType, "principalType");
    }

    @Override
    public void createSession(String sessionId, P principal) {
        Objects.requireNonNull(sessionId, "sessionId");
        Objects.requireNonNull(principal, "principal");
        P previous;
        lock.lock();
        try {
            previous = sessions.put(sessionId, principal);
        } finally {
            lock.unlock();
        }
        if (previous != null && previous != principal) {
            LOG.debugf("Session %s reassigned to a different principal", sessionId);
        } else {
            LOG.debugf("Session created: %s", sessionId);
        }
    }

    @Override
    public Optional<P> getSession(String sessionId) {
        if (sessionId == null) {
            return Optional.empty();
        }
        lock.lock();
        try {
            return Optional.ofNullable(sessions.get(sessionId));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void removeSession(String sessionId) {
        if (sessionId == null) {
            return;
        }
        P removed;
        lock.lock();
        try {
            removed = sessions.remove(sessionId);
        } finally {
            lock.unlock();
        }
        if (removed != null) {
            LOG.debugf("Session deleted: %s", sessionId);
        }
    }

    @Override
    public int removeSessionsFor(P principal) {
        if (principal == null) {
            return 0;
        }
        int removed = 0;
        lock.lock();
        try {
            var it = sessions.values().iterator();
            while (it.hasNext()) {
                if (it.next() == principal) {
                    it.remove();
                    removed++;
                }
            }
        } finally {
            lock.unlock();
        }
        if (removed > 0) {
            LOG.debugf("Deleted %d sessions for %s", removed, principal);
        }
        return removed;
    }

    @Override
    public int sessionCount() {
        lock.lock();
        try {
            return sessions.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Class<P> principalType() {
        return principalType;
    }
}
