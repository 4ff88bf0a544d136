package latch.core.service.session;

import java.security.SecureRandom;
import java.util.Base64;
import java.util.Locale;

import latch.core.config.SessionConfig;

/**
 * Derives the session ID for a freshly authenticated principal.
 */
@FunctionalInterface
public interface SessionIdStrategy {

    String USERNAME = "username";
    String RANDOM = "random";

    /**
     * Derive a session ID.
     *
     * @param username the authenticated username
     * @return session ID, never empty
     */
    String sessionIdFor(String username);

    /**
     * Prefix followed by the username.
     *
     * <p>Deterministic: the same username always yields the same ID, so a new
     * session replaces the previous one. Not collision resistant against
     * adversarial usernames.
     */
    static SessionIdStrategy usernameBased(String prefix) {
        return username -> prefix + username;
    }

    /**
     * Prefix followed by 32 bytes (256 bits) of random data encoded as URL-safe
     * Base64 without padding.
     */
    static SessionIdStrategy random(String prefix) {
        final var secureRandom = new SecureRandom();
        final var encoder = Base64.getUrlEncoder().withoutPadding();
        return username -> {
            byte[] bytes = new byte[32];
            secureRandom.nextBytes(bytes);
            return prefix + encoder.encodeToString(bytes);
        };
    }

    /**
     * Build the strategy named by configuration.
     *
     * @throws IllegalArgumentException for an unknown strategy name
     */
    static SessionIdStrategy fromConfig(SessionConfig config) {
        final var name = config.idStrategy().trim().toLowerCase(Locale.ROOT);
        return switch (name) {
            case USERNAME -> usernameBased(config.idPrefix());
            case RANDOM -> random(config.idPrefix());
            default -> throw new IllegalArgumentException("Unknown session ID strategy: " + config.idStrategy());
        };
    }
}
