package latch.core.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for session issuance and storage.
 *
 * <p>Configuration prefix: {@code latch.session}
 */
@ConfigMapping(prefix = "latch.session")
public interface SessionConfig {

    /**
     * Session ID derivation strategy.
     *
     * <p>Available strategies:
     * <ul>
     *   <li>{@code username}: prefix followed by the username. Deterministic, so a
     *   username holds at most one session at a time.</li>
     *   <li>{@code random}: prefix followed by 256 random bits, URL-safe Base64.</li>
     * </ul>
     *
     * @return strategy name (default: username)
     */
    @WithDefault("username")
    String idStrategy();

    /**
     * Prefix prepended to every session ID.
     *
     * @return prefix (default: session_)
     */
    @WithDefault("session_")
    String idPrefix();

    /**
     * Storage configuration.
     */
    StorageConfig storage();

    /**
     * Storage configuration options.
     */
    interface StorageConfig {

        /**
         * Registry provider name.
         *
         * <p>Available providers: memory, or a custom SPI name.
         *
         * @return provider name (default: memory)
         */
        @WithDefault("memory")
        String provider();
    }
}
