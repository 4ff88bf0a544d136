package latch.core.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for per-principal lockout after repeated failures.
 *
 * <p>Configuration prefix: {@code latch.auth.lockout}
 *
 * <p>A locked-out principal refuses every authentication attempt until its
 * lockout is reset. A successful authentication clears the failure count.
 *
 * @see latch.core.model.principal.AbstractPrincipal
 */
@ConfigMapping(prefix = "latch.auth.lockout")
public interface AuthLockoutConfig {

    /**
     * Enable lockout.
     *
     * @return true if enabled (default: true)
     */
    @WithDefault("true")
    boolean enabled();

    /**
     * Consecutive failed attempts before lockout.
     *
     * @return max attempts (default: 5)
     */
    @WithDefault("5")
    int maxFailedAttempts();
}
