package latch.core.model.principal;

/**
 * Lockout rule applied by a principal to its own failed authentication attempts.
 *
 * @param maxFailedAttempts consecutive failures that trigger a lockout; zero or
 *                          negative disables lockout
 */
public record LockoutPolicy(int maxFailedAttempts) {

    private static final LockoutPolicy DISABLED = new LockoutPolicy(0);

    public LockoutPolicy {
        if (maxFailedAttempts < 0) {
            maxFailedAttempts = 0;
        }
    }

    public static LockoutPolicy disabled() {
        return DISABLED;
    }

    public static LockoutPolicy afterFailures(int maxFailedAttempts) {
        return new LockoutPolicy(maxFailedAttempts);
    }

    public boolean enabled() {
        return maxFailedAttempts > 0;
    }

    /**
     * Whether the given number of consecutive failures locks the principal out.
     */
    public boolean isLockedOut(int consecutiveFailures) {
        return enabled() && consecutiveFailures >= maxFailedAttempts;
    }
}
