package me.internalizable.authgate.ratelimit;

import java.time.Duration;

/**
 * Lockout thresholds and backoff.
 *
 * @param threshold          failed attempts that engage the first lockout
 * @param baseLockoutMinutes lockout length when the threshold is first reached
 * @param maxLockoutMinutes  upper bound for the exponential backoff
 * @param attemptWindow      idle time after which a lockout-free counter starts over
 */
public record RateLimitPolicy(
        int threshold,
        int baseLockoutMinutes,
        int maxLockoutMinutes,
        Duration attemptWindow
) {

    // 2^30 minutes already overflows any sane maximum
    private static final int MAX_EXPONENT = 30;

    public RateLimitPolicy {
        if (threshold < 1) {
            throw new IllegalArgumentException("threshold must be >= 1, was " + threshold);
        }
        if (baseLockoutMinutes < 1) {
            throw new IllegalArgumentException("baseLockoutMinutes must be >= 1, was " + baseLockoutMinutes);
        }
        if (maxLockoutMinutes < baseLockoutMinutes) {
            throw new IllegalArgumentException("maxLockoutMinutes must be >= baseLockoutMinutes");
        }
        if (attemptWindow == null || attemptWindow.isNegative() || attemptWindow.isZero()) {
            throw new IllegalArgumentException("attemptWindow must be positive");
        }
    }

    public static RateLimitPolicy defaults() {
        return new RateLimitPolicy(5, 1, 60, Duration.ofMinutes(15));
    }

    public boolean locksAt(int attempts) {
        return attempts >= threshold;
    }

    /**
     * min(max, base * 2^(attempts - threshold)) minutes; zero below the threshold.
     */
    public Duration backoff(int attempts) {
        if (!locksAt(attempts)) {
            return Duration.ZERO;
        }
        int exponent = Math.min(attempts - threshold, MAX_EXPONENT);
        long minutes = Math.min((long) maxLockoutMinutes, (long) baseLockoutMinutes << exponent);
        return Duration.ofMinutes(minutes);
    }
}
