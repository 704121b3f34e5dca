package me.internalizable.authgate.ratelimit;

import java.time.Duration;
import java.time.Instant;

/**
 * Persisted attempt counter for one rate limit key.
 *
 * @param lockoutUntil null while the key is open
 */
public record RateLimitState(int attempts, Instant windowStart, Instant lockoutUntil) {

    public static RateLimitState fresh(Instant now) {
        return new RateLimitState(0, now, null);
    }

    public boolean lockedAt(Instant now) {
        return lockoutUntil != null && now.isBefore(lockoutUntil);
    }

    /**
     * True once the key has been quiet for a full window, counted from the end
     * of the last lockout or, if it never locked, from the window start.
     */
    public boolean windowExpiredAt(Instant now, Duration window) {
        if (lockedAt(now)) {
            return false;
        }
        Instant anchor = lockoutUntil != null ? lockoutUntil : windowStart;
        return anchor == null || !now.isBefore(anchor.plus(window));
    }

    public RateLimitState withFailure(Instant now, RateLimitPolicy policy) {
        RateLimitState base = windowExpiredAt(now, policy.attemptWindow()) ? fresh(now) : this;
        int next = base.attempts + 1;
        Instant lockout = policy.locksAt(next) ? now.plus(policy.backoff(next)) : base.lockoutUntil;
        return new RateLimitState(next, base.windowStart, lockout);
    }
}
