package me.internalizable.authgate.ratelimit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Lockout-with-backoff gate over a {@link RateLimitStore}.
 *
 * Each key is either open (attempts below the threshold, or the last lockout
 * has run out) or locked. Expiry is evaluated lazily on the next call; there
 * is no background timer. A failure that reaches the threshold locks the key
 * for {@link RateLimitPolicy#backoff(int)}, a success resets it.
 *
 * Store failures never reach the caller. Reads fail open so an outage of the
 * store cannot lock every user out; writes are logged and dropped.
 */
public class StoreBackedRateLimitGate implements RateLimitGate {

    private static final Logger logger = LoggerFactory.getLogger(StoreBackedRateLimitGate.class);

    private final RateLimitStore store;
    private final RateLimitPolicy policy;
    private final AttemptLog attemptLog;
    private final Clock clock;

    public StoreBackedRateLimitGate(RateLimitStore store, RateLimitPolicy policy, AttemptLog attemptLog, Clock clock) {
        this.store = store;
        this.policy = policy;
        this.attemptLog = attemptLog;
        this.clock = clock;
    }

    @Override
    public RateLimitDecision check(String email, String identity) {
        if (email == null || email.isBlank()) {
            logger.warn("Rate limit check without an email from {}, allowing", identity);
            return RateLimitDecision.failOpen();
        }
        String key = RateLimitKeys.forEmail(email);
        Instant now = clock.instant();

        Optional<RateLimitState> stored;
        try {
            stored = store.get(key);
        } catch (RuntimeException e) {
            logger.error("Rate limit check error for key: {}, failing open", key, e);
            return RateLimitDecision.failOpen();
        }

        if (stored.isEmpty()) {
            return RateLimitDecision.allow(0);
        }

        RateLimitState state = stored.get();
        if (state.lockedAt(now)) {
            long remainingMillis = Duration.between(now, state.lockoutUntil()).toMillis();
            long remainingSeconds = (remainingMillis + 999) / 1000;
            logger.debug("Denied attempt for {} from {}, locked for {}s", key, identity, remainingSeconds);
            return RateLimitDecision.deny(remainingSeconds, state.attempts());
        }

        if (state.windowExpiredAt(now, policy.attemptWindow())) {
            return RateLimitDecision.allow(0);
        }
        return RateLimitDecision.allow(state.attempts());
    }

    @Override
    public void record(String email, String identity, boolean success, String userAgent) {
        if (email == null || email.isBlank()) {
            logger.warn("Dropping attempt without an email from {}", identity);
            return;
        }
        String key = RateLimitKeys.forEmail(email);
        Instant now = clock.instant();

        try {
            RateLimitState updated = store.update(key, current -> next(current, now, success));
            if (!success && policy.locksAt(updated.attempts())) {
                logger.info("Locked {} until {} after {} failed attempts",
                        key, updated.lockoutUntil(), updated.attempts());
            }
        } catch (RuntimeException e) {
            logger.warn("Failed to record attempt for key: {}, dropping it", key, e);
        }

        try {
            attemptLog.append(new AttemptRecord(key, identity, userAgent, now, success));
        } catch (RuntimeException e) {
            logger.warn("Failed to append attempt record for key: {}", key, e);
        }
    }

    private RateLimitState next(RateLimitState current, Instant now, boolean success) {
        if (success) {
            return RateLimitState.fresh(now);
        }
        RateLimitState base = current != null ? current : RateLimitState.fresh(now);
        return base.withFailure(now, policy);
    }
}
