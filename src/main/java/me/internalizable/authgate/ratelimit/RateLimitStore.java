package me.internalizable.authgate.ratelimit;

import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Keyed storage for rate limit state.
 * Allows switching between local (Caffeine) and distributed (Redis) state.
 */
public interface RateLimitStore {

    /**
     * @throws StoreUnavailableException if the backing store cannot be reached
     */
    Optional<RateLimitState> get(String key);

    /**
     * Atomically replace the state for a key. Concurrent updates of the same key
     * never interleave, so no increment is lost.
     *
     * @param mutation receives the current state, or null if the key has none
     * @return the stored state
     * @throws StoreUnavailableException if the backing store cannot be reached
     */
    RateLimitState update(String key, UnaryOperator<RateLimitState> mutation);
}
