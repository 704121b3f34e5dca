package me.internalizable.authgate.ratelimit;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.Builder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * In-process state for single-server deployments.
 * Per-key atomicity comes from {@code asMap().compute}, which holds the entry lock
 * for the duration of the mutation.
 */
public class LocalRateLimitStore implements RateLimitStore {

    private static final Logger logger = LoggerFactory.getLogger(LocalRateLimitStore.class);

    private final Cache<String, RateLimitState> states;

    @Builder
    public LocalRateLimitStore(long maxSize, Duration ttl) {
        long size = maxSize > 0 ? maxSize : 100_000;
        Duration duration = ttl != null ? ttl : Duration.ofHours(24);
        this.states = Caffeine.newBuilder()
                .maximumSize(size)
                .expireAfterAccess(duration)
                .build();
        logger.info("LocalRateLimitStore initialized - maxSize: {}, ttl: {}", size, duration);
    }

    @Override
    public Optional<RateLimitState> get(String key) {
        return Optional.ofNullable(states.getIfPresent(key));
    }

    @Override
    public RateLimitState update(String key, UnaryOperator<RateLimitState> mutation) {
        RateLimitState updated = states.asMap().compute(key, (k, current) -> mutation.apply(current));
        logger.trace("[local] Updated rate limit state for key: {}", key);
        return updated;
    }
}
