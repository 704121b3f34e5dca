package me.internalizable.authgate.ratelimit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Builder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisOperations;
import org.springframework.data.redis.core.SessionCallback;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Distributed state in Redis, shared across servers behind a load balancer.
 *
 * Updates use optimistic locking: WATCH the key, read, compute, then
 * MULTI/SET/EXEC. EXEC is discarded when another writer touched the key in the
 * meantime, in which case the whole read-modify-write is retried.
 * Keys expire after the configured TTL.
 */
public class RedisRateLimitStore implements RateLimitStore {

    private static final Logger logger = LoggerFactory.getLogger(RedisRateLimitStore.class);

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final String keyPrefix;
    private final Duration ttl;
    private final int maxRetries;

    @Builder
    public RedisRateLimitStore(
            StringRedisTemplate redisTemplate,
            ObjectMapper objectMapper,
            String keyPrefix,
            Duration ttl,
            int maxRetries) {
        if (redisTemplate == null) {
            throw new IllegalStateException("RedisTemplate is required");
        }
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper != null ? objectMapper : new ObjectMapper().findAndRegisterModules();
        this.keyPrefix = keyPrefix != null ? (keyPrefix.endsWith(":") ? keyPrefix : keyPrefix + ":") : "auth-rate-limit:";
        this.ttl = ttl != null ? ttl : Duration.ofHours(24);
        this.maxRetries = maxRetries > 0 ? maxRetries : 16;

        logger.info("RedisRateLimitStore initialized - prefix: {}, ttl: {}", this.keyPrefix, this.ttl);
    }

    @Override
    public Optional<RateLimitState> get(String key) {
        try {
            String json = redisTemplate.opsForValue().get(keyPrefix + key);
            return Optional.ofNullable(decode(json));
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Redis read failed for key: " + key, e);
        }
    }

    @Override
    public RateLimitState update(String key, UnaryOperator<RateLimitState> mutation) {
        String redisKey = keyPrefix + key;
        try {
            for (int attempt = 1; attempt <= maxRetries; attempt++) {
                CasResult result = redisTemplate.execute(new CompareAndSet(redisKey, mutation));
                if (result != null && result.committed()) {
                    return result.state();
                }
                logger.debug("[Redis] Concurrent update on {}, retry {}/{}", key, attempt, maxRetries);
            }
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Redis write failed for key: " + key, e);
        }
        throw new StoreUnavailableException("Redis update for key " + key + " lost " + maxRetries + " races in a row");
    }

    private RateLimitState decode(String json) {
        if (json == null) {
            return null;
        }
        try {
            return objectMapper.readValue(json, RateLimitState.class);
        } catch (JsonProcessingException e) {
            throw new StoreUnavailableException("Corrupt rate limit state: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Read side of an update: an unreadable value is treated as absent so the
     * write replaces it instead of failing forever.
     */
    private RateLimitState decodeOrDiscard(String json) {
        try {
            return decode(json);
        } catch (StoreUnavailableException e) {
            logger.warn("[Redis] Discarding unreadable rate limit state: {}", e.getMessage());
            return null;
        }
    }

    private String encode(RateLimitState state) {
        try {
            return objectMapper.writeValueAsString(state);
        } catch (JsonProcessingException e) {
            throw new StoreUnavailableException("Could not serialize rate limit state", e);
        }
    }

    private record CasResult(boolean committed, RateLimitState state) {}

    private class CompareAndSet implements SessionCallback<CasResult> {

        private final String redisKey;
        private final UnaryOperator<RateLimitState> mutation;

        CompareAndSet(String redisKey, UnaryOperator<RateLimitState> mutation) {
            this.redisKey = redisKey;
            this.mutation = mutation;
        }

        @Override
        @SuppressWarnings("unchecked")
        public <K, V> CasResult execute(RedisOperations<K, V> operations) throws DataAccessException {
            RedisOperations<String, String> ops = (RedisOperations<String, String>) operations;

            ops.watch(redisKey);
            RateLimitState next;
            try {
                next = mutation.apply(decodeOrDiscard(ops.opsForValue().get(redisKey)));
            } catch (RuntimeException e) {
                ops.unwatch();
                throw e;
            }

            ops.multi();
            ops.opsForValue().set(redisKey, encode(next), ttl);
            List<Object> committed = ops.exec();
            return new CasResult(committed != null && !committed.isEmpty(), next);
        }
    }
}
