package me.internalizable.authgate.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.internalizable.authgate.ratelimit.AttemptLog;
import me.internalizable.authgate.ratelimit.LocalRateLimitStore;
import me.internalizable.authgate.ratelimit.RateLimitGate;
import me.internalizable.authgate.ratelimit.RateLimitPolicy;
import me.internalizable.authgate.ratelimit.RateLimitStore;
import me.internalizable.authgate.ratelimit.RedisRateLimitStore;
import me.internalizable.authgate.ratelimit.RemoteRateLimitGate;
import me.internalizable.authgate.ratelimit.StoreBackedRateLimitGate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.client.RestClient;

import java.time.Clock;
import java.time.Duration;

@Configuration
public class RateLimitConfig {

    private static final Logger logger = LoggerFactory.getLogger(RateLimitConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Runs gate calls and caller credential checks for {@code AttemptRecorder}.
     */
    @Bean
    public ThreadPoolTaskExecutor attemptExecutor(
            @Value("${auth-gate.attempt.max-threads:64}") int maxThreads) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setThreadNamePrefix("auth-attempt-");
        executor.setCorePoolSize(maxThreads);
        executor.setMaxPoolSize(maxThreads);
        executor.setAllowCoreThreadTimeOut(true);
        executor.setKeepAliveSeconds(30);
        executor.setQueueCapacity(1_000);
        executor.initialize();
        return executor;
    }

    @Bean
    public RateLimitPolicy rateLimitPolicy(
            @Value("${auth-gate.rate-limit.threshold:5}") int threshold,
            @Value("${auth-gate.rate-limit.base-lockout-minutes:1}") int baseLockoutMinutes,
            @Value("${auth-gate.rate-limit.max-lockout-minutes:60}") int maxLockoutMinutes,
            @Value("${auth-gate.rate-limit.attempt-window-minutes:15}") int attemptWindowMinutes) {
        RateLimitPolicy policy = new RateLimitPolicy(
                threshold, baseLockoutMinutes, maxLockoutMinutes, Duration.ofMinutes(attemptWindowMinutes));
        logger.info("Login rate limit policy: {}", policy);
        return policy;
    }

    @Bean
    @ConditionalOnProperty(
            name = "auth-gate.rate-limit.use-redis",
            havingValue = "true",
            matchIfMissing = false
    )
    public RateLimitStore redisRateLimitStore(
            StringRedisTemplate redisTemplate,
            ObjectMapper objectMapper,
            @Value("${auth-gate.store.ttl-hours:24}") int ttlHours) {
        return RedisRateLimitStore.builder()
                .redisTemplate(redisTemplate)
                .objectMapper(objectMapper)
                .keyPrefix("auth-gate:attempts")
                .ttl(Duration.ofHours(ttlHours))
                .build();
    }

    @Bean
    @ConditionalOnProperty(
            name = "auth-gate.rate-limit.use-redis",
            havingValue = "false",
            matchIfMissing = true
    )
    public RateLimitStore localRateLimitStore(
            @Value("${auth-gate.store.local.max-size:100000}") long maxSize,
            @Value("${auth-gate.store.ttl-hours:24}") int ttlHours) {
        return LocalRateLimitStore.builder()
                .maxSize(maxSize)
                .ttl(Duration.ofHours(ttlHours))
                .build();
    }

    @Bean
    @ConditionalOnProperty(
            name = "auth-gate.remote.enabled",
            havingValue = "false",
            matchIfMissing = true
    )
    public RateLimitGate storeBackedRateLimitGate(
            RateLimitStore store, RateLimitPolicy policy, AttemptLog attemptLog, Clock clock) {
        return new StoreBackedRateLimitGate(store, policy, attemptLog, clock);
    }

    @Bean
    @ConditionalOnProperty(name = "auth-gate.remote.enabled", havingValue = "true")
    public RateLimitGate remoteRateLimitGate(
            @Value("${auth-gate.remote.base-url:http://localhost:8080}") String baseUrl,
            @Value("${auth-gate.remote.api-key:}") String apiKey,
            @Value("${auth-gate.remote.timeout-ms:3000}") int timeoutMs,
            @Value("${auth-gate.fingerprint.user-agent:}") String userAgent) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(timeoutMs);
        requestFactory.setReadTimeout(timeoutMs);

        RestClient.Builder builder = RestClient.builder()
                .baseUrl(baseUrl)
                .requestFactory(requestFactory)
                .defaultHeader("Content-Type", "application/json");
        if (!apiKey.isBlank()) {
            builder.defaultHeader("Authorization", "Bearer " + apiKey);
        }

        logger.info("Using remote rate limit gate at {}", baseUrl);
        return new RemoteRateLimitGate(builder.build(),
                userAgent.isBlank() ? "Java/" + System.getProperty("java.version", "") : userAgent);
    }
}
