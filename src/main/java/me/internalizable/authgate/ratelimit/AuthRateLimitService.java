package me.internalizable.authgate.ratelimit;

import me.internalizable.authgate.identity.ClientIdentity;
import me.internalizable.authgate.identity.ClientIdentityResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletableFuture;

/**
 * Entry point for authentication flows that call the gate directly.
 *
 * Uses the configured {@link RateLimitGate} (local/Redis backed, or a remote
 * auth-gate instance). None of the methods throw.
 *
 * Configuration (application.properties):
 * - auth-gate.rate-limit.enabled: Enable/disable login rate limiting
 */
@Service
public class AuthRateLimitService {

    private static final Logger logger = LoggerFactory.getLogger(AuthRateLimitService.class);

    private final RateLimitGate gate;
    private final ClientIdentityResolver identityResolver;
    private final boolean enabled;

    public AuthRateLimitService(
            RateLimitGate gate,
            ClientIdentityResolver identityResolver,
            @Value("${auth-gate.rate-limit.enabled:true}") boolean enabled) {
        this.gate = gate;
        this.identityResolver = identityResolver;
        this.enabled = enabled;
        if (!enabled) {
            logger.warn("Login rate limiting is disabled");
        }
    }

    /**
     * Check if an authentication attempt is allowed for the given email and client identity
     */
    public RateLimitDecision checkRateLimit(String email, String identity) {
        if (!enabled) return RateLimitDecision.allow(0);
        return gate.check(email, identity);
    }

    /**
     * Record the outcome of an authentication attempt. Best effort.
     */
    public void recordAttempt(String email, String identity, boolean success) {
        recordAttempt(email, identity, success, null);
    }

    public void recordAttempt(String email, String identity, boolean success, String userAgent) {
        if (!enabled) return;
        gate.record(email, identity, success, userAgent);
    }

    /**
     * Resolve the calling client's identifier; never blank, never throws.
     */
    public String getClientIdentity() {
        return identityResolver.getClientIdentity();
    }

    public CompletableFuture<ClientIdentity> resolveClientIdentity() {
        return identityResolver.resolve();
    }
}
