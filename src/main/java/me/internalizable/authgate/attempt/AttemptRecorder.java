package me.internalizable.authgate.attempt;

import me.internalizable.authgate.identity.ClientIdentity;
import me.internalizable.authgate.ratelimit.AuthRateLimitService;
import me.internalizable.authgate.ratelimit.RateLimitDecision;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Runs one authentication submission through the gate.
 *
 * Flow: resolve client identity, check the rate limit, and if allowed run the
 * caller's credential check. The outcome is recorded exactly once, even when
 * the check throws. A denied submission never reaches the credential check and
 * records nothing.
 *
 * The gated part runs on its own executor, never on the thread that completed
 * identity resolution: that may be the JDK's shared timeout scheduler.
 */
@Component
public class AttemptRecorder {

    private static final Logger logger = LoggerFactory.getLogger(AttemptRecorder.class);

    private final AuthRateLimitService rateLimitService;
    private final Executor attemptExecutor;

    public AttemptRecorder(AuthRateLimitService rateLimitService,
                           @Qualifier("attemptExecutor") Executor attemptExecutor) {
        this.rateLimitService = rateLimitService;
        this.attemptExecutor = attemptExecutor;
    }

    public <T> CompletableFuture<AttemptResult<T>> attempt(String email, CredentialCheck<T> check) {
        return attempt(email, null, check);
    }

    /**
     * @return a future that completes with the result, or exceptionally with the
     * credential check's own exception wrapped in a {@link CompletionException}
     */
    public <T> CompletableFuture<AttemptResult<T>> attempt(String email, String userAgent, CredentialCheck<T> check) {
        return rateLimitService.resolveClientIdentity()
                .thenApplyAsync(identity -> gated(email, userAgent, identity, check), attemptExecutor);
    }

    /**
     * Blocking variant that rethrows the credential check's exception unwrapped.
     */
    public <T> AttemptResult<T> attemptAndWait(String email, CredentialCheck<T> check) throws Exception {
        try {
            return attempt(email, check).join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof Exception cause) {
                throw cause;
            }
            throw e;
        }
    }

    private <T> AttemptResult<T> gated(String email, String userAgent, ClientIdentity identity, CredentialCheck<T> check) {
        RateLimitDecision decision = rateLimitService.checkRateLimit(email, identity.value());
        if (!decision.allowed()) {
            logger.info("Sign-in for {} blocked for {}s ({} failed attempts)",
                    email, decision.remainingSeconds(), decision.attempts());
            return AttemptResult.denied(identity, decision);
        }

        boolean success = false;
        try {
            T value = check.verify();
            success = true;
            return AttemptResult.accepted(identity, decision, value);
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new CompletionException(e);
        } finally {
            rateLimitService.recordAttempt(email, identity.value(), success, userAgent);
        }
    }
}
