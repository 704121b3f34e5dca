package me.internalizable.authgate.attempt;

import me.internalizable.authgate.identity.ClientIdentity;
import me.internalizable.authgate.ratelimit.RateLimitDecision;

import java.util.Optional;

/**
 * Outcome of a gated submission: either the credential check's value, or the
 * denial that kept the check from running.
 */
public record AttemptResult<T>(ClientIdentity identity, RateLimitDecision decision, T value) {

    public static <T> AttemptResult<T> accepted(ClientIdentity identity, RateLimitDecision decision, T value) {
        return new AttemptResult<>(identity, decision, value);
    }

    public static <T> AttemptResult<T> denied(ClientIdentity identity, RateLimitDecision decision) {
        return new AttemptResult<>(identity, decision, null);
    }

    public boolean isDenied() {
        return !decision.allowed();
    }

    public Optional<T> valueIfAccepted() {
        return isDenied() ? Optional.empty() : Optional.ofNullable(value);
    }

    public Optional<String> denialMessage() {
        return isDenied() ? Optional.of(decision.lockoutMessage()) : Optional.empty();
    }
}
