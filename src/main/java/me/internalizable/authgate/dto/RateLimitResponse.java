package me.internalizable.authgate.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import me.internalizable.authgate.ratelimit.RateLimitDecision;

@JsonIgnoreProperties(ignoreUnknown = true)
public record RateLimitResponse(
        boolean allowed,
        @JsonProperty("remaining_seconds") int remainingSeconds,
        int attempts,
        @JsonProperty("lockout_time_minutes") int lockoutTimeMinutes
) {

    public static RateLimitResponse from(RateLimitDecision decision) {
        return new RateLimitResponse(
                decision.allowed(),
                decision.remainingSeconds(),
                decision.attempts(),
                decision.lockoutMinutes()
        );
    }

    /**
     * A denial without a positive wait cannot be honoured, so it is read as permissive.
     */
    public RateLimitDecision toDecision() {
        if (allowed || remainingSeconds <= 0) {
            return RateLimitDecision.allow(Math.max(0, attempts));
        }
        return RateLimitDecision.deny(remainingSeconds, attempts);
    }
}
