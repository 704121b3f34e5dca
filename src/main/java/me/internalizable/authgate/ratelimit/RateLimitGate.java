package me.internalizable.authgate.ratelimit;

/**
 * Decides whether an authentication attempt may proceed and records its outcome.
 *
 * Neither operation throws: state that cannot be read is treated as permissive,
 * and outcomes that cannot be written are dropped.
 */
public interface RateLimitGate {

    /**
     * @param email    the account being signed into; the rate limit key
     * @param identity the caller's resolved client identity, recorded as metadata
     */
    RateLimitDecision check(String email, String identity);

    void record(String email, String identity, boolean success, String userAgent);

    default void record(String email, String identity, boolean success) {
        record(email, identity, success, null);
    }
}
