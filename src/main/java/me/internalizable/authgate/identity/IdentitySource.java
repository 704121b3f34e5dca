package me.internalizable.authgate.identity;

import java.time.Duration;
import java.util.Optional;

/**
 * One network step of the identity fallback chain.
 *
 * Implementations perform a single blocking lookup and may throw on transport
 * or parse errors; the resolver owns timeouts and error recovery.
 */
public interface IdentitySource {

    IdentityTier tier();

    Duration timeout();

    /**
     * @return the identifier reported by the source, empty if it answered without one
     */
    Optional<String> lookup();
}
