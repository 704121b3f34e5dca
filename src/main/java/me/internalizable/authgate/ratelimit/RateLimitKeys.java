package me.internalizable.authgate.ratelimit;

import java.util.Locale;

/**
 * The rate limit key is the normalized email. The client identity is left out on
 * purpose: a user can switch networks between attempts.
 */
public final class RateLimitKeys {

    private RateLimitKeys() {
    }

    public static String forEmail(String email) {
        if (email == null || email.isBlank()) {
            throw new IllegalArgumentException("email is required");
        }
        return email.trim().toLowerCase(Locale.ROOT);
    }
}
