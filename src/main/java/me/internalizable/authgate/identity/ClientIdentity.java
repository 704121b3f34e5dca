package me.internalizable.authgate.identity;

/**
 * Best-available identifier for the calling client. The value is never blank.
 */
public record ClientIdentity(String value, IdentityTier tier) {

    public static final String UNKNOWN_CLIENT = "unknown-client";
    public static final String FINGERPRINT_PREFIX = "browser-";

    public ClientIdentity {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Client identity value must not be blank");
        }
        if (tier == null) {
            throw new IllegalArgumentException("Client identity tier is required");
        }
    }

    public static ClientIdentity fingerprint(String hash) {
        return new ClientIdentity(FINGERPRINT_PREFIX + hash, IdentityTier.FINGERPRINT);
    }

    public static ClientIdentity unknown() {
        return new ClientIdentity(UNKNOWN_CLIENT, IdentityTier.UNKNOWN);
    }
}
