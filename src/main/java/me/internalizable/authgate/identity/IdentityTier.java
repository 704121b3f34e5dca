package me.internalizable.authgate.identity;

/**
 * Which step of the fallback chain produced a client identity.
 */
public enum IdentityTier {
    NETWORK_EDGE,
    PUBLIC_API,
    FINGERPRINT,
    UNKNOWN
}
