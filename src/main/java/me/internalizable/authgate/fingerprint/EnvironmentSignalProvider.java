package me.internalizable.authgate.fingerprint;

/**
 * Source of the environment signals used as the last-resort client identifier.
 */
@FunctionalInterface
public interface EnvironmentSignalProvider {

    EnvironmentSignals collect();
}
