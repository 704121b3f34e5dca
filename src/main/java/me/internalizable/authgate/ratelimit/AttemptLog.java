package me.internalizable.authgate.ratelimit;

/**
 * Append-only sink for attempt records. Never queried back.
 */
@FunctionalInterface
public interface AttemptLog {

    void append(AttemptRecord record);
}
