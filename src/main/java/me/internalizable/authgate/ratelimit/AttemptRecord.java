package me.internalizable.authgate.ratelimit;

import java.time.Instant;

/**
 * One authentication attempt as written to the attempt log.
 */
public record AttemptRecord(String email, String identity, String userAgent, Instant timestamp, boolean success) {}
