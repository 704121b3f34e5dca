package me.internalizable.authgate.ratelimit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Writes attempts to the {@code auth-gate.attempts} logger so they can be
 * routed to their own appender.
 */
@Component
public class LoggingAttemptLog implements AttemptLog {

    private static final Logger attempts = LoggerFactory.getLogger("auth-gate.attempts");

    @Override
    public void append(AttemptRecord record) {
        attempts.info("attempt email={} identity={} success={} at={} ua=\"{}\"",
                record.email(), record.identity(), record.success(), record.timestamp(),
                record.userAgent() != null ? record.userAgent() : "");
    }
}
