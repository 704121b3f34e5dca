package me.internalizable.authgate.ratelimit;

import me.internalizable.authgate.dto.CheckRateLimitRequest;
import me.internalizable.authgate.dto.RateLimitResponse;
import me.internalizable.authgate.dto.RecordAttemptRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;

/**
 * Gate that delegates to the rate limit endpoints of another auth-gate instance.
 *
 * Any failure to reach or understand the remote side is treated like a store
 * outage: checks fail open and records are dropped.
 */
public class RemoteRateLimitGate implements RateLimitGate {

    private static final Logger logger = LoggerFactory.getLogger(RemoteRateLimitGate.class);

    static final String CHECK_PATH = "/api/auth-rate-limit/check";
    static final String RECORD_PATH = "/api/auth-rate-limit/record";

    private final RestClient restClient;
    private final String defaultUserAgent;

    public RemoteRateLimitGate(RestClient restClient, String defaultUserAgent) {
        this.restClient = restClient;
        this.defaultUserAgent = defaultUserAgent;
    }

    @Override
    public RateLimitDecision check(String email, String identity) {
        try {
            RateLimitResponse response = restClient.post()
                    .uri(CHECK_PATH)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(new CheckRateLimitRequest(email, identity, defaultUserAgent))
                    .retrieve()
                    .body(RateLimitResponse.class);

            if (response == null) {
                logger.error("Empty rate limit check response for {}, failing open", email);
                return RateLimitDecision.failOpen();
            }
            return response.toDecision();
        } catch (Exception e) {
            logger.error("Rate limit check error for {}, failing open", email, e);
            return RateLimitDecision.failOpen();
        }
    }

    @Override
    public void record(String email, String identity, boolean success, String userAgent) {
        try {
            restClient.post()
                    .uri(RECORD_PATH)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(new RecordAttemptRequest(email, identity, success,
                            userAgent != null ? userAgent : defaultUserAgent))
                    .retrieve()
                    .toBodilessEntity();
        } catch (Exception e) {
            logger.error("Record attempt error for {}", email, e);
        }
    }
}
