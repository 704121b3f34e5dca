package me.internalizable.authgate.identity;

import me.internalizable.authgate.dto.ClientIpResponse;
import org.springframework.web.client.RestClient;

import java.time.Duration;
import java.util.Optional;

/**
 * Asks an HTTP echo service for the caller's address. Both the first-party
 * endpoint and the public fallback answer with {@code {"ip": "..."}}.
 */
public class HttpIdentitySource implements IdentitySource {

    private final IdentityTier tier;
    private final RestClient restClient;
    private final String uri;
    private final Duration timeout;

    public HttpIdentitySource(IdentityTier tier, RestClient restClient, String uri, Duration timeout) {
        this.tier = tier;
        this.restClient = restClient;
        this.uri = uri;
        this.timeout = timeout;
    }

    @Override
    public IdentityTier tier() {
        return tier;
    }

    @Override
    public Duration timeout() {
        return timeout;
    }

    @Override
    public Optional<String> lookup() {
        ClientIpResponse response = restClient.get()
                .uri(uri)
                .retrieve()
                .body(ClientIpResponse.class);

        if (response == null || response.ip() == null || response.ip().isBlank()) {
            return Optional.empty();
        }
        return Optional.of(response.ip().trim());
    }

    @Override
    public String toString() {
        return tier + "(" + uri + ")";
    }
}
