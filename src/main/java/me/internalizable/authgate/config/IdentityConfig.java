package me.internalizable.authgate.config;

import me.internalizable.authgate.fingerprint.EnvironmentSignalProvider;
import me.internalizable.authgate.identity.ClientIdentityResolver;
import me.internalizable.authgate.identity.HttpIdentitySource;
import me.internalizable.authgate.identity.IdentitySource;
import me.internalizable.authgate.identity.IdentityTier;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.client.RestClient;

import java.time.Duration;
import java.util.List;

@Configuration
public class IdentityConfig {

    @Value("${auth-gate.identity.edge-url:http://localhost:8080/api/get-client-ip}")
    private String edgeUrl;

    @Value("${auth-gate.identity.edge-api-key:}")
    private String edgeApiKey;

    @Value("${auth-gate.identity.edge-timeout-ms:2000}")
    private int edgeTimeoutMs;

    @Value("${auth-gate.identity.public-url:https://api.ipify.org?format=json}")
    private String publicUrl;

    @Value("${auth-gate.identity.public-timeout-ms:3000}")
    private int publicTimeoutMs;

    @Bean
    public ThreadPoolTaskExecutor identityLookupExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setThreadNamePrefix("identity-lookup-");
        // Direct handoff: a queued lookup would burn its timeout before it starts
        executor.setCorePoolSize(8);
        executor.setMaxPoolSize(128);
        executor.setQueueCapacity(0);
        executor.setKeepAliveSeconds(30);
        executor.setDaemon(true);
        executor.initialize();
        return executor;
    }

    @Bean
    public IdentitySource edgeIdentitySource() {
        RestClient.Builder builder = RestClient.builder()
                .requestFactory(requestFactory(edgeTimeoutMs));
        if (!edgeApiKey.isBlank()) {
            builder.defaultHeader("Authorization", "Bearer " + edgeApiKey);
        }
        return new HttpIdentitySource(IdentityTier.NETWORK_EDGE, builder.build(), edgeUrl,
                Duration.ofMillis(edgeTimeoutMs));
    }

    @Bean
    public IdentitySource publicIdentitySource() {
        RestClient restClient = RestClient.builder()
                .requestFactory(requestFactory(publicTimeoutMs))
                .build();
        return new HttpIdentitySource(IdentityTier.PUBLIC_API, restClient, publicUrl,
                Duration.ofMillis(publicTimeoutMs));
    }

    @Bean
    public ClientIdentityResolver clientIdentityResolver(
            @Qualifier("edgeIdentitySource") IdentitySource edgeIdentitySource,
            @Qualifier("publicIdentitySource") IdentitySource publicIdentitySource,
            EnvironmentSignalProvider signalProvider,
            @Qualifier("identityLookupExecutor") ThreadPoolTaskExecutor identityLookupExecutor) {
        return new ClientIdentityResolver(
                List.of(edgeIdentitySource, publicIdentitySource),
                signalProvider,
                identityLookupExecutor);
    }

    private static SimpleClientHttpRequestFactory requestFactory(int timeoutMs) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(timeoutMs);
        requestFactory.setReadTimeout(timeoutMs);
        return requestFactory;
    }
}
