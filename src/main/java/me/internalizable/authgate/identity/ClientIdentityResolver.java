package me.internalizable.authgate.identity;

import me.internalizable.authgate.fingerprint.EnvironmentSignalProvider;
import me.internalizable.authgate.fingerprint.FingerprintGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Resolves an identifier for the calling client through an ordered fallback chain.
 *
 * Each network source gets exactly one attempt, bounded by its own timeout.
 * A timed-out call is abandoned and the chain moves on. When every network
 * source fails, the local environment fingerprint is used; if even that
 * throws, the fixed {@link ClientIdentity#UNKNOWN_CLIENT} sentinel is returned.
 *
 * The returned future never completes exceptionally, and identities are never
 * cached: network conditions may change between attempts.
 */
public class ClientIdentityResolver {

    private static final Logger logger = LoggerFactory.getLogger(ClientIdentityResolver.class);

    private final List<IdentitySource> sources;
    private final EnvironmentSignalProvider signalProvider;
    private final Executor executor;

    public ClientIdentityResolver(List<IdentitySource> sources,
                                  EnvironmentSignalProvider signalProvider,
                                  Executor executor) {
        this.sources = List.copyOf(sources);
        this.signalProvider = signalProvider;
        this.executor = executor;
    }

    public CompletableFuture<ClientIdentity> resolve() {
        CompletableFuture<Optional<ClientIdentity>> chain = CompletableFuture.completedFuture(Optional.empty());

        for (IdentitySource source : sources) {
            chain = chain.thenCompose(found -> found.isPresent()
                    ? CompletableFuture.completedFuture(found)
                    : attempt(source));
        }

        return chain
                .thenApply(found -> found.orElseGet(this::fallbackIdentity))
                .exceptionally(e -> {
                    logger.error("Client identity resolution failed unexpectedly", e);
                    return ClientIdentity.unknown();
                });
    }

    /**
     * Blocking variant; waits at most for the sum of the source timeouts.
     */
    public String getClientIdentity() {
        return resolve().join().value();
    }

    private CompletableFuture<Optional<ClientIdentity>> attempt(IdentitySource source) {
        CompletableFuture<Optional<String>> call;
        try {
            call = CompletableFuture.supplyAsync(source::lookup, executor)
                    .orTimeout(source.timeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (RuntimeException e) {
            logger.warn("Could not dispatch identity lookup to {}: {}", source, e.getMessage());
            return CompletableFuture.completedFuture(Optional.empty());
        }

        return call.handle((value, error) -> {
            if (error != null) {
                Throwable cause = unwrap(error);
                if (cause instanceof TimeoutException) {
                    logger.warn("Identity lookup via {} timed out after {} ms", source, source.timeout().toMillis());
                } else {
                    logger.warn("Identity lookup via {} failed: {}", source, cause.toString());
                }
                return Optional.empty();
            }
            if (value == null || value.isEmpty() || value.get().isBlank()) {
                logger.warn("Identity lookup via {} returned no identifier", source);
                return Optional.empty();
            }
            logger.debug("Resolved client identity via {}", source.tier());
            return Optional.of(new ClientIdentity(value.get(), source.tier()));
        });
    }

    private ClientIdentity fallbackIdentity() {
        try {
            String hash = FingerprintGenerator.generate(signalProvider.collect());
            logger.info("Network identity lookups failed, using environment fingerprint");
            return ClientIdentity.fingerprint(hash);
        } catch (RuntimeException e) {
            logger.error("All client identity methods failed", e);
            return ClientIdentity.unknown();
        }
    }

    private static Throwable unwrap(Throwable error) {
        Throwable cause = error;
        while (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause;
    }
}
