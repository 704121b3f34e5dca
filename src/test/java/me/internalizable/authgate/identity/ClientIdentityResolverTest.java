package me.internalizable.authgate.identity;

import me.internalizable.authgate.fingerprint.EnvironmentSignalProvider;
import me.internalizable.authgate.fingerprint.EnvironmentSignals;
import me.internalizable.authgate.fingerprint.FingerprintGenerator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

import static me.internalizable.authgate.identity.IdentityTier.NETWORK_EDGE;
import static me.internalizable.authgate.identity.IdentityTier.PUBLIC_API;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Fallback chain tests.
 *
 * Focus:
 * - Tier order and early exit
 * - Timeouts, transport errors and empty answers advance the chain
 * - Fingerprint and sentinel fallbacks
 */
class ClientIdentityResolverTest {

    private static final EnvironmentSignals SIGNALS = new EnvironmentSignals(
            "1080x1920x24", "Europe/London", "en-GB", "MacIntel", "Mozilla/5.0");
    private static final EnvironmentSignalProvider PROVIDER = () -> SIGNALS;

    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        executor = Executors.newCachedThreadPool();
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        executor.shutdownNow();
        executor.awaitTermination(5, TimeUnit.SECONDS);
    }

    private ClientIdentityResolver resolver(IdentitySource... sources) {
        return new ClientIdentityResolver(List.of(sources), PROVIDER, executor);
    }

    @Test
    void testEdgeSucceeds_publicNeverCalled() {
        StubIdentitySource edge = StubIdentitySource.answering(NETWORK_EDGE, "203.0.113.5");
        StubIdentitySource pub = StubIdentitySource.answering(PUBLIC_API, "198.51.100.5");

        ClientIdentity identity = resolver(edge, pub).resolve().join();

        assertEquals(new ClientIdentity("203.0.113.5", NETWORK_EDGE), identity);
        assertEquals(1, edge.calls());
        assertEquals(0, pub.calls());
    }

    @Test
    void testEdgeFails_fallsBackToPublic() {
        StubIdentitySource edge = StubIdentitySource.failing(NETWORK_EDGE);
        StubIdentitySource pub = StubIdentitySource.answering(PUBLIC_API, "198.51.100.5");

        ClientIdentity identity = resolver(edge, pub).resolve().join();

        assertEquals(new ClientIdentity("198.51.100.5", PUBLIC_API), identity);
        assertEquals(1, edge.calls());
        assertEquals(1, pub.calls());
    }

    @Test
    void testEdgeAnswersWithoutIp_fallsBackToPublic() {
        StubIdentitySource edge = StubIdentitySource.empty(NETWORK_EDGE);
        StubIdentitySource pub = StubIdentitySource.answering(PUBLIC_API, "198.51.100.5");

        assertEquals(PUBLIC_API, resolver(edge, pub).resolve().join().tier());
    }

    @Test
    void testEdgeAnswersBlank_fallsBackToPublic() {
        StubIdentitySource edge = StubIdentitySource.answering(NETWORK_EDGE, "   ");
        StubIdentitySource pub = StubIdentitySource.answering(PUBLIC_API, "198.51.100.5");

        assertEquals("198.51.100.5", resolver(edge, pub).resolve().join().value());
    }

    @Test
    void testEdgeTimesOut_chainMovesOnWithinBound() {
        StubIdentitySource edge = StubIdentitySource.hanging(NETWORK_EDGE, Duration.ofMillis(150));
        StubIdentitySource pub = StubIdentitySource.answering(PUBLIC_API, "198.51.100.5");

        long start = System.nanoTime();
        ClientIdentity identity = resolver(edge, pub).resolve().join();
        long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertEquals(PUBLIC_API, identity.tier());
        assertTrue(elapsedMillis < 2_000, "took " + elapsedMillis + " ms");
    }

    @Test
    void testBothTimeOut_latencyBoundedBySumOfTimeouts() {
        StubIdentitySource edge = StubIdentitySource.hanging(NETWORK_EDGE, Duration.ofMillis(100));
        StubIdentitySource pub = StubIdentitySource.hanging(PUBLIC_API, Duration.ofMillis(100));

        long start = System.nanoTime();
        ClientIdentity identity = resolver(edge, pub).resolve().join();
        long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertEquals(IdentityTier.FINGERPRINT, identity.tier());
        assertTrue(elapsedMillis < 2_000, "took " + elapsedMillis + " ms");
    }

    @Test
    void testAllNetworkTiersFail_usesTaggedFingerprint() {
        ClientIdentity identity = resolver(
                StubIdentitySource.failing(NETWORK_EDGE),
                StubIdentitySource.failing(PUBLIC_API)).resolve().join();

        assertEquals(IdentityTier.FINGERPRINT, identity.tier());
        assertEquals("browser-" + FingerprintGenerator.generate(SIGNALS), identity.value());
    }

    @Test
    void testNoRetries_eachTierCalledOnce() {
        StubIdentitySource edge = StubIdentitySource.failing(NETWORK_EDGE);
        StubIdentitySource pub = StubIdentitySource.failing(PUBLIC_API);

        resolver(edge, pub).resolve().join();

        assertEquals(1, edge.calls());
        assertEquals(1, pub.calls());
    }

    @Test
    void testFingerprintThrows_returnsUnknownSentinel() {
        EnvironmentSignalProvider broken = () -> {
            throw new IllegalStateException("no environment");
        };
        ClientIdentityResolver resolver = new ClientIdentityResolver(
                List.of(StubIdentitySource.failing(NETWORK_EDGE)), broken, executor);

        ClientIdentity identity = resolver.resolve().join();

        assertEquals(ClientIdentity.unknown(), identity);
        assertEquals(ClientIdentity.UNKNOWN_CLIENT, resolver.getClientIdentity());
    }

    @Test
    void testRejectedExecution_skipsTier() {
        ClientIdentityResolver resolver = new ClientIdentityResolver(
                List.of(StubIdentitySource.answering(NETWORK_EDGE, "203.0.113.5")),
                PROVIDER,
                task -> {
                    throw new RejectedExecutionException("pool exhausted");
                });

        assertEquals(IdentityTier.FINGERPRINT, resolver.resolve().join().tier());
    }

    @Test
    void testGetClientIdentity_neverBlank() {
        String identity = resolver(
                StubIdentitySource.failing(NETWORK_EDGE),
                StubIdentitySource.empty(PUBLIC_API)).getClientIdentity();

        assertNotNull(identity);
        assertFalse(identity.isBlank());
        assertTrue(identity.startsWith(ClientIdentity.FINGERPRINT_PREFIX));
    }

    @Test
    void testResolve_freshEachTime() {
        StubIdentitySource edge = StubIdentitySource.answering(NETWORK_EDGE, "203.0.113.5");
        ClientIdentityResolver resolver = resolver(edge);

        resolver.resolve().join();
        resolver.resolve().join();

        assertEquals(2, edge.calls());
    }

    @Test
    void testBlankIdentity_rejected() {
        assertThrows(IllegalArgumentException.class, () -> new ClientIdentity("", NETWORK_EDGE));
        assertThrows(IllegalArgumentException.class, () -> new ClientIdentity("1.2.3.4", null));
    }
}
