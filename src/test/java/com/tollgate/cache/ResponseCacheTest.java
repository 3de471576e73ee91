package com.tollgate.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tollgate.model.CompletionRequest;
import com.tollgate.model.CompletionResponse;
import com.tollgate.model.ResolvedCompletion;
import com.tollgate.model.ResponseSource;
import com.tollgate.model.TokenUsage;
import com.tollgate.provider.LlmProvider;
import com.tollgate.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ResponseCache.
 */
class ResponseCacheTest {

    private MutableClock clock;
    private AtomicInteger upstreamCalls;
    private UpstreamFetch echo;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-05-01T10:00:00Z");
        upstreamCalls = new AtomicInteger();
        echo = request -> {
            int call = upstreamCalls.incrementAndGet();
            return Mono.just(response(request.getPrompt() + " #" + call));
        };
    }

    private ResponseCache newCache(long ttlSeconds, int maxSize) {
        RequestFingerprinter fingerprinter = new RequestFingerprinter(new ObjectMapper(), () -> LlmProvider.GROQ);
        return new ResponseCache(fingerprinter, clock, Duration.ofSeconds(ttlSeconds), maxSize);
    }

    private static CompletionRequest request(String prompt) {
        return CompletionRequest.builder().prompt(prompt).build();
    }

    private static CompletionResponse response(String text) {
        return CompletionResponse.builder()
                .text(text)
                .usage(new TokenUsage(3, 5, 8))
                .provider("groq")
                .build();
    }

    private ResolvedCompletion resolve(ResponseCache cache, String prompt) {
        return cache.resolve(request(prompt), echo).block(Duration.ofSeconds(5));
    }

    @Test
    void testSecondResolveIsHitWithIdenticalContent() {
        ResponseCache cache = newCache(300, 100);

        ResolvedCompletion first = resolve(cache, "hello");
        ResolvedCompletion second = resolve(cache, "hello");

        assertEquals(ResponseSource.UPSTREAM, first.getSource());
        assertFalse(first.isCacheHit());
        assertEquals(ResponseSource.CACHE, second.getSource());
        assertTrue(second.isCacheHit());
        assertEquals(first.getResponse(), second.getResponse());
        assertEquals(first.getKey(), second.getKey());
        assertEquals(1, upstreamCalls.get());
    }

    @Test
    void testConcurrentIdenticalRequestsShareOneFetch() throws Exception {
        ResponseCache cache = newCache(300, 100);
        Sinks.One<CompletionResponse> sink = Sinks.one();
        UpstreamFetch slow = request -> {
            upstreamCalls.incrementAndGet();
            return sink.asMono();
        };

        int callers = 16;
        ExecutorService pool = Executors.newFixedThreadPool(callers);
        CountDownLatch start = new CountDownLatch(1);
        List<CompletableFuture<CompletableFuture<ResolvedCompletion>>> submitted = new ArrayList<>();
        try {
            for (int i = 0; i < callers; i++) {
                submitted.add(CompletableFuture.supplyAsync(() -> {
                    try {
                        start.await();
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        throw new IllegalStateException(e);
                    }
                    return cache.resolve(request("same"), slow).toFuture();
                }, pool));
            }
            start.countDown();

            List<CompletableFuture<ResolvedCompletion>> results = new ArrayList<>();
            for (CompletableFuture<CompletableFuture<ResolvedCompletion>> f : submitted) {
                results.add(f.get(5, TimeUnit.SECONDS));
            }

            assertEquals(1, upstreamCalls.get());
            assertEquals(1, cache.inFlightCount());

            sink.tryEmitValue(response("shared"));

            long leaders = 0;
            for (CompletableFuture<ResolvedCompletion> result : results) {
                ResolvedCompletion resolved = result.get(5, TimeUnit.SECONDS);
                assertEquals("shared", resolved.getResponse().getText());
                if (resolved.getSource() == ResponseSource.UPSTREAM) {
                    leaders++;
                }
            }
            assertEquals(1, leaders);
            assertEquals(0, cache.inFlightCount());
            assertEquals(1, cache.metrics().getMisses());
            assertEquals(1, cache.metrics().getSize());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void testFailurePropagatesToEveryJoinerAndIsNotCached() {
        ResponseCache cache = newCache(300, 100);
        Sinks.One<CompletionResponse> sink = Sinks.one();
        UpstreamFetch failing = request -> {
            upstreamCalls.incrementAndGet();
            return sink.asMono();
        };

        CompletableFuture<ResolvedCompletion> first = cache.resolve(request("boom"), failing).toFuture();
        CompletableFuture<ResolvedCompletion> second = cache.resolve(request("boom"), failing).toFuture();

        IllegalStateException failure = new IllegalStateException("provider down");
        sink.tryEmitError(failure);

        ExecutionException e1 = assertThrows(ExecutionException.class, () -> first.get(5, TimeUnit.SECONDS));
        ExecutionException e2 = assertThrows(ExecutionException.class, () -> second.get(5, TimeUnit.SECONDS));
        assertSame(failure, e1.getCause());
        assertSame(failure, e2.getCause());

        assertEquals(1, upstreamCalls.get());
        assertEquals(0, cache.inFlightCount());
        assertEquals(0, cache.metrics().getSize());

        // A failed fetch doesn't poison the key
        ResolvedCompletion retry = resolve(cache, "boom");
        assertEquals(ResponseSource.UPSTREAM, retry.getSource());
        assertEquals(2, upstreamCalls.get());
    }

    @Test
    void testSynchronousUpstreamExceptionIsPropagated() {
        ResponseCache cache = newCache(300, 100);
        UpstreamFetch throwing = request -> {
            throw new IllegalStateException("missing credentials");
        };

        StepVerifier.create(cache.resolve(request("x"), throwing))
                .expectErrorMessage("missing credentials")
                .verify(Duration.ofSeconds(5));

        assertEquals(0, cache.inFlightCount());
    }

    @Test
    void testEntryExpiresExactlyAtTtl() {
        ResponseCache cache = newCache(10, 100);

        resolve(cache, "ttl");
        clock.advance(Duration.ofMillis(9_999));
        assertEquals(ResponseSource.CACHE, resolve(cache, "ttl").getSource());

        clock.advance(Duration.ofMillis(1));
        assertEquals(ResponseSource.UPSTREAM, resolve(cache, "ttl").getSource());
        assertEquals(2, upstreamCalls.get());
    }

    @Test
    void testOverflowEvictsOldestCreatedNotLeastRecentlyUsed() {
        ResponseCache cache = newCache(300, 3);

        resolve(cache, "a");
        clock.advance(Duration.ofSeconds(1));
        resolve(cache, "b");
        clock.advance(Duration.ofSeconds(1));
        resolve(cache, "c");

        // Reads don't protect an entry from eviction
        for (int i = 0; i < 5; i++) {
            assertTrue(resolve(cache, "a").isCacheHit());
        }

        clock.advance(Duration.ofSeconds(1));
        resolve(cache, "d");
        clock.advance(Duration.ofSeconds(1));
        resolve(cache, "e");

        assertEquals(3, cache.metrics().getSize());
        assertTrue(resolve(cache, "c").isCacheHit());
        assertTrue(resolve(cache, "d").isCacheHit());
        assertTrue(resolve(cache, "e").isCacheHit());
    }

    @Test
    void testEvictionOrderWithinSameInstantFollowsInsertion() {
        ResponseCache cache = newCache(300, 2);

        resolve(cache, "first");
        resolve(cache, "second");
        resolve(cache, "third");

        assertEquals(2, cache.metrics().getSize());
        assertTrue(resolve(cache, "second").isCacheHit());
        assertTrue(resolve(cache, "third").isCacheHit());
    }

    @Test
    void testHitRateArithmeticAndClear() {
        ResponseCache cache = newCache(300, 100);
        assertEquals(0.0, cache.metrics().getHitRate());

        resolve(cache, "q");
        resolve(cache, "q");
        resolve(cache, "q");
        resolve(cache, "q");

        CacheMetrics metrics = cache.metrics();
        assertEquals(3, metrics.getHits());
        assertEquals(1, metrics.getMisses());
        assertEquals(0.75, metrics.getHitRate(), 1e-9);

        cache.clear();

        CacheMetrics cleared = cache.metrics();
        assertEquals(0, cleared.getSize());
        assertEquals(0, cleared.getHits());
        assertEquals(0, cleared.getMisses());
        assertEquals(0.0, cleared.getHitRate());
    }

    @Test
    void testSkipCacheBypassesEverything() {
        ResponseCache cache = newCache(300, 100);
        CompletionRequest fresh = CompletionRequest.builder().prompt("fresh").skipCache(true).build();

        ResolvedCompletion first = cache.resolve(fresh, echo).block();
        ResolvedCompletion second = cache.resolve(fresh, echo).block();

        assertEquals(ResponseSource.BYPASS, first.getSource());
        assertEquals(ResponseSource.BYPASS, second.getSource());
        assertNull(first.getKey());
        assertNotEquals(first.getResponse().getText(), second.getResponse().getText());
        assertEquals(2, upstreamCalls.get());

        CacheMetrics metrics = cache.metrics();
        assertEquals(0, metrics.getSize());
        assertEquals(0, metrics.getHits());
        assertEquals(0, metrics.getMisses());
    }

    @Test
    void testPruneRemovesOnlyExpiredEntries() {
        ResponseCache cache = newCache(60, 100);

        resolve(cache, "old");
        clock.advance(Duration.ofSeconds(30));
        resolve(cache, "new");
        clock.advance(Duration.ofSeconds(30));

        assertEquals(1, cache.prune());
        assertEquals(0, cache.prune());
        assertEquals(1, cache.metrics().getSize());
        assertTrue(resolve(cache, "new").isCacheHit());
    }

    @Test
    void testConfigureAppliesToFutureEntriesOnly() {
        ResponseCache cache = newCache(300, 100);

        resolve(cache, "before");
        cache.configure(10, null);
        resolve(cache, "after");

        clock.advance(Duration.ofSeconds(10));

        assertTrue(resolve(cache, "before").isCacheHit());
        assertFalse(resolve(cache, "after").isCacheHit());
        assertEquals(10, cache.metrics().getTtlInSeconds());
        assertEquals(100, cache.metrics().getMaxSize());
    }

    @Test
    void testConfigureShrinksImmediately() {
        ResponseCache cache = newCache(300, 100);
        for (int i = 0; i < 5; i++) {
            resolve(cache, "p" + i);
            clock.advance(Duration.ofSeconds(1));
        }

        cache.configure(300, 2);

        assertEquals(2, cache.metrics().getSize());
        assertTrue(resolve(cache, "p3").isCacheHit());
        assertTrue(resolve(cache, "p4").isCacheHit());
    }

    @Test
    void testConfigureRejectsInvalidValuesAndKeepsState() {
        ResponseCache cache = newCache(300, 100);

        assertThrows(IllegalArgumentException.class, () -> cache.configure(0, 10));
        assertThrows(IllegalArgumentException.class, () -> cache.configure(60, 0));

        assertEquals(300, cache.metrics().getTtlInSeconds());
        assertEquals(100, cache.metrics().getMaxSize());
    }

    @Test
    void testClearDuringFetchStillStoresResult() {
        ResponseCache cache = newCache(300, 100);
        Sinks.One<CompletionResponse> sink = Sinks.one();

        CompletableFuture<ResolvedCompletion> pending = cache.resolve(request("late"), r -> sink.asMono()).toFuture();
        cache.clear();
        sink.tryEmitValue(response("late answer"));

        assertEquals("late answer", pending.join().getResponse().getText());
        assertEquals(1, cache.metrics().getSize());
        assertEquals(0, cache.metrics().getMisses());
        assertTrue(resolve(cache, "late").isCacheHit());
    }

    @Test
    void testCancelledSubscriberDoesNotCancelSharedFetch() {
        ResponseCache cache = newCache(300, 100);
        Sinks.One<CompletionResponse> sink = Sinks.one();

        Disposable leader = cache.resolve(request("shared"), r -> sink.asMono()).subscribe();
        CompletableFuture<ResolvedCompletion> joiner = cache.resolve(request("shared"), r -> sink.asMono()).toFuture();

        leader.dispose();
        sink.tryEmitValue(response("still delivered"));

        ResolvedCompletion joined = joiner.join();
        assertEquals(ResponseSource.COALESCED, joined.getSource());
        assertEquals("still delivered", joined.getResponse().getText());
        assertEquals(1, cache.metrics().getSize());
    }

    @Test
    void testEndToEndTtlSixtyMaxSizeTwo() {
        ResponseCache cache = newCache(60, 2);

        ResolvedCompletion a = resolve(cache, "A");
        ResolvedCompletion b = resolve(cache, "B");
        ResolvedCompletion c = resolve(cache, "C");
        assertEquals(2, cache.metrics().getSize());

        ResolvedCompletion bAgain = resolve(cache, "B");
        ResolvedCompletion cAgain = resolve(cache, "C");
        assertTrue(bAgain.isCacheHit());
        assertTrue(cAgain.isCacheHit());
        assertEquals(b.getResponse(), bAgain.getResponse());
        assertEquals(c.getResponse(), cAgain.getResponse());

        ResolvedCompletion aAgain = resolve(cache, "A");
        assertEquals(ResponseSource.UPSTREAM, aAgain.getSource());
        assertNotEquals(a.getResponse().getText(), aAgain.getResponse().getText());
        assertEquals(4, upstreamCalls.get());
    }
}
