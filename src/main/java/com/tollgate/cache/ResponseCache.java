package com.tollgate.cache;

import com.tollgate.model.CompletionRequest;
import com.tollgate.model.CompletionResponse;
import com.tollgate.model.ResolvedCompletion;
import com.tollgate.model.ResponseSource;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * In-memory response cache with request coalescing.
 *
 * Flow for a cacheable request:
 * 1. Live entry for the key: count a hit and serve it
 * 2. Another caller is already fetching the key: join that fetch
 * 3. Otherwise: count a miss, fetch once, store on success, fail every joiner on error
 *
 * Entries expire {@code ttl} after creation and are evicted oldest-created
 * first once the map grows past {@code maxSize}. Reads never touch entry
 * placement or timestamps.
 */
@Slf4j
public class ResponseCache {

    private final Map<String, CacheEntry> entries = new ConcurrentHashMap<>();
    private final Map<String, CompletableFuture<CompletionResponse>> inFlight = new ConcurrentHashMap<>();

    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong sequence = new AtomicLong();

    private final RequestFingerprinter fingerprinter;
    private final Clock clock;

    private volatile Duration ttl;
    private volatile int maxSize;

    public ResponseCache(RequestFingerprinter fingerprinter, Clock clock, Duration ttl, int maxSize) {
        validate(ttl.getSeconds(), maxSize);
        this.fingerprinter = fingerprinter;
        this.clock = clock;
        this.ttl = ttl;
        this.maxSize = maxSize;
    }

    /**
     * Resolve a request from the cache, an in-flight fetch, or the upstream.
     *
     * @param request completion request
     * @param upstream computation to run on a miss
     * @return response tagged with its source
     */
    public Mono<ResolvedCompletion> resolve(CompletionRequest request, UpstreamFetch upstream) {
        if (request.isSkipCache()) {
            return Mono.defer(() -> upstream.fetch(request))
                    .map(response -> resolved(response, ResponseSource.BYPASS, null));
        }

        return Mono.defer(() -> {
            String key = fingerprinter.fingerprint(request);

            CacheEntry entry = lookup(key);
            if (entry != null) {
                return Mono.just(hit(key, entry));
            }

            Claim claim = claim(key);
            if (claim.entry != null) {
                return Mono.just(hit(key, claim.entry));
            }

            ResponseSource source;
            if (claim.leader) {
                misses.incrementAndGet();
                log.debug("Cache MISS, fetching upstream: key={}", key);
                launch(key, request, upstream, claim.future);
                source = ResponseSource.UPSTREAM;
            } else {
                log.debug("Joining in-flight fetch: key={}", key);
                source = ResponseSource.COALESCED;
            }

            // A cancelled subscriber must not cancel the fetch other callers share
            return Mono.fromFuture(claim.future, true)
                    .map(response -> resolved(response, source, key));
        });
    }

    /**
     * Remove expired entries.
     *
     * @return number of entries removed
     */
    public int prune() {
        Instant now = clock.instant();
        int removed = 0;
        for (Map.Entry<String, CacheEntry> e : entries.entrySet()) {
            if (e.getValue().isExpired(now) && entries.remove(e.getKey(), e.getValue())) {
                removed++;
            }
        }
        if (removed > 0) {
            log.debug("Pruned {} expired entries, {} remaining", removed, entries.size());
        }
        return removed;
    }

    /**
     * Drop every entry and reset hit/miss counters. In-flight fetches are
     * left alone and still store their result when they settle.
     */
    public void clear() {
        entries.clear();
        hits.set(0);
        misses.set(0);
        log.info("Response cache cleared");
    }

    /**
     * Change TTL and, optionally, capacity for future entries, then prune and
     * evict so the cache is consistent with the new limits.
     *
     * @param ttlSeconds time-to-live in seconds, at least 1
     * @param newMaxSize capacity, at least 1, or null to keep the current one
     */
    public void configure(long ttlSeconds, Integer newMaxSize) {
        validate(ttlSeconds, newMaxSize != null ? newMaxSize : maxSize);

        this.ttl = Duration.ofSeconds(ttlSeconds);
        if (newMaxSize != null) {
            this.maxSize = newMaxSize;
        }
        log.info("Response cache configured: ttl={}s, maxSize={}", ttlSeconds, maxSize);

        prune();
        evictOverflow();
    }

    public CacheMetrics metrics() {
        long h = hits.get();
        long m = misses.get();
        long total = h + m;

        return CacheMetrics.builder()
                .size(entries.size())
                .hitRate(total == 0 ? 0.0 : (double) h / total)
                .hits(h)
                .misses(m)
                .ttlInSeconds(ttl.getSeconds())
                .maxSize(maxSize)
                .build();
    }

    int inFlightCount() {
        return inFlight.size();
    }

    /**
     * Live entry for the key, dropping it if it has expired.
     */
    private CacheEntry lookup(String key) {
        CacheEntry entry = entries.get(key);
        if (entry == null) {
            return null;
        }
        if (entry.isExpired(clock.instant())) {
            entries.remove(key, entry);
            return null;
        }
        return entry;
    }

    private ResolvedCompletion hit(String key, CacheEntry entry) {
        hits.incrementAndGet();
        log.debug("Cache HIT: key={}", key);
        return resolved(entry.getResponse(), ResponseSource.CACHE, key);
    }

    /**
     * Join or register the in-flight fetch for a key. Runs under the
     * registry's per-key lock and re-checks the entry map there: a leader
     * stores its entry before unregistering, so a caller that lands after the
     * unregister always sees the stored entry.
     */
    private Claim claim(String key) {
        Claim[] result = new Claim[1];
        inFlight.compute(key, (k, existing) -> {
            if (existing != null) {
                result[0] = Claim.join(existing);
                return existing;
            }
            CacheEntry entry = lookup(k);
            if (entry != null) {
                result[0] = Claim.hit(entry);
                return null;
            }
            CompletableFuture<CompletionResponse> future = new CompletableFuture<>();
            result[0] = Claim.lead(future);
            return future;
        });
        return result[0];
    }

    private void launch(String key,
                        CompletionRequest request,
                        UpstreamFetch upstream,
                        CompletableFuture<CompletionResponse> future) {
        Mono.defer(() -> upstream.fetch(request))
                .switchIfEmpty(Mono.error(() -> new IllegalStateException("Upstream completed without a response")))
                .subscribe(
                        response -> {
                            store(key, response);
                            inFlight.remove(key, future);
                            future.complete(response);
                        },
                        error -> {
                            inFlight.remove(key, future);
                            log.debug("Upstream fetch failed, nothing cached: key={}, error={}", key, error.getMessage());
                            future.completeExceptionally(error);
                        });
    }

    private void store(String key, CompletionResponse response) {
        Instant now = clock.instant();
        entries.put(key, new CacheEntry(response, now, now.plus(ttl), sequence.incrementAndGet()));
        evictOverflow();
    }

    /**
     * Evict oldest-created entries until the map fits {@code maxSize}.
     */
    private synchronized void evictOverflow() {
        int overflow = entries.size() - maxSize;
        if (overflow <= 0) {
            return;
        }

        List<Map.Entry<String, CacheEntry>> victims = entries.entrySet().stream()
                .sorted(Comparator
                        .comparing((Map.Entry<String, CacheEntry> e) -> e.getValue().getCreatedAt())
                        .thenComparingLong(e -> e.getValue().getSequence()))
                .limit(overflow)
                .collect(Collectors.toList());

        victims.forEach(e -> entries.remove(e.getKey(), e.getValue()));
        log.debug("Evicted {} oldest entries, {} remaining", victims.size(), entries.size());
    }

    private static ResolvedCompletion resolved(CompletionResponse response, ResponseSource source, String key) {
        return ResolvedCompletion.builder()
                .response(response)
                .source(source)
                .key(key)
                .build();
    }

    private static void validate(long ttlSeconds, int maxSize) {
        if (ttlSeconds < 1) {
            throw new IllegalArgumentException("ttlInSeconds must be at least 1, got " + ttlSeconds);
        }
        if (maxSize < 1) {
            throw new IllegalArgumentException("maxSize must be at least 1, got " + maxSize);
        }
    }

    private static final class Claim {
        private final CacheEntry entry;
        private final CompletableFuture<CompletionResponse> future;
        private final boolean leader;

        private Claim(CacheEntry entry, CompletableFuture<CompletionResponse> future, boolean leader) {
            this.entry = entry;
            this.future = future;
            this.leader = leader;
        }

        static Claim hit(CacheEntry entry) {
            return new Claim(entry, null, false);
        }

        static Claim join(CompletableFuture<CompletionResponse> future) {
            return new Claim(null, future, false);
        }

        static Claim lead(CompletableFuture<CompletionResponse> future) {
            return new Claim(null, future, true);
        }
    }
}
