package com.ryuqq.scriptgate.adapter.inmemory.cache;

import com.github.benmanes.caffeine.cache.AsyncCache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import com.ryuqq.scriptgate.core.spi.CacheStats;
import com.ryuqq.scriptgate.core.spi.ResultCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.LongAdder;
import java.util.function.Predicate;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * In-memory implementation of {@link ResultCache} SPI, backed by a Caffeine {@link AsyncCache}.
 *
 * <p>Each entry holds a {@link CompletableFuture}; the first caller for a missing key installs
 * its own future and computes on its own thread, later callers join that future.</p>
 *
 * <p><strong>Semantics:</strong></p>
 * <ul>
 *   <li><strong>Single computation per miss:</strong> concurrent callers for the same key wait for
 *       the in-flight future instead of running the script again</li>
 *   <li><strong>No stale repopulation:</strong> a future removed by invalidation is never put back;
 *       its value reaches the waiting callers only</li>
 *   <li><strong>Failures not retained:</strong> a value rejected by {@code cacheable}, a null value or
 *       a computation that throws leaves no entry behind</li>
 *   <li><strong>TTL:</strong> per entry, measured from completion with a {@link Ticker} over the
 *       injected {@link Clock}</li>
 * </ul>
 *
 * <p>Maintenance (expiry, removal bookkeeping) runs on the calling thread.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * ResultCache&lt;ExecutionResult&gt; cache = new InMemoryResultCache&lt;&gt;();
 * ExecutionResult todos = cache.getOrCompute(
 *     "todos:all", Duration.ofSeconds(30),
 *     () -&gt; executor.execute(command, timeout),
 *     ExecutionResult::success
 * );
 * </pre>
 *
 * @param <V> cached value type
 *
 * @author ScriptGate Team
 * @since 1.0.0
 */
public class InMemoryResultCache<V> implements ResultCache<V> {

    private static final Logger log = LoggerFactory.getLogger(InMemoryResultCache.class);

    private final AsyncCache<String, Timed<V>> cache;
    private final LongAdder invalidations = new LongAdder();

    /**
     * Creates a cache on the system UTC clock.
     */
    public InMemoryResultCache() {
        this(Clock.systemUTC());
    }

    /**
     * Creates a cache on the given clock.
     *
     * @param clock clock used for TTL
     * @throws IllegalArgumentException if clock is null
     */
    public InMemoryResultCache(Clock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.cache = Caffeine.newBuilder()
            .<String, Timed<V>>expireAfter(new PerEntryTtl<>())
            .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
            .executor(Runnable::run)
            .recordStats()
            .buildAsync();
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public V getOrCompute(String key, Duration ttl, Supplier<V> compute, Predicate<V> cacheable) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("key cannot be null or blank");
        }
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive (current: " + ttl + ")");
        }
        if (compute == null) {
            throw new IllegalArgumentException("compute cannot be null");
        }
        if (cacheable == null) {
            throw new IllegalArgumentException("cacheable cannot be null");
        }

        CompletableFuture<Timed<V>> promise = new CompletableFuture<>();
        CompletableFuture<Timed<V>> current = cache.get(key, (k, executor) -> promise);
        if (current != promise) {
            log.debug("Cache hit: {}", key);
            return join(current);
        }
        log.debug("Cache miss: {}", key);
        return computeInto(key, ttl, promise, compute, cacheable);
    }

    private V computeInto(String key, Duration ttl, CompletableFuture<Timed<V>> promise,
                          Supplier<V> compute, Predicate<V> cacheable) {
        V value;
        boolean keep;
        try {
            value = compute.get();
            keep = value != null && cacheable.test(value);
        } catch (RuntimeException | Error e) {
            cache.asMap().remove(key, promise);
            promise.completeExceptionally(e);
            throw e;
        }
        if (!keep) {
            cache.asMap().remove(key, promise);
            log.debug("Computed value not cached: {}", key);
        }
        promise.complete(new Timed<>(value, ttl));
        return value;
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public int invalidate(Collection<String> keys) {
        if (keys == null) {
            throw new IllegalArgumentException("keys cannot be null");
        }
        int removed = 0;
        for (String key : keys) {
            if (key != null && cache.asMap().remove(key) != null) {
                removed++;
            }
        }
        countInvalidations(removed, "keys", keys);
        return removed;
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public int invalidatePrefixes(Collection<String> prefixes) {
        if (prefixes == null) {
            throw new IllegalArgumentException("prefixes cannot be null");
        }
        List<String> copy = List.copyOf(prefixes);
        int removed = removeMatching(key -> copy.stream().anyMatch(key::startsWith));
        countInvalidations(removed, "prefixes", copy);
        return removed;
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public int invalidateIf(Predicate<String> keyMatcher) {
        if (keyMatcher == null) {
            throw new IllegalArgumentException("keyMatcher cannot be null");
        }
        int removed = removeMatching(keyMatcher);
        countInvalidations(removed, "predicate", "custom");
        return removed;
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public void clear() {
        int removed = removeMatching(key -> true);
        countInvalidations(removed, "clear", "all");
    }

    /**
     * Evicts every entry whose age has reached its TTL.
     *
     * @return number of entries evicted
     */
    public int purgeExpired() {
        long before = cache.synchronous().stats().evictionCount();
        cache.synchronous().cleanUp();
        int removed = (int) (cache.synchronous().stats().evictionCount() - before);
        if (removed > 0) {
            log.debug("Purged {} expired cache entries", removed);
        }
        return removed;
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public int size() {
        cache.synchronous().cleanUp();
        return (int) cache.synchronous().estimatedSize();
    }

    /**
     * {@inheritDoc}
     *
     * <p>Evictions count both TTL expiry and explicit invalidation.</p>
     */
    @Override
    public CacheStats stats() {
        com.github.benmanes.caffeine.cache.stats.CacheStats caffeine = cache.synchronous().stats();
        return new CacheStats(
            caffeine.hitCount(),
            caffeine.missCount(),
            caffeine.evictionCount() + invalidations.sum(),
            size()
        );
    }

    private int removeMatching(Predicate<String> keyMatcher) {
        ConcurrentMap<String, CompletableFuture<Timed<V>>> map = cache.asMap();
        List<String> matching = map.keySet().stream()
            .filter(keyMatcher)
            .collect(Collectors.toList());
        int removed = 0;
        for (String key : matching) {
            if (map.remove(key) != null) {
                removed++;
            }
        }
        return removed;
    }

    private void countInvalidations(int removed, String mode, Object selector) {
        invalidations.add(removed);
        if (removed > 0) {
            log.debug("Invalidated {} cache entries by {}: {}", removed, mode, selector);
        }
    }

    /**
     * Waits for the value, rethrowing the computation's own failure.
     */
    private V join(CompletableFuture<Timed<V>> future) {
        try {
            return future.join().value();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw e;
        }
    }

    /**
     * Cached value with the TTL requested by the caller that computed it.
     */
    private record Timed<V>(V value, Duration ttl) {
    }

    /**
     * Expires each entry after its own TTL, counted from when its value was set.
     */
    private static final class PerEntryTtl<V> implements Expiry<String, Timed<V>> {

        @Override
        public long expireAfterCreate(String key, Timed<V> timed, long currentTime) {
            return timed.ttl().toNanos();
        }

        @Override
        public long expireAfterUpdate(String key, Timed<V> timed, long currentTime, long currentDuration) {
            return timed.ttl().toNanos();
        }

        @Override
        public long expireAfterRead(String key, Timed<V> timed, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
