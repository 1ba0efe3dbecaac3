package com.ryuqq.scriptgate.core.spi;

import java.time.Duration;
import java.util.Collection;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Result cache SPI for read commands.
 *
 * <p>Entries are keyed by the read command's cache key and expire after a per-entry TTL.
 * An entry is never served once its age reaches its TTL.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe with atomic per-entry replace and evict</li>
 *   <li>Concurrent misses on the same key share one computation</li>
 *   <li>A value rejected by {@code cacheable}, or a computation that throws, is not retained</li>
 *   <li>Invalidation removes matching entries, including ones still computing</li>
 * </ul>
 *
 * @param <V> cached value type
 *
 * @author ScriptGate Team
 * @since 1.0.0
 */
public interface ResultCache<V> {

    /**
     * Returns a live cached value or computes, stores and returns a fresh one.
     *
     * @param key cache key
     * @param ttl time to live of a newly stored value (positive)
     * @param compute computation run on a miss
     * @param cacheable decides whether a computed value may be stored
     * @return cached or freshly computed value
     * @throws IllegalArgumentException if any argument is null or ttl is not positive
     * @throws RuntimeException whatever {@code compute} throws
     */
    V getOrCompute(String key, Duration ttl, Supplier<V> compute, Predicate<V> cacheable);

    /**
     * Removes the given keys.
     *
     * @param keys exact keys to remove
     * @return number of entries removed
     */
    int invalidate(Collection<String> keys);

    /**
     * Removes every key starting with one of the given prefixes.
     *
     * @param prefixes key prefixes
     * @return number of entries removed
     */
    int invalidatePrefixes(Collection<String> prefixes);

    /**
     * Removes every key matching the predicate.
     *
     * @param keyMatcher key predicate
     * @return number of entries removed
     */
    int invalidateIf(Predicate<String> keyMatcher);

    /**
     * Removes all entries.
     */
    void clear();

    /**
     * Number of entries currently held, including expired ones not yet evicted.
     */
    int size();

    /**
     * Hit/miss/eviction counters since creation.
     */
    CacheStats stats();
}
