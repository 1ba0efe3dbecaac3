package com.ryuqq.scriptgate.testkit.contract;

import com.ryuqq.scriptgate.core.spi.CacheStats;
import com.ryuqq.scriptgate.core.spi.ResultCache;
import com.ryuqq.scriptgate.testkit.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Abstract base class for ResultCache SPI contract tests.
 *
 * <p>Every {@link ResultCache} adapter extends this class and supplies a cache bound to the
 * given clock. Time only moves through {@link #clock}.</p>
 *
 * <p><strong>Contract Scenarios:</strong></p>
 * <ul>
 *   <li>Value served from cache until its TTL elapses, recomputed afterwards</li>
 *   <li>Non-cacheable, null and thrown results are returned or propagated but never stored</li>
 *   <li>Key, prefix, predicate and full invalidation</li>
 *   <li>Hit/miss accounting</li>
 * </ul>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * class MyCacheContractTest extends AbstractResultCacheContractTest {
 *     {@literal @}Override
 *     protected ResultCache&lt;String&gt; createCache(Clock clock) {
 *         return new MyCache&lt;&gt;(clock);
 *     }
 * }
 * </pre>
 *
 * @author ScriptGate Team
 * @since 1.0.0
 */
public abstract class AbstractResultCacheContractTest {

    protected static final Duration TTL = Duration.ofSeconds(30);
    protected static final Predicate<String> ALWAYS = value -> true;

    protected MutableClock clock;
    protected ResultCache<String> cache;

    /**
     * Creates the cache under test.
     *
     * @param clock clock the cache must use for TTL
     * @return fresh, empty cache
     */
    protected abstract ResultCache<String> createCache(Clock clock);

    @BeforeEach
    void setUpCache() {
        clock = MutableClock.atDefaultInstant();
        cache = createCache(clock);
    }

    @AfterEach
    void tearDownCache() {
        if (cache != null) {
            cache.clear();
        }
    }

    @Test
    void testGetOrCompute_WithinTtl_ServedFromCache() {
        // Given
        AtomicInteger computations = new AtomicInteger();
        Supplier<String> compute = counting(computations, "inbox");

        // When
        String first = cache.getOrCompute("todos:list:inbox", TTL, compute, ALWAYS);
        clock.advance(TTL.minusMillis(1));
        String second = cache.getOrCompute("todos:list:inbox", TTL, compute, ALWAYS);

        // Then
        assertEquals("inbox-1", first);
        assertEquals("inbox-1", second, "second read within TTL must not recompute");
        assertEquals(1, computations.get());
        assertEquals(1, cache.size());
    }

    @Test
    void testGetOrCompute_AfterTtl_Recomputes() {
        // Given
        AtomicInteger computations = new AtomicInteger();
        Supplier<String> compute = counting(computations, "tags");
        cache.getOrCompute("tags:all", TTL, compute, ALWAYS);

        // When: entry age reaches TTL
        clock.advance(TTL);
        String refreshed = cache.getOrCompute("tags:all", TTL, compute, ALWAYS);

        // Then
        assertEquals("tags-2", refreshed);
        assertEquals(2, computations.get());
    }

    @Test
    void testGetOrCompute_NonCacheableValue_ReturnedButNotStored() {
        // Given
        AtomicInteger computations = new AtomicInteger();
        Supplier<String> compute = counting(computations, "error");
        Predicate<String> rejectAll = value -> false;

        // When
        String first = cache.getOrCompute("projects:all", TTL, compute, rejectAll);
        String second = cache.getOrCompute("projects:all", TTL, compute, rejectAll);

        // Then
        assertEquals("error-1", first);
        assertEquals("error-2", second);
        assertEquals(0, cache.size());
    }

    @Test
    void testGetOrCompute_NullValue_NotStored() {
        // When
        String value = cache.getOrCompute("areas:all", TTL, () -> null, ALWAYS);

        // Then
        assertNull(value);
        assertEquals(0, cache.size());
    }

    @Test
    void testGetOrCompute_ComputeThrows_PropagatesAndLeavesNoEntry() {
        // When
        IllegalStateException thrown = assertThrows(IllegalStateException.class, () ->
            cache.getOrCompute("todo:ABC", TTL, () -> {
                throw new IllegalStateException("engine exploded");
            }, ALWAYS)
        );

        // Then
        assertEquals("engine exploded", thrown.getMessage());
        assertEquals(0, cache.size());
        assertEquals("recovered", cache.getOrCompute("todo:ABC", TTL, () -> "recovered", ALWAYS));
    }

    @Test
    void testGetOrCompute_InvalidArguments_Rejected() {
        assertThrows(IllegalArgumentException.class, () -> cache.getOrCompute(null, TTL, () -> "x", ALWAYS));
        assertThrows(IllegalArgumentException.class, () -> cache.getOrCompute(" ", TTL, () -> "x", ALWAYS));
        assertThrows(IllegalArgumentException.class, () -> cache.getOrCompute("k", Duration.ZERO, () -> "x", ALWAYS));
        assertThrows(IllegalArgumentException.class, () -> cache.getOrCompute("k", TTL, null, ALWAYS));
        assertThrows(IllegalArgumentException.class, () -> cache.getOrCompute("k", TTL, () -> "x", null));
    }

    @Test
    void testInvalidate_ExactKeys_RemovesOnlyThoseKeys() {
        // Given
        populate("todo:A", "todo:B", "todos:all");

        // When
        int removed = cache.invalidate(List.of("todo:A", "todos:all", "todo:missing"));

        // Then
        assertEquals(2, removed);
        assertEquals(1, cache.size());
        assertComputed("todo:A");
        assertCached("todo:B");
    }

    @Test
    void testInvalidatePrefixes_RemovesEveryKeyUnderPrefix() {
        // Given
        populate("todos:all", "todos:project:P1", "todos:list:today", "projects:all", "tags:all");

        // When
        int removed = cache.invalidatePrefixes(List.of("todos:", "tags:"));

        // Then
        assertEquals(4, removed);
        assertCached("projects:all");
        assertComputed("todos:project:P1");
    }

    @Test
    void testInvalidateIf_MatchingPredicate_RemovesMatches() {
        // Given
        populate("search:milk", "search:eggs", "todos:all");

        // When
        int removed = cache.invalidateIf(key -> key.startsWith("search:"));

        // Then
        assertEquals(2, removed);
        assertCached("todos:all");
    }

    @Test
    void testClear_RemovesEverything() {
        // Given
        populate("todos:all", "projects:all");

        // When
        cache.clear();

        // Then
        assertEquals(0, cache.size());
        assertComputed("projects:all");
    }

    @Test
    void testStats_CountsHitsAndMisses() {
        // Given
        cache.getOrCompute("tags:all", TTL, () -> "t", ALWAYS);
        cache.getOrCompute("tags:all", TTL, () -> "t", ALWAYS);
        cache.getOrCompute("tags:all", TTL, () -> "t", ALWAYS);

        // When
        CacheStats stats = cache.stats();

        // Then
        assertEquals(2L, stats.hits());
        assertEquals(1L, stats.misses());
        assertEquals(1, stats.size());
        assertEquals(2.0 / 3.0, stats.hitRatio(), 1e-9);
    }

    // ---- helpers ----

    protected void populate(String... keys) {
        for (String key : keys) {
            cache.getOrCompute(key, TTL, () -> "cached:" + key, ALWAYS);
        }
    }

    /**
     * Asserts the key is still served from cache (compute would return something else).
     */
    protected void assertCached(String key) {
        assertEquals("cached:" + key, cache.getOrCompute(key, TTL, () -> "fresh:" + key, ALWAYS),
            "expected cached value for " + key);
    }

    /**
     * Asserts the key was evicted and the next read recomputes.
     */
    protected void assertComputed(String key) {
        assertEquals("fresh:" + key, cache.getOrCompute(key, TTL, () -> "fresh:" + key, ALWAYS),
            "expected recomputation for " + key);
    }

    private static Supplier<String> counting(AtomicInteger counter, String prefix) {
        return () -> prefix + "-" + counter.incrementAndGet();
    }
}
