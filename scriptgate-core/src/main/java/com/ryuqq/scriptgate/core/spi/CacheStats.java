package com.ryuqq.scriptgate.core.spi;

/**
 * Snapshot of cache counters.
 *
 * @param hits lookups served from a live entry (including joins on an in-flight computation)
 * @param misses lookups that started a computation
 * @param evictions entries removed by expiry or invalidation
 * @param size entries held at snapshot time
 *
 * @author ScriptGate Team
 * @since 1.0.0
 */
public record CacheStats(long hits, long misses, long evictions, int size) {

    public CacheStats {
        if (hits < 0 || misses < 0 || evictions < 0 || size < 0) {
            throw new IllegalArgumentException("counters must be non-negative");
        }
    }

    /**
     * Hit ratio in [0, 1]; 0 when there were no lookups.
     */
    public double hitRatio() {
        long total = hits + misses;
        return total == 0 ? 0.0 : (double) hits / total;
    }
}
