/**
 * In-memory implementation of ResultCache SPI.
 *
 * <p>This package provides a thread-safe TTL cache for read results on a Caffeine
 * {@code AsyncCache} with a per-entry {@code Expiry}.</p>
 *
 * <h2>Features</h2>
 * <ul>
 *   <li>Concurrent misses on one key share a single script execution</li>
 *   <li>Failed or non-cacheable results are returned but not stored</li>
 *   <li>Prefix and predicate invalidation for mutation-driven eviction</li>
 * </ul>
 *
 * @author ScriptGate Team
 * @since 1.0.0
 */
package com.ryuqq.scriptgate.adapter.inmemory.cache;
