/**
 * Read-cache key conventions and mutation-driven invalidation rules.
 *
 * <p>The cache itself is an SPI ({@link com.ryuqq.scriptgate.core.spi.ResultCache});
 * this package only decides which keys a mutation makes stale.</p>
 *
 * @since 1.0.0
 * @author ScriptGate Team
 */
package com.ryuqq.scriptgate.core.cache;
