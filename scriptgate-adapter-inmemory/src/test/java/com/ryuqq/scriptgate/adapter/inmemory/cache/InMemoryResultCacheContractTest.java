package com.ryuqq.scriptgate.adapter.inmemory.cache;

import com.ryuqq.scriptgate.core.spi.ResultCache;
import com.ryuqq.scriptgate.testkit.contract.AbstractResultCacheContractTest;

import java.time.Clock;

/**
 * Contract Test for InMemoryResultCache adapter.
 *
 * <p>Runs every ResultCache SPI scenario from {@link AbstractResultCacheContractTest}
 * against the in-memory implementation.</p>
 *
 * @author ScriptGate Team
 * @since 1.0.0
 * @see AbstractResultCacheContractTest
 */
class InMemoryResultCacheContractTest extends AbstractResultCacheContractTest {

    @Override
    protected ResultCache<String> createCache(Clock clock) {
        return new InMemoryResultCache<>(clock);
    }
}
