/**
 * Service Provider Interfaces (SPI) for ScriptGate.
 *
 * <p>Adapters implement these interfaces to plug in the external pieces:</p>
 *
 * <h2>Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.scriptgate.core.spi.ScriptEngine} - one script invocation (osascript, fake engine)</li>
 *   <li>{@link com.ryuqq.scriptgate.core.spi.ResultCache} - TTL cache for read results</li>
 * </ul>
 *
 * <h2>Implementations</h2>
 * <ul>
 *   <li>{@code scriptgate-adapter-process}: {@code OsascriptEngine}</li>
 *   <li>{@code scriptgate-adapter-inmemory}: {@code InMemoryResultCache}</li>
 *   <li>{@code scriptgate-testkit}: {@code FakeScriptEngine}</li>
 * </ul>
 *
 * @since 1.0.0
 * @author ScriptGate Team
 */
package com.ryuqq.scriptgate.core.spi;
