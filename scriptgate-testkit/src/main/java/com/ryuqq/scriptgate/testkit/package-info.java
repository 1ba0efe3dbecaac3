/**
 * Test doubles for ScriptGate SPI and time.
 *
 * <p>{@link com.ryuqq.scriptgate.testkit.FakeScriptEngine} stands in for the scripting engine
 * process, including date property semantics through
 * {@link com.ryuqq.scriptgate.testkit.FakeEngineDate}.
 * {@link com.ryuqq.scriptgate.testkit.MutableClock} drives TTL and age calculations.</p>
 *
 * @author ScriptGate Team
 * @since 1.0.0
 */
package com.ryuqq.scriptgate.testkit;
