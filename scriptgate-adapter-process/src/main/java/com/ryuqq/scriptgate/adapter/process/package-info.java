/**
 * Process-backed ScriptEngine adapter.
 *
 * <p>Runs one {@code osascript} child process per call. The adapter only captures exit code and
 * output; classification, retries and the hard per-call timeout belong to the executor layer.</p>
 *
 * @author ScriptGate Team
 * @since 1.0.0
 */
package com.ryuqq.scriptgate.adapter.process;
