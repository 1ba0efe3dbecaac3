/**
 * Script execution contracts.
 *
 * <ul>
 *   <li>{@link com.ryuqq.scriptgate.core.executor.ScriptExecutor} - executes one command with a hard timeout</li>
 *   <li>{@link com.ryuqq.scriptgate.core.executor.ScriptErrorClassifier} - maps engine failures to error kinds</li>
 *   <li>{@link com.ryuqq.scriptgate.core.executor.ExecutorStats} - call counters snapshot</li>
 * </ul>
 *
 * <p>Implementations live in {@code scriptgate-adapter-runner}.</p>
 *
 * @since 1.0.0
 * @author ScriptGate Team
 */
package com.ryuqq.scriptgate.core.executor;
