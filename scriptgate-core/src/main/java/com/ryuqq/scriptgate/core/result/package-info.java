/**
 * Script execution result package.
 *
 * <p>Expected application failures are values, not exceptions: every executor call
 * yields exactly one {@link com.ryuqq.scriptgate.core.result.ExecutionResult}, and a failed
 * result carries a {@link com.ryuqq.scriptgate.core.result.ScriptError} classified by
 * {@link com.ryuqq.scriptgate.core.result.ErrorKind}.</p>
 *
 * <h2>Retry Semantics</h2>
 * <ul>
 *   <li><strong>Transient:</strong> TIMEOUT, APPLICATION_UNAVAILABLE</li>
 *   <li><strong>Permanent:</strong> everything else</li>
 * </ul>
 *
 * @since 1.0.0
 * @author ScriptGate Team
 */
package com.ryuqq.scriptgate.core.result;
