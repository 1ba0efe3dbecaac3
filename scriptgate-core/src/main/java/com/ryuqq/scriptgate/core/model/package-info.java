/**
 * Core value types.
 *
 * <ul>
 *   <li>{@link com.ryuqq.scriptgate.core.model.OperationId} - identifier of a queued write</li>
 *   <li>{@link com.ryuqq.scriptgate.core.model.Priority} - queue ordering class</li>
 * </ul>
 *
 * @since 1.0.0
 * @author ScriptGate Team
 */
package com.ryuqq.scriptgate.core.model;
