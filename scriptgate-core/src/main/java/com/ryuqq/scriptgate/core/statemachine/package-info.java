/**
 * Queued operation state machine package.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.scriptgate.core.statemachine.OperationState} - queued write lifecycle states (enum)</li>
 *   <li>{@link com.ryuqq.scriptgate.core.statemachine.StateTransition} - transition validation</li>
 * </ul>
 *
 * <h2>State Transition Rules</h2>
 * <pre>
 * PENDING  → RUNNING | CANCELLED
 * RUNNING  → SUCCEEDED | FAILED | RETRYING
 * RETRYING → RUNNING | FAILED
 *
 * Forbidden:
 * - SUCCEEDED, FAILED, CANCELLED → * (terminal states)
 * - RUNNING → CANCELLED (a running script cannot be recalled)
 * </pre>
 *
 * <h2>Usage Example</h2>
 * <pre>
 * OperationState state = OperationState.PENDING;
 * state = StateTransition.transition(state, OperationState.RUNNING);
 * state = StateTransition.transition(state, OperationState.SUCCEEDED);
 * </pre>
 *
 * @since 1.0.0
 * @author ScriptGate Team
 */
package com.ryuqq.scriptgate.core.statemachine;
