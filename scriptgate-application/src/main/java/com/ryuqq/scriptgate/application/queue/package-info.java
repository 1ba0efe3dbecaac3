/**
 * Single-flight operation queue port.
 *
 * <ul>
 *   <li>{@link com.ryuqq.scriptgate.application.queue.OperationQueue} - serializes writes</li>
 *   <li>{@link com.ryuqq.scriptgate.application.queue.QueueStatus} - depth, oldest pending age, failure counts</li>
 *   <li>{@link com.ryuqq.scriptgate.application.queue.OperationSnapshot} - per-operation view</li>
 *   <li>{@link com.ryuqq.scriptgate.application.queue.QueueSaturationException} - backpressure signal</li>
 * </ul>
 *
 * @author ScriptGate Team
 * @since 1.0.0
 */
package com.ryuqq.scriptgate.application.queue;
