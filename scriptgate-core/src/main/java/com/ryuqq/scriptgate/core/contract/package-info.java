/**
 * Script command contract package.
 *
 * <h2>Records</h2>
 * <ul>
 *   <li>{@link com.ryuqq.scriptgate.core.contract.ScriptCommand} - one script to send to the application</li>
 *   <li>{@link com.ryuqq.scriptgate.core.contract.Mutation} - what a write changes (drives cache invalidation)</li>
 * </ul>
 *
 * <h2>Enums</h2>
 * <ul>
 *   <li>{@link com.ryuqq.scriptgate.core.contract.AccessMode} - READ bypasses the queue, WRITE goes through it</li>
 *   <li>{@link com.ryuqq.scriptgate.core.contract.ResultShape} - expected output form, checked by executors</li>
 * </ul>
 *
 * @since 1.0.0
 * @author ScriptGate Team
 */
package com.ryuqq.scriptgate.core.contract;
