/**
 * Error taxonomy of the registry subsystem.
 *
 * <ul>
 *   <li><strong>Terminal client errors</strong> ({@code CLIENT}, {@code AUTH}, {@code NOT_FOUND}): never retried</li>
 *   <li><strong>Transient errors</strong> ({@code RATE_LIMITED}, {@code SERVER}, {@code SERVER_OVERLOAD},
 *       {@code TIMEOUT}, {@code NETWORK}): retried up to the attempt ceiling</li>
 *   <li><strong>Circuit-open</strong>: raised without attempting the call</li>
 *   <li><strong>Job failures</strong> ({@code JOB_FAILED}, {@code JOB_TIMEOUT}): not retried by the poller</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.registry.core.error;
