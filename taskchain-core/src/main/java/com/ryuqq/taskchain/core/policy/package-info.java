/**
 * Failure handling policies.
 *
 * <h2>Policies</h2>
 * <ul>
 *   <li>{@link com.ryuqq.taskchain.core.policy.RetryPolicy} - Retry decision and backoff delay (pure computation)</li>
 *   <li>{@link com.ryuqq.taskchain.core.policy.BackoffStrategy} - FIXED, LINEAR, EXPONENTIAL</li>
 *   <li>{@link com.ryuqq.taskchain.core.policy.FailureStrategy} - Workflow reaction to a failed step</li>
 * </ul>
 *
 * <h2>Safety Limits</h2>
 * <p>Out-of-range retry settings are clamped, never rejected:
 * attempts are capped at 100 and delays at one hour.</p>
 *
 * @since 1.0.0
 * @author TaskChain Team
 */
package com.ryuqq.taskchain.core.policy;
