/**
 * Execution outcome package.
 *
 * <p>Every executable returns exactly one {@link com.ryuqq.taskchain.core.outcome.Outcome}
 * per {@code execute} call.</p>
 *
 * <h2>Statuses</h2>
 * <ul>
 *   <li>{@code SUCCESS} - every unit of work completed</li>
 *   <li>{@code FAILED} - retries exhausted, compensated, or errors accumulated under CONTINUE</li>
 *   <li>{@code ABORTED} - stopped at the first failure under ABORT</li>
 * </ul>
 *
 * @since 1.0.0
 * @author TaskChain Team
 */
package com.ryuqq.taskchain.core.outcome;
