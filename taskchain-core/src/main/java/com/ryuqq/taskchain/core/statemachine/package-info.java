/**
 * Composite run state machine.
 *
 * <h2>States</h2>
 * <ul>
 *   <li>{@link com.ryuqq.taskchain.core.statemachine.RunState#RUNNING} - Steps still executing</li>
 *   <li>{@link com.ryuqq.taskchain.core.statemachine.RunState#SUCCESS} - Terminal</li>
 *   <li>{@link com.ryuqq.taskchain.core.statemachine.RunState#FAILED} - Terminal</li>
 *   <li>{@link com.ryuqq.taskchain.core.statemachine.RunState#ABORTED} - Terminal</li>
 * </ul>
 *
 * <p>{@link com.ryuqq.taskchain.core.statemachine.StateTransition} rejects any transition out of a
 * terminal state. Each composite execution holds a
 * {@link com.ryuqq.taskchain.core.statemachine.RunLifecycle} that applies it, so a run settles exactly once.</p>
 *
 * @since 1.0.0
 * @author TaskChain Team
 */
package com.ryuqq.taskchain.core.statemachine;
