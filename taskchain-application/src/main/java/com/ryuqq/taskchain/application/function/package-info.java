/**
 * User function contracts plugged into a Task.
 *
 * <h2>Blocking</h2>
 * <ul>
 *   <li>{@link com.ryuqq.taskchain.application.function.StepAction} - Work run on the calling thread</li>
 *   <li>{@link com.ryuqq.taskchain.application.function.UndoAction} - Compensation for blocking or cooperative tasks</li>
 * </ul>
 *
 * <h2>Cooperative</h2>
 * <ul>
 *   <li>{@link com.ryuqq.taskchain.application.function.AsyncStepAction} - Work returning a CompletionStage</li>
 *   <li>{@link com.ryuqq.taskchain.application.function.AsyncUndoAction} - Compensation returning a CompletionStage</li>
 * </ul>
 *
 * @since 1.0.0
 * @author TaskChain Team
 */
package com.ryuqq.taskchain.application.function;
