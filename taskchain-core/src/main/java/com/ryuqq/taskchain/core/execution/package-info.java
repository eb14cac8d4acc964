/**
 * Executable contract package.
 *
 * <p>This package defines the polymorphic unit of work and its dual-mode return shape.</p>
 *
 * <h2>Sealed Interface</h2>
 * <ul>
 *   <li>{@link com.ryuqq.taskchain.core.execution.Execution} - Sealed interface (permits Ready, Pending)</li>
 *   <li>{@link com.ryuqq.taskchain.core.execution.Ready} - Result already available (blocking mode)</li>
 *   <li>{@link com.ryuqq.taskchain.core.execution.Pending} - Result completes later (cooperative mode)</li>
 * </ul>
 *
 * <h2>Usage Example</h2>
 * <pre>
 * Execution&lt;Outcome&lt;D&gt;&gt; execution = step.execute(ctx);
 * if (blockingMode) {
 *     Outcome&lt;D&gt; outcome = execution.requireReady(step.name()); // throws on Pending
 * } else {
 *     execution.toFuture().thenAccept(outcome -&gt; ...);
 * }
 * </pre>
 *
 * @since 1.0.0
 * @author TaskChain Team
 */
package com.ryuqq.taskchain.core.execution;
