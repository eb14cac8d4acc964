/**
 * Executable building blocks.
 *
 * <p>This package provides the leaf unit of work and the two sequential composites
 * that make up an execution tree.</p>
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.taskchain.application.component.Task} - One user function with retry, timeout and undo</li>
 *   <li>{@link com.ryuqq.taskchain.application.component.Process} - Fail-fast sequence</li>
 *   <li>{@link com.ryuqq.taskchain.application.component.Workflow} - Sequence with ABORT / CONTINUE / COMPENSATE strategy</li>
 * </ul>
 *
 * <h2>Completion Tracking</h2>
 * <p>Every component records its own name into {@code RunContext.completedSteps()} when it succeeds.
 * Compensation consults only that set, never the trace.</p>
 *
 * <h2>Usage Example</h2>
 * <pre>
 * Workflow&lt;Order&gt; checkout = new Workflow&lt;&gt;("checkout", List.of(
 *     Task.of("validate", ctx -&gt; validator.check(ctx.data())),
 *     createOrder,
 *     notifyCustomer
 * ), FailureStrategy.COMPENSATE);
 *
 * Outcome&lt;Order&gt; outcome = new SyncRunner().run(checkout, RunContext.of(order));
 * </pre>
 *
 * @since 1.0.0
 * @author TaskChain Team
 */
package com.ryuqq.taskchain.application.component;
