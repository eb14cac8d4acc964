/**
 * Run context package.
 *
 * <p>This package holds the mutable carrier that flows through every unit of work
 * during a single run.</p>
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.taskchain.core.context.RunContext} - payload, trace, metadata and step bookkeeping</li>
 *   <li>{@link com.ryuqq.taskchain.core.context.Event} - single trace record</li>
 *   <li>{@link com.ryuqq.taskchain.core.context.EventLevel} - INFO, ERROR, DEBUG</li>
 * </ul>
 *
 * <h2>Invariants</h2>
 * <ul>
 *   <li>The trace is append-only and chronological</li>
 *   <li>completedSteps and compensatedSteps only grow during a run</li>
 *   <li>A step name is in completedSteps iff that step's execute returned SUCCESS</li>
 * </ul>
 *
 * @since 1.0.0
 * @author TaskChain Team
 */
package com.ryuqq.taskchain.core.context;
