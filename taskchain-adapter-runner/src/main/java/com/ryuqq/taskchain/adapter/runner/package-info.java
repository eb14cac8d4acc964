/**
 * Runner adapters and the pooled timeout guard.
 *
 * <h2>Runners</h2>
 * <ul>
 *   <li>{@link com.ryuqq.taskchain.adapter.runner.SyncRunner} - Runs a tree on the calling thread; rejects pending results</li>
 *   <li>{@link com.ryuqq.taskchain.adapter.runner.AsyncRunner} - Returns a CompletableFuture; accepts both result shapes</li>
 * </ul>
 *
 * <h2>Timeout Enforcement</h2>
 * <ul>
 *   <li>{@link com.ryuqq.taskchain.adapter.runner.PooledTimeoutGuard} - Bounded worker pool owned by the caller</li>
 *   <li>{@link com.ryuqq.taskchain.adapter.runner.TimeoutGuardConfig} - Pool size, queue capacity, timed-out work policy</li>
 *   <li>{@link com.ryuqq.taskchain.adapter.runner.TimedOutWorkPolicy} - INTERRUPT or ABANDON</li>
 * </ul>
 *
 * @since 1.0.0
 * @author TaskChain Team
 */
package com.ryuqq.taskchain.adapter.runner;
