package com.ryuqq.taskchain.core.execution;

import com.ryuqq.taskchain.core.exception.ExecutionModeViolationException;

import java.util.concurrent.CompletableFuture;

/**
 * 아직 완료되지 않은 실행 결과.
 *
 * @param future 결과를 완료할 future
 * @param <R> 결과 타입
 *
 * @author TaskChain Team
 * @since 1.0.0
 */
public record Pending<R>(CompletableFuture<R> future) implements Execution<R> {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException future가 null인 경우
     */
    public Pending {
        if (future == null) {
            throw new IllegalArgumentException("future cannot be null");
        }
    }

    @Override
    public CompletableFuture<R> toFuture() {
        return future;
    }

    @Override
    public R requireReady(String stepName) {
        future.cancel(true);
        throw ExecutionModeViolationException.pendingInBlockingMode(stepName);
    }
}
