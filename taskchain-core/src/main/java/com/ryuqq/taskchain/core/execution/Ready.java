package com.ryuqq.taskchain.core.execution;

import java.util.concurrent.CompletableFuture;

/**
 * 이미 확정된 실행 결과.
 *
 * @param value 결과 값 ({@code Void}인 경우 null)
 * @param <R> 결과 타입
 *
 * @author TaskChain Team
 * @since 1.0.0
 */
public record Ready<R>(R value) implements Execution<R> {

    @Override
    public CompletableFuture<R> toFuture() {
        return CompletableFuture.completedFuture(value);
    }

    @Override
    public R requireReady(String stepName) {
        return value;
    }
}
