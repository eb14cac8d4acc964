package com.ryuqq.taskchain.application.function;

import com.ryuqq.taskchain.core.context.RunContext;

import java.util.concurrent.CompletionStage;

/**
 * 비동기 보상(undo) 함수. cooperative Task에서만 사용할 수 있습니다.
 *
 * @param <D> payload 타입
 *
 * @author TaskChain Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface AsyncUndoAction<D> {

    CompletionStage<?> undo(RunContext<D> ctx) throws Exception;
}
