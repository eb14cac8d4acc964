package com.ryuqq.taskchain.application.function;

import com.ryuqq.taskchain.core.context.RunContext;

/**
 * Task 보상(undo) 함수.
 *
 * <p>실패는 재시도되지 않으며 {@link com.ryuqq.taskchain.core.exception.CompensationException}으로
 * 호출자에게 전파됩니다.</p>
 *
 * @param <D> payload 타입
 *
 * @author TaskChain Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface UndoAction<D> {

    void undo(RunContext<D> ctx) throws Exception;
}
