package com.ryuqq.taskchain.application.function;

import com.ryuqq.taskchain.core.context.RunContext;

import java.util.concurrent.CompletionStage;

/**
 * Cooperative(비동기) Task의 사용자 함수.
 *
 * <p>반드시 non-null {@link CompletionStage}를 반환해야 합니다.
 * stage의 예외 완료와 함수가 직접 던진 예외는 모두 일반 실패로 처리됩니다.</p>
 *
 * @param <D> payload 타입
 *
 * @author TaskChain Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface AsyncStepAction<D> {

    /**
     * 비동기 작업 시작.
     *
     * @param ctx 실행 컨텍스트
     * @return 작업 완료를 나타내는 stage
     * @throws Exception 작업 시작 실패 시
     */
    CompletionStage<?> apply(RunContext<D> ctx) throws Exception;
}
