package com.ryuqq.taskchain.application.function;

import com.ryuqq.taskchain.core.context.RunContext;

/**
 * Blocking Task의 사용자 함수.
 *
 * <p>반환값은 무시됩니다. 단, {@link java.util.concurrent.CompletionStage} 또는
 * {@link java.util.concurrent.Future}를 반환하면 실행 모드 위반으로 간주됩니다
 * (비동기 작업은 {@link AsyncStepAction}으로 선언해야 합니다).</p>
 *
 * <p>던진 예외는 Task의 재시도 정책에 따라 처리되며 {@code execute} 밖으로 전파되지 않습니다.</p>
 *
 * @param <D> payload 타입
 *
 * @author TaskChain Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface StepAction<D> {

    /**
     * 작업 수행.
     *
     * @param ctx 실행 컨텍스트
     * @return 임의의 결과 (무시됨, null 허용)
     * @throws Exception 작업 실패 시
     */
    Object apply(RunContext<D> ctx) throws Exception;
}
