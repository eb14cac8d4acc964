package com.ryuqq.taskchain.core.execution;

import com.ryuqq.taskchain.core.exception.ExecutionModeViolationException;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * {@code execute}/{@code compensate}의 반환 형태.
 *
 * <p>Execution은 두 가지 경우를 나타냅니다:</p>
 * <ul>
 *   <li>{@link Ready}: 이미 확정된 결과 (blocking 모드)</li>
 *   <li>{@link Pending}: 아직 완료되지 않은 결과 (cooperative 모드)</li>
 * </ul>
 *
 * <p>호출 지점에서 값을 검사해 모드를 추측하지 않도록 sealed interface로 명시합니다.
 * 어느 쪽을 반환할지는 Executable 생성 시점에 결정되어 캐시됩니다.</p>
 *
 * @param <R> 결과 타입 ({@code Outcome} 또는 {@code Void})
 *
 * @author TaskChain Team
 * @since 1.0.0
 */
public sealed interface Execution<R> permits Ready, Pending {

    /**
     * 확정된 결과 생성.
     *
     * @param value 결과 값 ({@code Void}인 경우 null)
     * @param <R> 결과 타입
     * @return Ready 인스턴스
     */
    static <R> Execution<R> ready(R value) {
        return new Ready<>(value);
    }

    /**
     * 대기 중인 결과 생성.
     *
     * @param stage 결과를 완료할 stage
     * @param <R> 결과 타입
     * @return Pending 인스턴스
     * @throws IllegalArgumentException stage가 null인 경우
     */
    static <R> Execution<R> pending(CompletionStage<R> stage) {
        if (stage == null) {
            throw new IllegalArgumentException("stage cannot be null");
        }
        return new Pending<>(stage.toCompletableFuture());
    }

    /**
     * 결과가 아직 완료되지 않았는지 확인.
     *
     * @return Pending이면 true
     */
    default boolean isPending() {
        return this instanceof Pending;
    }

    /**
     * cooperative 모드에서 사용할 future로 변환.
     *
     * <p>Ready는 완료된 future로, Pending은 보관 중인 future 그대로 반환합니다.</p>
     *
     * @return 결과 future
     */
    CompletableFuture<R> toFuture();

    /**
     * blocking 모드에서 결과를 꺼냅니다.
     *
     * <p>Pending이면 보관 중인 future를 취소하고 모드 위반 예외를 던집니다.</p>
     *
     * @param stepName 결과를 반환한 Step 이름 (오류 메시지용)
     * @return 확정된 결과 값
     * @throws ExecutionModeViolationException Pending인 경우
     */
    R requireReady(String stepName);
}
