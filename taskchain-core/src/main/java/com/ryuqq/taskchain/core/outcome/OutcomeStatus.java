package com.ryuqq.taskchain.core.outcome;

/**
 * Executable 실행 결과 상태.
 *
 * @author TaskChain Team
 * @since 1.0.0
 */
public enum OutcomeStatus {

    /**
     * 모든 작업이 성공.
     */
    SUCCESS,

    /**
     * 실패 (재시도 소진, 보상 후 종료, CONTINUE 전략의 누적 오류 등).
     */
    FAILED,

    /**
     * ABORT 전략에 의해 첫 실패 지점에서 중단됨.
     */
    ABORTED;

    public boolean isSuccess() {
        return this == SUCCESS;
    }
}
