package com.ryuqq.taskchain.core.statemachine;

import com.ryuqq.taskchain.core.outcome.OutcomeStatus;

/**
 * Composite(Process, Workflow) 실행의 상태.
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * RUNNING
 *    │
 *    ├─► SUCCESS (모든 Step 성공 또는 CONTINUE 후 오류 없음)
 *    │
 *    ├─► FAILED  (fail-fast, COMPENSATE, CONTINUE 후 오류 누적)
 *    │
 *    └─► ABORTED (ABORT 전략)
 *
 * 금지된 전이:
 * - 종료 상태 → 모든 상태 ❌
 * </pre>
 *
 * @author TaskChain Team
 * @since 1.0.0
 */
public enum RunState {

    /**
     * Step 실행 중.
     */
    RUNNING,

    SUCCESS,

    FAILED,

    ABORTED;

    /**
     * 종료 상태인지 확인.
     *
     * @return RUNNING이 아니면 true
     */
    public boolean isTerminal() {
        return this != RUNNING;
    }

    /**
     * 종료 상태를 Outcome 상태로 변환.
     *
     * @return 대응하는 OutcomeStatus
     * @throws IllegalStateException RUNNING인 경우
     */
    public OutcomeStatus toOutcomeStatus() {
        return switch (this) {
            case SUCCESS -> OutcomeStatus.SUCCESS;
            case FAILED -> OutcomeStatus.FAILED;
            case ABORTED -> OutcomeStatus.ABORTED;
            case RUNNING -> throw new IllegalStateException("RUNNING has no outcome status");
        };
    }
}
