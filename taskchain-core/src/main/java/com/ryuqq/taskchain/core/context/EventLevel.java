package com.ryuqq.taskchain.core.context;

/**
 * Trace 이벤트 레벨.
 *
 * @author TaskChain Team
 * @since 1.0.0
 */
public enum EventLevel {

    /**
     * 일반 진행 상황 (시작, 완료, 재시도 예약 등).
     */
    INFO,

    /**
     * 실패 기록 (Task 실패, 보상 실패, 전략 분기 등).
     */
    ERROR,

    /**
     * 진단용 상세 기록.
     */
    DEBUG
}
