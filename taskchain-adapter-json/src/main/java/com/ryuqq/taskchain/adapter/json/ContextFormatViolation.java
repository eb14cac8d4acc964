package com.ryuqq.taskchain.adapter.json;

/**
 * RunContext 디코딩 실패 유형.
 *
 * @author TaskChain Team
 * @since 1.0.0
 */
public enum ContextFormatViolation {

    /** JSON으로 파싱할 수 없음. */
    MALFORMED_JSON,

    /** 최상위 값이 객체가 아님. */
    NOT_AN_OBJECT,

    /** trace가 배열이 아님. */
    TRACE_NOT_ARRAY,

    /** trace 항목이 객체가 아님. */
    TRACE_EVENT_NOT_OBJECT,

    /** trace 항목에 필드가 없거나 level을 알 수 없음. */
    TRACE_EVENT_INCOMPLETE,

    /** metadata가 객체가 아님. */
    METADATA_NOT_OBJECT,

    /** completedSteps가 문자열 배열이 아님. */
    COMPLETED_STEPS_NOT_ARRAY,

    /** compensatedSteps가 문자열 배열이 아님. */
    COMPENSATED_STEPS_NOT_ARRAY,

    /** data를 요청한 타입으로 변환할 수 없음. */
    DATA_TYPE_MISMATCH
}
