package com.ryuqq.taskchain.core.policy;

/**
 * 재시도 간격 증가 방식.
 *
 * <p><strong>계산식 (attempt는 1부터 시작):</strong></p>
 * <ul>
 *   <li>FIXED: baseDelay</li>
 *   <li>LINEAR: baseDelay * attempt</li>
 *   <li>EXPONENTIAL: baseDelay * 2^(attempt-1)</li>
 * </ul>
 *
 * @author TaskChain Team
 * @since 1.0.0
 */
public enum BackoffStrategy {

    /**
     * 모든 재시도에 동일한 간격.
     */
    FIXED,

    /**
     * 시도 횟수에 비례하여 증가.
     */
    LINEAR,

    /**
     * 시도마다 두 배로 증가.
     */
    EXPONENTIAL
}
