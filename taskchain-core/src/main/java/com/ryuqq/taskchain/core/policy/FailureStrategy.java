package com.ryuqq.taskchain.core.policy;

/**
 * Workflow에서 Step이 실패했을 때의 대응 방식.
 *
 * <p><strong>동작:</strong></p>
 * <ul>
 *   <li>ABORT: 즉시 중단, 보상 없음 → ABORTED</li>
 *   <li>CONTINUE: 오류를 누적하고 다음 Step 진행 → 오류가 있으면 FAILED</li>
 *   <li>COMPENSATE: 실패한 Step과 완료된 Step을 역순으로 보상 후 중단 → FAILED</li>
 * </ul>
 *
 * @author TaskChain Team
 * @since 1.0.0
 */
public enum FailureStrategy {

    ABORT,

    CONTINUE,

    COMPENSATE;

    /**
     * 이름으로 전략 조회 (대소문자 무시).
     *
     * <p>알 수 없는 이름이거나 null이면 {@link #ABORT}를 반환합니다.</p>
     *
     * @param name 전략 이름
     * @return 해당 전략 또는 ABORT
     */
    public static FailureStrategy fromNameOrDefault(String name) {
        if (name == null) {
            return ABORT;
        }
        for (FailureStrategy strategy : values()) {
            if (strategy.name().equalsIgnoreCase(name.trim())) {
                return strategy;
            }
        }
        return ABORT;
    }
}
