package com.ryuqq.taskchain.application.manifest;

import com.ryuqq.taskchain.core.policy.FailureStrategy;

import java.util.List;

/**
 * Workflow 구조 요약 (불변 record).
 *
 * <p>실행과 무관한 정적 정보만 담습니다. 문서화나 외부 도구에 Workflow를
 * 노출할 때 사용합니다.</p>
 *
 * @param name Workflow 이름
 * @param description 설명
 * @param strategy 실패 전략
 * @param steps Step 요약 목록 (실행 순서)
 *
 * @author TaskChain Team
 * @since 1.0.0
 */
public record WorkflowManifest(
    String name,
    String description,
    FailureStrategy strategy,
    List<StepManifest> steps
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 값이 null인 경우
     */
    public WorkflowManifest {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (description == null) {
            throw new IllegalArgumentException("description cannot be null");
        }
        if (strategy == null) {
            throw new IllegalArgumentException("strategy cannot be null");
        }
        if (steps == null) {
            throw new IllegalArgumentException("steps cannot be null");
        }
        steps = List.copyOf(steps);
    }
}
