package com.ryuqq.taskchain.application.manifest;

/**
 * Workflow를 구성하는 Step 하나의 요약.
 *
 * @param name Step 이름
 * @param type Step 종류 (Task, Process, Workflow 등 구현 클래스 이름)
 * @param description 설명
 *
 * @author TaskChain Team
 * @since 1.0.0
 */
public record StepManifest(String name, String type, String description) {

    public StepManifest {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("type cannot be null or blank");
        }
        if (description == null) {
            throw new IllegalArgumentException("description cannot be null");
        }
    }
}
