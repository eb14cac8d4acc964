package com.ryuqq.taskchain.adapter.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.ryuqq.taskchain.application.manifest.WorkflowManifest;

/**
 * WorkflowManifest를 JSON으로 출력합니다.
 *
 * <pre>
 * {
 *   "name" : "OrderFlow",
 *   "description" : "No description provided.",
 *   "strategy" : "ABORT",
 *   "steps" : [ { "name" : "validate", "type" : "Task", "description" : "..." } ]
 * }
 * </pre>
 *
 * @author TaskChain Team
 * @since 1.0.0
 */
public final class WorkflowManifestWriter {

    private final ObjectMapper objectMapper;

    public WorkflowManifestWriter() {
        this(TaskChainObjectMappers.createMapper().enable(SerializationFeature.INDENT_OUTPUT));
    }

    public WorkflowManifestWriter(ObjectMapper objectMapper) {
        if (objectMapper == null) {
            throw new IllegalArgumentException("objectMapper cannot be null");
        }
        this.objectMapper = objectMapper;
    }

    /**
     * Manifest를 JSON 문자열로 변환.
     *
     * @param manifest 변환할 manifest
     * @return JSON 문자열
     * @throws IllegalArgumentException manifest가 null이거나 직렬화에 실패한 경우
     */
    public String toJson(WorkflowManifest manifest) {
        if (manifest == null) {
            throw new IllegalArgumentException("manifest cannot be null");
        }
        try {
            return objectMapper.writeValueAsString(manifest);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize manifest: " + e.getMessage(), e);
        }
    }
}
