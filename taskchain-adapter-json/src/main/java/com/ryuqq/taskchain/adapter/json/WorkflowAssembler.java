package com.ryuqq.taskchain.adapter.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.taskchain.application.component.Workflow;
import com.ryuqq.taskchain.core.execution.Executable;
import com.ryuqq.taskchain.core.policy.FailureStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * JSON 정의로부터 Workflow를 조립합니다.
 *
 * <p>Step 구현은 호출자가 이름으로 등록한 registry에서 찾습니다.
 * 정의에는 이름과 순서, 실패 전략만 담깁니다.</p>
 *
 * <p><strong>정의 형식:</strong></p>
 * <pre>
 * {
 *   "name": "OrderFlow",
 *   "description": "주문 처리",
 *   "steps": ["validate", "create", "notify"],
 *   "strategy": "COMPENSATE"
 * }
 * </pre>
 *
 * <p><strong>기본값:</strong></p>
 * <ul>
 *   <li>name 생략: "DynamicWorkflow"</li>
 *   <li>strategy 생략 또는 알 수 없는 값: ABORT</li>
 *   <li>steps 생략: 빈 Workflow</li>
 * </ul>
 *
 * @author TaskChain Team
 * @since 1.0.0
 */
public final class WorkflowAssembler {

    private static final Logger log = LoggerFactory.getLogger(WorkflowAssembler.class);

    static final String DEFAULT_NAME = "DynamicWorkflow";

    private final ObjectMapper objectMapper;

    public WorkflowAssembler() {
        this(TaskChainObjectMappers.createMapper());
    }

    public WorkflowAssembler(ObjectMapper objectMapper) {
        if (objectMapper == null) {
            throw new IllegalArgumentException("objectMapper cannot be null");
        }
        this.objectMapper = objectMapper;
    }

    /**
     * Workflow 조립.
     *
     * @param definitionJson Workflow 정의 JSON
     * @param registry Step 이름 → Executable
     * @param <D> payload 타입
     * @return 조립된 Workflow
     * @throws IllegalArgumentException 정의가 잘못되었거나 registry에 없는 Step 이름이 있는 경우
     */
    public <D> Workflow<D> assemble(String definitionJson, Map<String, ? extends Executable<D>> registry) {
        if (definitionJson == null) {
            throw new IllegalArgumentException("definitionJson cannot be null");
        }
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }

        JsonNode definition = readDefinition(definitionJson);
        String name = textOrDefault(definition, "name", DEFAULT_NAME);
        String description = textOrDefault(definition, "description", null);
        FailureStrategy strategy = resolveStrategy(definition.get("strategy"));

        List<Executable<D>> steps = new ArrayList<>();
        for (String stepName : stepNames(definition.get("steps"))) {
            Executable<D> step = registry.get(stepName);
            if (step == null) {
                throw new IllegalArgumentException(
                    "Step '" + stepName + "' not found in registry " + registry.keySet()
                );
            }
            steps.add(step);
        }

        log.debug("Assembled workflow '{}' with {} steps, strategy={}", name, steps.size(), strategy);
        return new Workflow<>(name, description, steps, strategy);
    }

    private JsonNode readDefinition(String definitionJson) {
        JsonNode definition;
        try {
            definition = objectMapper.readTree(definitionJson);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                "Failed to parse workflow definition: " + e.getOriginalMessage(), e
            );
        }
        if (definition == null || !definition.isObject()) {
            throw new IllegalArgumentException("Workflow definition must be a JSON object");
        }
        return definition;
    }

    private static String textOrDefault(JsonNode definition, String field, String defaultValue) {
        JsonNode value = definition.get(field);
        if (value == null || value.isNull()) {
            return defaultValue;
        }
        if (!value.isTextual()) {
            throw new IllegalArgumentException(field + " must be a string");
        }
        return value.asText();
    }

    private static FailureStrategy resolveStrategy(JsonNode value) {
        if (value == null || value.isNull()) {
            return FailureStrategy.ABORT;
        }
        String text = value.asText();
        FailureStrategy strategy = FailureStrategy.fromNameOrDefault(text);
        if (strategy == FailureStrategy.ABORT && !"ABORT".equalsIgnoreCase(text.trim())) {
            log.warn("Unknown failure strategy '{}', falling back to ABORT", text);
        }
        return strategy;
    }

    private static List<String> stepNames(JsonNode value) {
        List<String> names = new ArrayList<>();
        if (value == null || value.isNull()) {
            return names;
        }
        if (!value.isArray()) {
            throw new IllegalArgumentException("steps must be an array of step names");
        }
        for (JsonNode element : value) {
            if (!element.isTextual()) {
                throw new IllegalArgumentException("steps must be an array of step names");
            }
            names.add(element.asText());
        }
        return names;
    }
}
