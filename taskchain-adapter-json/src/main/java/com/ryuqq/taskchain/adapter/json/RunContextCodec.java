package com.ryuqq.taskchain.adapter.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ryuqq.taskchain.core.context.Event;
import com.ryuqq.taskchain.core.context.EventLevel;
import com.ryuqq.taskchain.core.context.RunContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * RunContext JSON 코덱.
 *
 * <p>실행 중간 상태를 보관하거나 다른 곳에서 이어서 검사할 수 있도록
 * RunContext를 JSON 스냅샷으로 변환합니다.</p>
 *
 * <p><strong>와이어 형식:</strong></p>
 * <pre>
 * {
 *   "data": &lt;any&gt;,
 *   "trace": [{"timestamp": "2024-01-01T00:00:00Z", "level": "INFO", "source": "s", "message": "m"}],
 *   "metadata": {...},
 *   "completedSteps": ["a", "b"],
 *   "compensatedSteps": ["b"]
 * }
 * </pre>
 *
 * <p><strong>디코딩 규칙:</strong></p>
 * <ul>
 *   <li>없는 필드는 빈 값으로 복원 (data는 null)</li>
 *   <li>형식 위반은 {@link InvalidContextFormatException}으로 거부</li>
 *   <li>해석할 수 없는 timestamp는 디코딩 시각으로 대체</li>
 *   <li>metadata와 타입 미지정 data의 숫자: 정수는 Long, 소수는 Double
 *       (JSON에는 Integer/Long 구분이 없으므로 Integer 값은 Long으로 돌아옴)</li>
 * </ul>
 *
 * <p>예외 포맷터는 직렬화되지 않습니다. 복원된 컨텍스트는 기본 포맷터를 사용합니다.</p>
 *
 * @author TaskChain Team
 * @since 1.0.0
 */
public final class RunContextCodec {

    private static final Logger log = LoggerFactory.getLogger(RunContextCodec.class);

    private static final TypeReference<Map<String, Object>> METADATA_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public RunContextCodec() {
        this(TaskChainObjectMappers.createMapper());
    }

    /**
     * 생성자.
     *
     * <p>위 숫자 복원 규칙은 {@link TaskChainObjectMappers#createMapper()}의 설정입니다.
     * 직접 만든 ObjectMapper에는 USE_LONG_FOR_INTS를 켜야 같은 규칙이 적용됩니다.</p>
     *
     * @param objectMapper payload 변환에 사용할 ObjectMapper
     * @throws IllegalArgumentException objectMapper가 null인 경우
     */
    public RunContextCodec(ObjectMapper objectMapper) {
        if (objectMapper == null) {
            throw new IllegalArgumentException("objectMapper cannot be null");
        }
        this.objectMapper = objectMapper;
    }

    /**
     * 컨텍스트를 JSON 문자열로 변환.
     *
     * @param ctx 변환할 컨텍스트
     * @return JSON 문자열
     * @throws IllegalArgumentException ctx가 null이거나 data/metadata를 직렬화할 수 없는 경우
     */
    public String encode(RunContext<?> ctx) {
        if (ctx == null) {
            throw new IllegalArgumentException("ctx cannot be null");
        }
        ObjectNode root = objectMapper.createObjectNode();
        root.set("data", objectMapper.valueToTree(ctx.data()));

        ArrayNode trace = root.putArray("trace");
        for (Event event : ctx.trace()) {
            ObjectNode node = trace.addObject();
            node.put("timestamp", event.timestamp().toString());
            node.put("level", event.level().name());
            node.put("source", event.source());
            node.put("message", event.message());
        }

        root.set("metadata", objectMapper.valueToTree(ctx.metadata()));
        ArrayNode completed = root.putArray("completedSteps");
        ctx.completedSteps().forEach(completed::add);
        ArrayNode compensated = root.putArray("compensatedSteps");
        ctx.compensatedSteps().forEach(compensated::add);

        try {
            return objectMapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to encode context: " + e.getMessage(), e);
        }
    }

    /**
     * JSON 문자열에서 컨텍스트 복원 (data는 Map/List/기본 타입).
     *
     * @param json JSON 문자열
     * @return 복원된 컨텍스트
     * @throws InvalidContextFormatException 형식 위반 시
     */
    public RunContext<Object> decode(String json) {
        return decode(json, Object.class);
    }

    /**
     * JSON 문자열에서 컨텍스트 복원 (data를 지정 타입으로 변환).
     *
     * @param json JSON 문자열
     * @param dataType data 타입
     * @param <D> payload 타입
     * @return 복원된 컨텍스트
     * @throws InvalidContextFormatException 형식 위반 시
     * @throws IllegalArgumentException dataType이 null인 경우
     */
    public <D> RunContext<D> decode(String json, Class<D> dataType) {
        if (dataType == null) {
            throw new IllegalArgumentException("dataType cannot be null");
        }
        JsonNode root = parse(json);
        if (!root.isObject()) {
            throw new InvalidContextFormatException(
                ContextFormatViolation.NOT_AN_OBJECT,
                "Context JSON must be an object (current: " + root.getNodeType() + ")"
            );
        }

        D data = decodeData(root.get("data"), dataType);
        List<Event> trace = decodeTrace(root.get("trace"));
        Map<String, Object> metadata = decodeMetadata(root.get("metadata"));
        List<String> completedSteps = decodeStepNames(
            root.get("completedSteps"), "completedSteps", ContextFormatViolation.COMPLETED_STEPS_NOT_ARRAY
        );
        List<String> compensatedSteps = decodeStepNames(
            root.get("compensatedSteps"), "compensatedSteps", ContextFormatViolation.COMPENSATED_STEPS_NOT_ARRAY
        );

        return RunContext.restore(data, trace, metadata, completedSteps, compensatedSteps);
    }

    private JsonNode parse(String json) {
        if (json == null) {
            throw new InvalidContextFormatException(ContextFormatViolation.MALFORMED_JSON, "json cannot be null");
        }
        try {
            JsonNode root = objectMapper.readTree(json);
            if (root == null || root.isMissingNode()) {
                throw new InvalidContextFormatException(ContextFormatViolation.MALFORMED_JSON, "json is empty");
            }
            return root;
        } catch (JsonProcessingException e) {
            throw new InvalidContextFormatException(
                ContextFormatViolation.MALFORMED_JSON,
                "Failed to parse context JSON: " + e.getOriginalMessage(),
                e
            );
        }
    }

    private <D> D decodeData(JsonNode node, Class<D> dataType) {
        if (node == null || node.isNull()) {
            return null;
        }
        try {
            return objectMapper.treeToValue(node, dataType);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new InvalidContextFormatException(
                ContextFormatViolation.DATA_TYPE_MISMATCH,
                "data cannot be converted to " + dataType.getName(),
                e
            );
        }
    }

    private List<Event> decodeTrace(JsonNode node) {
        List<Event> trace = new ArrayList<>();
        if (node == null || node.isNull()) {
            return trace;
        }
        if (!node.isArray()) {
            throw new InvalidContextFormatException(
                ContextFormatViolation.TRACE_NOT_ARRAY,
                "trace must be an array (current: " + node.getNodeType() + ")"
            );
        }
        int index = 0;
        for (JsonNode entry : node) {
            trace.add(decodeEvent(entry, index++));
        }
        return trace;
    }

    private Event decodeEvent(JsonNode entry, int index) {
        if (!entry.isObject()) {
            throw new InvalidContextFormatException(
                ContextFormatViolation.TRACE_EVENT_NOT_OBJECT,
                "trace[" + index + "] must be an object"
            );
        }
        String timestamp = requireText(entry, "timestamp", index);
        String level = requireText(entry, "level", index);
        String source = requireText(entry, "source", index);
        String message = requireText(entry, "message", index);

        EventLevel eventLevel;
        try {
            eventLevel = EventLevel.valueOf(level.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidContextFormatException(
                ContextFormatViolation.TRACE_EVENT_INCOMPLETE,
                "trace[" + index + "] has unknown level: " + level,
                e
            );
        }
        return new Event(parseTimestamp(timestamp), eventLevel, source, message);
    }

    private static String requireText(JsonNode entry, String field, int index) {
        JsonNode value = entry.get(field);
        if (value == null || !value.isTextual()) {
            throw new InvalidContextFormatException(
                ContextFormatViolation.TRACE_EVENT_INCOMPLETE,
                "trace[" + index + "] is missing '" + field + "'"
            );
        }
        return value.asText();
    }

    private static Instant parseTimestamp(String text) {
        try {
            return OffsetDateTime.parse(text).toInstant();
        } catch (DateTimeParseException e) {
            return parseInstantOrNow(text);
        }
    }

    private static Instant parseInstantOrNow(String text) {
        try {
            return Instant.parse(text);
        } catch (DateTimeParseException e) {
            log.debug("Unparsable trace timestamp '{}', using decode time", text);
            return Instant.now();
        }
    }

    private Map<String, Object> decodeMetadata(JsonNode node) {
        if (node == null || node.isNull()) {
            return new LinkedHashMap<>();
        }
        if (!node.isObject()) {
            throw new InvalidContextFormatException(
                ContextFormatViolation.METADATA_NOT_OBJECT,
                "metadata must be an object (current: " + node.getNodeType() + ")"
            );
        }
        return objectMapper.convertValue(node, METADATA_TYPE);
    }

    private static List<String> decodeStepNames(JsonNode node, String field, ContextFormatViolation violation) {
        List<String> names = new ArrayList<>();
        if (node == null || node.isNull()) {
            return names;
        }
        if (!node.isArray()) {
            throw new InvalidContextFormatException(
                violation,
                field + " must be an array (current: " + node.getNodeType() + ")"
            );
        }
        for (JsonNode element : node) {
            if (!element.isTextual() || element.asText().isBlank()) {
                throw new InvalidContextFormatException(violation, field + " must contain only step names");
            }
            names.add(element.asText());
        }
        return names;
    }
}
