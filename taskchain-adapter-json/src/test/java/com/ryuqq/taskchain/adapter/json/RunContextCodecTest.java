package com.ryuqq.taskchain.adapter.json;

import com.ryuqq.taskchain.core.context.Event;
import com.ryuqq.taskchain.core.context.EventLevel;
import com.ryuqq.taskchain.core.context.RunContext;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * RunContextCodec 유닛 테스트.
 *
 * @author TaskChain Team
 * @since 1.0.0
 */
class RunContextCodecTest {

    private final RunContextCodec codec = new RunContextCodec();

    public record Order(String id, int quantity) {
    }

    // ============================================================
    // 1. 왕복 변환
    // ============================================================

    @Test
    void encode_decode_기록과_메타데이터_보존() {
        // given
        RunContext<Map<String, Object>> ctx = RunContext.of(Map.of("orderId", "o-1"));
        ctx.logEvent(EventLevel.INFO, "validate", "Task Started");
        ctx.logEvent(EventLevel.ERROR, "notify", "Task Failed: boom");
        ctx.metadata().put("tenant", "acme");
        ctx.markCompleted("validate");
        ctx.markCompleted("create");
        ctx.markCompensated("create");

        // when
        RunContext<Object> restored = codec.decode(codec.encode(ctx));

        // then
        assertThat(restored.data()).isEqualTo(Map.of("orderId", "o-1"));
        assertThat(restored.trace()).hasSize(2);
        assertThat(restored.trace().get(1).level()).isEqualTo(EventLevel.ERROR);
        assertThat(restored.trace().get(1).message()).isEqualTo("Task Failed: boom");
        assertThat(restored.trace().get(0).timestamp()).isEqualTo(ctx.trace().get(0).timestamp());
        assertThat(restored.metadata()).containsEntry("tenant", "acme");
        assertThat(restored.completedSteps()).containsExactly("validate", "create");
        assertThat(restored.compensatedSteps()).containsExactly("create");
    }

    @Test
    void encode_decode_정수_메타데이터는_항상_Long으로_복원() {
        // given
        RunContext<String> ctx = RunContext.of("x");
        ctx.metadata().put("count", 5L);
        ctx.metadata().put("attempt", 2);
        ctx.metadata().put("offset", 9_000_000_000L);
        ctx.metadata().put("ratio", 0.5);

        // when
        RunContext<String> restored = codec.decode(codec.encode(ctx), String.class);

        // then
        assertThat(restored.metadata().get("count")).isInstanceOf(Long.class).isEqualTo(5L);
        assertThat(restored.metadata().get("attempt")).isEqualTo(2L);
        assertThat(restored.metadata().get("offset")).isEqualTo(9_000_000_000L);
        assertThat(restored.metadata().get("ratio")).isEqualTo(0.5);
        assertThat(restored.metadata()).isEqualTo(Map.of("count", 5L, "attempt", 2L,
            "offset", 9_000_000_000L, "ratio", 0.5));
    }

    @Test
    void decode_data를_지정한_타입으로_변환() {
        // given
        String json = codec.encode(RunContext.of(new Order("o-7", 3)));

        // when
        RunContext<Order> restored = codec.decode(json, Order.class);

        // then
        assertThat(restored.data()).isEqualTo(new Order("o-7", 3));
    }

    @Test
    void decode_없는_필드는_빈_값으로_복원() {
        // when
        RunContext<Object> restored = codec.decode("{}");

        // then
        assertThat(restored.data()).isNull();
        assertThat(restored.trace()).isEmpty();
        assertThat(restored.metadata()).isEmpty();
        assertThat(restored.completedSteps()).isEmpty();
        assertThat(restored.compensatedSteps()).isEmpty();
    }

    @Test
    void decode_복원된_컨텍스트는_계속_기록_가능() {
        // given
        RunContext<Object> restored = codec.decode("{\"completedSteps\": [\"a\"]}");

        // when
        restored.markCompleted("b");
        restored.metadata().put("k", 1);

        // then
        assertThat(restored.completedSteps()).containsExactly("a", "b");
        assertThat(restored.metadata()).containsEntry("k", 1);
    }

    // ============================================================
    // 2. timestamp 처리
    // ============================================================

    @Test
    void decode_오프셋이_있는_timestamp는_UTC로_변환() {
        // given
        String json = "{\"trace\": [{\"timestamp\": \"2024-03-01T09:00:00+09:00\","
            + " \"level\": \"INFO\", \"source\": \"s\", \"message\": \"m\"}]}";

        // when
        Event event = codec.decode(json).trace().get(0);

        // then
        assertThat(event.timestamp()).isEqualTo(Instant.parse("2024-03-01T00:00:00Z"));
    }

    @Test
    void decode_해석할_수_없는_timestamp는_디코딩_시각으로_대체() {
        // given
        Instant before = Instant.now();
        String json = "{\"trace\": [{\"timestamp\": \"yesterday\","
            + " \"level\": \"DEBUG\", \"source\": \"s\", \"message\": \"m\"}]}";

        // when
        Event event = codec.decode(json).trace().get(0);

        // then
        assertThat(event.timestamp()).isAfterOrEqualTo(before);
        assertThat(event.level()).isEqualTo(EventLevel.DEBUG);
    }

    // ============================================================
    // 3. 형식 위반
    // ============================================================

    @Test
    void decode_잘못된_JSON은_MALFORMED_JSON() {
        assertViolation("{not json", ContextFormatViolation.MALFORMED_JSON);
    }

    @Test
    void decode_최상위가_배열이면_NOT_AN_OBJECT() {
        assertViolation("[1, 2]", ContextFormatViolation.NOT_AN_OBJECT);
    }

    @Test
    void decode_trace가_배열이_아니면_TRACE_NOT_ARRAY() {
        assertViolation("{\"trace\": {}}", ContextFormatViolation.TRACE_NOT_ARRAY);
    }

    @Test
    void decode_trace_항목이_객체가_아니면_TRACE_EVENT_NOT_OBJECT() {
        assertViolation("{\"trace\": [\"Task Started\"]}", ContextFormatViolation.TRACE_EVENT_NOT_OBJECT);
    }

    @Test
    void decode_trace_항목에_필드가_없으면_TRACE_EVENT_INCOMPLETE() {
        assertViolation(
            "{\"trace\": [{\"timestamp\": \"2024-01-01T00:00:00Z\", \"level\": \"INFO\", \"source\": \"s\"}]}",
            ContextFormatViolation.TRACE_EVENT_INCOMPLETE
        );
    }

    @Test
    void decode_알_수_없는_level은_TRACE_EVENT_INCOMPLETE() {
        assertViolation(
            "{\"trace\": [{\"timestamp\": \"2024-01-01T00:00:00Z\", \"level\": \"TRACE\","
                + " \"source\": \"s\", \"message\": \"m\"}]}",
            ContextFormatViolation.TRACE_EVENT_INCOMPLETE
        );
    }

    @Test
    void decode_metadata가_객체가_아니면_METADATA_NOT_OBJECT() {
        assertViolation("{\"metadata\": [1]}", ContextFormatViolation.METADATA_NOT_OBJECT);
    }

    @Test
    void decode_completedSteps가_배열이_아니면_COMPLETED_STEPS_NOT_ARRAY() {
        assertViolation("{\"completedSteps\": \"a\"}", ContextFormatViolation.COMPLETED_STEPS_NOT_ARRAY);
    }

    @Test
    void decode_compensatedSteps가_배열이_아니면_COMPENSATED_STEPS_NOT_ARRAY() {
        assertViolation("{\"compensatedSteps\": 3}", ContextFormatViolation.COMPENSATED_STEPS_NOT_ARRAY);
    }

    @Test
    void decode_data_타입이_맞지_않으면_DATA_TYPE_MISMATCH() {
        // given
        String json = "{\"data\": {\"id\": \"o-1\", \"quantity\": \"many\"}}";

        // when & then
        assertThatThrownBy(() -> codec.decode(json, Order.class))
            .isInstanceOf(InvalidContextFormatException.class)
            .satisfies(e -> assertThat(((InvalidContextFormatException) e).getViolation())
                .isEqualTo(ContextFormatViolation.DATA_TYPE_MISMATCH));
    }

    @Test
    void encode_null_컨텍스트는_IllegalArgumentException() {
        assertThatThrownBy(() -> codec.encode(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("ctx cannot be null");
    }

    @Test
    void encode_trace는_ISO8601_문자열로_기록() {
        // given
        RunContext<String> ctx = RunContext.restore(
            "x",
            List.of(new Event(Instant.parse("2024-01-01T00:00:00Z"), EventLevel.INFO, "a", "Task Started")),
            Map.of(),
            List.of(),
            List.of()
        );

        // when
        String json = codec.encode(ctx);

        // then
        assertThat(json).contains("\"timestamp\":\"2024-01-01T00:00:00Z\"");
        assertThat(json).contains("\"data\":\"x\"");
    }

    private void assertViolation(String json, ContextFormatViolation expected) {
        assertThatThrownBy(() -> codec.decode(json))
            .isInstanceOf(InvalidContextFormatException.class)
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageStartingWith("[" + expected + "]")
            .satisfies(e -> assertThat(((InvalidContextFormatException) e).getViolation()).isEqualTo(expected));
    }
}
