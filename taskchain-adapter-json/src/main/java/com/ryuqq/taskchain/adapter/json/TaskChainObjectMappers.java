package com.ryuqq.taskchain.adapter.json;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * JSON adapter 공용 ObjectMapper 팩토리.
 *
 * <p><strong>등록 항목:</strong></p>
 * <ul>
 *   <li>JavaTimeModule: Instant, Duration 등 java.time 타입</li>
 *   <li>WRITE_DATES_AS_TIMESTAMPS 비활성화: ISO-8601 문자열로 기록</li>
 *   <li>FAIL_ON_UNKNOWN_PROPERTIES 비활성화: 상위 버전이 추가한 필드 무시</li>
 *   <li>USE_LONG_FOR_INTS 활성화: 타입 정보 없는 정수는 크기와 무관하게 항상 Long으로 복원</li>
 * </ul>
 *
 * @author TaskChain Team
 * @since 1.0.0
 */
public final class TaskChainObjectMappers {

    private TaskChainObjectMappers() {
        throw new UnsupportedOperationException("Utility class");
    }

    public static ObjectMapper createMapper() {
        return new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .enable(DeserializationFeature.USE_LONG_FOR_INTS);
    }
}
