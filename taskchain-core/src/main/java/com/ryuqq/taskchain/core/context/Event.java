package com.ryuqq.taskchain.core.context;

import java.time.Instant;

/**
 * 실행 Trace에 기록되는 단일 이벤트.
 *
 * <p>순수 로그 레코드이며 엔진 로직은 이 값을 해석하지 않습니다.
 * 완료 여부 판정은 항상 {@link RunContext#completedSteps()}를 사용합니다.</p>
 *
 * @param timestamp 발생 시각 (UTC)
 * @param level 이벤트 레벨
 * @param source 이벤트를 기록한 Step 이름
 * @param message 메시지
 *
 * @author TaskChain Team
 * @since 1.0.0
 */
public record Event(
    Instant timestamp,
    EventLevel level,
    String source,
    String message
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 값이 null인 경우
     */
    public Event {
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp cannot be null");
        }
        if (level == null) {
            throw new IllegalArgumentException("level cannot be null");
        }
        if (source == null) {
            throw new IllegalArgumentException("source cannot be null");
        }
        if (message == null) {
            throw new IllegalArgumentException("message cannot be null");
        }
    }

    /**
     * 현재 시각으로 이벤트 생성.
     *
     * @param level 이벤트 레벨
     * @param source Step 이름
     * @param message 메시지
     * @return Event 인스턴스
     */
    public static Event now(EventLevel level, String source, String message) {
        return new Event(Instant.now(), level, source, message);
    }
}
