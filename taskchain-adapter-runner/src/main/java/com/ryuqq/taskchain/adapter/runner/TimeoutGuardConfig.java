package com.ryuqq.taskchain.adapter.runner;

/**
 * PooledTimeoutGuard 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>poolSize: 작업 스레드 수 (기본 4)</li>
 *   <li>queueCapacity: 대기열 크기 (기본 64, 가득 차면 제출 거부)</li>
 *   <li>timedOutWorkPolicy: 타임아웃된 작업 처리 방식 (기본 INTERRUPT)</li>
 *   <li>shutdownTimeoutMs: shutdown 시 진행 중 작업 대기 시간 (기본 30000ms)</li>
 * </ul>
 *
 * <p><strong>튜닝 가이드:</strong></p>
 * <ul>
 *   <li>timeout이 걸린 blocking Task를 동시에 많이 실행: poolSize 증가</li>
 *   <li>ABANDON 사용 시: 방치된 작업이 스레드를 점유하므로 poolSize에 여유 확보</li>
 * </ul>
 *
 * @author TaskChain Team
 * @since 1.0.0
 * @param poolSize 작업 스레드 수 (1 이상이어야 함)
 * @param queueCapacity 대기열 크기 (1 이상이어야 함)
 * @param timedOutWorkPolicy 타임아웃된 작업 처리 방식
 * @param shutdownTimeoutMs shutdown 대기 시간 (밀리초, 양수여야 함)
 */
public record TimeoutGuardConfig(
    int poolSize,
    int queueCapacity,
    TimedOutWorkPolicy timedOutWorkPolicy,
    long shutdownTimeoutMs
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: poolSize=4, queueCapacity=64, timedOutWorkPolicy=INTERRUPT, shutdownTimeoutMs=30000ms</p>
     */
    public TimeoutGuardConfig() {
        this(4, 64, TimedOutWorkPolicy.INTERRUPT, 30000);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public TimeoutGuardConfig {
        if (poolSize <= 0) {
            throw new IllegalArgumentException(
                "poolSize must be positive (current: " + poolSize + ")"
            );
        }
        if (queueCapacity <= 0) {
            throw new IllegalArgumentException(
                "queueCapacity must be positive (current: " + queueCapacity + ")"
            );
        }
        if (timedOutWorkPolicy == null) {
            throw new IllegalArgumentException("timedOutWorkPolicy cannot be null");
        }
        if (shutdownTimeoutMs <= 0) {
            throw new IllegalArgumentException(
                "shutdownTimeoutMs must be positive (current: " + shutdownTimeoutMs + ")"
            );
        }
    }

    public TimeoutGuardConfig withPoolSize(int poolSize) {
        return new TimeoutGuardConfig(poolSize, queueCapacity, timedOutWorkPolicy, shutdownTimeoutMs);
    }

    public TimeoutGuardConfig withQueueCapacity(int queueCapacity) {
        return new TimeoutGuardConfig(poolSize, queueCapacity, timedOutWorkPolicy, shutdownTimeoutMs);
    }

    public TimeoutGuardConfig withTimedOutWorkPolicy(TimedOutWorkPolicy timedOutWorkPolicy) {
        return new TimeoutGuardConfig(poolSize, queueCapacity, timedOutWorkPolicy, shutdownTimeoutMs);
    }

    public TimeoutGuardConfig withShutdownTimeoutMs(long shutdownTimeoutMs) {
        return new TimeoutGuardConfig(poolSize, queueCapacity, timedOutWorkPolicy, shutdownTimeoutMs);
    }
}
