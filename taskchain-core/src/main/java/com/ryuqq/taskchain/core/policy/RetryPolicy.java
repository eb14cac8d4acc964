package com.ryuqq.taskchain.core.policy;

import java.time.Duration;
import java.util.List;
import java.util.Random;
import java.util.random.RandomGenerator;

/**
 * Task 재시도 정책.
 *
 * <p>재시도 여부 판단과 재시도 간격 계산만 담당하는 순수 계산 객체입니다.
 * 실제 대기는 Task가 실행 모드에 맞게 수행합니다.</p>
 *
 * <p><strong>안전 한도:</strong> 범위를 벗어난 값은 예외 없이 보정됩니다.</p>
 * <ul>
 *   <li>maxAttempts: 0 ~ {@value #MAX_ATTEMPTS_LIMIT}</li>
 *   <li>baseDelay: 음수는 0으로</li>
 *   <li>maxDelay: 0 ~ {@link #MAX_DELAY_LIMIT}</li>
 * </ul>
 *
 * <p><strong>기본값:</strong> maxAttempts=3, baseDelay=1s, FIXED, maxDelay=60s,
 * jitter 없음, retryOn={Exception}, giveUpOn={}</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * RetryPolicy policy = RetryPolicy.builder()
 *     .maxAttempts(5)
 *     .baseDelay(Duration.ofMillis(200))
 *     .backoff(BackoffStrategy.EXPONENTIAL)
 *     .giveUpOn(IllegalArgumentException.class)
 *     .build();
 * </pre>
 *
 * @author TaskChain Team
 * @since 1.0.0
 */
public final class RetryPolicy {

    public static final int MAX_ATTEMPTS_LIMIT = 100;
    public static final Duration MAX_DELAY_LIMIT = Duration.ofHours(1);

    private static final double JITTER_RATIO = 0.1;

    private final int maxAttempts;
    private final Duration baseDelay;
    private final BackoffStrategy backoff;
    private final Duration maxDelay;
    private final boolean jitter;
    private final List<Class<? extends Throwable>> retryOn;
    private final List<Class<? extends Throwable>> giveUpOn;
    private final RandomGenerator random;

    private RetryPolicy(Builder builder) {
        this.maxAttempts = Math.max(0, Math.min(builder.maxAttempts, MAX_ATTEMPTS_LIMIT));
        this.baseDelay = builder.baseDelay.isNegative() ? Duration.ZERO : builder.baseDelay;
        this.backoff = builder.backoff;
        this.maxDelay = clampMaxDelay(builder.maxDelay);
        this.jitter = builder.jitter;
        this.retryOn = List.copyOf(builder.retryOn);
        this.giveUpOn = List.copyOf(builder.giveUpOn);
        this.random = builder.random;
    }

    /**
     * 기본 정책 (3회, 1초 고정 간격).
     *
     * @return 기본 RetryPolicy
     */
    public static RetryPolicy defaults() {
        return builder().build();
    }

    /**
     * 재시도 없는 정책 (1회 시도).
     *
     * <p>정책을 지정하지 않은 Task가 사용합니다.</p>
     *
     * @return maxAttempts=1 RetryPolicy
     */
    public static RetryPolicy noRetry() {
        return builder().maxAttempts(1).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * 재시도 여부 판단.
     *
     * <p>판단 순서:</p>
     * <ol>
     *   <li>attempt ≥ maxAttempts → false</li>
     *   <li>giveUpOn 중 하나의 인스턴스 → false</li>
     *   <li>retryOn 중 하나의 인스턴스 → true</li>
     *   <li>그 외 → false</li>
     * </ol>
     *
     * @param attempt 방금 실패한 시도 번호 (1부터 시작)
     * @param failure 실패 원인
     * @return 재시도해야 하면 true
     */
    public boolean shouldRetry(int attempt, Throwable failure) {
        if (attempt >= maxAttempts) {
            return false;
        }
        if (failure == null) {
            return false;
        }
        for (Class<? extends Throwable> type : giveUpOn) {
            if (type.isInstance(failure)) {
                return false;
            }
        }
        for (Class<? extends Throwable> type : retryOn) {
            if (type.isInstance(failure)) {
                return true;
            }
        }
        return false;
    }

    /**
     * 재시도 전 대기 시간 계산.
     *
     * <p>backoff 계산 결과를 maxDelay로 제한한 뒤, jitter가 켜져 있으면
     * 제한된 값의 0 ~ 10%를 무작위로 더합니다.</p>
     *
     * @param attempt 재시도 번호 (1부터 시작, 1 미만이면 0 반환)
     * @return 대기 시간
     */
    public Duration calculateDelay(int attempt) {
        if (attempt < 1) {
            return Duration.ZERO;
        }

        long delayNanos = cappedDelayNanos(attempt);

        if (jitter && delayNanos > 0) {
            delayNanos += (long) (random.nextDouble() * JITTER_RATIO * delayNanos);
        }
        return Duration.ofNanos(delayNanos);
    }

    private long cappedDelayNanos(int attempt) {
        if (baseDelay.compareTo(maxDelay) >= 0) {
            return maxDelay.toNanos();
        }
        // 여기서 baseDelay < maxDelay ≤ 1h 이므로 toNanos()는 overflow 없음
        long baseNanos = baseDelay.toNanos();
        long maxNanos = maxDelay.toNanos();
        if (baseNanos == 0) {
            return 0;
        }

        switch (backoff) {
            case FIXED:
                return baseNanos;
            case LINEAR:
                if (attempt > maxNanos / baseNanos) {
                    return maxNanos;
                }
                return Math.min(baseNanos * attempt, maxNanos);
            case EXPONENTIAL:
                int shift = attempt - 1;
                if (shift >= 62 || baseNanos > (maxNanos >> shift)) {
                    return maxNanos;
                }
                return Math.min(baseNanos << shift, maxNanos);
            default:
                throw new IllegalStateException("Unknown backoff strategy: " + backoff);
        }
    }

    private static Duration clampMaxDelay(Duration maxDelay) {
        if (maxDelay.isNegative()) {
            return Duration.ZERO;
        }
        if (maxDelay.compareTo(MAX_DELAY_LIMIT) > 0) {
            return MAX_DELAY_LIMIT;
        }
        return maxDelay;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public Duration getBaseDelay() {
        return baseDelay;
    }

    public BackoffStrategy getBackoff() {
        return backoff;
    }

    public Duration getMaxDelay() {
        return maxDelay;
    }

    public boolean isJitter() {
        return jitter;
    }

    public List<Class<? extends Throwable>> getRetryOn() {
        return retryOn;
    }

    public List<Class<? extends Throwable>> getGiveUpOn() {
        return giveUpOn;
    }

    @Override
    public String toString() {
        return "RetryPolicy{maxAttempts=" + maxAttempts
            + ", baseDelay=" + baseDelay
            + ", backoff=" + backoff
            + ", maxDelay=" + maxDelay
            + ", jitter=" + jitter + '}';
    }

    /**
     * RetryPolicy 빌더.
     *
     * <p>null 인자는 {@link IllegalArgumentException}으로 거부하고,
     * 범위를 벗어난 숫자 값은 {@link #build()} 시점에 보정합니다.</p>
     */
    public static final class Builder {

        private int maxAttempts = 3;
        private Duration baseDelay = Duration.ofSeconds(1);
        private BackoffStrategy backoff = BackoffStrategy.FIXED;
        private Duration maxDelay = Duration.ofSeconds(60);
        private boolean jitter;
        private List<Class<? extends Throwable>> retryOn = List.of(Exception.class);
        private List<Class<? extends Throwable>> giveUpOn = List.of();
        private RandomGenerator random = new Random();

        private Builder() {
        }

        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder baseDelay(Duration baseDelay) {
            this.baseDelay = requireNonNull(baseDelay, "baseDelay");
            return this;
        }

        public Builder backoff(BackoffStrategy backoff) {
            this.backoff = requireNonNull(backoff, "backoff");
            return this;
        }

        public Builder maxDelay(Duration maxDelay) {
            this.maxDelay = requireNonNull(maxDelay, "maxDelay");
            return this;
        }

        public Builder jitter(boolean jitter) {
            this.jitter = jitter;
            return this;
        }

        /**
         * 재시도 대상 예외 타입 지정 (기존 값 대체).
         *
         * @param types 예외 타입
         * @return this
         */
        @SafeVarargs
        public final Builder retryOn(Class<? extends Throwable>... types) {
            this.retryOn = List.of(requireNonNull(types, "retryOn"));
            return this;
        }

        /**
         * 즉시 포기할 예외 타입 지정 (기존 값 대체). retryOn보다 우선합니다.
         *
         * @param types 예외 타입
         * @return this
         */
        @SafeVarargs
        public final Builder giveUpOn(Class<? extends Throwable>... types) {
            this.giveUpOn = List.of(requireNonNull(types, "giveUpOn"));
            return this;
        }

        /**
         * jitter 난수 생성기 지정 (테스트에서 seed 고정용).
         *
         * @param random 난수 생성기
         * @return this
         */
        public Builder random(RandomGenerator random) {
            this.random = requireNonNull(random, "random");
            return this;
        }

        public RetryPolicy build() {
            return new RetryPolicy(this);
        }

        private static <T> T requireNonNull(T value, String field) {
            if (value == null) {
                throw new IllegalArgumentException(field + " cannot be null");
            }
            return value;
        }
    }
}
