package com.ryuqq.taskchain.core.outcome;

import com.ryuqq.taskchain.core.context.RunContext;

import java.util.List;

/**
 * Executable 실행 결과 (불변 record).
 *
 * <p>모든 {@code execute} 호출은 정확히 하나의 Outcome을 생성합니다.
 * 일반적인 비즈니스 실패는 예외로 전파되지 않고 {@link #errors()}에 담깁니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Outcome&lt;Order&gt; outcome = runner.run(workflow, ctx);
 * if (!outcome.isSuccess()) {
 *     outcome.errors().forEach(e -&gt; log.warn("step failed", e));
 * }
 * </pre>
 *
 * @param status 결과 상태
 * @param context 실행에 사용된 컨텍스트
 * @param errors 수집된 실패 목록 (순서 유지)
 * @param durationMs 경과 시간 (밀리초, 0 이상)
 * @param <D> payload 타입
 *
 * @author TaskChain Team
 * @since 1.0.0
 */
public record Outcome<D>(
    OutcomeStatus status,
    RunContext<D> context,
    List<Throwable> errors,
    long durationMs
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public Outcome {
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        if (context == null) {
            throw new IllegalArgumentException("context cannot be null");
        }
        if (errors == null) {
            throw new IllegalArgumentException("errors cannot be null");
        }
        if (durationMs < 0) {
            throw new IllegalArgumentException("durationMs must be non-negative (current: " + durationMs + ")");
        }
        errors = List.copyOf(errors);
    }

    /**
     * 성공 결과 생성.
     *
     * @param context 컨텍스트
     * @param durationMs 경과 시간 (밀리초)
     * @param <D> payload 타입
     * @return SUCCESS Outcome
     */
    public static <D> Outcome<D> success(RunContext<D> context, long durationMs) {
        return new Outcome<>(OutcomeStatus.SUCCESS, context, List.of(), durationMs);
    }

    /**
     * 실패 결과 생성.
     *
     * @param context 컨텍스트
     * @param errors 실패 목록
     * @param durationMs 경과 시간 (밀리초)
     * @param <D> payload 타입
     * @return FAILED Outcome
     */
    public static <D> Outcome<D> failed(RunContext<D> context, List<Throwable> errors, long durationMs) {
        return new Outcome<>(OutcomeStatus.FAILED, context, errors, durationMs);
    }

    /**
     * 중단 결과 생성.
     *
     * @param context 컨텍스트
     * @param errors 실패한 Step의 오류 목록
     * @param durationMs 경과 시간 (밀리초)
     * @param <D> payload 타입
     * @return ABORTED Outcome
     */
    public static <D> Outcome<D> aborted(RunContext<D> context, List<Throwable> errors, long durationMs) {
        return new Outcome<>(OutcomeStatus.ABORTED, context, errors, durationMs);
    }

    public boolean isSuccess() {
        return status.isSuccess();
    }

    /**
     * 경과 시간만 변경한 새 인스턴스 생성.
     *
     * <p>호출자가 전체 경과 시간을 사후에 채워 넣을 때 사용합니다.</p>
     *
     * @param durationMs 경과 시간 (밀리초)
     * @return 새 Outcome
     */
    public Outcome<D> withDurationMs(long durationMs) {
        return new Outcome<>(status, context, errors, durationMs);
    }
}
