package com.ryuqq.taskchain.core.exception;

/**
 * Task가 재시도를 모두 소진하고 실패했음을 나타냅니다.
 *
 * <p>마지막 시도의 실패 원인을 cause로 보관합니다.
 * 이 예외는 던져지지 않고 FAILED Outcome의 errors에 담깁니다.</p>
 *
 * @author TaskChain Team
 * @since 1.0.0
 */
public class StepExecutionException extends TaskChainException {

    private static final long serialVersionUID = 1L;

    private final String stepName;

    public StepExecutionException(String stepName, String message, Throwable cause) {
        super(message, cause);
        this.stepName = stepName;
    }

    /**
     * 재시도 소진 예외 생성.
     *
     * @param stepName Task 이름
     * @param attempts 수행한 시도 횟수
     * @param lastFailure 마지막 실패 원인
     * @return StepExecutionException 인스턴스
     */
    public static StepExecutionException exhausted(String stepName, int attempts, Throwable lastFailure) {
        return new StepExecutionException(
            stepName,
            "Task '" + stepName + "' failed after " + attempts + " attempts",
            lastFailure
        );
    }

    public String getStepName() {
        return stepName;
    }
}
