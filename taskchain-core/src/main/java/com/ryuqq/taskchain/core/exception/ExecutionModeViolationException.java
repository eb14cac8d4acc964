package com.ryuqq.taskchain.core.exception;

/**
 * 실행 모드 계약 위반.
 *
 * <p>동기 Runner로 비동기 실행 결과를 받았거나, Step이 선언된 모드와 다른 형태의 값을
 * 반환한 경우 발생합니다. 일시적 오류가 아닌 프로그래밍 오류이므로 재시도되지 않고
 * 즉시 전파됩니다.</p>
 *
 * @author TaskChain Team
 * @since 1.0.0
 */
public class ExecutionModeViolationException extends TaskChainException {

    private static final long serialVersionUID = 1L;

    private final String stepName;

    public ExecutionModeViolationException(String stepName, String message) {
        super(message);
        this.stepName = stepName;
    }

    /**
     * 동기 실행 중 Pending 결과를 받은 경우.
     *
     * @param stepName Step 이름
     * @return 예외 인스턴스
     */
    public static ExecutionModeViolationException pendingInBlockingMode(String stepName) {
        return new ExecutionModeViolationException(
            stepName,
            "Step '" + stepName + "' returned a pending result in blocking mode. Use AsyncRunner for asynchronous flows."
        );
    }

    /**
     * 동기 Task의 함수가 CompletionStage/Future를 반환한 경우.
     *
     * @param stepName Task 이름
     * @return 예외 인스턴스
     */
    public static ExecutionModeViolationException asyncValueFromBlockingAction(String stepName) {
        return new ExecutionModeViolationException(
            stepName,
            "Task '" + stepName + "' returned an asynchronous value from a blocking action. "
                + "Declare it with asyncAction(...) and run it with AsyncRunner."
        );
    }

    /**
     * 비동기 함수가 CompletionStage 대신 null을 반환한 경우.
     *
     * @param stepName Task 이름
     * @return 예외 인스턴스
     */
    public static ExecutionModeViolationException missingStage(String stepName) {
        return new ExecutionModeViolationException(
            stepName,
            "Task '" + stepName + "' declared an asynchronous action but returned null instead of a CompletionStage"
        );
    }

    /**
     * Executable이 결과 자체를 반환하지 않은 경우.
     *
     * @param stepName Step 이름
     * @return 예외 인스턴스
     */
    public static ExecutionModeViolationException missingResult(String stepName) {
        return new ExecutionModeViolationException(
            stepName,
            "Step '" + stepName + "' returned no result"
        );
    }

    public String getStepName() {
        return stepName;
    }
}
