package com.ryuqq.taskchain.core.exception;

/**
 * Process/Workflow의 자식이 Outcome을 반환하지 않고 예외를 던졌을 때 사용됩니다.
 *
 * <p>Composite는 이 예외로 감싼 뒤 자신의 정책에 따라 Outcome으로 변환합니다.</p>
 *
 * @author TaskChain Team
 * @since 1.0.0
 */
public class CompositeExecutionException extends TaskChainException {

    private static final long serialVersionUID = 1L;

    private final String compositeName;
    private final String stepName;

    public CompositeExecutionException(String compositeName, String stepName, Throwable cause) {
        super("Step '" + stepName + "' of '" + compositeName + "' raised an unexpected error", cause);
        this.compositeName = compositeName;
        this.stepName = stepName;
    }

    public String getCompositeName() {
        return compositeName;
    }

    public String getStepName() {
        return stepName;
    }
}
