package com.ryuqq.taskchain.core.exception;

/**
 * 보상(undo) 동작 자체가 실패했음을 나타냅니다.
 *
 * <p><strong>항상 치명적입니다:</strong> 재시도되지 않으며 Outcome으로 흡수되지 않고
 * 호출자에게 그대로 전파됩니다.</p>
 *
 * @author TaskChain Team
 * @since 1.0.0
 */
public class CompensationException extends TaskChainException {

    private static final long serialVersionUID = 1L;

    private final String stepName;

    public CompensationException(String stepName, Throwable cause) {
        super("Compensation of step '" + stepName + "' failed", cause);
        this.stepName = stepName;
    }

    public String getStepName() {
        return stepName;
    }
}
