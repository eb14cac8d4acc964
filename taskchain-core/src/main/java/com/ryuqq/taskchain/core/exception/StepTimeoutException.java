package com.ryuqq.taskchain.core.exception;

import java.time.Duration;

/**
 * 단일 시도가 허용 시간을 초과했음을 나타냅니다.
 *
 * <p>재시도 판단에서는 일반 실패와 동일하게 취급됩니다.</p>
 *
 * @author TaskChain Team
 * @since 1.0.0
 */
public class StepTimeoutException extends StepExecutionException {

    private static final long serialVersionUID = 1L;

    private final Duration timeout;

    public StepTimeoutException(String stepName, Duration timeout) {
        super(stepName, "Task '" + stepName + "' timed out after " + timeout.toMillis() + "ms", null);
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
