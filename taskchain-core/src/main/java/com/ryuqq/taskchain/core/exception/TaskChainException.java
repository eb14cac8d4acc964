package com.ryuqq.taskchain.core.exception;

/**
 * TaskChain 예외 계층의 최상위 타입.
 *
 * @author TaskChain Team
 * @since 1.0.0
 */
public class TaskChainException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public TaskChainException(String message) {
        super(message);
    }

    public TaskChainException(String message, Throwable cause) {
        super(message, cause);
    }
}
