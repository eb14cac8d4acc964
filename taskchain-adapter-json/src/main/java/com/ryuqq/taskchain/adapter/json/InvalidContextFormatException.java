package com.ryuqq.taskchain.adapter.json;

/**
 * 직렬화된 RunContext가 기대한 형식이 아닐 때 발생합니다.
 *
 * <p>어떤 규칙을 위반했는지 {@link #getViolation()}으로 구분할 수 있습니다.</p>
 *
 * @author TaskChain Team
 * @since 1.0.0
 */
public class InvalidContextFormatException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    private final ContextFormatViolation violation;

    public InvalidContextFormatException(ContextFormatViolation violation, String message) {
        this(violation, message, null);
    }

    public InvalidContextFormatException(ContextFormatViolation violation, String message, Throwable cause) {
        super("[" + violation + "] " + message, cause);
        this.violation = violation;
    }

    public ContextFormatViolation getViolation() {
        return violation;
    }
}
