package com.ryuqq.taskchain.core.spi;

import java.time.Duration;
import java.util.concurrent.Callable;

/**
 * Blocking 작업에 시간 제한을 적용하는 SPI.
 *
 * <p>blocking Task에 timeout이 선언된 경우 Task는 이 인터페이스를 통해
 * 사용자 함수를 호출합니다. 구현체는 작업을 별도 스레드에서 실행하고
 * 호출 스레드에서 결과를 기다립니다.</p>
 *
 * <p><strong>구현 요구사항:</strong></p>
 * <ul>
 *   <li>제한 시간 초과 시 {@link com.ryuqq.taskchain.core.exception.StepTimeoutException} 발생</li>
 *   <li>작업이 던진 예외는 감싸지 않고 그대로 전파 (ExecutionException unwrap)</li>
 *   <li>단, 작업 스레드 안의 InterruptedException은
 *       {@link com.ryuqq.taskchain.core.exception.StepExecutionException}으로 감싸서 전파
 *       (호출 스레드의 인터럽트와 구분)</li>
 *   <li>스레드 자원의 소유권은 구현체에 있으며, 생성과 종료는 호출자가 관리</li>
 * </ul>
 *
 * @author TaskChain Team
 * @since 1.0.0
 * @see com.ryuqq.taskchain.core.exception.StepTimeoutException
 */
public interface TimeoutGuard {

    /**
     * 시간 제한 하에서 작업 실행.
     *
     * @param work 실행할 작업
     * @param timeout 제한 시간 (양수)
     * @param stepName 작업을 소유한 Step 이름 (오류 메시지용)
     * @param <T> 결과 타입
     * @return 작업 결과
     * @throws com.ryuqq.taskchain.core.exception.StepTimeoutException 제한 시간 초과 시
     * @throws InterruptedException 대기 중 호출 스레드가 인터럽트된 경우
     * @throws Exception 작업이 던진 예외
     */
    <T> T call(Callable<T> work, Duration timeout, String stepName) throws Exception;
}
