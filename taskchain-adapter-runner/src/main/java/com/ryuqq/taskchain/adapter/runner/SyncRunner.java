package com.ryuqq.taskchain.adapter.runner;

import com.ryuqq.taskchain.core.context.RunContext;
import com.ryuqq.taskchain.core.exception.ExecutionModeViolationException;
import com.ryuqq.taskchain.core.execution.Executable;
import com.ryuqq.taskchain.core.execution.Execution;
import com.ryuqq.taskchain.core.outcome.Outcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Blocking 모드 Runner.
 *
 * <p>호출 스레드에서 실행 트리를 끝까지 실행하고 Outcome을 반환합니다.
 * 재시도 대기 동안 호출 스레드는 block 됩니다.</p>
 *
 * <p><strong>계약 검증:</strong></p>
 * <ul>
 *   <li>비동기 트리: 실행 전에 {@link ExecutionModeViolationException}</li>
 *   <li>Pending 결과: future를 취소하고 {@link ExecutionModeViolationException}</li>
 *   <li>null Execution 또는 null Outcome: {@link ExecutionModeViolationException}</li>
 * </ul>
 *
 * <p>Stateless 설계이므로 하나의 인스턴스를 여러 스레드에서 공유할 수 있습니다.</p>
 *
 * @author TaskChain Team
 * @since 1.0.0
 */
public final class SyncRunner {

    private static final Logger log = LoggerFactory.getLogger(SyncRunner.class);

    /**
     * 주어진 컨텍스트로 실행.
     *
     * @param executable 실행할 Executable
     * @param ctx 실행 컨텍스트
     * @param <D> payload 타입
     * @return 실행 결과
     * @throws IllegalArgumentException executable 또는 ctx가 null인 경우
     * @throws ExecutionModeViolationException 비동기 Executable을 실행한 경우
     * @throws com.ryuqq.taskchain.core.exception.CompensationException 보상 실패 시
     */
    public <D> Outcome<D> run(Executable<D> executable, RunContext<D> ctx) {
        if (executable == null) {
            throw new IllegalArgumentException("executable cannot be null");
        }
        if (ctx == null) {
            throw new IllegalArgumentException("ctx cannot be null");
        }

        if (executable.isAsync()) {
            log.error("'{}' is asynchronous and cannot run in blocking mode", executable.name());
            throw ExecutionModeViolationException.pendingInBlockingMode(executable.name());
        }

        log.debug("Running '{}' in blocking mode", executable.name());
        Execution<Outcome<D>> execution = executable.execute(ctx);
        if (execution == null) {
            throw ExecutionModeViolationException.missingResult(executable.name());
        }
        if (execution.isPending()) {
            log.error("'{}' returned a pending result to SyncRunner", executable.name());
        }
        Outcome<D> outcome = execution.requireReady(executable.name());
        if (outcome == null) {
            throw ExecutionModeViolationException.missingResult(executable.name());
        }
        log.debug("'{}' finished with {} in {}ms", executable.name(), outcome.status(), outcome.durationMs());
        return outcome;
    }

    /**
     * payload로 새 컨텍스트를 만들어 실행.
     *
     * <p>{@code run}과 이름을 달리하여 payload 타입이 Object인 경우의 overload 모호성을 피합니다.</p>
     *
     * @param executable 실행할 Executable
     * @param data payload
     * @param <D> payload 타입
     * @return 실행 결과
     */
    public <D> Outcome<D> runWith(Executable<D> executable, D data) {
        return run(executable, RunContext.of(data));
    }
}
