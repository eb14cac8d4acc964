package com.ryuqq.taskchain.adapter.runner;

import com.ryuqq.taskchain.core.context.RunContext;
import com.ryuqq.taskchain.core.exception.ExecutionModeViolationException;
import com.ryuqq.taskchain.core.execution.Executable;
import com.ryuqq.taskchain.core.execution.Execution;
import com.ryuqq.taskchain.core.outcome.Outcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;

/**
 * Cooperative 모드 Runner.
 *
 * <p>실행 결과를 {@link CompletableFuture}로 반환합니다. blocking Executable도
 * 실행할 수 있으며, 이 경우 결과는 이미 완료된 future로 감싸집니다.</p>
 *
 * <p><strong>예외 전달:</strong> 보상 실패와 모드 위반은 반환된 future의 예외 완료로 전달됩니다.
 * blocking Executable이 실행 중 즉시 던진 경우도 동일하게 처리합니다.</p>
 *
 * @author TaskChain Team
 * @since 1.0.0
 */
public final class AsyncRunner {

    private static final Logger log = LoggerFactory.getLogger(AsyncRunner.class);

    /**
     * 주어진 컨텍스트로 실행.
     *
     * @param executable 실행할 Executable
     * @param ctx 실행 컨텍스트
     * @param <D> payload 타입
     * @return 실행 결과 future
     * @throws IllegalArgumentException executable 또는 ctx가 null인 경우
     */
    public <D> CompletableFuture<Outcome<D>> run(Executable<D> executable, RunContext<D> ctx) {
        if (executable == null) {
            throw new IllegalArgumentException("executable cannot be null");
        }
        if (ctx == null) {
            throw new IllegalArgumentException("ctx cannot be null");
        }

        log.debug("Running '{}' in cooperative mode", executable.name());
        Execution<Outcome<D>> execution;
        try {
            execution = executable.execute(ctx);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
        if (execution == null) {
            return CompletableFuture.failedFuture(ExecutionModeViolationException.missingResult(executable.name()));
        }

        return execution.toFuture().thenCompose(outcome -> {
            if (outcome == null) {
                return CompletableFuture.<Outcome<D>>failedFuture(
                    ExecutionModeViolationException.missingResult(executable.name()));
            }
            log.debug("'{}' finished with {} in {}ms", executable.name(), outcome.status(), outcome.durationMs());
            return CompletableFuture.completedFuture(outcome);
        });
    }

    /**
     * payload로 새 컨텍스트를 만들어 실행.
     *
     * <p>{@code run}과 이름을 달리하여 payload 타입이 Object인 경우의 overload 모호성을 피합니다.</p>
     *
     * @param executable 실행할 Executable
     * @param data payload
     * @param <D> payload 타입
     * @return 실행 결과 future
     */
    public <D> CompletableFuture<Outcome<D>> runWith(Executable<D> executable, D data) {
        return run(executable, RunContext.of(data));
    }
}
