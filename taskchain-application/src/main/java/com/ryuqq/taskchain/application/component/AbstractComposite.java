package com.ryuqq.taskchain.application.component;

import com.ryuqq.taskchain.core.context.EventLevel;
import com.ryuqq.taskchain.core.context.RunContext;
import com.ryuqq.taskchain.core.exception.CompositeExecutionException;
import com.ryuqq.taskchain.core.exception.ExecutionModeViolationException;
import com.ryuqq.taskchain.core.execution.Executable;
import com.ryuqq.taskchain.core.execution.Execution;
import com.ryuqq.taskchain.core.outcome.Outcome;
import com.ryuqq.taskchain.core.statemachine.RunLifecycle;
import com.ryuqq.taskchain.core.statemachine.RunState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * 순차 실행 Composite(Process, Workflow)의 공통 골격.
 *
 * <p><strong>공통 책임:</strong></p>
 * <ul>
 *   <li>자식 목록 고정 (생성 시 복사) 및 isAsync 캐시 (자식 중 하나라도 비동기면 true)</li>
 *   <li>자식 실행 결과 정규화: 일반 예외 → {@link CompositeExecutionException}을 담은 FAILED Outcome</li>
 *   <li>모드 위반과 보상 실패는 그대로 전파</li>
 *   <li>completedSteps 기준 역순 보상</li>
 *   <li>{@link RunLifecycle}을 통한 단일 종료 보장</li>
 *   <li>cooperative 모드에서 이미 완료된 자식은 루프로 진행 (깊은 트리에서도 스택이 자라지 않음)</li>
 * </ul>
 *
 * @param <D> payload 타입
 *
 * @author TaskChain Team
 * @since 1.0.0
 */
abstract class AbstractComposite<D> implements Executable<D> {

    private static final Logger log = LoggerFactory.getLogger(AbstractComposite.class);

    private final String name;
    private final String description;
    private final List<Executable<D>> steps;
    private final boolean async;

    AbstractComposite(String name, String description, List<? extends Executable<D>> steps) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (steps == null) {
            throw new IllegalArgumentException("steps cannot be null");
        }
        for (Executable<D> step : steps) {
            if (step == null) {
                throw new IllegalArgumentException("steps cannot contain null (composite: " + name + ")");
            }
        }
        this.name = name;
        this.description = description;
        this.steps = List.copyOf(steps);
        this.async = this.steps.stream().anyMatch(Executable::isAsync);
    }

    /**
     * 이벤트 메시지에 사용할 종류 이름 ("Process", "Workflow").
     */
    abstract String kind();

    @Override
    public final String name() {
        return name;
    }

    @Override
    public final String description() {
        return description;
    }

    @Override
    public final boolean isAsync() {
        return async;
    }

    public final List<Executable<D>> steps() {
        return steps;
    }

    // ========== child execution ==========

    /**
     * blocking 모드에서 자식 실행.
     *
     * @throws ExecutionModeViolationException 자식이 Pending 또는 null을 반환한 경우
     */
    final Outcome<D> runChildBlocking(Executable<D> child, RunContext<D> ctx) {
        try {
            Execution<Outcome<D>> execution = child.execute(ctx);
            if (execution == null) {
                throw ExecutionModeViolationException.missingResult(child.name());
            }
            Outcome<D> outcome = execution.requireReady(child.name());
            if (outcome == null) {
                throw ExecutionModeViolationException.missingResult(child.name());
            }
            return outcome;
        } catch (RuntimeException e) {
            if (Futures.isEscalation(e)) {
                throw e;
            }
            return childRaised(child, ctx, e);
        }
    }

    /**
     * cooperative 모드에서 자식 실행. 예외 전파는 future의 예외 완료로 표현됩니다.
     */
    final CompletableFuture<Outcome<D>> runChildCooperative(Executable<D> child, RunContext<D> ctx) {
        CompletableFuture<Outcome<D>> future;
        try {
            Execution<Outcome<D>> execution = child.execute(ctx);
            if (execution == null) {
                throw ExecutionModeViolationException.missingResult(child.name());
            }
            future = execution.toFuture();
        } catch (RuntimeException e) {
            if (Futures.isEscalation(e)) {
                return CompletableFuture.failedFuture(e);
            }
            return CompletableFuture.completedFuture(childRaised(child, ctx, e));
        }

        return future
            .handle((outcome, error) -> {
                if (error == null) {
                    return outcome == null
                        ? CompletableFuture.<Outcome<D>>failedFuture(
                            ExecutionModeViolationException.missingResult(child.name()))
                        : CompletableFuture.<Outcome<D>>completedFuture(outcome);
                }
                Throwable cause = Futures.unwrap(error);
                if (Futures.isEscalation(cause)) {
                    return CompletableFuture.<Outcome<D>>failedFuture(cause);
                }
                return CompletableFuture.<Outcome<D>>completedFuture(childRaised(child, ctx, cause));
            })
            .thenCompose(Function.identity());
    }

    private Outcome<D> childRaised(Executable<D> child, RunContext<D> ctx, Throwable cause) {
        CompositeExecutionException error = new CompositeExecutionException(name, child.name(), cause);
        ctx.logEvent(EventLevel.ERROR, name, kind() + " Error: " + ctx.formatException(cause));
        log.warn("{} '{}' step '{}' raised instead of returning an outcome", kind(), name, child.name(), cause);
        return Outcome.failed(ctx, List.of(error), 0);
    }

    // ========== settlement ==========

    /**
     * 실행을 종료 상태로 확정하고 Outcome 생성.
     *
     * <p>SUCCESS인 경우 자신의 이름을 completedSteps에 기록합니다.</p>
     *
     * @throws IllegalStateException 같은 실행이 이미 종료된 경우
     */
    final Outcome<D> settle(RunContext<D> ctx, RunLifecycle run, RunState terminal, List<Throwable> errors) {
        RunState state = run.settle(terminal);
        long durationMs = run.elapsedMs();
        if (state == RunState.SUCCESS) {
            ctx.markCompleted(name);
        }
        log.debug("{} '{}' finished with {} in {}ms", kind(), name, state, durationMs);
        return new Outcome<>(state.toOutcomeStatus(), ctx, errors, durationMs);
    }

    /**
     * 이미 끝난 future인지 확인. 예외 완료는 체인으로 전파해야 하므로 제외합니다.
     */
    static boolean completedNormally(CompletableFuture<?> future) {
        return future.isDone() && !future.isCompletedExceptionally();
    }

    // ========== compensation ==========

    /**
     * 완료된 자식을 역순으로 보상합니다.
     *
     * <p>각 자식은 이름이 completedSteps에 있을 때만 보상됩니다.</p>
     *
     * @param ctx 실행 컨텍스트
     * @return 보상 결과 (비동기 Composite는 Pending)
     * @throws com.ryuqq.taskchain.core.exception.CompensationException blocking 모드에서 보상 실패 시
     */
    @Override
    public final Execution<Void> compensate(RunContext<D> ctx) {
        if (ctx == null) {
            throw new IllegalArgumentException("ctx cannot be null");
        }
        ctx.logEvent(EventLevel.INFO, name, "Compensating " + kind());
        log.info("Compensating {} '{}'", kind(), name);
        return compensateSteps(ctx, steps);
    }

    /**
     * 주어진 후보 중 완료된 Step을 역순으로 보상합니다.
     */
    final Execution<Void> compensateSteps(RunContext<D> ctx, List<Executable<D>> candidates) {
        if (!async) {
            for (int i = candidates.size() - 1; i >= 0; i--) {
                Executable<D> step = candidates.get(i);
                if (ctx.isCompleted(step.name())) {
                    compensateChildBlocking(step, ctx);
                }
            }
            return Execution.ready(null);
        }

        return Execution.pending(compensateFrom(candidates, candidates.size() - 1, ctx));
    }

    private CompletableFuture<Void> compensateFrom(List<Executable<D>> candidates, int from, RunContext<D> ctx) {
        for (int i = from; i >= 0; i--) {
            Executable<D> step = candidates.get(i);
            if (!ctx.isCompleted(step.name())) {
                continue;
            }
            CompletableFuture<Void> undo = compensateChildCooperative(step, ctx);
            if (!completedNormally(undo)) {
                int next = i - 1;
                return undo.thenCompose(ignored -> compensateFrom(candidates, next, ctx));
            }
        }
        return CompletableFuture.completedFuture(null);
    }

    final void compensateChildBlocking(Executable<D> step, RunContext<D> ctx) {
        Execution<Void> execution = step.compensate(ctx);
        if (execution == null) {
            throw ExecutionModeViolationException.missingResult(step.name());
        }
        execution.requireReady(step.name());
    }

    final CompletableFuture<Void> compensateChildCooperative(Executable<D> step, RunContext<D> ctx) {
        Execution<Void> execution;
        try {
            execution = step.compensate(ctx);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
        if (execution == null) {
            return CompletableFuture.failedFuture(ExecutionModeViolationException.missingResult(step.name()));
        }
        return execution.toFuture();
    }

    @Override
    public String toString() {
        return kind() + "{name='" + name + "', steps=" + steps.size() + ", async=" + async + '}';
    }
}
