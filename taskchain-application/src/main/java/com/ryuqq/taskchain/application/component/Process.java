package com.ryuqq.taskchain.application.component;

import com.ryuqq.taskchain.core.context.EventLevel;
import com.ryuqq.taskchain.core.context.RunContext;
import com.ryuqq.taskchain.core.execution.Executable;
import com.ryuqq.taskchain.core.execution.Execution;
import com.ryuqq.taskchain.core.outcome.Outcome;
import com.ryuqq.taskchain.core.statemachine.RunLifecycle;
import com.ryuqq.taskchain.core.statemachine.RunState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * 순차 fail-fast Composite.
 *
 * <p>자식을 순서대로 실행하고, 처음으로 SUCCESS가 아닌 결과를 낸 자식에서 즉시 멈춥니다.
 * 실패 정책은 설정할 수 없으며 부분 성공 개념이 없습니다.</p>
 *
 * <p><strong>결과:</strong></p>
 * <ul>
 *   <li>모든 자식 성공 → 자신의 이름을 completedSteps에 기록, SUCCESS</li>
 *   <li>자식 실패 → FAILED (실패한 자식의 errors 그대로)</li>
 * </ul>
 *
 * <p>보상은 {@link #compensate(RunContext)} 호출 시 완료된 자식만 역순으로 수행합니다.
 * Process 스스로 보상을 시작하지는 않습니다.</p>
 *
 * <p>이름이 {@code java.lang.Process}와 겹치므로 사용하는 쪽에서는 명시적으로 import 합니다.</p>
 *
 * @param <D> payload 타입
 *
 * @author TaskChain Team
 * @since 1.0.0
 */
public final class Process<D> extends AbstractComposite<D> {

    private static final Logger log = LoggerFactory.getLogger(Process.class);

    public Process(String name, List<? extends Executable<D>> steps) {
        this(name, null, steps);
    }

    public Process(String name, String description, List<? extends Executable<D>> steps) {
        super(name, description, steps);
    }

    @SafeVarargs
    public static <D> Process<D> of(String name, Executable<D>... steps) {
        return new Process<>(name, List.of(steps));
    }

    @Override
    String kind() {
        return "Process";
    }

    @Override
    public Execution<Outcome<D>> execute(RunContext<D> ctx) {
        if (ctx == null) {
            throw new IllegalArgumentException("ctx cannot be null");
        }
        RunLifecycle run = RunLifecycle.start();
        if (isAsync()) {
            ctx.logEvent(EventLevel.INFO, name(), "Process Started (Async)");
            return Execution.pending(runFrom(0, ctx, run));
        }

        ctx.logEvent(EventLevel.INFO, name(), "Process Started");
        for (Executable<D> step : steps()) {
            Outcome<D> outcome = runChildBlocking(step, ctx);
            if (!outcome.isSuccess()) {
                return Execution.ready(failedAt(step, outcome, ctx, run));
            }
        }
        return Execution.ready(completed(ctx, run));
    }

    private CompletableFuture<Outcome<D>> runFrom(int start, RunContext<D> ctx, RunLifecycle run) {
        List<Executable<D>> steps = steps();
        for (int index = start; index < steps.size(); index++) {
            Executable<D> step = steps.get(index);
            CompletableFuture<Outcome<D>> child = runChildCooperative(step, ctx);
            if (!completedNormally(child)) {
                int next = index + 1;
                return child.thenCompose(outcome -> outcome.isSuccess()
                    ? runFrom(next, ctx, run)
                    : CompletableFuture.completedFuture(failedAt(step, outcome, ctx, run)));
            }
            Outcome<D> outcome = child.join();
            if (!outcome.isSuccess()) {
                return CompletableFuture.completedFuture(failedAt(step, outcome, ctx, run));
            }
        }
        return CompletableFuture.completedFuture(completed(ctx, run));
    }

    private Outcome<D> failedAt(Executable<D> step, Outcome<D> outcome, RunContext<D> ctx, RunLifecycle run) {
        ctx.logEvent(EventLevel.ERROR, name(), "Process Failed at step '" + step.name() + "'");
        log.warn("Process '{}' stopped at step '{}' ({})", name(), step.name(), outcome.status());
        return settle(ctx, run, RunState.FAILED, outcome.errors());
    }

    private Outcome<D> completed(RunContext<D> ctx, RunLifecycle run) {
        Outcome<D> outcome = settle(ctx, run, RunState.SUCCESS, List.of());
        ctx.logEvent(EventLevel.INFO, name(), "Process Completed");
        return outcome;
    }
}
