package com.ryuqq.taskchain.application.component;

import com.ryuqq.taskchain.application.manifest.StepManifest;
import com.ryuqq.taskchain.application.manifest.WorkflowManifest;
import com.ryuqq.taskchain.core.context.EventLevel;
import com.ryuqq.taskchain.core.context.RunContext;
import com.ryuqq.taskchain.core.execution.Executable;
import com.ryuqq.taskchain.core.execution.Execution;
import com.ryuqq.taskchain.core.outcome.Outcome;
import com.ryuqq.taskchain.core.policy.FailureStrategy;
import com.ryuqq.taskchain.core.statemachine.RunLifecycle;
import com.ryuqq.taskchain.core.statemachine.RunState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * 실패 전략을 선택할 수 있는 최상위 순차 Composite.
 *
 * <p><strong>실패 전략 ({@link FailureStrategy}, 생성 시 고정):</strong></p>
 * <ul>
 *   <li>ABORT: 첫 실패에서 중단 → ABORTED (실패한 Step의 errors), 보상 없음</li>
 *   <li>CONTINUE: errors를 누적하고 계속 진행 → 누적 errors가 있으면 FAILED, 없으면 SUCCESS</li>
 *   <li>COMPENSATE: 실패한 Step 자체를 보상한 뒤, 앞서 완료된 Step을 역순 보상 → FAILED</li>
 * </ul>
 *
 * <p><strong>실행 흐름 (COMPENSATE):</strong></p>
 * <pre>
 * validate ✔ → create ✔ → notify ✘
 *                             ↓
 *        notify.compensate → create.compensate → validate.compensate
 *                             ↓
 *                  Outcome{FAILED, notify.errors}
 * </pre>
 *
 * <p>isAsync는 자식 중 하나라도 비동기이면 true이며 생성 시 한 번 계산됩니다.</p>
 *
 * @param <D> payload 타입
 *
 * @author TaskChain Team
 * @since 1.0.0
 */
public final class Workflow<D> extends AbstractComposite<D> {

    static final String NO_DESCRIPTION = "No description provided.";

    private static final Logger log = LoggerFactory.getLogger(Workflow.class);

    private final FailureStrategy strategy;

    public Workflow(String name, List<? extends Executable<D>> steps) {
        this(name, null, steps, FailureStrategy.ABORT);
    }

    public Workflow(String name, List<? extends Executable<D>> steps, FailureStrategy strategy) {
        this(name, null, steps, strategy);
    }

    /**
     * 생성자.
     *
     * @param name Workflow 이름
     * @param description 설명 (null 허용)
     * @param steps 자식 목록 (복사되어 고정됨)
     * @param strategy 실패 전략
     * @throws IllegalArgumentException name/steps/strategy가 null인 경우
     */
    public Workflow(String name, String description, List<? extends Executable<D>> steps, FailureStrategy strategy) {
        super(name, description, steps);
        if (strategy == null) {
            throw new IllegalArgumentException("strategy cannot be null");
        }
        this.strategy = strategy;
    }

    public FailureStrategy strategy() {
        return strategy;
    }

    @Override
    String kind() {
        return "Workflow";
    }

    @Override
    public Execution<Outcome<D>> execute(RunContext<D> ctx) {
        if (ctx == null) {
            throw new IllegalArgumentException("ctx cannot be null");
        }
        RunLifecycle run = RunLifecycle.start();
        List<Throwable> collected = new ArrayList<>();

        if (isAsync()) {
            ctx.logEvent(EventLevel.INFO, name(), "Workflow Started (Async)");
            log.debug("Workflow '{}' started (async, strategy={})", name(), strategy);
            return Execution.pending(runFrom(0, ctx, collected, run));
        }

        ctx.logEvent(EventLevel.INFO, name(), "Workflow Started");
        log.debug("Workflow '{}' started (strategy={})", name(), strategy);
        List<Executable<D>> steps = steps();
        for (int i = 0; i < steps.size(); i++) {
            Executable<D> step = steps.get(i);
            Outcome<D> outcome = runChildBlocking(step, ctx);
            if (outcome.isSuccess()) {
                continue;
            }
            switch (strategy) {
                case ABORT:
                    return Execution.ready(abort(step, outcome, ctx, run));
                case CONTINUE:
                    proceedAfter(step, outcome, ctx, collected);
                    break;
                case COMPENSATE:
                    announceCompensation(step, ctx);
                    compensateChildBlocking(step, ctx);
                    compensateSteps(ctx, steps.subList(0, i)).requireReady(name());
                    return Execution.ready(compensated(outcome, ctx, run));
                default:
                    throw new IllegalStateException("Unknown failure strategy: " + strategy);
            }
        }
        return Execution.ready(finish(ctx, collected, run));
    }

    private CompletableFuture<Outcome<D>> runFrom(
        int start,
        RunContext<D> ctx,
        List<Throwable> collected,
        RunLifecycle run
    ) {
        List<Executable<D>> steps = steps();
        for (int index = start; index < steps.size(); index++) {
            Executable<D> step = steps.get(index);
            CompletableFuture<Outcome<D>> child = runChildCooperative(step, ctx);
            if (!completedNormally(child)) {
                int current = index;
                return child.thenCompose(outcome -> {
                    CompletableFuture<Outcome<D>> settled = afterChild(current, step, outcome, ctx, collected, run);
                    return settled != null ? settled : runFrom(current + 1, ctx, collected, run);
                });
            }
            CompletableFuture<Outcome<D>> settled = afterChild(index, step, child.join(), ctx, collected, run);
            if (settled != null) {
                return settled;
            }
        }
        return CompletableFuture.completedFuture(finish(ctx, collected, run));
    }

    /**
     * 자식 결과에 실패 전략 적용.
     *
     * @return Workflow가 끝나면 최종 Outcome의 future, 다음 Step으로 진행하면 null
     */
    private CompletableFuture<Outcome<D>> afterChild(
        int index,
        Executable<D> step,
        Outcome<D> outcome,
        RunContext<D> ctx,
        List<Throwable> collected,
        RunLifecycle run
    ) {
        if (outcome.isSuccess()) {
            return null;
        }
        switch (strategy) {
            case ABORT:
                return CompletableFuture.completedFuture(abort(step, outcome, ctx, run));
            case CONTINUE:
                proceedAfter(step, outcome, ctx, collected);
                return null;
            case COMPENSATE:
                announceCompensation(step, ctx);
                return compensateChildCooperative(step, ctx)
                    .thenCompose(ignored -> compensateSteps(ctx, steps().subList(0, index)).toFuture())
                    .thenApply(ignored -> compensated(outcome, ctx, run));
            default:
                return CompletableFuture.failedFuture(
                    new IllegalStateException("Unknown failure strategy: " + strategy));
        }
    }

    private Outcome<D> abort(Executable<D> step, Outcome<D> outcome, RunContext<D> ctx, RunLifecycle run) {
        ctx.logEvent(EventLevel.ERROR, name(), "Workflow Aborted due to failure in step '" + step.name() + "'");
        log.warn("Workflow '{}' aborted at step '{}'", name(), step.name());
        return settle(ctx, run, RunState.ABORTED, outcome.errors());
    }

    private void proceedAfter(Executable<D> step, Outcome<D> outcome, RunContext<D> ctx, List<Throwable> collected) {
        ctx.logEvent(EventLevel.ERROR, name(), "Workflow Continuing after failure in step '" + step.name() + "'");
        log.warn("Workflow '{}' continuing after failure in step '{}'", name(), step.name());
        collected.addAll(outcome.errors());
    }

    private void announceCompensation(Executable<D> step, RunContext<D> ctx) {
        ctx.logEvent(EventLevel.ERROR, name(), "Workflow Compensating due to failure in step '" + step.name() + "'");
        log.warn("Workflow '{}' compensating due to failure in step '{}'", name(), step.name());
    }

    private Outcome<D> compensated(Outcome<D> failed, RunContext<D> ctx, RunLifecycle run) {
        return settle(ctx, run, RunState.FAILED, failed.errors());
    }

    private Outcome<D> finish(RunContext<D> ctx, List<Throwable> collected, RunLifecycle run) {
        RunState terminal = collected.isEmpty() ? RunState.SUCCESS : RunState.FAILED;
        Outcome<D> outcome = settle(ctx, run, terminal, collected);
        ctx.logEvent(EventLevel.INFO, name(), "Workflow Completed with status " + outcome.status());
        return outcome;
    }

    /**
     * Workflow 구조 요약.
     *
     * <p>설명이 없는 항목은 "No description provided."로 표시됩니다.</p>
     *
     * @return WorkflowManifest
     */
    public WorkflowManifest manifest() {
        List<StepManifest> stepManifests = new ArrayList<>();
        for (Executable<D> step : steps()) {
            stepManifests.add(new StepManifest(step.name(), typeOf(step), describe(step.description())));
        }
        return new WorkflowManifest(name(), describe(description()), strategy, stepManifests);
    }

    private static String typeOf(Executable<?> step) {
        String simpleName = step.getClass().getSimpleName();
        return simpleName.isEmpty() ? "Executable" : simpleName;
    }

    private static String describe(String description) {
        return description == null || description.isBlank() ? NO_DESCRIPTION : description;
    }
}
