package com.ryuqq.taskchain.application.component;

import com.ryuqq.taskchain.application.function.AsyncStepAction;
import com.ryuqq.taskchain.application.function.AsyncUndoAction;
import com.ryuqq.taskchain.application.function.StepAction;
import com.ryuqq.taskchain.application.function.UndoAction;
import com.ryuqq.taskchain.core.context.EventLevel;
import com.ryuqq.taskchain.core.context.RunContext;
import com.ryuqq.taskchain.core.exception.CompensationException;
import com.ryuqq.taskchain.core.exception.ExecutionModeViolationException;
import com.ryuqq.taskchain.core.exception.StepExecutionException;
import com.ryuqq.taskchain.core.exception.StepTimeoutException;
import com.ryuqq.taskchain.core.execution.Executable;
import com.ryuqq.taskchain.core.execution.Execution;
import com.ryuqq.taskchain.core.outcome.Outcome;
import com.ryuqq.taskchain.core.policy.RetryPolicy;
import com.ryuqq.taskchain.core.spi.TimeoutGuard;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 하나의 사용자 함수를 실행하는 leaf Executable.
 *
 * <p><strong>실행 흐름:</strong></p>
 * <pre>
 * "Task Started" 기록
 *   ↓
 * attempt = 1부터 반복:
 *   1. 사용자 함수 호출 (timeout이 있으면 제한 시간 적용)
 *   2. 성공 → completedSteps 기록 → SUCCESS
 *   3. 실패 → RetryPolicy.shouldRetry(attempt, failure)
 *      - true: calculateDelay(attempt)만큼 대기 후 다음 attempt
 *      - false: StepExecutionException으로 감싸 FAILED
 * </pre>
 *
 * <p><strong>실행 모드:</strong></p>
 * <ul>
 *   <li>blocking ({@link StepAction}): 호출 스레드에서 실행, 재시도 대기는 Thread.sleep</li>
 *   <li>cooperative ({@link AsyncStepAction}): CompletableFuture 연쇄, 재시도 대기는 delayed executor</li>
 * </ul>
 *
 * <p><strong>모드 위반:</strong> blocking 함수가 CompletionStage/Future를 반환하거나,
 * 비동기 함수가 null을 반환하면 재시도 없이 {@link ExecutionModeViolationException}이 전파됩니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Task&lt;Order&gt; create = Task.&lt;Order&gt;builder("create")
 *     .action(ctx -&gt; orderRepository.save(ctx.data()))
 *     .undo(ctx -&gt; orderRepository.delete(ctx.data().id()))
 *     .retryPolicy(RetryPolicy.builder().maxAttempts(3).build())
 *     .timeout(Duration.ofSeconds(2))
 *     .timeoutGuard(guard)
 *     .build();
 * </pre>
 *
 * @param <D> payload 타입
 *
 * @author TaskChain Team
 * @since 1.0.0
 */
public final class Task<D> implements Executable<D> {

    private static final Logger log = LoggerFactory.getLogger(Task.class);

    private final String name;
    private final String description;
    private final StepAction<D> action;
    private final AsyncStepAction<D> asyncAction;
    private final UndoAction<D> undo;
    private final AsyncUndoAction<D> asyncUndo;
    private final RetryPolicy retryPolicy;
    private final Duration timeout;
    private final TimeoutGuard timeoutGuard;
    private final boolean async;

    private Task(Builder<D> builder) {
        this.name = builder.name;
        this.description = builder.description;
        this.action = builder.action;
        this.asyncAction = builder.asyncAction;
        this.undo = builder.undo;
        this.asyncUndo = builder.asyncUndo;
        this.retryPolicy = builder.retryPolicy;
        this.timeout = builder.timeout;
        this.timeoutGuard = builder.timeoutGuard;
        this.async = builder.asyncAction != null;
    }

    public static <D> Builder<D> builder(String name) {
        return new Builder<>(name);
    }

    /**
     * 재시도 없는 blocking Task 생성.
     *
     * @param name Task 이름
     * @param action 사용자 함수
     * @param <D> payload 타입
     * @return Task 인스턴스
     */
    public static <D> Task<D> of(String name, StepAction<D> action) {
        return Task.<D>builder(name).action(action).build();
    }

    /**
     * 재시도 없는 cooperative Task 생성.
     *
     * @param name Task 이름
     * @param asyncAction 비동기 사용자 함수
     * @param <D> payload 타입
     * @return Task 인스턴스
     */
    public static <D> Task<D> ofAsync(String name, AsyncStepAction<D> asyncAction) {
        return Task.<D>builder(name).asyncAction(asyncAction).build();
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public String description() {
        return description;
    }

    @Override
    public boolean isAsync() {
        return async;
    }

    public RetryPolicy retryPolicy() {
        return retryPolicy;
    }

    public Duration timeout() {
        return timeout;
    }

    public boolean hasUndo() {
        return undo != null || asyncUndo != null;
    }

    @Override
    public Execution<Outcome<D>> execute(RunContext<D> ctx) {
        if (ctx == null) {
            throw new IllegalArgumentException("ctx cannot be null");
        }
        if (async) {
            return Execution.pending(executeCooperative(ctx));
        }
        return Execution.ready(executeBlocking(ctx));
    }

    // ========== blocking ==========

    private Outcome<D> executeBlocking(RunContext<D> ctx) {
        ctx.logEvent(EventLevel.INFO, name, "Task Started");
        log.debug("Task '{}' started", name);
        long startNanos = System.nanoTime();
        int attempt = 1;

        while (true) {
            Exception failure;
            try {
                Object result = invokeBlocking(ctx);
                if (result instanceof CompletionStage || result instanceof Future) {
                    if (result instanceof Future) {
                        ((Future<?>) result).cancel(true);
                    }
                    throw ExecutionModeViolationException.asyncValueFromBlockingAction(name);
                }
                return succeed(ctx, startNanos, attempt);
            } catch (ExecutionModeViolationException e) {
                log.error("Task '{}' violated its execution mode: {}", name, e.getMessage());
                throw e;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return interrupted(ctx, startNanos, e);
            } catch (Exception e) {
                failure = e;
            }

            ctx.logEvent(EventLevel.ERROR, name, "Task Failed: " + ctx.formatException(failure));

            if (!retryPolicy.shouldRetry(attempt, failure)) {
                return exhausted(ctx, startNanos, attempt, failure);
            }

            Duration delay = announceRetry(ctx, attempt, failure);
            try {
                TimeUnit.NANOSECONDS.sleep(delay.toNanos());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return interrupted(ctx, startNanos, e);
            }
            attempt++;
        }
    }

    private Object invokeBlocking(RunContext<D> ctx) throws Exception {
        if (timeout == null) {
            return action.apply(ctx);
        }
        return timeoutGuard.call(() -> action.apply(ctx), timeout, name);
    }

    // ========== cooperative ==========

    private CompletableFuture<Outcome<D>> executeCooperative(RunContext<D> ctx) {
        ctx.logEvent(EventLevel.INFO, name, "Task Started (Async)");
        log.debug("Task '{}' started (async)", name);
        return attemptCooperative(ctx, 1, System.nanoTime());
    }

    private CompletableFuture<Outcome<D>> attemptCooperative(RunContext<D> ctx, int attempt, long startNanos) {
        CompletableFuture<?> invocation;
        try {
            invocation = invokeCooperative(ctx);
        } catch (ExecutionModeViolationException e) {
            log.error("Task '{}' violated its execution mode: {}", name, e.getMessage());
            return CompletableFuture.failedFuture(e);
        } catch (Exception e) {
            invocation = CompletableFuture.failedFuture(e);
        }

        return invocation
            .handle((value, error) -> error)
            .thenCompose(error -> {
                if (error == null) {
                    return CompletableFuture.completedFuture(succeed(ctx, startNanos, attempt));
                }
                Throwable failure = Futures.unwrap(error);
                ctx.logEvent(EventLevel.ERROR, name, "Task Failed: " + ctx.formatException(failure));

                if (!retryPolicy.shouldRetry(attempt, failure)) {
                    return CompletableFuture.completedFuture(exhausted(ctx, startNanos, attempt, failure));
                }

                Duration delay = announceRetry(ctx, attempt, failure);
                Executor delayed = CompletableFuture.delayedExecutor(delay.toNanos(), TimeUnit.NANOSECONDS);
                return CompletableFuture.runAsync(() -> { }, delayed)
                    .thenCompose(ignored -> attemptCooperative(ctx, attempt + 1, startNanos));
            });
    }

    private CompletableFuture<?> invokeCooperative(RunContext<D> ctx) throws Exception {
        CompletionStage<?> stage = asyncAction.apply(ctx);
        if (stage == null) {
            throw ExecutionModeViolationException.missingStage(name);
        }
        CompletableFuture<?> future = stage.toCompletableFuture();
        if (timeout == null) {
            return future;
        }
        return withTimeout(future);
    }

    /**
     * 제한 시간이 지나면 사용자 future를 취소하고 StepTimeoutException으로 완료합니다.
     */
    private CompletableFuture<Object> withTimeout(CompletableFuture<?> future) {
        CompletableFuture<Object> result = new CompletableFuture<>();
        AtomicReference<StepTimeoutException> timedOut = new AtomicReference<>();
        future.whenComplete((value, error) -> {
            StepTimeoutException timeoutError = timedOut.get();
            if (timeoutError != null) {
                result.completeExceptionally(timeoutError);
            } else if (error != null) {
                result.completeExceptionally(error);
            } else {
                result.complete(value);
            }
        });
        CompletableFuture.delayedExecutor(timeout.toNanos(), TimeUnit.NANOSECONDS).execute(() -> {
            if (result.isDone() || !timedOut.compareAndSet(null, new StepTimeoutException(name, timeout))) {
                return;
            }
            log.warn("Task '{}' timed out after {}ms, cancelling pending work", name, timeout.toMillis());
            future.cancel(true);
            result.completeExceptionally(timedOut.get());
        });
        return result;
    }

    // ========== outcome ==========

    private Outcome<D> succeed(RunContext<D> ctx, long startNanos, int attempt) {
        ctx.markCompleted(name);
        ctx.logEvent(EventLevel.INFO, name, "Task Completed");
        log.debug("Task '{}' completed on attempt {}", name, attempt);
        return Outcome.success(ctx, Futures.elapsedMs(startNanos));
    }

    private Outcome<D> exhausted(RunContext<D> ctx, long startNanos, int attempt, Throwable lastFailure) {
        StepExecutionException error = StepExecutionException.exhausted(name, attempt, lastFailure);
        ctx.logEvent(EventLevel.ERROR, name, error.getMessage());
        log.warn("{}: {}", error.getMessage(), lastFailure.toString());
        return Outcome.failed(ctx, List.of(error), Futures.elapsedMs(startNanos));
    }

    private Outcome<D> interrupted(RunContext<D> ctx, long startNanos, InterruptedException cause) {
        StepExecutionException error = new StepExecutionException(
            name, "Task '" + name + "' was interrupted", cause
        );
        ctx.logEvent(EventLevel.ERROR, name, error.getMessage());
        log.warn("Task '{}' interrupted, giving up", name);
        return Outcome.failed(ctx, List.of(error), Futures.elapsedMs(startNanos));
    }

    private Duration announceRetry(RunContext<D> ctx, int attempt, Throwable failure) {
        Duration delay = retryPolicy.calculateDelay(attempt);
        ctx.logEvent(EventLevel.INFO, name, String.format(
            "Retrying in %dms (Attempt %d/%d)", delay.toMillis(), attempt, retryPolicy.getMaxAttempts()
        ));
        log.warn("Task '{}' failed on attempt {}/{}, retrying in {}ms: {}",
            name, attempt, retryPolicy.getMaxAttempts(), delay.toMillis(), failure.toString());
        return delay;
    }

    // ========== compensation ==========

    /**
     * 완료된 Task의 효과를 되돌립니다.
     *
     * <p>undo가 없거나, 완료되지 않았거나, 이미 보상된 경우 아무것도 하지 않습니다.
     * undo는 실행당 최대 한 번 호출되며 재시도되지 않습니다.</p>
     *
     * @param ctx 실행 컨텍스트
     * @return 보상 결과
     * @throws CompensationException blocking Task의 undo가 실패한 경우
     */
    @Override
    public Execution<Void> compensate(RunContext<D> ctx) {
        if (ctx == null) {
            throw new IllegalArgumentException("ctx cannot be null");
        }
        if (!hasUndo() || !ctx.isCompleted(name) || !ctx.markCompensated(name)) {
            return Execution.ready(null);
        }

        ctx.logEvent(EventLevel.INFO, name, "Compensating Task");
        log.info("Compensating task '{}'", name);

        if (asyncUndo != null) {
            return Execution.pending(compensateCooperative(ctx));
        }

        try {
            undo.undo(ctx);
        } catch (Exception e) {
            CompensationException error = compensationFailed(ctx, e);
            if (async) {
                return Execution.pending(CompletableFuture.failedFuture(error));
            }
            throw error;
        }
        return Execution.ready(null);
    }

    private CompletableFuture<Void> compensateCooperative(RunContext<D> ctx) {
        CompletionStage<?> stage;
        try {
            stage = asyncUndo.undo(ctx);
        } catch (Exception e) {
            return CompletableFuture.failedFuture(compensationFailed(ctx, e));
        }
        if (stage == null) {
            return CompletableFuture.failedFuture(ExecutionModeViolationException.missingStage(name));
        }
        return stage.toCompletableFuture()
            .handle((value, error) -> error)
            .thenCompose(error -> error == null
                ? CompletableFuture.<Void>completedFuture(null)
                : CompletableFuture.<Void>failedFuture(compensationFailed(ctx, Futures.unwrap(error))));
    }

    private CompensationException compensationFailed(RunContext<D> ctx, Throwable cause) {
        ctx.logEvent(EventLevel.ERROR, name, "Compensation Failed: " + ctx.formatException(cause));
        log.error("Compensation of task '{}' failed", name, cause);
        return new CompensationException(name, cause);
    }

    @Override
    public String toString() {
        return "Task{name='" + name + "', async=" + async + ", retryPolicy=" + retryPolicy + '}';
    }

    /**
     * Task 빌더.
     *
     * <p><strong>검증 규칙 ({@link #build()}):</strong></p>
     * <ul>
     *   <li>action과 asyncAction 중 정확히 하나</li>
     *   <li>asyncUndo는 cooperative Task에서만 허용</li>
     *   <li>blocking Task에 timeout을 지정하면 timeoutGuard 필수</li>
     * </ul>
     *
     * @param <D> payload 타입
     */
    public static final class Builder<D> {

        private final String name;
        private String description;
        private StepAction<D> action;
        private AsyncStepAction<D> asyncAction;
        private UndoAction<D> undo;
        private AsyncUndoAction<D> asyncUndo;
        private RetryPolicy retryPolicy = RetryPolicy.noRetry();
        private Duration timeout;
        private TimeoutGuard timeoutGuard;

        private Builder(String name) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("name cannot be null or blank");
            }
            this.name = name;
        }

        public Builder<D> description(String description) {
            this.description = description;
            return this;
        }

        public Builder<D> action(StepAction<D> action) {
            this.action = requireNonNull(action, "action");
            return this;
        }

        public Builder<D> asyncAction(AsyncStepAction<D> asyncAction) {
            this.asyncAction = requireNonNull(asyncAction, "asyncAction");
            return this;
        }

        public Builder<D> undo(UndoAction<D> undo) {
            this.undo = requireNonNull(undo, "undo");
            return this;
        }

        public Builder<D> asyncUndo(AsyncUndoAction<D> asyncUndo) {
            this.asyncUndo = requireNonNull(asyncUndo, "asyncUndo");
            return this;
        }

        public Builder<D> retryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = requireNonNull(retryPolicy, "retryPolicy");
            return this;
        }

        /**
         * 시도당 제한 시간.
         *
         * @param timeout 제한 시간 (양수)
         * @return this
         * @throws IllegalArgumentException timeout이 null이거나 양수가 아닌 경우
         */
        public Builder<D> timeout(Duration timeout) {
            requireNonNull(timeout, "timeout");
            if (timeout.isZero() || timeout.isNegative()) {
                throw new IllegalArgumentException("timeout must be positive (current: " + timeout + ")");
            }
            this.timeout = timeout;
            return this;
        }

        public Builder<D> timeoutGuard(TimeoutGuard timeoutGuard) {
            this.timeoutGuard = requireNonNull(timeoutGuard, "timeoutGuard");
            return this;
        }

        public Task<D> build() {
            if ((action == null) == (asyncAction == null)) {
                throw new IllegalStateException(
                    "Task '" + name + "' requires exactly one of action or asyncAction"
                );
            }
            if (undo != null && asyncUndo != null) {
                throw new IllegalStateException(
                    "Task '" + name + "' cannot declare both undo and asyncUndo"
                );
            }
            if (asyncUndo != null && asyncAction == null) {
                throw new IllegalStateException(
                    "Task '" + name + "' is blocking and cannot declare an asynchronous undo"
                );
            }
            if (timeout != null && action != null && timeoutGuard == null) {
                throw new IllegalStateException(
                    "Task '" + name + "' declares a timeout on a blocking action but no TimeoutGuard"
                );
            }
            return new Task<>(this);
        }

        private static <T> T requireNonNull(T value, String field) {
            if (value == null) {
                throw new IllegalArgumentException(field + " cannot be null");
            }
            return value;
        }
    }
}
