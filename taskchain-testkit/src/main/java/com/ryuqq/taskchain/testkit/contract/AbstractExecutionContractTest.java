package com.ryuqq.taskchain.testkit.contract;

import com.ryuqq.taskchain.adapter.json.RunContextCodec;
import com.ryuqq.taskchain.adapter.runner.AsyncRunner;
import com.ryuqq.taskchain.adapter.runner.PooledTimeoutGuard;
import com.ryuqq.taskchain.adapter.runner.SyncRunner;
import com.ryuqq.taskchain.adapter.runner.TimeoutGuardConfig;
import com.ryuqq.taskchain.application.component.Task;
import com.ryuqq.taskchain.core.context.Event;
import com.ryuqq.taskchain.core.context.RunContext;
import com.ryuqq.taskchain.core.outcome.Outcome;
import com.ryuqq.taskchain.core.outcome.OutcomeStatus;
import com.ryuqq.taskchain.core.policy.RetryPolicy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Abstract base class for execution Contract Tests.
 *
 * <p>Provides fresh runners, an owned timeout guard and a codec per test, plus factories
 * for steps whose invocations are written to an {@link InvocationRecorder}.</p>
 *
 * <p><strong>Test Infrastructure:</strong></p>
 * <ul>
 *   <li>SyncRunner / AsyncRunner: the two entry points</li>
 *   <li>PooledTimeoutGuard: small pool, shut down after each test</li>
 *   <li>RunContextCodec: snapshot and restore of a context</li>
 *   <li>InvocationRecorder: ordered log of actions and undos</li>
 * </ul>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * class MyContractTest extends AbstractExecutionContractTest {
 *     {@literal @}Test
 *     void testScenario() {
 *         Workflow&lt;String&gt; workflow = new Workflow&lt;&gt;("flow",
 *             List.of(succeeding("a"), failing("b")), FailureStrategy.COMPENSATE);
 *
 *         Outcome&lt;String&gt; outcome = syncRunner.runWith(workflow, "payload");
 *
 *         assertStatus(outcome, OutcomeStatus.FAILED);
 *         assertCalls("a", "b", "undo:a");
 *     }
 * }
 * </pre>
 *
 * @author TaskChain Team
 * @since 1.0.0
 */
public abstract class AbstractExecutionContractTest {

    /** Retry policy with short fixed delays so retry scenarios stay fast. */
    protected static final RetryPolicy FAST_RETRY = RetryPolicy.builder()
        .maxAttempts(3)
        .baseDelay(Duration.ofMillis(10))
        .build();

    protected SyncRunner syncRunner;
    protected AsyncRunner asyncRunner;
    protected PooledTimeoutGuard timeoutGuard;
    protected RunContextCodec codec;
    protected InvocationRecorder recorder;

    /**
     * Sets up test fixtures before each test.
     */
    @BeforeEach
    void setUp() {
        syncRunner = new SyncRunner();
        asyncRunner = new AsyncRunner();
        timeoutGuard = new PooledTimeoutGuard(new TimeoutGuardConfig().withPoolSize(2).withShutdownTimeoutMs(1000));
        codec = new RunContextCodec();
        recorder = new InvocationRecorder();
    }

    /**
     * Releases the timeout guard and clears recorded calls.
     */
    @AfterEach
    void tearDown() {
        if (timeoutGuard != null) {
            timeoutGuard.close();
        }
        if (recorder != null) {
            recorder.clear();
        }
    }

    // ========== step factories ==========

    /**
     * Blocking step that records {@code name} and has an undo recording {@code "undo:" + name}.
     *
     * @param name step name
     * @return task
     */
    protected Task<String> succeeding(String name) {
        return Task.<String>builder(name)
            .action(ctx -> {
                recorder.record(name);
                return null;
            })
            .undo(ctx -> recorder.record("undo:" + name))
            .build();
    }

    /**
     * Blocking step that records {@code name} and always throws.
     *
     * @param name step name
     * @return task without retries
     */
    protected Task<String> failing(String name) {
        return failing(name, RetryPolicy.noRetry());
    }

    protected Task<String> failing(String name, RetryPolicy retryPolicy) {
        return Task.<String>builder(name)
            .action(ctx -> {
                recorder.record(name);
                throw new IllegalStateException(name + " failed");
            })
            .undo(ctx -> recorder.record("undo:" + name))
            .retryPolicy(retryPolicy)
            .build();
    }

    /**
     * Blocking step that fails {@code failures} times, then succeeds.
     *
     * @param name step name
     * @param failures number of leading failures
     * @param retryPolicy retry policy
     * @return task
     */
    protected Task<String> flaky(String name, int failures, RetryPolicy retryPolicy) {
        AtomicInteger remaining = new AtomicInteger(failures);
        return Task.<String>builder(name)
            .action(ctx -> {
                recorder.record(name);
                if (remaining.getAndDecrement() > 0) {
                    throw new IllegalStateException(name + " transient failure");
                }
                return null;
            })
            .retryPolicy(retryPolicy)
            .build();
    }

    /**
     * Blocking step whose undo throws.
     *
     * @param name step name
     * @return task
     */
    protected Task<String> brokenUndo(String name) {
        return Task.<String>builder(name)
            .action(ctx -> {
                recorder.record(name);
                return null;
            })
            .undo(ctx -> {
                recorder.record("undo:" + name);
                throw new IllegalStateException("undo of " + name + " failed");
            })
            .build();
    }

    /**
     * Blocking step that sleeps longer than its timeout, enforced by {@link #timeoutGuard}.
     *
     * @param name step name
     * @param work how long the action sleeps
     * @param timeout per-attempt budget
     * @param retryPolicy retry policy
     * @return task
     */
    protected Task<String> slow(String name, Duration work, Duration timeout, RetryPolicy retryPolicy) {
        return Task.<String>builder(name)
            .action(ctx -> {
                recorder.record(name);
                Thread.sleep(work.toMillis());
                return null;
            })
            .timeout(timeout)
            .timeoutGuard(timeoutGuard)
            .retryPolicy(retryPolicy)
            .build();
    }

    /**
     * Cooperative step that records {@code name} after a short delay.
     *
     * @param name step name
     * @return asynchronous task with an asynchronous undo
     */
    protected Task<String> succeedingAsync(String name) {
        return Task.<String>builder(name)
            .asyncAction(ctx -> CompletableFuture.runAsync(() -> recorder.record(name), shortDelay()))
            .asyncUndo(ctx -> CompletableFuture.runAsync(() -> recorder.record("undo:" + name), shortDelay()))
            .build();
    }

    /**
     * Cooperative step whose future always completes exceptionally.
     *
     * @param name step name
     * @return asynchronous task with an asynchronous undo
     */
    protected Task<String> failingAsync(String name) {
        return Task.<String>builder(name)
            .asyncAction(ctx -> CompletableFuture.runAsync(() -> {
                recorder.record(name);
                throw new IllegalStateException(name + " failed");
            }, shortDelay()))
            .asyncUndo(ctx -> CompletableFuture.runAsync(() -> recorder.record("undo:" + name), shortDelay()))
            .build();
    }

    private static Executor shortDelay() {
        return CompletableFuture.delayedExecutor(5, TimeUnit.MILLISECONDS);
    }

    // ========== assertions ==========

    protected void assertStatus(Outcome<?> outcome, OutcomeStatus expected) {
        assertEquals(expected, outcome.status(),
            String.format("Expected outcome status %s but was %s (errors: %s)",
                expected, outcome.status(), outcome.errors()));
    }

    /**
     * Asserts the exact sequence of recorded invocations.
     *
     * @param expected expected calls in order
     */
    protected void assertCalls(String... expected) {
        assertEquals(List.of(expected), recorder.calls(), "Unexpected invocation order");
    }

    /**
     * Asserts that the trace contains an event from {@code source} whose message starts with {@code prefix}.
     *
     * @param ctx run context
     * @param source step name
     * @param prefix message prefix
     */
    protected void assertTraceContains(RunContext<?> ctx, String source, String prefix) {
        boolean found = false;
        for (Event event : ctx.trace()) {
            if (event.source().equals(source) && event.message().startsWith(prefix)) {
                found = true;
                break;
            }
        }
        assertTrue(found, String.format("Expected trace event from '%s' starting with '%s' in %s",
            source, prefix, ctx.trace()));
    }

    /**
     * Waits for a future and returns the cause of its exceptional completion.
     *
     * @param future future expected to fail
     * @return the unwrapped failure
     */
    protected Throwable failureOf(CompletableFuture<?> future) {
        try {
            future.get(5, TimeUnit.SECONDS);
        } catch (ExecutionException e) {
            return unwrap(e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AssertionError("Interrupted while waiting for the future", e);
        } catch (TimeoutException e) {
            throw new AssertionError("Future did not complete within 5s", e);
        }
        throw new AssertionError("Expected the future to complete exceptionally");
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
