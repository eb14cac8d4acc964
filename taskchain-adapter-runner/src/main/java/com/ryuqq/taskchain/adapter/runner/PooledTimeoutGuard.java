package com.ryuqq.taskchain.adapter.runner;

import com.ryuqq.taskchain.core.exception.StepExecutionException;
import com.ryuqq.taskchain.core.exception.StepTimeoutException;
import com.ryuqq.taskchain.core.spi.TimeoutGuard;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 고정 크기 스레드 풀 기반 {@link TimeoutGuard} 구현체.
 *
 * <p>blocking Task의 사용자 함수를 풀의 작업 스레드에서 실행하고,
 * 호출 스레드는 제한 시간만큼만 결과를 기다립니다.</p>
 *
 * <p><strong>동작 방식:</strong></p>
 * <ol>
 *   <li>작업을 bounded 풀에 제출 (대기열이 가득 차면 RejectedExecutionException)</li>
 *   <li>Future.get(timeout)으로 대기</li>
 *   <li>완료: 결과 반환, 작업 예외는 ExecutionException을 벗겨 그대로 전파</li>
 *   <li>타임아웃: {@link TimedOutWorkPolicy}에 따라 처리 후 StepTimeoutException</li>
 * </ol>
 *
 * <p><strong>자원 소유권:</strong> 전역 풀을 두지 않습니다. 생성한 쪽이 Task에 전달하고
 * 사용이 끝나면 {@link #shutdown()} (또는 try-with-resources)으로 종료해야 합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * try (PooledTimeoutGuard guard = new PooledTimeoutGuard(new TimeoutGuardConfig())) {
 *     Task&lt;Order&gt; task = Task.&lt;Order&gt;builder("charge")
 *         .action(ctx -&gt; paymentClient.charge(ctx.data()))
 *         .timeout(Duration.ofSeconds(3))
 *         .timeoutGuard(guard)
 *         .build();
 *     new SyncRunner().run(task, order);
 * }
 * </pre>
 *
 * @author TaskChain Team
 * @since 1.0.0
 */
public final class PooledTimeoutGuard implements TimeoutGuard, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(PooledTimeoutGuard.class);

    private final TimeoutGuardConfig config;
    private final ThreadPoolExecutor workerExecutor;

    /**
     * 기본 설정으로 생성.
     */
    public PooledTimeoutGuard() {
        this(new TimeoutGuardConfig());
    }

    /**
     * 생성자.
     *
     * @param config 풀 설정
     * @throws IllegalArgumentException config가 null인 경우
     */
    public PooledTimeoutGuard(TimeoutGuardConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.config = config;
        this.workerExecutor = new ThreadPoolExecutor(
            config.poolSize(),
            config.poolSize(),
            0L,
            TimeUnit.MILLISECONDS,
            new ArrayBlockingQueue<>(config.queueCapacity()),
            new WorkerThreadFactory()
        );
    }

    @Override
    public <T> T call(Callable<T> work, Duration timeout, String stepName) throws Exception {
        if (work == null) {
            throw new IllegalArgumentException("work cannot be null");
        }
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be positive (current: " + timeout + ")");
        }

        Future<T> future = workerExecutor.submit(work);
        try {
            return future.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof InterruptedException) {
                // 워커 스레드의 인터럽트는 호출 스레드와 무관한 일반 실패
                throw new StepExecutionException(stepName,
                    "Task '" + stepName + "' was interrupted in its worker thread", cause);
            }
            if (cause instanceof Exception) {
                throw (Exception) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw e;
        } catch (TimeoutException e) {
            handleTimedOut(future, timeout, stepName);
            throw new StepTimeoutException(stepName, timeout);
        } catch (InterruptedException e) {
            // 호출 스레드가 인터럽트되면 작업도 함께 취소
            future.cancel(true);
            throw e;
        }
    }

    private void handleTimedOut(Future<?> future, Duration timeout, String stepName) {
        if (config.timedOutWorkPolicy() == TimedOutWorkPolicy.INTERRUPT) {
            future.cancel(true);
            log.warn("Step '{}' exceeded {}ms, worker interrupted", stepName, timeout.toMillis());
        } else {
            log.warn("Step '{}' exceeded {}ms, worker abandoned and still running (active={})",
                stepName, timeout.toMillis(), workerExecutor.getActiveCount());
        }
    }

    public TimeoutGuardConfig config() {
        return config;
    }

    /**
     * 현재 작업 중인 스레드 수 (방치된 작업 포함).
     *
     * @return 활성 스레드 수
     */
    public int activeCount() {
        return workerExecutor.getActiveCount();
    }

    public boolean isShutdown() {
        return workerExecutor.isShutdown();
    }

    /**
     * 풀 종료.
     *
     * <p>진행 중인 작업이 끝나길 shutdownTimeoutMs 동안 기다린 뒤,
     * 남은 작업은 인터럽트합니다.</p>
     *
     * @throws InterruptedException shutdown 대기 중 인터럽트 발생 시
     */
    public void shutdown() throws InterruptedException {
        workerExecutor.shutdown();
        if (!workerExecutor.awaitTermination(config.shutdownTimeoutMs(), TimeUnit.MILLISECONDS)) {
            log.warn("Timeout guard workers did not finish within {}ms, forcing shutdown",
                config.shutdownTimeoutMs());
            workerExecutor.shutdownNow();
        }
    }

    @Override
    public void close() {
        try {
            shutdown();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            workerExecutor.shutdownNow();
        }
    }

    /**
     * 이름이 붙은 daemon 작업 스레드 생성.
     */
    private static final class WorkerThreadFactory implements ThreadFactory {

        private static final AtomicInteger POOL_SEQUENCE = new AtomicInteger();

        private final int poolId = POOL_SEQUENCE.incrementAndGet();
        private final AtomicInteger threadSequence = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(
                runnable,
                "taskchain-timeout-" + poolId + "-" + threadSequence.incrementAndGet()
            );
            thread.setDaemon(true);
            return thread;
        }
    }
}
