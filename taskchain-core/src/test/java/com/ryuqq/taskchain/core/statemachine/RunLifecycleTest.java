package com.ryuqq.taskchain.core.statemachine;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicInteger;

import static com.ryuqq.taskchain.core.statemachine.RunState.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * RunLifecycle 테스트.
 *
 * @author TaskChain Team
 * @since 1.0.0
 */
class RunLifecycleTest {

    @Test
    void start_StateIsRunning() {
        // When
        RunLifecycle run = RunLifecycle.start();

        // Then
        assertEquals(RUNNING, run.state());
        assertTrue(run.elapsedMs() >= 0);
    }

    @Test
    void settle_FromRunning_MovesToTerminal() {
        // Given
        RunLifecycle run = RunLifecycle.start();

        // When
        RunState state = run.settle(FAILED);

        // Then
        assertEquals(FAILED, state);
        assertEquals(FAILED, run.state());
    }

    // ========== 단일 종료 ==========

    @Test
    void settle_Twice_ThrowsException() {
        // Given
        RunLifecycle run = RunLifecycle.start();
        run.settle(SUCCESS);

        // When & Then
        IllegalStateException exception = assertThrows(IllegalStateException.class, () -> run.settle(FAILED));
        assertTrue(exception.getMessage().contains("terminal state"));
        assertEquals(SUCCESS, run.state());
    }

    @Test
    void settle_ToRunning_ThrowsException() {
        // Given
        RunLifecycle run = RunLifecycle.start();

        // When & Then
        assertThrows(IllegalStateException.class, () -> run.settle(RUNNING));
        assertEquals(RUNNING, run.state());
    }

    @Test
    void settle_Null_ThrowsException() {
        RunLifecycle run = RunLifecycle.start();

        assertThrows(IllegalArgumentException.class, () -> run.settle(null));
    }

    @Test
    void settle_ConcurrentCallers_OnlyOneSucceeds() throws InterruptedException {
        // Given
        RunLifecycle run = RunLifecycle.start();
        CountDownLatch ready = new CountDownLatch(1);
        AtomicInteger settled = new AtomicInteger();
        AtomicInteger rejected = new AtomicInteger();
        List<Thread> threads = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            RunState terminal = i % 2 == 0 ? SUCCESS : ABORTED;
            Thread thread = new Thread(() -> {
                try {
                    ready.await();
                    run.settle(terminal);
                    settled.incrementAndGet();
                } catch (IllegalStateException e) {
                    rejected.incrementAndGet();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });
            threads.add(thread);
            thread.start();
        }

        // When
        ready.countDown();
        for (Thread thread : threads) {
            thread.join();
        }

        // Then
        assertEquals(1, settled.get());
        assertEquals(7, rejected.get());
        assertTrue(run.state().isTerminal());
    }
}
