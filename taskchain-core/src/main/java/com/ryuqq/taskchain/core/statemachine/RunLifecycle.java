package com.ryuqq.taskchain.core.statemachine;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Composite 실행 1회의 상태.
 *
 * <p>{@link #start()}로 RUNNING 상태에서 시작하며, {@link #settle(RunState)}는
 * {@link StateTransition} 검증을 거쳐 정확히 한 번만 성공합니다.
 * cooperative 실행에서는 완료 스레드가 settle 하므로 상태는 원자적으로 갱신됩니다.</p>
 *
 * @author TaskChain Team
 * @since 1.0.0
 */
public final class RunLifecycle {

    private final long startNanos;
    private final AtomicReference<RunState> state = new AtomicReference<>(RunState.RUNNING);

    private RunLifecycle(long startNanos) {
        this.startNanos = startNanos;
    }

    public static RunLifecycle start() {
        return new RunLifecycle(System.nanoTime());
    }

    public RunState state() {
        return state.get();
    }

    /**
     * 실행 시작 이후 경과 시간.
     *
     * @return 경과 시간 (ms)
     */
    public long elapsedMs() {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    /**
     * 종료 상태로 전이.
     *
     * @param terminal 종료 상태
     * @return 전이된 상태
     * @throws IllegalArgumentException terminal이 null인 경우
     * @throws IllegalStateException 이미 종료되었거나 terminal이 RUNNING인 경우
     */
    public RunState settle(RunState terminal) {
        RunState current = state.get();
        RunState next = StateTransition.transition(current, terminal);
        if (!state.compareAndSet(current, next)) {
            throw new IllegalStateException(
                String.format("Cannot transition from terminal state: %s → %s", state.get(), terminal)
            );
        }
        return next;
    }

    @Override
    public String toString() {
        return "RunLifecycle{state=" + state.get() + '}';
    }
}
