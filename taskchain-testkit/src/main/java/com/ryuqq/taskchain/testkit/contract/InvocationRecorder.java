package com.ryuqq.taskchain.testkit.contract;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Thread-safe log of step invocations for contract tests.
 *
 * <p>Actions and undos created by {@link AbstractExecutionContractTest} record their
 * step name here ({@code "create"}, {@code "undo:create"}), so a test can assert the
 * exact order in which the engine called user code.</p>
 *
 * @author TaskChain Team
 * @since 1.0.0
 */
public final class InvocationRecorder {

    private final List<String> calls = new CopyOnWriteArrayList<>();

    public void record(String call) {
        calls.add(call);
    }

    /**
     * Returns a snapshot of all recorded calls in invocation order.
     *
     * @return immutable copy of the calls
     */
    public List<String> calls() {
        return List.copyOf(calls);
    }

    /**
     * Counts how many times a call was recorded.
     *
     * @param call the call label
     * @return number of occurrences
     */
    public int count(String call) {
        int count = 0;
        for (String recorded : calls) {
            if (recorded.equals(call)) {
                count++;
            }
        }
        return count;
    }

    public void clear() {
        calls.clear();
    }
}
