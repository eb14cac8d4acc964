package com.ryuqq.taskchain.testkit.contract;

import com.ryuqq.taskchain.application.component.Process;
import com.ryuqq.taskchain.application.component.Task;
import com.ryuqq.taskchain.application.component.Workflow;
import com.ryuqq.taskchain.core.context.Event;
import com.ryuqq.taskchain.core.context.EventLevel;
import com.ryuqq.taskchain.core.context.RunContext;
import com.ryuqq.taskchain.core.outcome.Outcome;
import com.ryuqq.taskchain.core.outcome.OutcomeStatus;
import com.ryuqq.taskchain.core.policy.FailureStrategy;
import com.ryuqq.taskchain.core.policy.RetryPolicy;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end scenarios over the "validate → create → notify" order flow.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Happy path: all steps complete, data updates are visible downstream</li>
 *   <li>notify keeps failing: attempted exactly maxAttempts times, then create is undone
 *       and validate, which has no undo, is skipped</li>
 *   <li>Two-step ABORT where both succeed: SUCCESS with both names completed</li>
 *   <li>Two-step ABORT: the second step's error is reported, the first stays completed</li>
 *   <li>Exception formatter sanitizes failure text written to the trace</li>
 * </ul>
 *
 * @author TaskChain Team
 * @since 1.0.0
 */
class EndToEndScenarioTest extends AbstractExecutionContractTest {

    private static final RetryPolicy NOTIFY_RETRY = RetryPolicy.builder()
        .maxAttempts(3)
        .baseDelay(Duration.ofMillis(5))
        .build();

    @Test
    void testOrderFlow_WhenAllStepsSucceed_DataFlowsThrough() {
        // Given
        Task<Map<String, Object>> validate = Task.of("validate", ctx -> {
            recorder.record("validate");
            return ctx.metadata().put("validated", true);
        });
        Task<Map<String, Object>> create = Task.of("create", ctx -> {
            recorder.record("create");
            ctx.setData(Map.of("orderId", "o-1", "validated", ctx.metadata().get("validated")));
            return null;
        });
        Process<Map<String, Object>> flow = Process.of("order", validate, create);
        RunContext<Map<String, Object>> ctx = RunContext.of(Map.of());

        // When
        Outcome<Map<String, Object>> outcome = syncRunner.run(flow, ctx);

        // Then
        assertStatus(outcome, OutcomeStatus.SUCCESS);
        assertCalls("validate", "create");
        assertEquals("o-1", ctx.data().get("orderId"));
        assertEquals(true, ctx.data().get("validated"));
        assertEquals(List.of("validate", "create", "order"), List.copyOf(ctx.completedSteps()));
    }

    @Test
    void testOrderFlow_WhenNotifyKeepsFailing_RetriedThenCompensated() {
        // Given
        Task<String> validate = Task.of("validate", ctx -> {
            recorder.record("validate");
            return null;
        });
        Workflow<String> flow = new Workflow<>("order",
            List.of(validate, succeeding("create"), failing("notify", NOTIFY_RETRY)),
            FailureStrategy.COMPENSATE);
        RunContext<String> ctx = RunContext.of("order-1");

        // When
        Outcome<String> outcome = syncRunner.run(flow, ctx);

        // Then
        assertStatus(outcome, OutcomeStatus.FAILED);
        assertEquals(3, recorder.count("notify"));
        assertCalls("validate", "create", "notify", "notify", "notify", "undo:create");
        assertTraceContains(ctx, "notify", "Task 'notify' failed after 3 attempts");
        assertTrue(ctx.isCompensated("create"));
        assertFalse(ctx.isCompensated("validate"));

        List<String> orderEvents = new ArrayList<>();
        for (Event event : ctx.trace()) {
            if (event.source().equals("order")) {
                orderEvents.add(event.message());
            }
        }
        assertEquals(List.of(
            "Workflow Started",
            "Workflow Compensating due to failure in step 'notify'"
        ), orderEvents);
    }

    @Test
    void testTwoStepAbort_WhenBothSucceed_BothCompleted() {
        // Given
        Workflow<String> flow = new Workflow<>("pair",
            List.of(succeeding("a"), succeeding("b")), FailureStrategy.ABORT);
        RunContext<String> ctx = RunContext.of("payload");

        // When
        Outcome<String> outcome = syncRunner.run(flow, ctx);

        // Then
        assertStatus(outcome, OutcomeStatus.SUCCESS);
        assertTrue(outcome.errors().isEmpty());
        assertCalls("a", "b");
        assertEquals(List.of("a", "b", "pair"), List.copyOf(ctx.completedSteps()));
        assertTrue(ctx.compensatedSteps().isEmpty());
    }

    @Test
    void testTwoStepAbort_WhenSecondFails_FirstRemainsCompleted() {
        // Given
        Workflow<String> flow = new Workflow<>("pair", List.of(succeeding("a"), failing("b")), FailureStrategy.ABORT);
        RunContext<String> ctx = RunContext.of("payload");

        // When
        Outcome<String> outcome = syncRunner.run(flow, ctx);

        // Then
        assertStatus(outcome, OutcomeStatus.ABORTED);
        assertEquals(1, outcome.errors().size());
        assertEquals("Task 'b' failed after 1 attempts", outcome.errors().get(0).getMessage());
        assertTrue(ctx.isCompleted("a"));
        assertFalse(ctx.isCompleted("b"));
        assertFalse(ctx.isCompleted("pair"));
        assertTrue(outcome.durationMs() >= 0);
    }

    @Test
    void testExceptionFormatter_WhenStepFails_TraceUsesSanitizedText() {
        // Given
        Task<String> leaky = Task.of("charge", ctx -> {
            throw new IllegalStateException("card 4111-1111-1111-1111 declined");
        });
        RunContext<String> ctx = RunContext.of("payload", e -> e.getClass().getSimpleName());

        // When
        syncRunner.run(leaky, ctx);

        // Then
        for (Event event : ctx.trace()) {
            assertFalse(event.message().contains("4111"), "Trace leaked sensitive text: " + event.message());
        }
        assertTraceContains(ctx, "charge", "Task Failed: IllegalStateException");
        assertTrue(ctx.trace().stream().anyMatch(e -> e.level() == EventLevel.ERROR));
    }
}
