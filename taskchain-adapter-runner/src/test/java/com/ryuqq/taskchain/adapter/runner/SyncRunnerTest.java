package com.ryuqq.taskchain.adapter.runner;

import com.ryuqq.taskchain.core.context.RunContext;
import com.ryuqq.taskchain.core.exception.ExecutionModeViolationException;
import com.ryuqq.taskchain.core.execution.Executable;
import com.ryuqq.taskchain.core.execution.Execution;
import com.ryuqq.taskchain.core.outcome.Outcome;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * SyncRunner 유닛 테스트.
 *
 * @author TaskChain Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class SyncRunnerTest {

    @Mock
    private Executable<String> executable;

    private final SyncRunner runner = new SyncRunner();

    @Test
    void run_Ready_결과를_그대로_반환() {
        // given
        RunContext<String> ctx = RunContext.of("x");
        Outcome<String> expected = Outcome.success(ctx, 3);
        when(executable.name()).thenReturn("step");
        when(executable.execute(ctx)).thenReturn(Execution.ready(expected));

        // when
        Outcome<String> outcome = runner.run(executable, ctx);

        // then
        assertThat(outcome).isSameAs(expected);
        verify(executable).execute(ctx);
    }

    @Test
    void run_payload_오버로드는_새_컨텍스트_생성() {
        // given
        when(executable.name()).thenReturn("step");
        when(executable.execute(any())).thenAnswer(invocation -> {
            RunContext<String> ctx = invocation.getArgument(0);
            return Execution.ready(Outcome.success(ctx, 0));
        });

        // when
        Outcome<String> outcome = runner.runWith(executable, "payload");

        // then
        assertThat(outcome.context().data()).isEqualTo("payload");
        assertThat(outcome.context().trace()).isEmpty();
    }

    @Test
    void run_Pending_결과는_취소하고_모드_위반() {
        // given
        CompletableFuture<Outcome<String>> pending = new CompletableFuture<>();
        when(executable.name()).thenReturn("remote");
        when(executable.execute(any())).thenReturn(Execution.pending(pending));

        // when & then
        assertThatThrownBy(() -> runner.run(executable, RunContext.of("x")))
            .isInstanceOf(ExecutionModeViolationException.class)
            .hasMessageContaining("remote");
        assertThat(pending.isCancelled()).isTrue();
    }

    @Test
    void run_비동기_트리는_실행하지_않고_모드_위반() {
        // given
        RunContext<String> ctx = RunContext.of("x");
        when(executable.name()).thenReturn("charge");
        when(executable.isAsync()).thenReturn(true);

        // when & then
        assertThatThrownBy(() -> runner.run(executable, ctx))
            .isInstanceOf(ExecutionModeViolationException.class)
            .hasMessageContaining("charge");
        verify(executable, never()).execute(any());
        assertThat(ctx.completedSteps()).isEmpty();
        assertThat(ctx.trace()).isEmpty();
    }

    @Test
    void run_null_Execution은_모드_위반() {
        // given
        when(executable.name()).thenReturn("broken");
        when(executable.execute(any())).thenReturn(null);

        // when & then
        assertThatThrownBy(() -> runner.run(executable, RunContext.of("x")))
            .isInstanceOf(ExecutionModeViolationException.class)
            .hasMessageContaining("returned no result");
    }

    @Test
    void run_null_Outcome은_모드_위반() {
        // given
        when(executable.name()).thenReturn("broken");
        when(executable.execute(any())).thenReturn(Execution.ready(null));

        // when & then
        assertThatThrownBy(() -> runner.run(executable, RunContext.of("x")))
            .isInstanceOf(ExecutionModeViolationException.class);
    }

    @Test
    void run_null_인자는_IllegalArgumentException() {
        assertThatThrownBy(() -> runner.run(null, RunContext.of("x")))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("executable cannot be null");
        assertThatThrownBy(() -> runner.run(executable, (RunContext<String>) null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("ctx cannot be null");
    }
}
