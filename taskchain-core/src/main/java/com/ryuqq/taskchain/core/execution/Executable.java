package com.ryuqq.taskchain.core.execution;

import com.ryuqq.taskchain.core.context.RunContext;
import com.ryuqq.taskchain.core.outcome.Outcome;

/**
 * 실행 가능한 단위 (Task, Process, Workflow).
 *
 * <p><strong>계약:</strong></p>
 * <ul>
 *   <li>{@link #isAsync()}는 생성 시점에 고정되며 실행 중 바뀌지 않습니다.</li>
 *   <li>blocking 구현은 {@link Ready}를, cooperative 구현은 {@link Pending}을 반환합니다.</li>
 *   <li>{@link #execute(RunContext)}는 total입니다. 보상 실패와 모드 위반만 예외로 전파됩니다.</li>
 *   <li>성공한 Executable은 자신의 이름을 {@code completedSteps}에 기록합니다.</li>
 * </ul>
 *
 * @param <D> payload 타입
 *
 * @author TaskChain Team
 * @since 1.0.0
 */
public interface Executable<D> {

    /**
     * Step 이름. 보상 범위 판정({@code completedSteps})의 키로 사용됩니다.
     *
     * @return Step 이름
     */
    String name();

    /**
     * 사람이 읽을 수 있는 설명.
     *
     * @return 설명 (없으면 null)
     */
    default String description() {
        return null;
    }

    /**
     * cooperative(비동기) 모드로 실행되는지 여부.
     *
     * @return 비동기 실행이면 true
     */
    boolean isAsync();

    /**
     * 작업 실행.
     *
     * @param ctx 실행 컨텍스트
     * @return 실행 결과 (Ready 또는 Pending)
     */
    Execution<Outcome<D>> execute(RunContext<D> ctx);

    /**
     * 이 단위가 만든 효과를 되돌립니다.
     *
     * @param ctx 실행 컨텍스트
     * @return 보상 결과 (Ready 또는 Pending)
     * @throws com.ryuqq.taskchain.core.exception.CompensationException 보상 실패 시 (blocking 모드)
     */
    Execution<Void> compensate(RunContext<D> ctx);
}
