package com.ryuqq.taskchain.core.context;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/**
 * 하나의 실행(run) 동안 모든 Step을 관통하는 가변 컨텍스트.
 *
 * <p>사용자 payload({@code data})와 엔진이 관리하는 기록을 함께 담습니다:</p>
 * <ul>
 *   <li>trace: 시간순, append-only 이벤트 로그</li>
 *   <li>metadata: 엔진과 사용자가 공유하는 자유 형식 저장소</li>
 *   <li>completedSteps: 성공적으로 완료된 Step 이름 집합 (완료 여부의 유일한 근거)</li>
 *   <li>compensatedSteps: 이미 보상(undo)이 수행된 Step 이름 집합</li>
 * </ul>
 *
 * <p><strong>불변식:</strong> completedSteps와 compensatedSteps는 한 실행 동안
 * 증가만 하며 제거되지 않습니다.</p>
 *
 * <p><strong>동시성:</strong> 형제 Step이 동시에 실행되지 않으므로 잠금을 제공하지 않습니다.
 * 단, 타임아웃 후 방치된 작업이 백그라운드에서 계속 기록할 수 있으므로
 * trace는 copy-on-write 리스트를 사용합니다.</p>
 *
 * @param <D> payload 타입
 *
 * @author TaskChain Team
 * @since 1.0.0
 */
public final class RunContext<D> {

    private D data;
    private final List<Event> trace;
    private final Map<String, Object> metadata;
    private final Set<String> completedSteps;
    private final Set<String> compensatedSteps;
    private final Function<Throwable, String> exceptionFormatter;

    private RunContext(
        D data,
        Collection<Event> trace,
        Map<String, Object> metadata,
        Collection<String> completedSteps,
        Collection<String> compensatedSteps,
        Function<Throwable, String> exceptionFormatter
    ) {
        if (exceptionFormatter == null) {
            throw new IllegalArgumentException("exceptionFormatter cannot be null");
        }
        this.data = data;
        this.trace = new CopyOnWriteArrayList<>(trace);
        this.metadata = new LinkedHashMap<>(metadata);
        this.completedSteps = new LinkedHashSet<>(completedSteps);
        this.compensatedSteps = new LinkedHashSet<>(compensatedSteps);
        this.exceptionFormatter = exceptionFormatter;
    }

    /**
     * 빈 기록으로 새 컨텍스트 생성.
     *
     * @param data 사용자 payload (null 허용)
     * @param <D> payload 타입
     * @return RunContext 인스턴스
     */
    public static <D> RunContext<D> of(D data) {
        return new RunContext<>(data, List.of(), Map.of(), List.of(), List.of(), Throwable::toString);
    }

    /**
     * 예외 포맷터를 지정하여 새 컨텍스트 생성.
     *
     * <p>Trace에 기록되는 모든 실패 메시지는 이 포맷터를 거칩니다.
     * 민감 정보를 걸러내야 할 때 사용합니다.</p>
     *
     * @param data 사용자 payload
     * @param exceptionFormatter 예외 → 문자열 변환 함수
     * @param <D> payload 타입
     * @return RunContext 인스턴스
     * @throws IllegalArgumentException exceptionFormatter가 null인 경우
     */
    public static <D> RunContext<D> of(D data, Function<Throwable, String> exceptionFormatter) {
        return new RunContext<>(data, List.of(), Map.of(), List.of(), List.of(), exceptionFormatter);
    }

    /**
     * 저장된 상태로부터 컨텍스트 복원.
     *
     * @param data 사용자 payload
     * @param trace 이벤트 목록
     * @param metadata 메타데이터
     * @param completedSteps 완료된 Step 이름
     * @param compensatedSteps 보상된 Step 이름
     * @param <D> payload 타입
     * @return RunContext 인스턴스
     * @throws IllegalArgumentException 컬렉션 인자가 null인 경우
     */
    public static <D> RunContext<D> restore(
        D data,
        List<Event> trace,
        Map<String, Object> metadata,
        Collection<String> completedSteps,
        Collection<String> compensatedSteps
    ) {
        if (trace == null || metadata == null || completedSteps == null || compensatedSteps == null) {
            throw new IllegalArgumentException("restored collections cannot be null");
        }
        return new RunContext<>(data, trace, metadata, completedSteps, compensatedSteps, Throwable::toString);
    }

    public D data() {
        return data;
    }

    /**
     * payload 교체.
     *
     * @param data 새 payload
     */
    public void setData(D data) {
        this.data = data;
    }

    /**
     * 이벤트 trace 조회.
     *
     * @return 읽기 전용 이벤트 목록 (시간순)
     */
    public List<Event> trace() {
        return Collections.unmodifiableList(trace);
    }

    /**
     * 메타데이터 조회.
     *
     * <p>반환된 Map은 수정 가능하며 엔진과 사용자 함수가 공유합니다.</p>
     *
     * @return 메타데이터 Map
     */
    public Map<String, Object> metadata() {
        return metadata;
    }

    /**
     * 완료된 Step 이름 조회.
     *
     * @return 읽기 전용 집합
     */
    public Set<String> completedSteps() {
        return Collections.unmodifiableSet(completedSteps);
    }

    /**
     * 보상된 Step 이름 조회.
     *
     * @return 읽기 전용 집합
     */
    public Set<String> compensatedSteps() {
        return Collections.unmodifiableSet(compensatedSteps);
    }

    /**
     * Step 완료 기록.
     *
     * @param stepName Step 이름
     * @throws IllegalArgumentException stepName이 null이거나 빈 문자열인 경우
     */
    public void markCompleted(String stepName) {
        requireStepName(stepName);
        completedSteps.add(stepName);
    }

    public boolean isCompleted(String stepName) {
        return completedSteps.contains(stepName);
    }

    /**
     * Step 보상 기록.
     *
     * @param stepName Step 이름
     * @return 처음 기록된 경우 true, 이미 보상된 Step이면 false
     * @throws IllegalArgumentException stepName이 null이거나 빈 문자열인 경우
     */
    public boolean markCompensated(String stepName) {
        requireStepName(stepName);
        return compensatedSteps.add(stepName);
    }

    public boolean isCompensated(String stepName) {
        return compensatedSteps.contains(stepName);
    }

    /**
     * Trace에 이벤트 추가.
     *
     * @param level 이벤트 레벨
     * @param source Step 이름
     * @param message 메시지
     */
    public void logEvent(EventLevel level, String source, String message) {
        trace.add(Event.now(level, source, message));
    }

    /**
     * 설정된 포맷터로 예외를 문자열로 변환.
     *
     * @param failure 예외
     * @return Trace에 기록할 문자열
     */
    public String formatException(Throwable failure) {
        return exceptionFormatter.apply(failure);
    }

    private static void requireStepName(String stepName) {
        if (stepName == null || stepName.isBlank()) {
            throw new IllegalArgumentException("stepName cannot be null or blank");
        }
    }

    @Override
    public String toString() {
        return "RunContext{data=" + data
            + ", events=" + trace.size()
            + ", completedSteps=" + completedSteps
            + ", compensatedSteps=" + compensatedSteps + '}';
    }
}
