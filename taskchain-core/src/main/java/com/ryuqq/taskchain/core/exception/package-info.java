/**
 * 예외 계층.
 *
 * <h2>분류</h2>
 * <ul>
 *   <li>{@link com.ryuqq.taskchain.core.exception.StepExecutionException} - 재시도 소진 (Outcome에 담김)</li>
 *   <li>{@link com.ryuqq.taskchain.core.exception.StepTimeoutException} - 시도 시간 초과 (재시도 대상)</li>
 *   <li>{@link com.ryuqq.taskchain.core.exception.CompositeExecutionException} - 자식 Step의 예기치 않은 예외 (Outcome에 담김)</li>
 *   <li>{@link com.ryuqq.taskchain.core.exception.CompensationException} - 보상 실패 (항상 전파)</li>
 *   <li>{@link com.ryuqq.taskchain.core.exception.ExecutionModeViolationException} - 실행 모드 계약 위반 (항상 전파)</li>
 * </ul>
 *
 * <h2>전파 규칙</h2>
 * <pre>
 * 사용자 함수 예외      → Task 경계에서 FAILED Outcome으로 변환
 * 자식 Outcome 실패    → Composite 정책(ABORT/CONTINUE/COMPENSATE)에 따라 처리
 * 보상 실패, 모드 위반  → execute 밖으로 전파
 * </pre>
 *
 * @author TaskChain Team
 * @since 1.0.0
 */
package com.ryuqq.taskchain.core.exception;
