package com.ryuqq.taskchain.adapter.runner;

/**
 * 제한 시간을 넘긴 blocking 작업의 처리 방식.
 *
 * <p>Java에서는 실행 중인 스레드를 강제로 멈출 수 없으므로, 타임아웃 후 작업 스레드를
 * 어떻게 다룰지 명시적으로 선택합니다.</p>
 *
 * @author TaskChain Team
 * @since 1.0.0
 */
public enum TimedOutWorkPolicy {

    /**
     * 작업 스레드를 인터럽트하여 취소 (기본값).
     *
     * <p>인터럽트에 반응하는 작업(sleep, I/O 대기 등)은 즉시 종료됩니다.</p>
     */
    INTERRUPT,

    /**
     * 작업을 백그라운드에서 계속 실행하도록 방치.
     *
     * <p>풀의 스레드를 계속 점유하므로 반복되면 풀이 포화될 수 있습니다.
     * 인터럽트가 안전하지 않은 작업에만 사용합니다.</p>
     */
    ABANDON
}
