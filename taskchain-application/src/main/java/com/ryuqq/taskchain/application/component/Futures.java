package com.ryuqq.taskchain.application.component;

import com.ryuqq.taskchain.core.exception.CompensationException;
import com.ryuqq.taskchain.core.exception.ExecutionModeViolationException;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * CompletableFuture 처리 공용 유틸리티.
 *
 * @author TaskChain Team
 * @since 1.0.0
 */
final class Futures {

    // Utility class - prevent instantiation
    private Futures() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * CompletionException/ExecutionException 래퍼를 벗겨 원래 원인을 반환.
     */
    static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
            && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    /**
     * Outcome으로 흡수하지 않고 호출자에게 전파해야 하는 예외인지 확인.
     */
    static boolean isEscalation(Throwable error) {
        return error instanceof ExecutionModeViolationException || error instanceof CompensationException;
    }

    static long elapsedMs(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }
}
