package com.ryuqq.taskchain.core.policy;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FailureStrategyTest {

    @Test
    void fromNameOrDefault_KnownName_IgnoresCase() {
        assertEquals(FailureStrategy.COMPENSATE, FailureStrategy.fromNameOrDefault("compensate"));
        assertEquals(FailureStrategy.CONTINUE, FailureStrategy.fromNameOrDefault(" Continue "));
    }

    @Test
    void fromNameOrDefault_UnknownOrNull_FallsBackToAbort() {
        assertEquals(FailureStrategy.ABORT, FailureStrategy.fromNameOrDefault("retry-forever"));
        assertEquals(FailureStrategy.ABORT, FailureStrategy.fromNameOrDefault(null));
    }
}
