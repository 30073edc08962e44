package com.ryuqq.monobuild.core.statemachine;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * OperationStatus Enum 테스트.
 *
 * @author Monobuild Team
 * @since 1.0.0
 */
class OperationStatusTest {

    @Test
    void isTerminal_NonTerminalStates_ReturnFalse() {
        assertFalse(OperationStatus.READY.isTerminal());
        assertFalse(OperationStatus.QUEUED.isTerminal());
        assertFalse(OperationStatus.EXECUTING.isTerminal());
    }

    @Test
    void isBlocking_FailureAndBlocked_ReturnTrue() {
        assertTrue(OperationStatus.FAILURE.isBlocking());
        assertTrue(OperationStatus.BLOCKED.isBlocking());
    }

    @Test
    void isNonBlockingTerminal_SkippedFromCacheNoOp_ReturnTrue() {
        // 증분 빌드로 건너뛴 의존성도 consumers를 막지 않아야 함
        assertTrue(OperationStatus.SKIPPED.isNonBlockingTerminal());
        assertTrue(OperationStatus.FROM_CACHE.isNonBlockingTerminal());
        assertTrue(OperationStatus.NO_OP.isNonBlockingTerminal());
        assertTrue(OperationStatus.SUCCESS_WITH_WARNING.isNonBlockingTerminal());
    }

    @Test
    void isNonBlockingTerminal_ExecutingOrFailure_ReturnFalse() {
        assertFalse(OperationStatus.EXECUTING.isNonBlockingTerminal());
        assertFalse(OperationStatus.FAILURE.isNonBlockingTerminal());
    }
}
