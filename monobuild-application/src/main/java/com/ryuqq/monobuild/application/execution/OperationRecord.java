package com.ryuqq.monobuild.application.execution;

import com.ryuqq.monobuild.core.operation.OperationId;
import com.ryuqq.monobuild.core.statemachine.OperationStatus;

import java.time.Duration;

/**
 * Operation 하나의 실행 기록.
 *
 * @param operationId Operation 식별자
 * @param status 최종 상태 (취소로 실행되지 않은 경우 READY/QUEUED)
 * @param duration 실행 시간 (BLOCKED 또는 미실행이면 0)
 * @param output runner 진단 출력
 * @author Monobuild Team
 * @since 1.0.0
 */
public record OperationRecord(
    OperationId operationId,
    OperationStatus status,
    Duration duration,
    String output
) {

    public OperationRecord {
        if (operationId == null) {
            throw new IllegalArgumentException("operationId cannot be null");
        }
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        duration = duration == null ? Duration.ZERO : duration;
        output = output == null ? "" : output;
    }
}
