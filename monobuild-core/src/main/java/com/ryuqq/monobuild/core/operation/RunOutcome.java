package com.ryuqq.monobuild.core.operation;

import com.ryuqq.monobuild.core.statemachine.OperationStatus;

/**
 * Runner 실행 결과.
 *
 * @param status 최종 상태 (terminal 상태만 허용)
 * @param output 진단 출력 (없으면 빈 문자열)
 * @author Monobuild Team
 * @since 1.0.0
 */
public record RunOutcome(OperationStatus status, String output) {

    public RunOutcome {
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        if (!status.isTerminal()) {
            throw new IllegalArgumentException("RunOutcome status must be terminal: " + status);
        }
        output = output == null ? "" : output;
    }

    public static RunOutcome of(OperationStatus status) {
        return new RunOutcome(status, "");
    }

    public static RunOutcome success() {
        return new RunOutcome(OperationStatus.SUCCESS, "");
    }

    public static RunOutcome failure(String output) {
        return new RunOutcome(OperationStatus.FAILURE, output);
    }
}
