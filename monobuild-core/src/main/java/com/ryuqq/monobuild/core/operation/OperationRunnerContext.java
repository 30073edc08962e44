package com.ryuqq.monobuild.core.operation;

import com.ryuqq.monobuild.core.config.Phase;
import com.ryuqq.monobuild.core.project.Project;

import java.util.function.BooleanSupplier;

/**
 * Runner에 전달되는 실행 컨텍스트.
 *
 * <p>global Operation은 phase와 project가 null입니다.
 * 장시간 실행되는 runner는 {@link #isCancellationRequested()}를 주기적으로 확인해야 합니다.</p>
 *
 * @param operationId Operation 식별자
 * @param phase 페이즈 (global이면 null)
 * @param project 프로젝트 (global이면 null)
 * @param cancellationRequested 취소 요청 여부 공급자
 * @author Monobuild Team
 * @since 1.0.0
 */
public record OperationRunnerContext(
    OperationId operationId,
    Phase phase,
    Project project,
    BooleanSupplier cancellationRequested
) {

    public OperationRunnerContext {
        if (operationId == null) {
            throw new IllegalArgumentException("operationId cannot be null");
        }
        if (cancellationRequested == null) {
            cancellationRequested = () -> false;
        }
    }

    public boolean isCancellationRequested() {
        return cancellationRequested.getAsBoolean();
    }
}
