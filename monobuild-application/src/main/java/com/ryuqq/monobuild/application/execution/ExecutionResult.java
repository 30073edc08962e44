package com.ryuqq.monobuild.application.execution;

import com.ryuqq.monobuild.core.statemachine.OperationStatus;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * 커맨드 실행 결과.
 *
 * <p>records는 완료 순서이며, 취소로 실행되지 않은 Operation은 마지막에 생성 순서로 붙습니다.</p>
 *
 * @param verdict 전체 판정
 * @param records Operation별 기록
 * @param elapsed 전체 실행 시간
 * @author Monobuild Team
 * @since 1.0.0
 */
public record ExecutionResult(
    ExecutionVerdict verdict,
    List<OperationRecord> records,
    Duration elapsed
) {

    public ExecutionResult {
        if (verdict == null) {
            throw new IllegalArgumentException("verdict cannot be null");
        }
        records = records == null ? List.of() : List.copyOf(records);
        elapsed = elapsed == null ? Duration.ZERO : elapsed;
    }

    public int exitCode() {
        return verdict.exitCode();
    }

    public boolean isSuccess() {
        return verdict.isSuccess();
    }

    /**
     * 특정 상태로 끝난 Operation 수.
     *
     * @param status 상태
     * @return 개수
     */
    public long countOf(OperationStatus status) {
        return records.stream().filter(record -> record.status() == status).count();
    }

    /**
     * 직접 실패한 Operation ("원인").
     *
     * @return FAILURE 기록
     */
    public List<OperationRecord> failures() {
        return withStatus(OperationStatus.FAILURE);
    }

    /**
     * 실패 때문에 실행되지 않은 Operation ("부수 피해").
     *
     * @return BLOCKED 기록
     */
    public List<OperationRecord> blocked() {
        return withStatus(OperationStatus.BLOCKED);
    }

    public Optional<OperationRecord> find(String operationId) {
        return records.stream()
            .filter(record -> record.operationId().getValue().equals(operationId))
            .findFirst();
    }

    private List<OperationRecord> withStatus(OperationStatus status) {
        return records.stream().filter(record -> record.status() == status).toList();
    }
}
