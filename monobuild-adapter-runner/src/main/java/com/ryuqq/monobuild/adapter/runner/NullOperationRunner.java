package com.ryuqq.monobuild.adapter.runner;

import com.ryuqq.monobuild.core.operation.OperationRunner;
import com.ryuqq.monobuild.core.operation.OperationRunnerContext;
import com.ryuqq.monobuild.core.operation.RunOutcome;
import com.ryuqq.monobuild.core.statemachine.OperationStatus;

/**
 * 작업 없이 고정된 상태를 보고하는 runner.
 *
 * <p>빈 스크립트나 ignoreMissingScript로 허용된 누락 스크립트에 NO_OP로 사용됩니다.</p>
 *
 * @author Monobuild Team
 * @since 1.0.0
 */
public final class NullOperationRunner implements OperationRunner {

    private final String name;
    private final OperationStatus result;
    private final boolean silent;

    /**
     * 생성자.
     *
     * @param name runner 이름
     * @param result 보고할 terminal 상태
     * @param silent 요약 출력에서 숨길지 여부
     * @throws IllegalArgumentException result가 null이거나 terminal이 아닌 경우
     */
    public NullOperationRunner(String name, OperationStatus result, boolean silent) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (result == null || !result.isTerminal()) {
            throw new IllegalArgumentException("result must be a terminal status (current: " + result + ")");
        }
        this.name = name;
        this.result = result;
        this.silent = silent;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public RunOutcome execute(OperationRunnerContext context) {
        return RunOutcome.of(result);
    }

    @Override
    public boolean isSkipAllowed() {
        return false;
    }

    @Override
    public boolean isCacheWriteAllowed() {
        return false;
    }

    @Override
    public boolean warningsAreAllowed() {
        return true;
    }

    @Override
    public boolean reportTiming() {
        return false;
    }

    @Override
    public boolean isSilent() {
        return silent;
    }

    public OperationStatus getResult() {
        return result;
    }
}
