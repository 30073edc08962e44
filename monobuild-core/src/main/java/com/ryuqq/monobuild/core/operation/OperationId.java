package com.ryuqq.monobuild.core.operation;

import com.ryuqq.monobuild.core.config.GlobalCommand;
import com.ryuqq.monobuild.core.config.Phase;
import com.ryuqq.monobuild.core.project.Project;

/**
 * 한 번의 커맨드 실행 안에서 Operation을 식별하는 값.
 *
 * <p>페이즈 Operation은 {@code "<project> (<phase>)"}, global Operation은 커맨드 이름을 값으로 가집니다.
 * 증분 상태 저장소의 키로도 사용되므로 실행 간에 안정적이어야 합니다.</p>
 *
 * @author Monobuild Team
 * @since 1.0.0
 */
public final class OperationId {

    private final String value;

    private OperationId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("OperationId cannot be null or blank");
        }
        this.value = value;
    }

    /**
     * 임의 값으로 생성.
     *
     * @param value 식별자 값
     * @return OperationId
     * @throws IllegalArgumentException 값이 null이거나 빈 문자열인 경우
     */
    public static OperationId of(String value) {
        return new OperationId(value);
    }

    /**
     * (페이즈, 프로젝트) Operation 식별자.
     *
     * @param phase 페이즈
     * @param project 프로젝트
     * @return {@code "<project> (<phase>)"} 형식의 OperationId
     */
    public static OperationId forPhase(Phase phase, Project project) {
        if (phase == null || project == null) {
            throw new IllegalArgumentException("phase and project cannot be null");
        }
        return new OperationId(project.name() + " (" + phase.getName() + ")");
    }

    /**
     * global 커맨드 Operation 식별자.
     *
     * @param command global 커맨드
     * @return 커맨드 이름을 값으로 가지는 OperationId
     */
    public static OperationId forGlobal(GlobalCommand command) {
        if (command == null) {
            throw new IllegalArgumentException("command cannot be null");
        }
        return new OperationId(command.getName());
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        OperationId that = (OperationId) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
