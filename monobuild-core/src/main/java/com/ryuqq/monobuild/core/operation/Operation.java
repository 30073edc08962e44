package com.ryuqq.monobuild.core.operation;

import com.ryuqq.monobuild.core.config.Phase;
import com.ryuqq.monobuild.core.project.Project;
import com.ryuqq.monobuild.core.statemachine.OperationStatus;
import com.ryuqq.monobuild.core.statemachine.StatusTransition;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * 실행 단위: (페이즈, 프로젝트) 쌍 또는 global 커맨드 하나.
 *
 * <p>커맨드 실행마다 새로 생성되며, 실행 중에는 executor의 조정 루프만 상태와 간선을 변경합니다
 * (single writer). 워커 스레드는 Operation을 직접 수정하지 않습니다.</p>
 *
 * <p><strong>간선:</strong></p>
 * <ul>
 *   <li>dependencies: 이 Operation보다 먼저 끝나야 하는 Operation</li>
 *   <li>consumers: 이 Operation에 의존하는 Operation (dependencies의 역방향)</li>
 * </ul>
 *
 * @author Monobuild Team
 * @since 1.0.0
 */
public final class Operation {

    private final OperationId id;
    private final Phase phase;
    private final Project project;
    private final OperationRunner runner;
    private final Set<Operation> dependencies = new LinkedHashSet<>();
    private final Set<Operation> consumers = new LinkedHashSet<>();
    private OperationStatus status = OperationStatus.READY;

    /**
     * Operation 생성.
     *
     * @param id 식별자
     * @param phase 페이즈 (global이면 null)
     * @param project 프로젝트 (global이면 null)
     * @param runner 실행할 runner
     */
    public Operation(OperationId id, Phase phase, Project project, OperationRunner runner) {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        if (runner == null) {
            throw new IllegalArgumentException("runner cannot be null");
        }
        this.id = id;
        this.phase = phase;
        this.project = project;
        this.runner = runner;
    }

    /**
     * 의존성 간선 추가 (역방향 consumers 간선도 함께 추가).
     *
     * @param dependency 먼저 끝나야 하는 Operation
     */
    public void addDependency(Operation dependency) {
        if (dependency == null) {
            throw new IllegalArgumentException("dependency cannot be null");
        }
        if (dependency == this) {
            throw new IllegalArgumentException("Operation cannot depend on itself: " + id);
        }
        dependencies.add(dependency);
        dependency.consumers.add(this);
    }

    /**
     * 상태 전이.
     *
     * @param next 다음 상태
     * @throws IllegalStateException 허용되지 않는 전이인 경우
     */
    public void transitionTo(OperationStatus next) {
        this.status = StatusTransition.transition(status, next);
    }

    /**
     * 성공 상태에서 경고를 허용하는지 여부.
     *
     * @return 페이즈의 allowWarningsOnSuccess 또는 runner의 warningsAreAllowed
     */
    public boolean isWarningsAllowed() {
        return (phase != null && phase.isAllowWarningsOnSuccess()) || runner.warningsAreAllowed();
    }

    public OperationId getId() {
        return id;
    }

    public Phase getPhase() {
        return phase;
    }

    public Project getProject() {
        return project;
    }

    public OperationRunner getRunner() {
        return runner;
    }

    public OperationStatus getStatus() {
        return status;
    }

    public Set<Operation> getDependencies() {
        return Collections.unmodifiableSet(dependencies);
    }

    public Set<Operation> getConsumers() {
        return Collections.unmodifiableSet(consumers);
    }

    @Override
    public String toString() {
        return "Operation{" + id + ", " + status + '}';
    }
}
