package com.ryuqq.monobuild.application.graph;

import com.ryuqq.monobuild.core.config.GlobalCommand;
import com.ryuqq.monobuild.core.config.Phase;
import com.ryuqq.monobuild.core.config.PhasedCommand;
import com.ryuqq.monobuild.core.operation.Operation;
import com.ryuqq.monobuild.core.operation.OperationId;
import com.ryuqq.monobuild.core.project.Project;
import com.ryuqq.monobuild.core.project.ProjectGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * 커맨드와 프로젝트 범위로부터 Operation DAG를 생성합니다.
 *
 * <p><strong>생성 규칙:</strong></p>
 * <pre>
 * 1. 노드: {커맨드 페이즈} × {범위 내 프로젝트} 마다 Operation 하나
 * 2. self 간선: (phase, p) → (selfDep, p)
 * 3. upstream 간선: (phase, p) → (upstreamDep, q)   q ∈ dependencies(p) ∩ 범위
 * </pre>
 *
 * <p>범위 밖의 upstream 프로젝트로 향하는 간선은 만들지 않습니다. 범위를 upstream까지 넓히는 것은
 * 호출자 책임입니다 ({@link ProjectGraph#withUpstreamClosure}).
 * 페이즈 그래프와 프로젝트 그래프가 비순환이면 결과도 비순환이므로 여기서 다시 검사하지 않습니다.</p>
 *
 * @author Monobuild Team
 * @since 1.0.0
 */
public final class OperationGraphBuilder {

    private static final Logger log = LoggerFactory.getLogger(OperationGraphBuilder.class);

    private final OperationRunnerFactory runnerFactory;

    /**
     * OperationGraphBuilder 생성.
     *
     * @param runnerFactory Operation별 runner 생성기
     * @throws IllegalArgumentException runnerFactory가 null인 경우
     */
    public OperationGraphBuilder(OperationRunnerFactory runnerFactory) {
        if (runnerFactory == null) {
            throw new IllegalArgumentException("runnerFactory cannot be null");
        }
        this.runnerFactory = runnerFactory;
    }

    /**
     * phased 커맨드의 전체 페이즈에 대한 그래프 생성.
     *
     * @param command phased 커맨드 (bulk에서 변환된 커맨드 포함)
     * @param projectGraph 프로젝트 의존성 그래프
     * @param scope 실행 범위 프로젝트
     * @return Operation DAG
     */
    public OperationGraph build(PhasedCommand command, ProjectGraph projectGraph, Collection<Project> scope) {
        if (command == null) {
            throw new IllegalArgumentException("command cannot be null");
        }
        return buildForPhases(command, command.getPhases(), projectGraph, scope);
    }

    /**
     * 주어진 페이즈 집합에 대한 그래프 생성 (watch 모드에서는 watchPhases 사용).
     *
     * <p>페이즈 집합 밖의 페이즈에 대한 의존성은 이번 실행에서 이미 충족된 것으로 보고 간선을 만들지 않습니다.
     * 커맨드의 전체 페이즈 집합은 의존성에 대해 닫혀 있으므로 {@link #build}에서는 이런 간선이 생기지 않습니다.</p>
     *
     * @param command phased 커맨드
     * @param phases 실행할 페이즈
     * @param projectGraph 프로젝트 의존성 그래프
     * @param scope 실행 범위 프로젝트
     * @return Operation DAG
     * @throws IllegalStateException 생성한 Operation 사이에서 참조가 끊긴 경우 (내부 결함)
     */
    public OperationGraph buildForPhases(PhasedCommand command, Collection<Phase> phases,
                                         ProjectGraph projectGraph, Collection<Project> scope) {
        if (command == null || phases == null) {
            throw new IllegalArgumentException("command and phases cannot be null");
        }
        if (projectGraph == null || scope == null) {
            throw new IllegalArgumentException("projectGraph and scope cannot be null");
        }

        Set<Phase> phaseSet = new LinkedHashSet<>(phases);
        Set<Project> projects = new LinkedHashSet<>(scope);
        for (Project project : projects) {
            if (!project.equals(projectGraph.find(project.name()).orElse(null))) {
                throw new IllegalArgumentException("Project is not part of the project graph: " + project.name());
            }
        }
        Map<OperationId, Operation> operations = new LinkedHashMap<>();

        for (Phase phase : phaseSet) {
            for (Project project : projects) {
                Operation operation = new Operation(
                    OperationId.forPhase(phase, project),
                    phase,
                    project,
                    runnerFactory.createPhaseRunner(command, phase, project)
                );
                operations.put(operation.getId(), operation);
            }
        }

        int edges = 0;
        for (Phase phase : phaseSet) {
            for (Project project : projects) {
                Operation operation = operations.get(OperationId.forPhase(phase, project));

                for (Phase selfDependency : phase.getSelfDependencies()) {
                    if (phaseSet.contains(selfDependency)) {
                        operation.addDependency(require(operations, selfDependency, project));
                        edges++;
                    }
                }

                if (phase.getUpstreamDependencies().isEmpty()) {
                    continue;
                }
                for (Project upstream : projectGraph.dependenciesOf(project)) {
                    if (!projects.contains(upstream)) {
                        continue;
                    }
                    for (Phase upstreamDependency : phase.getUpstreamDependencies()) {
                        if (phaseSet.contains(upstreamDependency)) {
                            operation.addDependency(require(operations, upstreamDependency, upstream));
                            edges++;
                        }
                    }
                }
            }
        }

        log.debug("Built operation graph for \"{}\": {} operations, {} edges",
            command.getName(), operations.size(), edges);
        return new OperationGraph(command.getName(), operations, command.isEnableParallelism());
    }

    /**
     * global 커맨드의 단일 Operation 그래프 생성.
     *
     * @param command global 커맨드
     * @return Operation 하나를 가진 DAG
     */
    public OperationGraph buildGlobal(GlobalCommand command) {
        if (command == null) {
            throw new IllegalArgumentException("command cannot be null");
        }
        Operation operation = new Operation(
            OperationId.forGlobal(command),
            null,
            null,
            runnerFactory.createGlobalRunner(command)
        );
        Map<OperationId, Operation> operations = new LinkedHashMap<>();
        operations.put(operation.getId(), operation);
        return new OperationGraph(command.getName(), operations, false);
    }

    private static Operation require(Map<OperationId, Operation> operations, Phase phase, Project project) {
        Operation dependency = operations.get(OperationId.forPhase(phase, project));
        if (dependency == null) {
            throw new IllegalStateException("Operation graph references missing operation " + OperationId.forPhase(phase, project));
        }
        return dependency;
    }
}
