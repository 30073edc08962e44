package com.ryuqq.monobuild.core.project;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 프로젝트 의존성 그래프.
 *
 * <p>모든 의존성 이름은 그래프 안의 프로젝트를 가리켜야 합니다.
 * 비순환성은 호출자(저장소 설정 로더)가 보장합니다.</p>
 *
 * @author Monobuild Team
 * @since 1.0.0
 */
public final class ProjectGraph {

    private final Map<String, Project> projectsByName;

    private ProjectGraph(Map<String, Project> projectsByName) {
        this.projectsByName = projectsByName;
    }

    /**
     * 프로젝트 목록으로 그래프 생성.
     *
     * @param projects 프로젝트 목록 (순서 유지)
     * @return ProjectGraph
     * @throws IllegalArgumentException 이름 중복 또는 존재하지 않는 프로젝트를 의존하는 경우
     */
    public static ProjectGraph of(Collection<Project> projects) {
        if (projects == null) {
            throw new IllegalArgumentException("projects cannot be null");
        }
        Map<String, Project> byName = new LinkedHashMap<>();
        for (Project project : projects) {
            if (byName.putIfAbsent(project.name(), project) != null) {
                throw new IllegalArgumentException("Duplicate project name: " + project.name());
            }
        }
        for (Project project : byName.values()) {
            for (String dependency : project.dependencies()) {
                if (!byName.containsKey(dependency)) {
                    throw new IllegalArgumentException(
                        "Project " + project.name() + " depends on unknown project " + dependency);
                }
            }
        }
        return new ProjectGraph(Collections.unmodifiableMap(byName));
    }

    public Optional<Project> find(String name) {
        return Optional.ofNullable(projectsByName.get(name));
    }

    public Collection<Project> projects() {
        return projectsByName.values();
    }

    public int size() {
        return projectsByName.size();
    }

    /**
     * 직접 의존하는 프로젝트 조회.
     *
     * @param project 대상 프로젝트
     * @return upstream 프로젝트 (선언 순서)
     */
    public Set<Project> dependenciesOf(Project project) {
        Set<Project> dependencies = new LinkedHashSet<>();
        for (String name : project.dependencies()) {
            dependencies.add(projectsByName.get(name));
        }
        return dependencies;
    }

    /**
     * 선택된 프로젝트와 그 upstream 의존성 전체 ("--to" 선택).
     *
     * @param selection 선택된 프로젝트
     * @return 선택 + 전이적 upstream 프로젝트
     * @throws IllegalArgumentException 그래프에 없는 프로젝트가 포함된 경우
     */
    public Set<Project> withUpstreamClosure(Collection<Project> selection) {
        Set<Project> closure = new LinkedHashSet<>();
        Deque<Project> worklist = new ArrayDeque<>();
        for (Project project : selection) {
            Project known = projectsByName.get(project.name());
            if (!project.equals(known)) {
                throw new IllegalArgumentException("Project is not part of this graph: " + project.name());
            }
            if (closure.add(known)) {
                worklist.add(known);
            }
        }
        while (!worklist.isEmpty()) {
            for (Project dependency : dependenciesOf(worklist.poll())) {
                if (closure.add(dependency)) {
                    worklist.add(dependency);
                }
            }
        }
        return closure;
    }
}
