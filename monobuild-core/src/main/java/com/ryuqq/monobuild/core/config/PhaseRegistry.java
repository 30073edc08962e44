package com.ryuqq.monobuild.core.config;

import com.ryuqq.monobuild.core.config.definition.PhaseDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import static com.ryuqq.monobuild.core.config.ConfigurationConstants.COMMAND_LINE_FILENAME;
import static com.ryuqq.monobuild.core.config.ConfigurationConstants.PHASE_NAME_PREFIX;

/**
 * 페이즈 선언을 검증하고 상호 참조된 {@link Phase} 그래프로 해석합니다.
 *
 * <p><strong>검증 항목:</strong></p>
 * <ul>
 *   <li>이름 중복</li>
 *   <li>이름 형식: {@code _phase:} 접두사 + 소문자/숫자, 하이픈으로 구분, 하이픈으로 끝나지 않음</li>
 *   <li>self/upstream 의존성이 존재하는 페이즈를 참조하는지</li>
 *   <li>self 의존성 순환 (DFS, white/gray/black 3색 방문)</li>
 * </ul>
 *
 * <p>upstream 의존성은 항상 다른 프로젝트의 Operation으로 해석되므로 순환 검사 대상이 아닙니다.</p>
 *
 * <p>bulk 커맨드의 합성 페이즈는 {@link CommandRegistry}가 변환 중에 등록합니다.</p>
 *
 * @author Monobuild Team
 * @since 1.0.0
 */
public final class PhaseRegistry {

    private static final Logger log = LoggerFactory.getLogger(PhaseRegistry.class);

    private static final Pattern PHASE_NAME_PATTERN =
        Pattern.compile("^" + Pattern.quote(PHASE_NAME_PREFIX) + "[a-z][a-z0-9]*([-][a-z0-9]+)*$");

    private enum VisitState { IN_PATH, CYCLE_FREE }

    private final Map<String, Phase> phasesByName = new LinkedHashMap<>();

    private PhaseRegistry() {
    }

    /**
     * 빈 레지스트리 생성.
     *
     * @return 페이즈가 없는 PhaseRegistry
     */
    public static PhaseRegistry empty() {
        return new PhaseRegistry();
    }

    /**
     * 페이즈 선언으로부터 레지스트리 생성.
     *
     * @param definitions 페이즈 선언 (선언 순서 유지)
     * @return 검증된 PhaseRegistry
     * @throws ConfigurationException 검증 실패 시
     */
    public static PhaseRegistry fromDefinitions(List<PhaseDefinition> definitions) {
        if (definitions == null) {
            throw new IllegalArgumentException("definitions cannot be null");
        }
        PhaseRegistry registry = new PhaseRegistry();

        // 1. 이름 검증 및 Phase 생성
        for (PhaseDefinition definition : definitions) {
            String name = definition.name();
            if (registry.phasesByName.containsKey(name)) {
                throw new ConfigurationException(
                    "In " + COMMAND_LINE_FILENAME + ", the phase \"" + name + "\" is specified more than once."
                );
            }
            if (!PHASE_NAME_PATTERN.matcher(name).matches()) {
                throw new ConfigurationException(
                    "In " + COMMAND_LINE_FILENAME + ", the phase \"" + name + "\"'s name is not a valid phase name. "
                        + "Phase names must begin with the required prefix \"" + PHASE_NAME_PREFIX + "\" followed by "
                        + "a name containing lowercase letters, numbers, or hyphens. The name must start with a "
                        + "letter and must not end with a hyphen."
                );
            }
            registry.phasesByName.put(name, new Phase(
                name,
                false,
                Boolean.TRUE.equals(definition.ignoreMissingScript()),
                Boolean.TRUE.equals(definition.allowWarningsOnSuccess())
            ));
        }

        // 2. 의존성 이름을 Phase 객체로 해석
        for (PhaseDefinition definition : definitions) {
            Phase phase = registry.phasesByName.get(definition.name());

            for (String dependencyName : definition.dependencies().self()) {
                Phase dependency = registry.phasesByName.get(dependencyName);
                if (dependency == null) {
                    throw new ConfigurationException(
                        "In " + COMMAND_LINE_FILENAME + ", in the phase \"" + phase.getName() + "\", the self "
                            + "dependency phase \"" + dependencyName + "\" does not exist."
                    );
                }
                phase.addSelfDependency(dependency);
            }

            for (String dependencyName : definition.dependencies().upstream()) {
                Phase dependency = registry.phasesByName.get(dependencyName);
                if (dependency == null) {
                    throw new ConfigurationException(
                        "In " + COMMAND_LINE_FILENAME + ", in the phase \"" + phase.getName() + "\", the upstream "
                            + "dependency phase \"" + dependencyName + "\" does not exist."
                    );
                }
                phase.addUpstreamDependency(dependency);
            }
        }

        // 3. self 의존성 순환 검사
        Map<Phase, VisitState> visitStates = new HashMap<>();
        for (Phase phase : registry.phasesByName.values()) {
            registry.checkForSelfCycles(phase, new ArrayList<>(), visitStates);
        }

        log.debug("Resolved {} phases", registry.phasesByName.size());
        return registry;
    }

    /**
     * self 의존성 그래프를 깊이 우선 탐색하여 순환을 찾습니다.
     *
     * @param phase 현재 방문 중인 페이즈
     * @param path 시작 페이즈부터 현재 페이즈 직전까지의 경로
     * @param visitStates IN_PATH(gray) 또는 CYCLE_FREE(black). 없으면 미방문(white)
     * @throws ConfigurationException back-edge 발견 시 (순환 경로를 순회 순서대로 나열)
     */
    private void checkForSelfCycles(Phase phase, List<Phase> path, Map<Phase, VisitState> visitStates) {
        VisitState state = visitStates.get(phase);
        if (state == VisitState.CYCLE_FREE) {
            return;
        }
        if (state == VisitState.IN_PATH) {
            List<Phase> cycle = new ArrayList<>(path.subList(path.indexOf(phase), path.size()));
            cycle.add(phase);
            throw new ConfigurationException(
                "In " + COMMAND_LINE_FILENAME + ", there exists a cycle within the set of " + phase.getName()
                    + " dependencies: " + cycle.stream().map(Phase::getName).collect(Collectors.joining(", "))
            );
        }

        visitStates.put(phase, VisitState.IN_PATH);
        path.add(phase);
        for (Phase dependency : phase.getSelfDependencies()) {
            checkForSelfCycles(dependency, path, visitStates);
        }
        path.remove(path.size() - 1);
        visitStates.put(phase, VisitState.CYCLE_FREE);
    }

    /**
     * bulk 커맨드에서 생성된 합성 페이즈 등록.
     *
     * @param phase 합성 페이즈
     */
    void registerSynthetic(Phase phase) {
        phasesByName.put(phase.getName(), phase);
    }

    /**
     * 이름으로 페이즈 조회.
     *
     * @param name 페이즈 이름
     * @return 페이즈 (없으면 empty)
     */
    public Optional<Phase> find(String name) {
        return Optional.ofNullable(phasesByName.get(name));
    }

    /**
     * 등록된 모든 페이즈 (등록 순서).
     *
     * @return 이름 → 페이즈 읽기 전용 맵
     */
    public Map<String, Phase> asMap() {
        return Collections.unmodifiableMap(phasesByName);
    }

    public int size() {
        return phasesByName.size();
    }
}
