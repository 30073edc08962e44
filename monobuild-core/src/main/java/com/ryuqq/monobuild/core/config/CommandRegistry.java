package com.ryuqq.monobuild.core.config;

import com.ryuqq.monobuild.core.config.definition.CommandDefinition;
import com.ryuqq.monobuild.core.config.definition.CommandKind;
import com.ryuqq.monobuild.core.config.definition.WatchOptionsDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static com.ryuqq.monobuild.core.config.ConfigurationConstants.BUILD_COMMAND_NAME;
import static com.ryuqq.monobuild.core.config.ConfigurationConstants.COMMAND_LINE_FILENAME;
import static com.ryuqq.monobuild.core.config.ConfigurationConstants.REBUILD_COMMAND_NAME;

/**
 * 커맨드 선언을 검증하고 해석된 {@link Command}로 변환합니다.
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * For each CommandDefinition:
 *   1. 이름 중복 검사
 *   2. 종류별 정규화:
 *      - phased → 페이즈 이름 해석 + self/upstream 전이적 확장, watchPhases는 그대로
 *      - global → GlobalCommand
 *      - bulk   → 합성 페이즈 하나를 가진 PhasedCommand로 변환
 *   3. build/rebuild 제약 검사 (global 금지, safeForSimultaneousRushProcesses 금지)
 * 기본값 적용:
 *   - build 없음 → 기본 bulk build 추가
 *   - rebuild 없음 → build의 phases, associatedParameters를 공유하는 합성 rebuild 추가
 * </pre>
 *
 * @author Monobuild Team
 * @since 1.0.0
 */
public final class CommandRegistry {

    private static final Logger log = LoggerFactory.getLogger(CommandRegistry.class);

    private final PhaseRegistry phaseRegistry;
    private final Map<String, Command> commandsByName = new LinkedHashMap<>();
    private final Map<String, Phase> syntheticPhasesByBulkCommandName = new LinkedHashMap<>();

    private CommandRegistry(PhaseRegistry phaseRegistry) {
        this.phaseRegistry = phaseRegistry;
    }

    /**
     * 커맨드 선언으로부터 레지스트리 생성.
     *
     * @param definitions 커맨드 선언 (선언 순서 유지)
     * @param phaseRegistry 해석된 페이즈 (bulk 변환 시 합성 페이즈가 추가됨)
     * @param includeDefaultBuildCommands 누락된 build/rebuild 기본 커맨드를 추가할지 여부
     * @return 검증된 CommandRegistry
     * @throws ConfigurationException 검증 실패 시
     */
    public static CommandRegistry fromDefinitions(Iterable<CommandDefinition> definitions,
                                                  PhaseRegistry phaseRegistry,
                                                  boolean includeDefaultBuildCommands) {
        if (definitions == null) {
            throw new IllegalArgumentException("definitions cannot be null");
        }
        if (phaseRegistry == null) {
            throw new IllegalArgumentException("phaseRegistry cannot be null");
        }

        CommandRegistry registry = new CommandRegistry(phaseRegistry);
        PhasedCommand buildCommand = null;

        for (CommandDefinition definition : definitions) {
            if (registry.commandsByName.containsKey(definition.name())) {
                throw new ConfigurationException(
                    "In " + COMMAND_LINE_FILENAME + ", the command \"" + definition.name()
                        + "\" is specified more than once."
                );
            }

            Command command = switch (definition.commandKind()) {
                case PHASED -> registry.normalizePhasedCommand(definition);
                case GLOBAL -> new GlobalCommand(
                    definition.name(),
                    definition.summary(),
                    definition.description(),
                    Boolean.TRUE.equals(definition.safeForSimultaneousRushProcesses()),
                    definition.shellCommand()
                );
                case BULK -> registry.translateBulkCommand(definition);
            };

            if (isBuildOrRebuild(command.getName())) {
                validateBuildCommand(command, definition);
                if (BUILD_COMMAND_NAME.equals(command.getName())) {
                    buildCommand = (PhasedCommand) command;
                }
            }

            registry.commandsByName.put(command.getName(), command);
        }

        if (includeDefaultBuildCommands) {
            registry.applyDefaultBuildCommands(buildCommand);
        }

        log.debug("Resolved {} commands ({} translated from bulk)",
            registry.commandsByName.size(), registry.syntheticPhasesByBulkCommandName.size());
        return registry;
    }

    private static boolean isBuildOrRebuild(String name) {
        return BUILD_COMMAND_NAME.equals(name) || REBUILD_COMMAND_NAME.equals(name);
    }

    /**
     * build/rebuild 제약 검사.
     *
     * @param command 정규화된 커맨드
     * @param definition 원본 선언 (safeForSimultaneousRushProcesses 확인용)
     * @throws ConfigurationException global 종류이거나 safeForSimultaneousRushProcesses=true인 경우
     */
    private static void validateBuildCommand(Command command, CommandDefinition definition) {
        if (command.getKind() == CommandKind.GLOBAL) {
            throw new ConfigurationException(
                COMMAND_LINE_FILENAME + " defines a command \"" + command.getName() + "\" using the command kind \""
                    + CommandKind.GLOBAL.jsonValue() + "\". This command can only be designated as a command kind \""
                    + CommandKind.BULK.jsonValue() + "\" or \"" + CommandKind.PHASED.jsonValue() + "\"."
            );
        }
        if (Boolean.TRUE.equals(definition.safeForSimultaneousRushProcesses())) {
            throw new ConfigurationException(
                COMMAND_LINE_FILENAME + " defines a command \"" + command.getName() + "\" using "
                    + "\"safeForSimultaneousRushProcesses=true\". This configuration is not supported for \""
                    + command.getName() + "\"."
            );
        }
    }

    /**
     * phased 커맨드 정규화.
     *
     * <p>선언된 페이즈에서 시작하여 self/upstream 의존성을 따라 너비 우선으로 확장합니다.
     * 작업 목록에 추가된 페이즈도 다시 방문하므로 결과는 의존성에 대해 닫혀 있습니다.</p>
     */
    private PhasedCommand normalizePhasedCommand(CommandDefinition definition) {
        Set<Phase> commandPhases = new LinkedHashSet<>();
        for (String phaseName : definition.phaseNames()) {
            Phase phase = phaseRegistry.find(phaseName).orElseThrow(() -> new ConfigurationException(
                "In " + COMMAND_LINE_FILENAME + ", in the \"phases\" property of the \"" + definition.name()
                    + "\" command, the phase \"" + phaseName + "\" does not exist."
            ));
            commandPhases.add(phase);
        }

        Deque<Phase> worklist = new ArrayDeque<>(commandPhases);
        while (!worklist.isEmpty()) {
            Phase phase = worklist.poll();
            for (Phase dependency : phase.getSelfDependencies()) {
                if (commandPhases.add(dependency)) {
                    worklist.add(dependency);
                }
            }
            for (Phase dependency : phase.getUpstreamDependencies()) {
                if (commandPhases.add(dependency)) {
                    worklist.add(dependency);
                }
            }
        }

        Set<Phase> watchPhases = new LinkedHashSet<>();
        boolean alwaysWatch = false;
        WatchOptionsDefinition watchOptions = definition.watchOptions();
        if (watchOptions != null) {
            alwaysWatch = watchOptions.alwaysWatch();
            for (String phaseName : watchOptions.watchPhases()) {
                Phase phase = phaseRegistry.find(phaseName).orElseThrow(() -> new ConfigurationException(
                    "In " + COMMAND_LINE_FILENAME + ", in the \"watchPhases\" property of the \"" + definition.name()
                        + "\" command, the phase \"" + phaseName + "\" does not exist."
                ));
                watchPhases.add(phase);
            }
        }

        return new PhasedCommand(
            definition.name(),
            definition.summary(),
            definition.description(),
            Boolean.TRUE.equals(definition.safeForSimultaneousRushProcesses()),
            false,
            !Boolean.FALSE.equals(definition.enableParallelism()),
            !Boolean.FALSE.equals(definition.incremental()),
            Boolean.TRUE.equals(definition.disableBuildCache()),
            alwaysWatch,
            commandPhases,
            watchPhases,
            new LinkedHashSet<>()
        );
    }

    /**
     * bulk 커맨드를 합성 페이즈 하나를 가진 phased 커맨드로 변환.
     *
     * <p>ignoreDependencyOrder가 설정되지 않으면 합성 페이즈는 자기 자신을 upstream 의존성으로 가집니다
     * (의존 프로젝트를 먼저 빌드).</p>
     */
    private PhasedCommand translateBulkCommand(CommandDefinition definition) {
        Phase phase = new Phase(
            definition.name(),
            true,
            Boolean.TRUE.equals(definition.ignoreMissingScript()),
            Boolean.TRUE.equals(definition.allowWarningsInSuccessfulBuild())
        );
        if (!Boolean.TRUE.equals(definition.ignoreDependencyOrder())) {
            phase.addUpstreamDependency(phase);
        }

        phaseRegistry.registerSynthetic(phase);
        syntheticPhasesByBulkCommandName.put(definition.name(), phase);

        Set<Phase> phases = new LinkedHashSet<>();
        phases.add(phase);
        boolean watchForChanges = Boolean.TRUE.equals(definition.watchForChanges());

        return new PhasedCommand(
            definition.name(),
            definition.summary(),
            definition.description(),
            Boolean.TRUE.equals(definition.safeForSimultaneousRushProcesses()),
            true,
            !Boolean.FALSE.equals(definition.enableParallelism()),
            !Boolean.FALSE.equals(definition.incremental()),
            Boolean.TRUE.equals(definition.disableBuildCache()),
            watchForChanges,
            phases,
            // bulk 커맨드는 watch 모드에서도 같은 페이즈를 사용
            watchForChanges ? phases : new LinkedHashSet<>(),
            new LinkedHashSet<>()
        );
    }

    private void applyDefaultBuildCommands(PhasedCommand declaredBuildCommand) {
        PhasedCommand buildCommand = declaredBuildCommand;
        if (!commandsByName.containsKey(BUILD_COMMAND_NAME)) {
            buildCommand = translateBulkCommand(DefaultCommands.BUILD);
            commandsByName.put(buildCommand.getName(), buildCommand);
            log.debug("Added default \"{}\" command", BUILD_COMMAND_NAME);
        }

        if (!commandsByName.containsKey(REBUILD_COMMAND_NAME)) {
            if (buildCommand == null) {
                throw new IllegalStateException("Phases for the \"" + BUILD_COMMAND_NAME + "\" were not found.");
            }
            CommandDefinition defaults = DefaultCommands.REBUILD;
            PhasedCommand rebuildCommand = new PhasedCommand(
                defaults.name(),
                defaults.summary(),
                defaults.description(),
                false,
                true,
                !Boolean.FALSE.equals(defaults.enableParallelism()),
                false,
                Boolean.TRUE.equals(defaults.disableBuildCache()),
                false,
                buildCommand.mutablePhases(),
                new LinkedHashSet<>(),
                buildCommand.mutableAssociatedParameters()
            );
            commandsByName.put(rebuildCommand.getName(), rebuildCommand);
            log.debug("Added default \"{}\" command sharing the phases of \"{}\"", REBUILD_COMMAND_NAME, BUILD_COMMAND_NAME);
        }
    }

    /**
     * 이름으로 커맨드 조회.
     *
     * @param name 커맨드 이름
     * @return 커맨드 (없으면 empty)
     */
    public Optional<Command> find(String name) {
        return Optional.ofNullable(commandsByName.get(name));
    }

    /**
     * bulk 커맨드 이름으로 변환된 합성 페이즈 조회.
     *
     * @param bulkCommandName bulk 커맨드 이름
     * @return 합성 페이즈 (bulk에서 변환되지 않았으면 empty)
     */
    public Optional<Phase> findSyntheticPhase(String bulkCommandName) {
        return Optional.ofNullable(syntheticPhasesByBulkCommandName.get(bulkCommandName));
    }

    /**
     * 모든 커맨드 (등록 순서).
     *
     * @return 이름 → 커맨드 읽기 전용 맵
     */
    public Map<String, Command> asMap() {
        return Collections.unmodifiableMap(commandsByName);
    }
}
