package com.ryuqq.monobuild.core.config;

import com.ryuqq.monobuild.core.config.definition.CommandLineDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;

/**
 * 검증이 끝난 커맨드라인 설정.
 *
 * <p>생성 시점에 페이즈, 커맨드, 파라미터 순으로 모든 검증을 수행하며,
 * 하나라도 실패하면 {@link ConfigurationException}을 던집니다.
 * 생성된 인스턴스는 실행 단계에서 읽기 전용으로 사용됩니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * CommandLineConfiguration configuration = CommandLineConfiguration.from(definition);
 * PhasedCommand build = configuration.findPhasedCommand("build").orElseThrow();
 * }</pre>
 *
 * @author Monobuild Team
 * @since 1.0.0
 */
public final class CommandLineConfiguration {

    private static final Logger log = LoggerFactory.getLogger(CommandLineConfiguration.class);

    private final PhaseRegistry phaseRegistry;
    private final CommandRegistry commandRegistry;
    private final Map<String, CommandLineParameter> parameters;

    private CommandLineConfiguration(PhaseRegistry phaseRegistry,
                                     CommandRegistry commandRegistry,
                                     Map<String, CommandLineParameter> parameters) {
        this.phaseRegistry = phaseRegistry;
        this.commandRegistry = commandRegistry;
        this.parameters = Collections.unmodifiableMap(parameters);
    }

    /**
     * 기본 옵션으로 설정 생성.
     *
     * @param definition 원시 설정
     * @return 검증된 설정
     * @throws ConfigurationException 검증 실패 시
     */
    public static CommandLineConfiguration from(CommandLineDefinition definition) {
        return from(definition, CommandLineConfigurationOptions.defaults());
    }

    /**
     * 설정 생성.
     *
     * @param definition 원시 설정
     * @param options 생성 옵션
     * @return 검증된 설정
     * @throws ConfigurationException 검증 실패 시
     */
    public static CommandLineConfiguration from(CommandLineDefinition definition,
                                                CommandLineConfigurationOptions options) {
        if (definition == null) {
            throw new IllegalArgumentException("definition cannot be null");
        }
        if (options == null) {
            throw new IllegalArgumentException("options cannot be null");
        }

        PhaseRegistry phaseRegistry = PhaseRegistry.fromDefinitions(definition.phases());
        CommandRegistry commandRegistry = CommandRegistry.fromDefinitions(
            definition.commands(), phaseRegistry, !options.doNotIncludeDefaultBuildCommands());
        Map<String, CommandLineParameter> parameters =
            ParameterBinder.bind(definition.parameters(), phaseRegistry, commandRegistry);

        log.debug("Loaded command-line configuration: {} phases, {} commands, {} parameters",
            phaseRegistry.size(), commandRegistry.asMap().size(), parameters.size());
        return new CommandLineConfiguration(phaseRegistry, commandRegistry, parameters);
    }

    /**
     * 이름으로 페이즈 조회 (bulk 변환으로 생긴 합성 페이즈 포함).
     *
     * @param name 페이즈 이름
     * @return 페이즈
     */
    public Optional<Phase> findPhase(String name) {
        return phaseRegistry.find(name);
    }

    /**
     * 이름으로 커맨드 조회.
     *
     * @param name 커맨드 이름
     * @return 커맨드
     */
    public Optional<Command> findCommand(String name) {
        return commandRegistry.find(name);
    }

    /**
     * 이름으로 phased 커맨드 조회 (bulk에서 변환된 커맨드 포함).
     *
     * @param name 커맨드 이름
     * @return phased 커맨드 (없거나 global이면 empty)
     */
    public Optional<PhasedCommand> findPhasedCommand(String name) {
        return commandRegistry.find(name)
            .filter(PhasedCommand.class::isInstance)
            .map(PhasedCommand.class::cast);
    }

    /**
     * bulk 커맨드가 변환된 합성 페이즈 조회.
     *
     * @param bulkCommandName bulk 커맨드 이름
     * @return 합성 페이즈
     */
    public Optional<Phase> findSyntheticPhase(String bulkCommandName) {
        return commandRegistry.findSyntheticPhase(bulkCommandName);
    }

    /**
     * 이름으로 파라미터 조회.
     *
     * @param longName 파라미터 long name (예: {@code --production})
     * @return 파라미터
     */
    public Optional<CommandLineParameter> findParameter(String longName) {
        return Optional.ofNullable(parameters.get(longName));
    }

    public Map<String, Phase> getPhases() {
        return phaseRegistry.asMap();
    }

    public Map<String, Command> getCommands() {
        return commandRegistry.asMap();
    }

    public Map<String, CommandLineParameter> getParameters() {
        return parameters;
    }
}
