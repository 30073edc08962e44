package com.ryuqq.monobuild.core.config;

import com.ryuqq.monobuild.core.config.definition.ChoiceAlternative;
import com.ryuqq.monobuild.core.config.definition.ParameterDefinition;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import static com.ryuqq.monobuild.core.config.ConfigurationConstants.COMMAND_LINE_FILENAME;

/**
 * 커스텀 파라미터를 커맨드와 페이즈에 연결합니다.
 *
 * <p><strong>검증 순서:</strong></p>
 * <ol>
 *   <li>이름 형식 및 중복</li>
 *   <li>choice 기본값이 alternatives에 포함되는지</li>
 *   <li>연결된 커맨드 존재 여부 (bulk에서 변환된 커맨드면 합성 페이즈도 연결)</li>
 *   <li>연결된 페이즈 존재 여부</li>
 *   <li>연결된 커맨드가 하나 이상인지</li>
 *   <li>phased 커맨드에만 연결된 경우 페이즈가 하나 이상인지</li>
 * </ol>
 *
 * <p>phased 커맨드는 실행 시 페이즈 단위로 파라미터를 주입하므로,
 * 페이즈 없이 phased 커맨드에만 연결된 파라미터는 어디에도 전달되지 않습니다.</p>
 *
 * @author Monobuild Team
 * @since 1.0.0
 */
public final class ParameterBinder {

    private static final Pattern LONG_NAME_PATTERN = Pattern.compile("^--[a-z][a-z0-9]*(-[a-z0-9]+)*$");
    private static final Pattern SHORT_NAME_PATTERN = Pattern.compile("^-[a-zA-Z]$");

    private ParameterBinder() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 파라미터 선언을 해석하고 커맨드/페이즈에 연결.
     *
     * @param definitions 파라미터 선언
     * @param phaseRegistry 페이즈 레지스트리
     * @param commandRegistry 커맨드 레지스트리
     * @return longName → 해석된 파라미터 (선언 순서)
     * @throws ConfigurationException 검증 실패 시
     */
    public static Map<String, CommandLineParameter> bind(Iterable<ParameterDefinition> definitions,
                                                         PhaseRegistry phaseRegistry,
                                                         CommandRegistry commandRegistry) {
        if (definitions == null) {
            throw new IllegalArgumentException("definitions cannot be null");
        }
        if (phaseRegistry == null || commandRegistry == null) {
            throw new IllegalArgumentException("registries cannot be null");
        }

        Map<String, CommandLineParameter> parameters = new LinkedHashMap<>();
        for (ParameterDefinition definition : definitions) {
            String longName = definition.longName();
            validateNames(definition);
            if (parameters.containsKey(longName)) {
                throw new ConfigurationException(
                    "In " + COMMAND_LINE_FILENAME + ", the parameter \"" + longName + "\" is specified more than once."
                );
            }

            validateChoiceDefault(definition);

            List<Command> commands = new ArrayList<>();
            Set<Phase> phases = new LinkedHashSet<>();
            boolean onlyPhasedCommands = true;

            for (String commandName : definition.associatedCommands()) {
                Command command = commandRegistry.find(commandName).orElseThrow(() -> new ConfigurationException(
                    COMMAND_LINE_FILENAME + " defines a parameter \"" + longName
                        + "\" that is associated with a command \"" + commandName + "\" that does not exist."
                ));
                // bulk에서 변환된 커맨드만 합성 페이즈를 가짐 (기본 rebuild는 해당 없음)
                commandRegistry.findSyntheticPhase(commandName).ifPresent(phases::add);
                if (command instanceof GlobalCommand) {
                    onlyPhasedCommands = false;
                }
                commands.add(command);
            }

            for (String phaseName : definition.associatedPhases()) {
                Phase phase = phaseRegistry.find(phaseName).orElseThrow(() -> new ConfigurationException(
                    COMMAND_LINE_FILENAME + " defines a parameter \"" + longName
                        + "\" that is associated with a phase \"" + phaseName + "\" that does not exist."
                ));
                phases.add(phase);
            }

            if (commands.isEmpty()) {
                throw new ConfigurationException(
                    COMMAND_LINE_FILENAME + " defines a parameter \"" + longName
                        + "\" that lists no associated commands."
                );
            }
            if (onlyPhasedCommands && phases.isEmpty()) {
                throw new ConfigurationException(
                    COMMAND_LINE_FILENAME + " defines a parameter \"" + longName
                        + "\" that is only associated with phased commands, but lists no associated phases."
                );
            }

            CommandLineParameter parameter = create(definition, phases);
            for (Command command : commands) {
                attach(command, parameter);
            }
            for (Phase phase : phases) {
                phase.addAssociatedParameter(parameter);
            }
            parameters.put(longName, parameter);
        }
        return parameters;
    }

    private static void validateNames(ParameterDefinition definition) {
        if (!LONG_NAME_PATTERN.matcher(definition.longName()).matches()) {
            throw new ConfigurationException(
                "In " + COMMAND_LINE_FILENAME + ", the parameter name \"" + definition.longName()
                    + "\" is invalid. It must be lower case, start with \"--\" and use hyphens as word separators."
            );
        }
        if (definition.shortName() != null && !SHORT_NAME_PATTERN.matcher(definition.shortName()).matches()) {
            throw new ConfigurationException(
                "In " + COMMAND_LINE_FILENAME + ", the short name \"" + definition.shortName()
                    + "\" of the parameter \"" + definition.longName() + "\" must be a dash followed by a single letter."
            );
        }
    }

    private static void validateChoiceDefault(ParameterDefinition definition) {
        switch (definition.parameterKind()) {
            case CHOICE -> {
                if (definition.alternatives().isEmpty()) {
                    throw new ConfigurationException(
                        "In " + COMMAND_LINE_FILENAME + ", the choice parameter \"" + definition.longName()
                            + "\" does not define any alternatives."
                    );
                }
                String defaultValue = definition.defaultValue();
                if (defaultValue != null && definition.alternatives().stream()
                    .noneMatch(alternative -> alternative.name().equals(defaultValue))) {
                    String names = definition.alternatives().stream()
                        .map(ChoiceAlternative::name)
                        .collect(Collectors.joining(","));
                    throw new ConfigurationException(
                        "In " + COMMAND_LINE_FILENAME + ", the parameter \"" + definition.longName()
                            + "\", specifies a default value \"" + defaultValue
                            + "\" which is not one of the defined alternatives: \"" + names + "\""
                    );
                }
            }
            case STRING -> {
                if (definition.argumentName() == null || definition.argumentName().isBlank()) {
                    throw new ConfigurationException(
                        "In " + COMMAND_LINE_FILENAME + ", the string parameter \"" + definition.longName()
                            + "\" does not define an \"argumentName\"."
                    );
                }
            }
            case FLAG -> {
                // 추가 검증 없음
            }
        }
    }

    private static CommandLineParameter create(ParameterDefinition definition, Set<Phase> phases) {
        boolean required = Boolean.TRUE.equals(definition.required());
        List<String> phaseNames = phases.stream().map(Phase::getName).toList();
        return switch (definition.parameterKind()) {
            case FLAG -> new FlagParameter(
                definition.longName(), definition.shortName(), definition.description(), required,
                definition.associatedCommands(), phaseNames);
            case STRING -> new StringParameter(
                definition.longName(), definition.shortName(), definition.description(), required,
                definition.argumentName(), definition.associatedCommands(), phaseNames);
            case CHOICE -> new ChoiceParameter(
                definition.longName(), definition.shortName(), definition.description(), required,
                definition.alternatives(), definition.defaultValue(), definition.associatedCommands(), phaseNames);
        };
    }

    private static void attach(Command command, CommandLineParameter parameter) {
        if (command instanceof PhasedCommand phased) {
            phased.addAssociatedParameter(parameter);
        } else if (command instanceof GlobalCommand global) {
            global.addAssociatedParameter(parameter);
        }
    }
}
