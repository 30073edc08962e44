package com.ryuqq.monobuild.core.config.definition;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * command-line.json 전체 선언 (구조 검증 이후, 의미 검증 이전).
 *
 * @param phases 페이즈 선언
 * @param commands 커맨드 선언
 * @param parameters 커스텀 파라미터 선언
 *
 * @author Monobuild Team
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CommandLineDefinition(
    @JsonProperty("phases") List<PhaseDefinition> phases,
    @JsonProperty("commands") List<CommandDefinition> commands,
    @JsonProperty("parameters") List<ParameterDefinition> parameters
) {

    public CommandLineDefinition {
        phases = phases == null ? List.of() : List.copyOf(phases);
        commands = commands == null ? List.of() : List.copyOf(commands);
        parameters = parameters == null ? List.of() : List.copyOf(parameters);
    }

    /**
     * 아무것도 선언하지 않은 정의.
     *
     * @return 빈 CommandLineDefinition
     */
    public static CommandLineDefinition empty() {
        return new CommandLineDefinition(List.of(), List.of(), List.of());
    }
}
