package com.ryuqq.monobuild.core.config.definition;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * command-line.json의 커스텀 파라미터 선언.
 *
 * @param parameterKind 파라미터 종류 (flag, choice, string)
 * @param longName 긴 이름 (예: {@code --production})
 * @param shortName 짧은 이름 (null 가능)
 * @param description 설명 (null 가능)
 * @param associatedCommands 연결된 커맨드 이름
 * @param associatedPhases 연결된 페이즈 이름
 * @param required 필수 여부 (null 가능)
 * @param argumentName string 파라미터의 인자 이름 (null 가능)
 * @param alternatives choice 파라미터의 선택지
 * @param defaultValue choice 파라미터의 기본값 (null 가능)
 *
 * @author Monobuild Team
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ParameterDefinition(
    @JsonProperty("parameterKind") ParameterKind parameterKind,
    @JsonProperty("longName") String longName,
    @JsonProperty("shortName") String shortName,
    @JsonProperty("description") String description,
    @JsonProperty("associatedCommands") List<String> associatedCommands,
    @JsonProperty("associatedPhases") List<String> associatedPhases,
    @JsonProperty("required") Boolean required,
    @JsonProperty("argumentName") String argumentName,
    @JsonProperty("alternatives") List<ChoiceAlternative> alternatives,
    @JsonProperty("defaultValue") String defaultValue
) {

    public ParameterDefinition {
        if (parameterKind == null) {
            throw new IllegalArgumentException("parameterKind cannot be null");
        }
        if (longName == null || longName.isBlank()) {
            throw new IllegalArgumentException("longName cannot be null or blank");
        }
        associatedCommands = associatedCommands == null ? List.of() : List.copyOf(associatedCommands);
        associatedPhases = associatedPhases == null ? List.of() : List.copyOf(associatedPhases);
        alternatives = alternatives == null ? List.of() : List.copyOf(alternatives);
    }

    /**
     * flag 파라미터 선언 생성.
     *
     * @param longName 긴 이름
     * @param associatedCommands 연결된 커맨드 이름
     * @param associatedPhases 연결된 페이즈 이름
     * @return ParameterDefinition 인스턴스
     */
    public static ParameterDefinition flag(String longName, List<String> associatedCommands, List<String> associatedPhases) {
        return new ParameterDefinition(ParameterKind.FLAG, longName, null, null,
            associatedCommands, associatedPhases, null, null, null, null);
    }

    /**
     * string 파라미터 선언 생성.
     *
     * @param longName 긴 이름
     * @param argumentName 인자 이름
     * @param associatedCommands 연결된 커맨드 이름
     * @param associatedPhases 연결된 페이즈 이름
     * @return ParameterDefinition 인스턴스
     */
    public static ParameterDefinition string(String longName, String argumentName,
                                             List<String> associatedCommands, List<String> associatedPhases) {
        return new ParameterDefinition(ParameterKind.STRING, longName, null, null,
            associatedCommands, associatedPhases, null, argumentName, null, null);
    }

    /**
     * choice 파라미터 선언 생성.
     *
     * @param longName 긴 이름
     * @param alternatives 선택지
     * @param defaultValue 기본값 (null 가능)
     * @param associatedCommands 연결된 커맨드 이름
     * @param associatedPhases 연결된 페이즈 이름
     * @return ParameterDefinition 인스턴스
     */
    public static ParameterDefinition choice(String longName, List<ChoiceAlternative> alternatives, String defaultValue,
                                             List<String> associatedCommands, List<String> associatedPhases) {
        return new ParameterDefinition(ParameterKind.CHOICE, longName, null, null,
            associatedCommands, associatedPhases, null, null, alternatives, defaultValue);
    }
}
