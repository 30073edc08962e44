package com.ryuqq.monobuild.core.config;

import com.ryuqq.monobuild.core.config.definition.ParameterKind;

import java.util.List;

/**
 * string 파라미터. 지정되면 {@code --name value} 형태로 전달됩니다.
 *
 * @param longName 긴 이름
 * @param shortName 짧은 이름 (null 가능)
 * @param description 설명 (null 가능)
 * @param required 필수 여부
 * @param argumentName 도움말에 표시할 인자 이름 (null 가능)
 * @param associatedCommands 연결된 커맨드 이름
 * @param associatedPhases 연결된 페이즈 이름
 *
 * @author Monobuild Team
 * @since 1.0.0
 */
public record StringParameter(
    String longName,
    String shortName,
    String description,
    boolean required,
    String argumentName,
    List<String> associatedCommands,
    List<String> associatedPhases
) implements CommandLineParameter {

    public StringParameter {
        if (longName == null || longName.isBlank()) {
            throw new IllegalArgumentException("longName cannot be null or blank");
        }
        associatedCommands = List.copyOf(associatedCommands);
        associatedPhases = List.copyOf(associatedPhases);
    }

    @Override
    public ParameterKind kind() {
        return ParameterKind.STRING;
    }

    @Override
    public List<String> toArguments(String value) {
        return value == null ? List.of() : List.of(longName, value);
    }
}
