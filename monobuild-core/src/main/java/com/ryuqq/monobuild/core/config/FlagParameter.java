package com.ryuqq.monobuild.core.config;

import com.ryuqq.monobuild.core.config.definition.ParameterKind;

import java.util.List;

/**
 * flag 파라미터. 지정되면 긴 이름만 인자로 전달됩니다.
 *
 * @param longName 긴 이름
 * @param shortName 짧은 이름 (null 가능)
 * @param description 설명 (null 가능)
 * @param required 필수 여부
 * @param associatedCommands 연결된 커맨드 이름
 * @param associatedPhases 연결된 페이즈 이름
 *
 * @author Monobuild Team
 * @since 1.0.0
 */
public record FlagParameter(
    String longName,
    String shortName,
    String description,
    boolean required,
    List<String> associatedCommands,
    List<String> associatedPhases
) implements CommandLineParameter {

    public FlagParameter {
        if (longName == null || longName.isBlank()) {
            throw new IllegalArgumentException("longName cannot be null or blank");
        }
        associatedCommands = List.copyOf(associatedCommands);
        associatedPhases = List.copyOf(associatedPhases);
    }

    @Override
    public ParameterKind kind() {
        return ParameterKind.FLAG;
    }

    @Override
    public List<String> toArguments(String value) {
        return Boolean.parseBoolean(value) ? List.of(longName) : List.of();
    }
}
