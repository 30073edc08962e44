package com.ryuqq.monobuild.core.config;

import com.ryuqq.monobuild.core.config.definition.ChoiceAlternative;
import com.ryuqq.monobuild.core.config.definition.ParameterKind;

import java.util.List;

/**
 * choice 파라미터. 값이 지정되지 않으면 기본값이 전달됩니다.
 *
 * <p><strong>불변식:</strong> defaultValue가 있으면 반드시 alternatives 중 하나여야 합니다
 * ({@link ParameterBinder}가 설정 로드 시 검증).</p>
 *
 * @param longName 긴 이름
 * @param shortName 짧은 이름 (null 가능)
 * @param description 설명 (null 가능)
 * @param required 필수 여부
 * @param alternatives 선택지
 * @param defaultValue 기본값 (null 가능)
 * @param associatedCommands 연결된 커맨드 이름
 * @param associatedPhases 연결된 페이즈 이름
 *
 * @author Monobuild Team
 * @since 1.0.0
 */
public record ChoiceParameter(
    String longName,
    String shortName,
    String description,
    boolean required,
    List<ChoiceAlternative> alternatives,
    String defaultValue,
    List<String> associatedCommands,
    List<String> associatedPhases
) implements CommandLineParameter {

    public ChoiceParameter {
        if (longName == null || longName.isBlank()) {
            throw new IllegalArgumentException("longName cannot be null or blank");
        }
        alternatives = List.copyOf(alternatives);
        associatedCommands = List.copyOf(associatedCommands);
        associatedPhases = List.copyOf(associatedPhases);
    }

    @Override
    public ParameterKind kind() {
        return ParameterKind.CHOICE;
    }

    /**
     * 선택지 이름 목록.
     *
     * @return 선언 순서대로의 선택지 이름
     */
    public List<String> alternativeNames() {
        return alternatives.stream().map(ChoiceAlternative::name).toList();
    }

    @Override
    public List<String> toArguments(String value) {
        String effective = value != null ? value : defaultValue;
        return effective == null ? List.of() : List.of(longName, effective);
    }
}
