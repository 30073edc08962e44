package com.ryuqq.monobuild.core.config.definition;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * command-line.json의 페이즈 선언.
 *
 * <p>이름 형식과 의존성 해석은 {@code PhaseRegistry}가 검증합니다.</p>
 *
 * @param name 페이즈 이름 (예: {@code _phase:compile})
 * @param dependencies self/upstream 의존성 (null이면 없음)
 * @param ignoreMissingScript 스크립트가 없는 프로젝트를 NO_OP으로 처리할지 여부 (null 가능)
 * @param allowWarningsOnSuccess 경고를 성공으로 인정할지 여부 (null 가능)
 *
 * @author Monobuild Team
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PhaseDefinition(
    @JsonProperty("name") String name,
    @JsonProperty("dependencies") PhaseDependenciesDefinition dependencies,
    @JsonProperty("ignoreMissingScript") Boolean ignoreMissingScript,
    @JsonProperty("allowWarningsOnSuccess") Boolean allowWarningsOnSuccess
) {

    public PhaseDefinition {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("phase name cannot be null or blank");
        }
        if (dependencies == null) {
            dependencies = PhaseDependenciesDefinition.none();
        }
    }

    /**
     * 의존성과 플래그 없이 페이즈 선언 생성.
     *
     * @param name 페이즈 이름
     * @return PhaseDefinition 인스턴스
     */
    public static PhaseDefinition of(String name) {
        return new PhaseDefinition(name, null, null, null);
    }
}
