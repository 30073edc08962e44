package com.ryuqq.monobuild.core.config.definition;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * 페이즈 의존성 선언 (이름 기준, 아직 해석되지 않음).
 *
 * @param self 같은 프로젝트에서 먼저 실행되어야 하는 페이즈 이름 목록
 * @param upstream 모든 상위(의존) 프로젝트에서 먼저 실행되어야 하는 페이즈 이름 목록
 *
 * @author Monobuild Team
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PhaseDependenciesDefinition(
    @JsonProperty("self") List<String> self,
    @JsonProperty("upstream") List<String> upstream
) {

    public PhaseDependenciesDefinition {
        self = self == null ? List.of() : List.copyOf(self);
        upstream = upstream == null ? List.of() : List.copyOf(upstream);
    }

    /**
     * 의존성 없는 선언.
     *
     * @return self, upstream 모두 비어 있는 인스턴스
     */
    public static PhaseDependenciesDefinition none() {
        return new PhaseDependenciesDefinition(List.of(), List.of());
    }
}
