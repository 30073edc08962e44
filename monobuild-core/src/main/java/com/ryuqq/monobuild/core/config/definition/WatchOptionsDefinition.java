package com.ryuqq.monobuild.core.config.definition;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * phased 커맨드의 watch 모드 옵션.
 *
 * @param alwaysWatch CLI 플래그와 무관하게 항상 watch 모드로 실행할지 여부
 * @param watchPhases watch 모드에서 실행할 페이즈 이름 (암묵적 확장 없음)
 *
 * @author Monobuild Team
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record WatchOptionsDefinition(
    @JsonProperty("alwaysWatch") boolean alwaysWatch,
    @JsonProperty("watchPhases") List<String> watchPhases
) {

    public WatchOptionsDefinition {
        watchPhases = watchPhases == null ? List.of() : List.copyOf(watchPhases);
    }
}
