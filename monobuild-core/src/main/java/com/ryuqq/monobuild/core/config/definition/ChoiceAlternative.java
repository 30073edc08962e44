package com.ryuqq.monobuild.core.config.definition;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * choice 파라미터의 선택지.
 *
 * @param name 선택지 이름
 * @param description 설명 (null 가능)
 *
 * @author Monobuild Team
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ChoiceAlternative(
    @JsonProperty("name") String name,
    @JsonProperty("description") String description
) {

    public ChoiceAlternative {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("alternative name cannot be null or blank");
        }
    }
}
