package com.ryuqq.monobuild.core.config.definition;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 커스텀 파라미터 종류.
 *
 * @author Monobuild Team
 * @since 1.0.0
 */
public enum ParameterKind {

    /** 값 없는 on/off 플래그. */
    @JsonProperty("flag")
    FLAG,

    /** 열거된 대안 중 하나를 선택. */
    @JsonProperty("choice")
    CHOICE,

    /** 임의 문자열 값. */
    @JsonProperty("string")
    STRING
}
