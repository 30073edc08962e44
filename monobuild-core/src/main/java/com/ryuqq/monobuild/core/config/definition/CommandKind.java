package com.ryuqq.monobuild.core.config.definition;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 커맨드 종류.
 *
 * <ul>
 *   <li>GLOBAL: 프로젝트 그래프와 무관하게 한 번 실행</li>
 *   <li>BULK: 레거시 단일 페이즈 커맨드. 로드 시 PHASED로 변환됨</li>
 *   <li>PHASED: 선언된 페이즈 집합을 프로젝트마다 실행</li>
 * </ul>
 *
 * @author Monobuild Team
 * @since 1.0.0
 */
public enum CommandKind {

    @JsonProperty("global")
    GLOBAL("global"),

    @JsonProperty("bulk")
    BULK("bulk"),

    @JsonProperty("phased")
    PHASED("phased");

    private final String jsonValue;

    CommandKind(String jsonValue) {
        this.jsonValue = jsonValue;
    }

    /**
     * command-line.json에서 사용하는 이름.
     *
     * @return 소문자 커맨드 종류 이름
     */
    public String jsonValue() {
        return jsonValue;
    }
}
