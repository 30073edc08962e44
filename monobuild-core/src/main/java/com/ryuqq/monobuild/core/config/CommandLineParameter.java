package com.ryuqq.monobuild.core.config;

import com.ryuqq.monobuild.core.config.definition.ParameterKind;

import java.util.List;

/**
 * 해석된 커스텀 파라미터.
 *
 * <p>세 가지 종류가 있습니다:</p>
 * <ul>
 *   <li>{@link FlagParameter}: 값 없는 플래그</li>
 *   <li>{@link ChoiceParameter}: 열거된 선택지 중 하나</li>
 *   <li>{@link StringParameter}: 임의 문자열</li>
 * </ul>
 *
 * <p>Sealed interface로 정의되어 모든 종류를 컴파일 타임에 검증합니다.</p>
 *
 * @author Monobuild Team
 * @since 1.0.0
 */
public sealed interface CommandLineParameter permits FlagParameter, ChoiceParameter, StringParameter {

    /**
     * 파라미터 종류.
     *
     * @return FLAG, CHOICE, STRING
     */
    ParameterKind kind();

    /**
     * 긴 이름 (예: {@code --production}).
     *
     * @return 긴 이름
     */
    String longName();

    /**
     * 짧은 이름.
     *
     * @return 짧은 이름 또는 null
     */
    String shortName();

    /**
     * 설명.
     *
     * @return 설명 또는 null
     */
    String description();

    /**
     * 필수 여부.
     *
     * @return 필수 파라미터면 true
     */
    boolean required();

    /**
     * 연결된 커맨드 이름.
     *
     * @return 커맨드 이름 목록
     */
    List<String> associatedCommands();

    /**
     * 연결된 페이즈 이름 (bulk 커맨드의 합성 페이즈 포함).
     *
     * @return 페이즈 이름 목록
     */
    List<String> associatedPhases();

    /**
     * 주어진 값을 커맨드 라인 인자로 변환.
     *
     * @param value 사용자가 지정한 값 (null이면 지정되지 않음)
     * @return 스크립트 뒤에 붙일 인자 목록 (없으면 빈 목록)
     */
    List<String> toArguments(String value);
}
