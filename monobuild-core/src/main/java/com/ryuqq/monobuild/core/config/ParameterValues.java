package com.ryuqq.monobuild.core.config;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 한 번의 커맨드 호출에서 사용자가 지정한 커스텀 파라미터 값.
 *
 * <p>CLI 파싱은 외부 협력자의 책임이며, 이 클래스는 그 결과(긴 이름 → 값)만 보관합니다.
 * flag 파라미터는 값 {@code "true"}로 표현합니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 *
 * @author Monobuild Team
 * @since 1.0.0
 */
public final class ParameterValues {

    private static final ParameterValues EMPTY = new ParameterValues(Map.of());

    private final Map<String, String> valuesByLongName;

    private ParameterValues(Map<String, String> valuesByLongName) {
        this.valuesByLongName = Map.copyOf(valuesByLongName);
    }

    /**
     * 값이 하나도 없는 인스턴스.
     *
     * @return 빈 ParameterValues
     */
    public static ParameterValues empty() {
        return EMPTY;
    }

    /**
     * ParameterValues 생성.
     *
     * @param valuesByLongName 긴 이름 → 값
     * @return ParameterValues 인스턴스
     * @throws IllegalArgumentException map이 null인 경우
     */
    public static ParameterValues of(Map<String, String> valuesByLongName) {
        if (valuesByLongName == null) {
            throw new IllegalArgumentException("valuesByLongName cannot be null");
        }
        return new ParameterValues(new LinkedHashMap<>(valuesByLongName));
    }

    /**
     * 값 조회.
     *
     * @param longName 긴 이름
     * @return 값 또는 null
     */
    public String get(String longName) {
        return valuesByLongName.get(longName);
    }

    /**
     * 주어진 파라미터들의 값을 커맨드 라인 인자로 변환.
     *
     * @param parameters 페이즈 또는 커맨드에 연결된 파라미터 (순서 유지)
     * @return 인자 목록
     */
    public List<String> toArguments(Collection<CommandLineParameter> parameters) {
        List<String> arguments = new ArrayList<>();
        for (CommandLineParameter parameter : parameters) {
            arguments.addAll(parameter.toArguments(valuesByLongName.get(parameter.longName())));
        }
        return arguments;
    }

    @Override
    public String toString() {
        return "ParameterValues" + valuesByLongName;
    }
}
