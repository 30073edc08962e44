package com.ryuqq.monobuild.core.config;

/**
 * 커맨드 라인 설정에서 공유하는 상수.
 *
 * @author Monobuild Team
 * @since 1.0.0
 */
public final class ConfigurationConstants {

    /** 오류 메시지에 사용하는 설정 파일 이름. */
    public static final String COMMAND_LINE_FILENAME = "command-line.json";

    /** 선언된 페이즈 이름의 필수 접두사. */
    public static final String PHASE_NAME_PREFIX = "_phase:";

    /** 기본 증분 빌드 커맨드 이름. */
    public static final String BUILD_COMMAND_NAME = "build";

    /** 기본 전체 재빌드 커맨드 이름. */
    public static final String REBUILD_COMMAND_NAME = "rebuild";

    private ConfigurationConstants() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }
}
