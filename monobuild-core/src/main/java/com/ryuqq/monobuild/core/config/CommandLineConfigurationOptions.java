package com.ryuqq.monobuild.core.config;

/**
 * 커맨드라인 설정 생성 옵션.
 *
 * @param doNotIncludeDefaultBuildCommands true면 누락된 build/rebuild 기본 커맨드를 추가하지 않음
 * @author Monobuild Team
 * @since 1.0.0
 */
public record CommandLineConfigurationOptions(boolean doNotIncludeDefaultBuildCommands) {

    /**
     * 기본 옵션 (build/rebuild 기본 커맨드 포함).
     *
     * @return 기본 옵션
     */
    public static CommandLineConfigurationOptions defaults() {
        return new CommandLineConfigurationOptions(false);
    }

    /**
     * 기본 build/rebuild 커맨드를 제외하는 옵션.
     *
     * @return 기본 커맨드 제외 옵션
     */
    public static CommandLineConfigurationOptions withoutDefaultBuildCommands() {
        return new CommandLineConfigurationOptions(true);
    }
}
