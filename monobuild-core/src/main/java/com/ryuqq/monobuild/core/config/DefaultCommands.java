package com.ryuqq.monobuild.core.config;

import com.ryuqq.monobuild.core.config.definition.CommandDefinition;
import com.ryuqq.monobuild.core.config.definition.CommandKind;

import static com.ryuqq.monobuild.core.config.ConfigurationConstants.BUILD_COMMAND_NAME;
import static com.ryuqq.monobuild.core.config.ConfigurationConstants.REBUILD_COMMAND_NAME;

/**
 * 설정에 없을 때 추가되는 기본 build/rebuild 커맨드 선언.
 *
 * <p>저장소 설정이 build/rebuild를 일부 필드만 재정의하는 경우,
 * 설정 로더는 이 선언 위에 저장소 필드를 얕게 병합합니다 (저장소 필드 우선).</p>
 *
 * @author Monobuild Team
 * @since 1.0.0
 */
public final class DefaultCommands {

    /**
     * 기본 build: 증분 bulk 커맨드.
     */
    public static final CommandDefinition BUILD = new CommandDefinition(
        CommandKind.BULK,
        BUILD_COMMAND_NAME,
        "Build all projects that haven't been built, or have changed since they were last built.",
        "This command is similar to \"rebuild\", except that \"build\" performs an incremental build. "
            + "In other words, it only builds projects whose inputs have changed since the last successful build. "
            + "A full rebuild is forced whenever the recorded input hash of a project no longer matches.",
        false,
        null,
        true,
        true,
        null,
        null,
        null,
        null,
        null,
        null,
        null
    );

    /**
     * 기본 rebuild: 비증분 bulk 커맨드.
     */
    public static final CommandDefinition REBUILD = new CommandDefinition(
        CommandKind.BULK,
        REBUILD_COMMAND_NAME,
        "Clean and rebuild the entire set of projects.",
        "This command assumes that each project defines a \"build\" script that performs a full clean build. "
            + "Projects are built in parallel where possible, but always respecting the dependency graph. "
            + "The number of simultaneous processes is based on the number of machine cores unless overridden. "
            + "(For an incremental build, see \"build\" instead of \"rebuild\".)",
        false,
        null,
        true,
        false,
        null,
        null,
        null,
        null,
        null,
        null,
        null
    );

    private DefaultCommands() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 커맨드 종류와 이름에 해당하는 기본 선언 조회.
     *
     * <p>bulk/phased 커맨드 중 이름이 build 또는 rebuild인 경우에만 기본 선언이 있습니다.</p>
     *
     * @param kind 커맨드 종류
     * @param name 커맨드 이름
     * @return 기본 선언 또는 null
     */
    public static CommandDefinition defaultFor(CommandKind kind, String name) {
        if (kind != CommandKind.BULK && kind != CommandKind.PHASED) {
            return null;
        }
        if (BUILD_COMMAND_NAME.equals(name)) {
            return BUILD;
        }
        if (REBUILD_COMMAND_NAME.equals(name)) {
            return REBUILD;
        }
        return null;
    }
}
