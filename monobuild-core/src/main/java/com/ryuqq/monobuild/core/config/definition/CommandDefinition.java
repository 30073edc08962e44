package com.ryuqq.monobuild.core.config.definition;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * command-line.json의 커맨드 선언.
 *
 * <p>global, bulk, phased 세 종류의 필드를 하나의 레코드로 표현합니다.
 * 종류에 해당하지 않는 필드는 무시됩니다.
 * Boolean 필드의 null은 "선언되지 않음"을 의미하며, 기본 build/rebuild 정의와의
 * 얕은 병합(shallow merge) 시 기본값이 사용됩니다.</p>
 *
 * <p><strong>종류별 필드:</strong></p>
 * <ul>
 *   <li>global: shellCommand</li>
 *   <li>bulk: enableParallelism, incremental, ignoreDependencyOrder, ignoreMissingScript,
 *       allowWarningsInSuccessfulBuild, watchForChanges, disableBuildCache</li>
 *   <li>phased: enableParallelism, incremental, disableBuildCache, phases, watchOptions</li>
 * </ul>
 *
 * @param commandKind 커맨드 종류
 * @param name 커맨드 이름
 * @param summary 한 줄 요약 (null 가능)
 * @param description 상세 설명 (null 가능)
 * @param safeForSimultaneousRushProcesses 여러 프로세스가 동시에 실행해도 안전한지 여부
 * @param shellCommand global 커맨드가 실행할 셸 명령
 * @param enableParallelism 병렬 실행 허용 여부
 * @param incremental 증분 빌드 회피 허용 여부
 * @param ignoreDependencyOrder bulk 커맨드에서 프로젝트 의존 순서를 무시할지 여부
 * @param ignoreMissingScript bulk 커맨드에서 스크립트 누락을 허용할지 여부
 * @param allowWarningsInSuccessfulBuild bulk 커맨드에서 경고를 성공으로 인정할지 여부
 * @param watchForChanges bulk 커맨드를 항상 watch 모드로 실행할지 여부
 * @param disableBuildCache 빌드 캐시 사용 비활성화 여부
 * @param phases phased 커맨드가 실행할 페이즈 이름
 * @param watchOptions phased 커맨드의 watch 옵션 (null 가능)
 *
 * @author Monobuild Team
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CommandDefinition(
    @JsonProperty("commandKind") CommandKind commandKind,
    @JsonProperty("name") String name,
    @JsonProperty("summary") String summary,
    @JsonProperty("description") String description,
    @JsonProperty("safeForSimultaneousRushProcesses") Boolean safeForSimultaneousRushProcesses,
    @JsonProperty("shellCommand") String shellCommand,
    @JsonProperty("enableParallelism") Boolean enableParallelism,
    @JsonProperty("incremental") Boolean incremental,
    @JsonProperty("ignoreDependencyOrder") Boolean ignoreDependencyOrder,
    @JsonProperty("ignoreMissingScript") Boolean ignoreMissingScript,
    @JsonProperty("allowWarningsInSuccessfulBuild") Boolean allowWarningsInSuccessfulBuild,
    @JsonProperty("watchForChanges") Boolean watchForChanges,
    @JsonProperty("disableBuildCache") Boolean disableBuildCache,
    @JsonProperty("phases") List<String> phases,
    @JsonProperty("watchOptions") WatchOptionsDefinition watchOptions
) {

    public CommandDefinition {
        if (commandKind == null) {
            throw new IllegalArgumentException("commandKind cannot be null");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("command name cannot be null or blank");
        }
        if (phases != null) {
            phases = List.copyOf(phases);
        }
    }

    /**
     * global 커맨드 선언 생성.
     *
     * @param name 커맨드 이름
     * @param shellCommand 실행할 셸 명령
     * @return CommandDefinition 인스턴스
     */
    public static CommandDefinition global(String name, String shellCommand) {
        return new CommandDefinition(CommandKind.GLOBAL, name, null, null, null, shellCommand,
            null, null, null, null, null, null, null, null, null);
    }

    /**
     * 기본 플래그를 사용하는 bulk 커맨드 선언 생성.
     *
     * @param name 커맨드 이름
     * @return CommandDefinition 인스턴스
     */
    public static CommandDefinition bulk(String name) {
        return new CommandDefinition(CommandKind.BULK, name, null, null, null, null,
            null, null, null, null, null, null, null, null, null);
    }

    /**
     * phased 커맨드 선언 생성.
     *
     * @param name 커맨드 이름
     * @param phases 실행할 페이즈 이름
     * @return CommandDefinition 인스턴스
     */
    public static CommandDefinition phased(String name, List<String> phases) {
        return new CommandDefinition(CommandKind.PHASED, name, null, null, null, null,
            null, null, null, null, null, null, null, phases, null);
    }

    /**
     * null 안전 phases 조회.
     *
     * @return 선언된 페이즈 이름 (없으면 빈 목록)
     */
    public List<String> phaseNames() {
        return phases == null ? List.of() : phases;
    }

    /**
     * safeForSimultaneousRushProcesses만 변경한 새 인스턴스 생성.
     */
    public CommandDefinition withSafeForSimultaneousRushProcesses(Boolean value) {
        return new CommandDefinition(commandKind, name, summary, description, value, shellCommand,
            enableParallelism, incremental, ignoreDependencyOrder, ignoreMissingScript,
            allowWarningsInSuccessfulBuild, watchForChanges, disableBuildCache, phases, watchOptions);
    }

    /**
     * ignoreDependencyOrder만 변경한 새 인스턴스 생성.
     */
    public CommandDefinition withIgnoreDependencyOrder(Boolean value) {
        return new CommandDefinition(commandKind, name, summary, description, safeForSimultaneousRushProcesses,
            shellCommand, enableParallelism, incremental, value, ignoreMissingScript,
            allowWarningsInSuccessfulBuild, watchForChanges, disableBuildCache, phases, watchOptions);
    }

    /**
     * watchOptions만 변경한 새 인스턴스 생성.
     */
    public CommandDefinition withWatchOptions(WatchOptionsDefinition value) {
        return new CommandDefinition(commandKind, name, summary, description, safeForSimultaneousRushProcesses,
            shellCommand, enableParallelism, incremental, ignoreDependencyOrder, ignoreMissingScript,
            allowWarningsInSuccessfulBuild, watchForChanges, disableBuildCache, phases, value);
    }

    /**
     * watchForChanges만 변경한 새 인스턴스 생성.
     */
    public CommandDefinition withWatchForChanges(Boolean value) {
        return new CommandDefinition(commandKind, name, summary, description, safeForSimultaneousRushProcesses,
            shellCommand, enableParallelism, incremental, ignoreDependencyOrder, ignoreMissingScript,
            allowWarningsInSuccessfulBuild, value, disableBuildCache, phases, watchOptions);
    }

    /**
     * enableParallelism만 변경한 새 인스턴스 생성.
     */
    public CommandDefinition withEnableParallelism(Boolean value) {
        return new CommandDefinition(commandKind, name, summary, description, safeForSimultaneousRushProcesses,
            shellCommand, value, incremental, ignoreDependencyOrder, ignoreMissingScript,
            allowWarningsInSuccessfulBuild, watchForChanges, disableBuildCache, phases, watchOptions);
    }
}
