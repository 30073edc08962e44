package com.ryuqq.monobuild.core.project;

import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 모노레포 내 하나의 프로젝트.
 *
 * <p>scripts는 package.json의 "scripts" 섹션에 해당하며, 페이즈 이름 또는
 * bulk 커맨드 이름을 키로 실행할 셸 명령을 조회합니다.</p>
 *
 * @param name 프로젝트 이름 (저장소 내 고유)
 * @param folder 프로젝트 폴더 (명령 실행 디렉토리)
 * @param scripts 스크립트 이름 → 셸 명령
 * @param dependencies 직접 의존하는 프로젝트 이름
 * @author Monobuild Team
 * @since 1.0.0
 */
public record Project(
    String name,
    Path folder,
    Map<String, String> scripts,
    Set<String> dependencies
) {

    public Project {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (folder == null) {
            throw new IllegalArgumentException("folder cannot be null");
        }
        scripts = scripts == null ? Map.of() : Map.copyOf(scripts);
        dependencies = dependencies == null ? Set.of() : Set.copyOf(dependencies);
        if (dependencies.contains(name)) {
            throw new IllegalArgumentException("Project " + name + " cannot depend on itself");
        }
    }

    /**
     * 스크립트 조회.
     *
     * @param scriptName 스크립트 이름
     * @return 셸 명령 (정의되지 않았으면 empty)
     */
    public Optional<String> script(String scriptName) {
        return Optional.ofNullable(scripts.get(scriptName));
    }
}
