package com.ryuqq.monobuild.core.config;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * 해석된 페이즈.
 *
 * <p>페이즈는 프로젝트마다 실행되는 이름 있는 작업 단위입니다 (예: {@code _phase:build}).</p>
 *
 * <p><strong>의존성 종류:</strong></p>
 * <ul>
 *   <li><strong>self:</strong> 같은 프로젝트의 다른 페이즈가 먼저 완료되어야 함</li>
 *   <li><strong>upstream:</strong> 모든 상위(의존) 프로젝트에서 해당 페이즈가 먼저 완료되어야 함.
 *       자기 자신을 upstream으로 가지면 "의존 프로젝트를 먼저 빌드"를 의미</li>
 * </ul>
 *
 * <p>동등성은 객체 식별성(identity)입니다. 이름이 같은 두 Phase 인스턴스는
 * 같은 설정 안에서 만들어질 수 없습니다.</p>
 *
 * <p>의존성 집합과 연결 파라미터 집합은 설정 로드 중에만 변경되며,
 * 외부에는 읽기 전용 뷰로 노출됩니다.</p>
 *
 * @author Monobuild Team
 * @since 1.0.0
 */
public final class Phase {

    private final String name;
    private final boolean synthetic;
    private final String logFilenameIdentifier;
    private final boolean ignoreMissingScript;
    private final boolean allowWarningsOnSuccess;
    private final Set<CommandLineParameter> associatedParameters = new LinkedHashSet<>();
    private final Set<Phase> selfDependencies = new LinkedHashSet<>();
    private final Set<Phase> upstreamDependencies = new LinkedHashSet<>();

    Phase(String name, boolean synthetic, boolean ignoreMissingScript, boolean allowWarningsOnSuccess) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        this.name = name;
        this.synthetic = synthetic;
        this.logFilenameIdentifier = normalizeForLogFilename(name);
        this.ignoreMissingScript = ignoreMissingScript;
        this.allowWarningsOnSuccess = allowWarningsOnSuccess;
    }

    /**
     * 로그 파일 이름에 쓸 수 있도록 콜론을 밑줄로 치환.
     *
     * @param name 페이즈 이름
     * @return 파일 시스템 안전한 이름 (예: {@code _phase:compile} → {@code _phase_compile})
     */
    static String normalizeForLogFilename(String name) {
        return name.replace(':', '_');
    }

    public String getName() {
        return name;
    }

    /**
     * bulk 커맨드에서 생성된 페이즈인지 확인.
     *
     * @return command-line.json에 명시적으로 선언되지 않은 경우 true
     */
    public boolean isSynthetic() {
        return synthetic;
    }

    public String getLogFilenameIdentifier() {
        return logFilenameIdentifier;
    }

    public boolean isIgnoreMissingScript() {
        return ignoreMissingScript;
    }

    public boolean isAllowWarningsOnSuccess() {
        return allowWarningsOnSuccess;
    }

    public Set<CommandLineParameter> getAssociatedParameters() {
        return Collections.unmodifiableSet(associatedParameters);
    }

    public Set<Phase> getSelfDependencies() {
        return Collections.unmodifiableSet(selfDependencies);
    }

    public Set<Phase> getUpstreamDependencies() {
        return Collections.unmodifiableSet(upstreamDependencies);
    }

    void addSelfDependency(Phase dependency) {
        selfDependencies.add(dependency);
    }

    void addUpstreamDependency(Phase dependency) {
        upstreamDependencies.add(dependency);
    }

    void addAssociatedParameter(CommandLineParameter parameter) {
        associatedParameters.add(parameter);
    }

    @Override
    public String toString() {
        return "Phase{" + name + (synthetic ? ", synthetic" : "") + '}';
    }
}
