package com.ryuqq.monobuild.core.config;

import com.ryuqq.monobuild.core.config.definition.CommandKind;

import java.util.Collections;
import java.util.Set;

/**
 * 페이즈 집합을 프로젝트마다 실행하는 커맨드.
 *
 * <p><strong>phases:</strong> 선언된 페이즈와 그 self/upstream 의존성의 전이적 폐포(closure).
 * 이 집합 안의 어떤 페이즈도 집합 밖의 페이즈에 의존하지 않습니다.</p>
 *
 * <p><strong>watchPhases:</strong> watch 모드에서 실행할 페이즈. 선언된 그대로이며 확장하지 않습니다.</p>
 *
 * <p>기본값으로 합성된 rebuild 커맨드는 build 커맨드와 phases 집합 및
 * associatedParameters 집합을 <em>같은 인스턴스로</em> 공유합니다.</p>
 *
 * @author Monobuild Team
 * @since 1.0.0
 */
public final class PhasedCommand implements Command {

    private final String name;
    private final String summary;
    private final String description;
    private final boolean safeForSimultaneousProcesses;
    private final boolean synthetic;
    private final boolean enableParallelism;
    private final boolean incremental;
    private final boolean disableBuildCache;
    private final boolean alwaysWatch;
    private final Set<Phase> phases;
    private final Set<Phase> watchPhases;
    private final Set<CommandLineParameter> associatedParameters;

    PhasedCommand(String name, String summary, String description, boolean safeForSimultaneousProcesses,
                  boolean synthetic, boolean enableParallelism, boolean incremental, boolean disableBuildCache,
                  boolean alwaysWatch, Set<Phase> phases, Set<Phase> watchPhases,
                  Set<CommandLineParameter> associatedParameters) {
        this.name = name;
        this.summary = summary;
        this.description = description;
        this.safeForSimultaneousProcesses = safeForSimultaneousProcesses;
        this.synthetic = synthetic;
        this.enableParallelism = enableParallelism;
        this.incremental = incremental;
        this.disableBuildCache = disableBuildCache;
        this.alwaysWatch = alwaysWatch;
        this.phases = phases;
        this.watchPhases = watchPhases;
        this.associatedParameters = associatedParameters;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public CommandKind getKind() {
        return CommandKind.PHASED;
    }

    @Override
    public String getSummary() {
        return summary;
    }

    @Override
    public String getDescription() {
        return description;
    }

    @Override
    public boolean isSafeForSimultaneousProcesses() {
        return safeForSimultaneousProcesses;
    }

    /**
     * bulk 커맨드에서 변환되었거나 기본값으로 합성되었는지 확인.
     *
     * @return command-line.json에 phased로 선언되지 않은 경우 true
     */
    public boolean isSynthetic() {
        return synthetic;
    }

    public boolean isEnableParallelism() {
        return enableParallelism;
    }

    public boolean isIncremental() {
        return incremental;
    }

    public boolean isDisableBuildCache() {
        return disableBuildCache;
    }

    public boolean isAlwaysWatch() {
        return alwaysWatch;
    }

    public Set<Phase> getPhases() {
        return Collections.unmodifiableSet(phases);
    }

    public Set<Phase> getWatchPhases() {
        return Collections.unmodifiableSet(watchPhases);
    }

    @Override
    public Set<CommandLineParameter> getAssociatedParameters() {
        return Collections.unmodifiableSet(associatedParameters);
    }

    /**
     * phases 집합이 다른 커맨드와 같은 인스턴스인지 확인.
     *
     * @param other 비교할 커맨드
     * @return phases 집합을 공유하면 true
     */
    public boolean sharesPhasesWith(PhasedCommand other) {
        return other != null && phases == other.phases;
    }

    /**
     * associatedParameters 집합이 다른 커맨드와 같은 인스턴스인지 확인.
     *
     * @param other 비교할 커맨드
     * @return 파라미터 집합을 공유하면 true
     */
    public boolean sharesParametersWith(Command other) {
        if (other instanceof PhasedCommand phased) {
            return associatedParameters == phased.associatedParameters;
        }
        return false;
    }

    Set<Phase> mutablePhases() {
        return phases;
    }

    Set<CommandLineParameter> mutableAssociatedParameters() {
        return associatedParameters;
    }

    void addAssociatedParameter(CommandLineParameter parameter) {
        associatedParameters.add(parameter);
    }

    @Override
    public String toString() {
        return "PhasedCommand{" + name + (synthetic ? ", synthetic" : "") + ", phases=" + phases.size() + '}';
    }
}
