package com.ryuqq.monobuild.adapter.runner;

import com.ryuqq.monobuild.application.graph.OperationRunnerFactory;
import com.ryuqq.monobuild.core.config.ConfigurationException;
import com.ryuqq.monobuild.core.config.GlobalCommand;
import com.ryuqq.monobuild.core.config.ParameterValues;
import com.ryuqq.monobuild.core.config.Phase;
import com.ryuqq.monobuild.core.config.PhasedCommand;
import com.ryuqq.monobuild.core.operation.OperationId;
import com.ryuqq.monobuild.core.operation.OperationRunner;
import com.ryuqq.monobuild.core.project.Project;
import com.ryuqq.monobuild.core.spi.ProcessLauncher;
import com.ryuqq.monobuild.core.statemachine.OperationStatus;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 프로젝트 스크립트를 셸로 실행하는 runner 팩토리.
 *
 * <p><strong>runner 선택:</strong></p>
 * <ul>
 *   <li>스크립트 없음 + ignoreMissingScript → NO_OP (silent)</li>
 *   <li>스크립트 없음 → {@link ConfigurationException}</li>
 *   <li>빈 스크립트 → NO_OP</li>
 *   <li>그 외 → 스크립트 + 페이즈 파라미터 인자를 실행하는 {@link ShellOperationRunner}
 *       (BuildCacheSupport가 있으면 {@link IncrementalOperationRunner}로 감쌈)</li>
 * </ul>
 *
 * @author Monobuild Team
 * @since 1.0.0
 */
public final class ShellOperationRunnerFactory implements OperationRunnerFactory {

    private final ProcessLauncher processLauncher;
    private final Path repositoryRoot;
    private final ParameterValues parameterValues;
    private final Map<String, String> environment;
    private final BuildCacheSupport buildCacheSupport;

    /**
     * 증분 빌드 회피 없이 생성.
     *
     * @param processLauncher 프로세스 실행기
     * @param repositoryRoot 저장소 루트 (global 커맨드 실행 디렉토리)
     * @param parameterValues 커맨드라인에서 받은 파라미터 값
     */
    public ShellOperationRunnerFactory(ProcessLauncher processLauncher, Path repositoryRoot,
                                       ParameterValues parameterValues) {
        this(processLauncher, repositoryRoot, parameterValues, Map.of(), null);
    }

    /**
     * 생성자.
     *
     * @param processLauncher 프로세스 실행기
     * @param repositoryRoot 저장소 루트 (global 커맨드 실행 디렉토리)
     * @param parameterValues 커맨드라인에서 받은 파라미터 값
     * @param environment 모든 프로세스에 전달할 환경 변수
     * @param buildCacheSupport 증분 빌드 회피/캐시 협력자 (null이면 항상 실행)
     */
    public ShellOperationRunnerFactory(ProcessLauncher processLauncher, Path repositoryRoot,
                                       ParameterValues parameterValues, Map<String, String> environment,
                                       BuildCacheSupport buildCacheSupport) {
        if (processLauncher == null) {
            throw new IllegalArgumentException("processLauncher cannot be null");
        }
        if (repositoryRoot == null) {
            throw new IllegalArgumentException("repositoryRoot cannot be null");
        }
        this.processLauncher = processLauncher;
        this.repositoryRoot = repositoryRoot;
        this.parameterValues = parameterValues == null ? ParameterValues.empty() : parameterValues;
        this.environment = environment == null ? Map.of() : Map.copyOf(environment);
        this.buildCacheSupport = buildCacheSupport;
    }

    @Override
    public OperationRunner createPhaseRunner(PhasedCommand command, Phase phase, Project project) {
        String name = OperationId.forPhase(phase, project).getValue();
        Optional<String> script = project.script(phase.getName());

        if (script.isEmpty()) {
            if (phase.isIgnoreMissingScript()) {
                return new NullOperationRunner(name, OperationStatus.NO_OP, true);
            }
            throw new ConfigurationException(
                "The project [" + project.name() + "] does not define a '" + phase.getName()
                    + "' command in the 'scripts' section of its package.json"
            );
        }
        if (script.get().isBlank()) {
            return new NullOperationRunner(name, OperationStatus.NO_OP, false);
        }

        String commandLine = appendArguments(script.get(),
            parameterValues.toArguments(phase.getAssociatedParameters()));
        OperationRunner runner = new ShellOperationRunner(name, commandLine, project.folder(), environment, processLauncher);

        if (buildCacheSupport == null) {
            return runner;
        }
        return new IncrementalOperationRunner(
            runner,
            buildCacheSupport.cacheKeyProvider(),
            buildCacheSupport.stateStore(),
            command.isDisableBuildCache() ? null : buildCacheSupport.buildCache(),
            command.isIncremental(),
            phase.isAllowWarningsOnSuccess()
        );
    }

    @Override
    public OperationRunner createGlobalRunner(GlobalCommand command) {
        if (command.getShellCommand() == null || command.getShellCommand().isBlank()) {
            return new NullOperationRunner(command.getName(), OperationStatus.NO_OP, false);
        }
        String commandLine = appendArguments(command.getShellCommand(),
            parameterValues.toArguments(command.getAssociatedParameters()));
        return new ShellOperationRunner(command.getName(), commandLine, repositoryRoot, environment, processLauncher);
    }

    static String appendArguments(String script, List<String> arguments) {
        if (arguments.isEmpty()) {
            return script;
        }
        return script + " " + String.join(" ", arguments);
    }
}
