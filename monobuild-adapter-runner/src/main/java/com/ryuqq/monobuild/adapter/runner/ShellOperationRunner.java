package com.ryuqq.monobuild.adapter.runner;

import com.ryuqq.monobuild.core.operation.OperationRunner;
import com.ryuqq.monobuild.core.operation.OperationRunnerContext;
import com.ryuqq.monobuild.core.operation.RunOutcome;
import com.ryuqq.monobuild.core.spi.ProcessLauncher;
import com.ryuqq.monobuild.core.spi.ProcessResult;
import com.ryuqq.monobuild.core.statemachine.OperationStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;

/**
 * 셸 명령을 실행하는 runner.
 *
 * <p><strong>결과 판정:</strong></p>
 * <ul>
 *   <li>종료 코드 != 0 → FAILURE</li>
 *   <li>종료 코드 0, stderr 출력 있음 → SUCCESS_WITH_WARNING (허용 여부는 executor가 판단)</li>
 *   <li>그 외 → SUCCESS</li>
 * </ul>
 *
 * @author Monobuild Team
 * @since 1.0.0
 */
public final class ShellOperationRunner implements OperationRunner {

    private static final Logger log = LoggerFactory.getLogger(ShellOperationRunner.class);

    private final String name;
    private final String commandLine;
    private final Path workingDirectory;
    private final Map<String, String> environment;
    private final ProcessLauncher processLauncher;

    /**
     * 생성자.
     *
     * @param name runner 이름
     * @param commandLine 실행할 전체 명령 (파라미터 인자 포함)
     * @param workingDirectory 실행 디렉토리
     * @param environment 추가 환경 변수
     * @param processLauncher 프로세스 실행기
     * @throws IllegalArgumentException 인자가 null이거나 명령이 비어 있는 경우
     */
    public ShellOperationRunner(String name, String commandLine, Path workingDirectory,
                                Map<String, String> environment, ProcessLauncher processLauncher) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (commandLine == null || commandLine.isBlank()) {
            throw new IllegalArgumentException("commandLine cannot be null or blank");
        }
        if (workingDirectory == null) {
            throw new IllegalArgumentException("workingDirectory cannot be null");
        }
        if (processLauncher == null) {
            throw new IllegalArgumentException("processLauncher cannot be null");
        }
        this.name = name;
        this.commandLine = commandLine;
        this.workingDirectory = workingDirectory;
        this.environment = environment == null ? Map.of() : Map.copyOf(environment);
        this.processLauncher = processLauncher;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public RunOutcome execute(OperationRunnerContext context) throws IOException, InterruptedException {
        log.debug("Invoking \"{}\" in {}", commandLine, workingDirectory);
        ProcessResult result = processLauncher.launch(commandLine, workingDirectory, environment);

        String output = result.hasWarnings()
            ? result.stdout() + result.stderr()
            : result.stdout();
        if (!result.isSuccess()) {
            log.debug("{} returned exit code {}", context.operationId(), result.exitCode());
            return new RunOutcome(OperationStatus.FAILURE, output);
        }
        if (result.hasWarnings()) {
            return new RunOutcome(OperationStatus.SUCCESS_WITH_WARNING, output);
        }
        return new RunOutcome(OperationStatus.SUCCESS, output);
    }

    public String getCommandLine() {
        return commandLine;
    }

    public Path getWorkingDirectory() {
        return workingDirectory;
    }
}
