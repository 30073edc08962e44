package com.ryuqq.monobuild.adapter.runner;

import com.ryuqq.monobuild.core.spi.ProcessLauncher;
import com.ryuqq.monobuild.core.spi.ProcessResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 로컬 셸({@code sh -c}, Windows는 {@code cmd /c})로 명령을 실행합니다.
 *
 * <p>출력은 임시 파일로 리다이렉트하여 파이프 버퍼가 가득 차 프로세스가 멈추는 일을 막고,
 * 호출 스레드가 인터럽트되면 프로세스를 강제 종료한 뒤 {@link InterruptedException}을 다시 던집니다.</p>
 *
 * @author Monobuild Team
 * @since 1.0.0
 */
public final class LocalProcessLauncher implements ProcessLauncher {

    private static final Logger log = LoggerFactory.getLogger(LocalProcessLauncher.class);

    private static final boolean WINDOWS =
        System.getProperty("os.name", "").toLowerCase(Locale.ROOT).startsWith("windows");

    @Override
    public ProcessResult launch(String command, Path workingDirectory, Map<String, String> environment)
        throws IOException, InterruptedException {
        if (command == null || command.isBlank()) {
            throw new IllegalArgumentException("command cannot be null or blank");
        }
        if (workingDirectory == null) {
            throw new IllegalArgumentException("workingDirectory cannot be null");
        }

        Path stdout = Files.createTempFile("monobuild-", ".out");
        Path stderr = Files.createTempFile("monobuild-", ".err");
        try {
            ProcessBuilder builder = new ProcessBuilder(shellCommand(command))
                .directory(workingDirectory.toFile())
                .redirectOutput(stdout.toFile())
                .redirectError(stderr.toFile());
            if (environment != null) {
                builder.environment().putAll(environment);
            }

            Process process = builder.start();
            int exitCode;
            try {
                exitCode = process.waitFor();
            } catch (InterruptedException e) {
                log.warn("Interrupted while running \"{}\", terminating process {}", command, process.pid());
                process.destroyForcibly();
                throw e;
            }

            return new ProcessResult(
                exitCode,
                readOutput(stdout),
                readOutput(stderr)
            );
        } finally {
            Files.deleteIfExists(stdout);
            Files.deleteIfExists(stderr);
        }
    }

    // 잘못된 UTF-8 바이트는 예외 대신 U+FFFD로 치환
    private static String readOutput(Path file) throws IOException {
        return new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
    }

    private static List<String> shellCommand(String command) {
        return WINDOWS ? List.of("cmd", "/c", command) : List.of("sh", "-c", command);
    }
}
