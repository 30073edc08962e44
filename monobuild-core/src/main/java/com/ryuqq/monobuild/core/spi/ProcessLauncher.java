package com.ryuqq.monobuild.core.spi;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;

/**
 * Spawns an external shell command and waits for it to exit.
 *
 * <p>Implementations must terminate the child process when the calling thread is
 * interrupted and then rethrow {@link InterruptedException}.</p>
 *
 * @author Monobuild Team
 * @since 1.0.0
 */
public interface ProcessLauncher {

    /**
     * Runs a shell command.
     *
     * @param command the full shell command line
     * @param workingDirectory the directory to run in
     * @param environment extra environment variables
     * @return the exit code and captured output
     * @throws IOException if the process cannot be started or its output cannot be read
     * @throws InterruptedException if the calling thread is interrupted while waiting
     */
    ProcessResult launch(String command, Path workingDirectory, Map<String, String> environment)
        throws IOException, InterruptedException;
}
