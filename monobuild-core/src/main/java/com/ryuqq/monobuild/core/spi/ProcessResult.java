package com.ryuqq.monobuild.core.spi;

/**
 * Result of a finished external process.
 *
 * @param exitCode the process exit code
 * @param stdout captured standard output
 * @param stderr captured standard error
 * @author Monobuild Team
 * @since 1.0.0
 */
public record ProcessResult(int exitCode, String stdout, String stderr) {

    public ProcessResult {
        stdout = stdout == null ? "" : stdout;
        stderr = stderr == null ? "" : stderr;
    }

    public boolean isSuccess() {
        return exitCode == 0;
    }

    /**
     * Whether the process wrote anything other than whitespace to standard error.
     *
     * @return true if stderr has content
     */
    public boolean hasWarnings() {
        return !stderr.isBlank();
    }
}
