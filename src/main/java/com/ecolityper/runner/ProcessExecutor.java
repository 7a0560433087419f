package com.ecolityper.runner;

import java.nio.file.Path;
import java.util.List;

/**
 * Runs an external tool to completion.
 * Implementations: {@link LocalProcessExecutor} (OS subprocess); tests substitute fakes.
 */
public interface ProcessExecutor {

    /**
     * Executes {@code command} with {@code workDir} as its working directory and blocks until it
     * exits. A non-zero exit is returned, not thrown.
     *
     * @return exit code and captured output
     * @throws ToolExecutionException if the process cannot be started or waiting is interrupted
     */
    ProcessResult execute(List<String> command, Path workDir);
}
