package com.ecolityper.runner;

/**
 * Result of an external tool invocation.
 *
 * @param exitCode  process exit code
 * @param stdout    captured standard output
 * @param stderr    captured standard error
 * @param elapsedMs wall-clock time in milliseconds
 */
public record ProcessResult(
    int exitCode,
    String stdout,
    String stderr,
    long elapsedMs
) {}
