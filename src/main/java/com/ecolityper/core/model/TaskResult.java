package com.ecolityper.core.model;

import java.io.Serializable;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;

/**
 * Result of running one {@link TaskSpec}.
 *
 * @param taskName        the task key
 * @param status          outcome classification
 * @param message         failure reason or warning detail (nullable)
 * @param stderrExcerpt   head of the tool's stderr (nullable)
 * @param exitCode        process exit code, null if the tool never ran
 * @param outputDirectory copied result directory under the output root, null unless successful
 * @param startedAt       when the task started (reporting only)
 * @param completedAt     when the task returned (reporting only)
 */
public record TaskResult(
    String taskName,
    TaskStatus status,
    String message,
    String stderrExcerpt,
    Integer exitCode,
    Path outputDirectory,
    Instant startedAt,
    Instant completedAt
) implements Serializable {

    public static TaskResult skipped(String taskName, String reason) {
        Instant now = Instant.now();
        return new TaskResult(taskName, TaskStatus.SKIPPED, reason, null, null, null, now, now);
    }

    public static TaskResult failed(String taskName, String message, Instant startedAt) {
        return new TaskResult(taskName, TaskStatus.FAILED, message, null, null, null,
                startedAt, Instant.now());
    }

    public Duration elapsed() {
        if (startedAt == null || completedAt == null) return Duration.ZERO;
        return Duration.between(startedAt, completedAt);
    }
}
