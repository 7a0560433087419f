package com.ecolityper.core.engine;

import com.ecolityper.core.model.InputFile;
import com.ecolityper.core.model.TaskResult;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

/**
 * Writes {@code run_summary.json} into the output root for downstream report generation.
 */
@Component
public class RunSummaryWriter {

    public static final String FILE_NAME = "run_summary.json";

    private final ObjectMapper objectMapper;

    public RunSummaryWriter() {
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT)
                .setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    /** JSON shape of the summary file. */
    public record Document(
        String runId,
        Instant startedAt,
        Instant completedAt,
        String outputRoot,
        List<String> inputs,
        int succeeded,
        int total,
        boolean allSucceeded,
        List<TaskEntry> tasks
    ) {}

    public record TaskEntry(
        String name,
        String status,
        String message,
        String stderrExcerpt,
        Integer exitCode,
        String outputDirectory,
        long elapsedMs
    ) {}

    public Path write(AnalysisReport report) throws IOException {
        Path target = report.outputRoot().resolve(FILE_NAME);
        Files.createDirectories(report.outputRoot());
        objectMapper.writeValue(target.toFile(), toDocument(report));
        return target;
    }

    Document toDocument(AnalysisReport report) {
        List<TaskEntry> tasks = report.results().results().stream()
                .map(RunSummaryWriter::toEntry)
                .toList();
        return new Document(
                report.runId(),
                report.startedAt(),
                report.completedAt(),
                report.outputRoot().toAbsolutePath().toString(),
                report.inputs().files().stream().map(InputFile::fileName).toList(),
                report.summary().succeededCount(),
                report.summary().totalCount(),
                report.summary().allSucceeded(),
                tasks);
    }

    private static TaskEntry toEntry(TaskResult result) {
        return new TaskEntry(
                result.taskName(),
                result.status().name(),
                result.message(),
                result.stderrExcerpt(),
                result.exitCode(),
                result.outputDirectory() != null ? result.outputDirectory().toString() : null,
                result.elapsed().toMillis());
    }
}
