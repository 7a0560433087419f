package com.ecolityper.runner;

import com.ecolityper.core.model.TaskSpec;
import com.ecolityper.core.model.TaskStatus;
import com.ecolityper.workspace.FileTrees;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Decides a task's status from what the tool left on disk.
 *
 * <p>Exit codes of the wrapped tools are unreliable, so the primary artifact decides:
 * <ul>
 *   <li>artifact present, clean exit, no warning markers: {@link TaskStatus#SUCCESS}</li>
 *   <li>artifact present but the summary file carries a warning marker, or the tool exited
 *       non-zero: {@link TaskStatus#SUCCESS_WITH_WARNINGS}</li>
 *   <li>artifact missing or empty: {@link TaskStatus#FAILED}</li>
 * </ul>
 */
@Component
public class OutcomeClassifier {

    private static final Logger log = LoggerFactory.getLogger(OutcomeClassifier.class);

    /** Summary-file cells are separated by tabs, commas or whitespace. */
    private static final Pattern CELL_SEPARATOR = Pattern.compile("[\\t,\\s]+");

    /**
     * @param status  the classification
     * @param message warning or failure detail, null for a clean success
     */
    public record Outcome(TaskStatus status, String message) {}

    public Outcome classify(TaskSpec spec, ProcessResult result) {
        Path artifact = spec.artifactPath();
        boolean present;
        try {
            present = FileTrees.hasContent(artifact);
        } catch (IOException e) {
            log.warn("Could not inspect artifact {} of {}: {}", artifact, spec.name(), e.getMessage());
            present = false;
        }

        if (!present) {
            String message = "Expected output " + spec.resultPath() + " was not produced";
            if (result.exitCode() != 0) {
                message += " (exit code " + result.exitCode() + ")";
            }
            return new Outcome(TaskStatus.FAILED, message);
        }

        Optional<String> marker = findWarningMarker(spec);
        if (marker.isPresent()) {
            return new Outcome(TaskStatus.SUCCESS_WITH_WARNINGS,
                    "Summary reports unresolved calls (" + marker.get() + ")");
        }
        if (result.exitCode() != 0) {
            return new Outcome(TaskStatus.SUCCESS_WITH_WARNINGS,
                    "Tool exited with code " + result.exitCode() + " but produced " + spec.resultPath());
        }
        return new Outcome(TaskStatus.SUCCESS, null);
    }

    /**
     * Scans the task's summary file for the first cell equal to one of its warning markers.
     */
    Optional<String> findWarningMarker(TaskSpec spec) {
        if (spec.summaryFile() == null || spec.warningMarkers().isEmpty()) {
            return Optional.empty();
        }
        Path artifact = spec.artifactPath();
        Path summary = Files.isDirectory(artifact)
                ? artifact.resolve(spec.summaryFile())
                : spec.workspace().resolve(spec.summaryFile());
        if (!Files.isRegularFile(summary)) {
            return Optional.empty();
        }

        List<String> markers = spec.warningMarkers();
        try (Stream<String> lines = Files.lines(summary, StandardCharsets.UTF_8)) {
            return lines.flatMap(CELL_SEPARATOR::splitAsStream)
                    .filter(markers::contains)
                    .findFirst();
        } catch (IOException | UncheckedIOException e) {
            log.warn("Could not read summary {} of {}: {}", summary, spec.name(), e.getMessage());
            return Optional.empty();
        }
    }
}
