package com.ecolityper.runner;

import com.ecolityper.core.events.AnalysisEvent;
import com.ecolityper.core.events.EventBus;
import com.ecolityper.core.logging.MdcContext;
import com.ecolityper.core.metrics.TyperMetrics;
import com.ecolityper.core.model.FilePattern;
import com.ecolityper.core.model.InputMode;
import com.ecolityper.core.model.InputSet;
import com.ecolityper.core.model.TaskResult;
import com.ecolityper.core.model.TaskSpec;
import com.ecolityper.core.model.ThreadBudget;
import com.ecolityper.tools.ToolProperties;
import com.ecolityper.workspace.FileTrees;
import com.ecolityper.workspace.StageException;
import com.ecolityper.workspace.Workspace;
import com.ecolityper.workspace.WorkspaceManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs one analysis tool over the input set inside its own workspace.
 *
 * <p>Flow:
 * <ol>
 *   <li>Stage inputs into the tool's workspace</li>
 *   <li>Build the command line from the {@link TaskSpec} template</li>
 *   <li>Run the tool via {@link ProcessExecutor}</li>
 *   <li>Classify the outcome via {@link OutcomeClassifier}</li>
 *   <li>Copy the artifact to {@code <outputRoot>/<name>_results} on success</li>
 *   <li>Clean the workspace (always, by closing the {@link Workspace})</li>
 * </ol>
 *
 * <p>Never throws: every failure becomes a {@link com.ecolityper.core.model.TaskStatus#FAILED} result.
 */
@Service
public class TaskRunner {

    private static final Logger log = LoggerFactory.getLogger(TaskRunner.class);

    private final WorkspaceManager workspaceManager;
    private final ProcessExecutor processExecutor;
    private final OutcomeClassifier classifier;
    private final EventBus eventBus;
    private final TyperMetrics metrics;
    private final String interpreter;
    private final int stderrExcerptChars;

    @Autowired
    public TaskRunner(WorkspaceManager workspaceManager,
                      ProcessExecutor processExecutor,
                      OutcomeClassifier classifier,
                      EventBus eventBus,
                      ToolProperties properties,
                      @Autowired(required = false) TyperMetrics metrics) {
        this(workspaceManager, processExecutor, classifier, eventBus, metrics,
                properties.getInterpreter(), properties.getStderrExcerptChars());
    }

    TaskRunner(WorkspaceManager workspaceManager,
               ProcessExecutor processExecutor,
               OutcomeClassifier classifier,
               EventBus eventBus,
               TyperMetrics metrics,
               String interpreter,
               int stderrExcerptChars) {
        this.workspaceManager = workspaceManager;
        this.processExecutor = processExecutor;
        this.classifier = classifier;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.interpreter = interpreter;
        this.stderrExcerptChars = stderrExcerptChars;
    }

    /**
     * Opens a workspace for {@code spec} and runs it. The run id is taken from the calling
     * thread's logging context.
     */
    public TaskResult run(TaskSpec spec, InputSet inputs, Path outputRoot, ThreadBudget budget) {
        return run(MdcContext.currentRunId(), workspaceManager.open(spec, inputs), outputRoot, budget);
    }

    /**
     * Runs the task owning {@code workspace}. The workspace is closed (cleaned) before this
     * method returns, whatever the outcome; if it was already closed by an emergency cleanup
     * the close is a no-op.
     */
    public TaskResult run(String runId, Workspace workspace, Path outputRoot, ThreadBudget budget) {
        TaskSpec spec = workspace.spec();
        Instant startedAt = Instant.now();
        publish("task.started", runId, spec.name(), Map.of("threads", budget.threads()));
        log.info("Starting {} with {} thread(s)", spec.displayName(), budget);

        TaskResult result;
        try (workspace) {
            workspace.stage();
            List<String> command = buildCommand(spec, workspace.inputs(), budget);
            ProcessResult process = processExecutor.execute(command, spec.workspace());
            OutcomeClassifier.Outcome outcome = classifier.classify(spec, process);

            Path outputDirectory = null;
            if (outcome.status().isSuccessful()) {
                outputDirectory = outputRoot.resolve(spec.outputDirectoryName());
                copyOut(spec.artifactPath(), outputDirectory);
            }
            result = new TaskResult(spec.name(), outcome.status(), outcome.message(),
                    excerpt(process.stderr()), process.exitCode(), outputDirectory,
                    startedAt, Instant.now());
        } catch (StageException e) {
            log.error("Staging failed for {}: {}", spec.name(), e.getMessage());
            result = TaskResult.failed(spec.name(), e.getMessage(), startedAt);
        } catch (Exception e) {
            log.error("{} failed: {}", spec.displayName(), e.getMessage(), e);
            result = TaskResult.failed(spec.name(),
                    e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName(), startedAt);
        }

        publish("workspace.cleaned", runId, spec.name(), Map.of("warnings", workspace.cleanupWarnings()));
        report(runId, result);
        return result;
    }

    /**
     * {@code [interpreter, <workspace>/<script>, args...]} with placeholders substituted.
     *
     * @throws ToolExecutionException if the script does not exist
     */
    List<String> buildCommand(TaskSpec spec, InputSet inputs, ThreadBudget budget) {
        Path script = spec.scriptPath();
        if (!Files.isRegularFile(script)) {
            throw new ToolExecutionException("Script not found for " + spec.name() + ": " + script);
        }
        String input = inputArgument(spec, inputs);

        var command = new ArrayList<String>();
        command.add(interpreter);
        command.add(script.toString());
        for (String arg : spec.arguments()) {
            String value = arg.replace(TaskSpec.THREADS, budget.toString())
                    .replace(TaskSpec.WORKDIR, spec.workspace().toString());
            if (input != null) {
                value = value.replace(TaskSpec.INPUT, input);
            }
            command.add(value);
        }
        return command;
    }

    static String inputArgument(TaskSpec spec, InputSet inputs) {
        if (spec.inputMode() == InputMode.NONE) {
            return null;
        }
        if (spec.inputMode() == InputMode.PATTERN_OR_SINGLE_FILE && inputs.size() == 1) {
            return inputs.files().get(0).fileName();
        }
        return FilePattern.of(inputs).glob();
    }

    /**
     * Replaces {@code target} with a copy of the artifact. A directory artifact's contents become
     * the target's contents; a file artifact is copied into the target directory.
     */
    private static void copyOut(Path artifact, Path target) throws IOException {
        FileTrees.deleteRecursively(target);
        if (Files.isDirectory(artifact)) {
            FileTrees.copyRecursively(artifact, target);
        } else {
            Files.createDirectories(target);
            FileTrees.copyRecursively(artifact, target.resolve(artifact.getFileName().toString()));
        }
        log.info("Copied {} to {}", artifact.getFileName(), target);
    }

    private String excerpt(String stderr) {
        if (stderr == null || stderr.isBlank()) return null;
        String trimmed = stderr.strip();
        return trimmed.length() <= stderrExcerptChars ? trimmed : trimmed.substring(0, stderrExcerptChars);
    }

    private void report(String runId, TaskResult result) {
        long ms = Duration.between(result.startedAt(), result.completedAt()).toMillis();
        var payload = new HashMap<String, Object>();
        payload.put("status", result.status().name());
        payload.put("elapsedMs", ms);
        if (result.message() != null) payload.put("message", result.message());
        if (result.stderrExcerpt() != null) payload.put("stderr", result.stderrExcerpt());

        if (result.status().isSuccessful()) {
            log.info("{} finished with {} in {}ms", result.taskName(), result.status(), ms);
            publish("task.completed", runId, result.taskName(), payload);
        } else {
            log.warn("{} failed in {}ms: {}", result.taskName(), ms, result.message());
            publish("task.failed", runId, result.taskName(), payload);
        }
        if (metrics != null) {
            metrics.recordTaskExecution(result.taskName(), result.status().name(), ms);
        }
    }

    private void publish(String type, String runId, String taskName, Map<String, Object> payload) {
        if (eventBus != null) {
            eventBus.publish(AnalysisEvent.of(type, runId, taskName, payload));
        }
    }
}
