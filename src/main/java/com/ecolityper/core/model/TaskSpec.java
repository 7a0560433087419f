package com.ecolityper.core.model;

import java.io.Serializable;
import java.nio.file.Path;
import java.util.List;

/**
 * Declarative description of one wrapped analysis tool.
 *
 * <p>A single {@code TaskRunner} executes every tool; everything that differs between tools
 * lives here as data.
 *
 * @param name             stable key, also used for the {@code <name>_results} output directory
 * @param displayName      human readable name for console output
 * @param description      one-line description of the analysis
 * @param workspace        the tool's module directory; inputs are staged here and the tool runs here
 * @param script           script file name inside the workspace
 * @param arguments        argument template; see {@link #INPUT}, {@link #THREADS}, {@link #WORKDIR}
 * @param inputMode        how inputs are handed to the tool
 * @param phase            scheduling phase
 * @param resultPath       workspace-relative path of the primary artifact (file or directory)
 * @param summaryFile      artifact-relative file scanned for warning markers, or null
 * @param warningMarkers   values that downgrade a result to {@link TaskStatus#SUCCESS_WITH_WARNINGS}
 * @param purgeDirectories workspace-relative directories removed on cleanup, besides the global list
 */
public record TaskSpec(
    String name,
    String displayName,
    String description,
    Path workspace,
    String script,
    List<String> arguments,
    InputMode inputMode,
    TaskPhase phase,
    String resultPath,
    String summaryFile,
    List<String> warningMarkers,
    List<String> purgeDirectories
) implements Serializable {

    public static final String INPUT = "{input}";
    public static final String THREADS = "{threads}";
    public static final String WORKDIR = "{workdir}";

    public TaskSpec {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Task name must not be blank");
        }
        if (workspace == null) {
            throw new IllegalArgumentException("Task " + name + " has no workspace");
        }
        if (resultPath == null || resultPath.isBlank()) {
            throw new IllegalArgumentException("Task " + name + " declares no result path");
        }
        displayName = displayName == null ? name : displayName;
        arguments = arguments == null ? List.of() : List.copyOf(arguments);
        inputMode = inputMode == null ? InputMode.PATTERN : inputMode;
        phase = phase == null ? TaskPhase.PARALLEL : phase;
        warningMarkers = warningMarkers == null ? List.of() : List.copyOf(warningMarkers);
        purgeDirectories = purgeDirectories == null ? List.of() : List.copyOf(purgeDirectories);
    }

    public Path scriptPath() {
        return workspace.resolve(script);
    }

    public Path artifactPath() {
        return workspace.resolve(resultPath);
    }

    /** Name of this task's directory under the shared output root. */
    public String outputDirectoryName() {
        return name + "_results";
    }

    public boolean stagesInputs() {
        return inputMode != InputMode.NONE;
    }

    public boolean isExclusive() {
        return phase == TaskPhase.EXCLUSIVE;
    }
}
