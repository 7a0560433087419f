package com.ecolityper.workspace;

import com.ecolityper.core.metrics.TyperMetrics;
import com.ecolityper.core.model.InputFile;
import com.ecolityper.core.model.InputSet;
import com.ecolityper.core.model.TaskSpec;
import com.ecolityper.tools.ToolProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Stages inputs into a tool's module directory and removes everything a run leaves behind.
 *
 * <p>Lifecycle per task:
 * <ol>
 *   <li>{@link #open} hands out a {@link Workspace} handle</li>
 *   <li>{@link #stage} clears a stale artifact and copies the inputs in</li>
 *   <li>{@link #clean} removes the copied inputs, known output directories and temp files</li>
 * </ol>
 *
 * <p>Cleanup never throws. Each entry that cannot be removed is logged and returned as a warning
 * and the remaining entries are still attempted. Absent entries are skipped, so cleaning twice is
 * harmless.
 */
@Service
public class WorkspaceManager {

    private static final Logger log = LoggerFactory.getLogger(WorkspaceManager.class);

    private final List<String> purgeDirectories;
    private final List<String> tempPatterns;
    private final TyperMetrics metrics;

    @Autowired
    public WorkspaceManager(ToolProperties properties, @Autowired(required = false) TyperMetrics metrics) {
        this(properties.getPurgeDirectories(), properties.getTempPatterns(), metrics);
    }

    WorkspaceManager(List<String> purgeDirectories, List<String> tempPatterns, TyperMetrics metrics) {
        this.purgeDirectories = List.copyOf(purgeDirectories);
        this.tempPatterns = List.copyOf(tempPatterns);
        this.metrics = metrics;
    }

    public Workspace open(TaskSpec spec, InputSet inputs) {
        return new Workspace(this, spec, inputs);
    }

    /**
     * Copies every input into the task's workspace as a full copy (tools may modify their inputs).
     * A stale artifact from an earlier run is removed first so it cannot pass for fresh output.
     *
     * @throws StageException if the workspace is missing, two inputs share a name, or a copy fails
     */
    public void stage(TaskSpec spec, InputSet inputs) {
        Path workspace = spec.workspace();
        if (!Files.isDirectory(workspace)) {
            throw new StageException("Workspace for " + spec.name() + " not found: " + workspace);
        }

        Path staleArtifact = spec.artifactPath();
        try {
            FileTrees.deleteRecursively(staleArtifact);
        } catch (IOException e) {
            throw new StageException("Could not clear stale results at " + staleArtifact, e);
        }

        if (!spec.stagesInputs()) {
            return;
        }

        var seen = new HashSet<String>();
        for (InputFile input : inputs.files()) {
            if (!seen.add(input.fileName())) {
                throw new StageException("Two inputs share the file name " + input.fileName()
                        + "; cannot stage both into " + spec.name());
            }
        }

        for (InputFile input : inputs.files()) {
            Path target = workspace.resolve(input.fileName());
            try {
                Files.copy(input.path(), target,
                        StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.COPY_ATTRIBUTES);
            } catch (IOException e) {
                throw new StageException("Failed to copy " + input.path() + " into " + workspace, e);
            }
        }
        log.info("Staged {} file(s) into {}", inputs.size(), workspace);
    }

    /**
     * Removes copied inputs, output directories, and temp files from the task's workspace.
     * A task that stages no inputs shares its module directory with bundled data, so only its
     * artifact is removed there.
     *
     * @return warnings for entries that could not be removed; empty when fully cleaned
     */
    public List<String> clean(TaskSpec spec, InputSet inputs) {
        Path workspace = spec.workspace();
        var warnings = new ArrayList<String>();
        if (!Files.isDirectory(workspace)) {
            log.debug("Workspace {} does not exist, nothing to clean", workspace);
            return warnings;
        }

        if (!spec.stagesInputs()) {
            remove(spec.artifactPath(), warnings);
            return finish(spec, warnings);
        }

        for (InputFile input : inputs.files()) {
            remove(workspace.resolve(input.fileName()), warnings);
        }

        for (String dir : directoriesToPurge(spec)) {
            remove(workspace.resolve(dir), warnings);
        }

        for (String pattern : tempPatterns) {
            try (DirectoryStream<Path> matches = Files.newDirectoryStream(workspace, pattern)) {
                for (Path match : matches) {
                    if (Files.isRegularFile(match)) {
                        remove(match, warnings);
                    }
                }
            } catch (IOException e) {
                warn(warnings, "Could not scan " + workspace + " for " + pattern + ": " + e.getMessage());
            }
        }

        return finish(spec, warnings);
    }

    private List<String> finish(TaskSpec spec, List<String> warnings) {
        Path workspace = spec.workspace();
        if (warnings.isEmpty()) {
            log.info("Cleaned workspace {}", workspace);
        } else {
            log.warn("Partial cleanup of {}: {} item(s) left behind", workspace, warnings.size());
            if (metrics != null) {
                metrics.recordCleanupWarnings(spec.name(), warnings.size());
            }
        }
        return warnings;
    }

    /**
     * Global purge list, the task's own output directories, and the top-level directory of its
     * result path.
     */
    Set<String> directoriesToPurge(TaskSpec spec) {
        var dirs = new LinkedHashSet<String>(purgeDirectories);
        dirs.addAll(spec.purgeDirectories());
        String resultPath = spec.resultPath().replace('\\', '/');
        int slash = resultPath.indexOf('/');
        dirs.add(slash < 0 ? resultPath : resultPath.substring(0, slash));
        return dirs;
    }

    private void remove(Path path, List<String> warnings) {
        try {
            FileTrees.deleteRecursively(path);
        } catch (IOException e) {
            warn(warnings, "Could not remove " + path + ": " + e.getMessage());
        }
    }

    private static void warn(List<String> warnings, String message) {
        log.warn(message);
        warnings.add(message);
    }
}
