package com.ecolityper.runner;

import com.ecolityper.core.model.InputMode;
import com.ecolityper.core.model.TaskPhase;
import com.ecolityper.core.model.TaskSpec;
import com.ecolityper.core.model.TaskStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class OutcomeClassifierTest {

    @TempDir
    Path workspace;

    private final OutcomeClassifier classifier = new OutcomeClassifier();
    private TaskSpec mlst;

    @BeforeEach
    void setUp() {
        mlst = new TaskSpec("mlst", "MLST", "", workspace, "ecolimlst_module.py", List.of(),
                InputMode.PATTERN_OR_SINGLE_FILE, TaskPhase.PARALLEL,
                "results", "mlst_summary.tsv", List.of("UNKNOWN", "ND"), null);
    }

    private static ProcessResult exit(int code) {
        return new ProcessResult(code, "", "", 10);
    }

    @Test
    @DisplayName("Missing artifact is a failure whatever the exit code")
    void missingArtifact() {
        var outcome = classifier.classify(mlst, exit(0));
        assertEquals(TaskStatus.FAILED, outcome.status());
        assertTrue(outcome.message().contains("results"));
    }

    @Test
    @DisplayName("Empty artifact directory is a failure")
    void emptyDirectory() throws IOException {
        Files.createDirectories(workspace.resolve("results"));
        assertEquals(TaskStatus.FAILED, classifier.classify(mlst, exit(0)).status());
    }

    @Test
    @DisplayName("Artifact present with a clean summary is a success")
    void success() throws IOException {
        Files.createDirectories(workspace.resolve("results"));
        Files.writeString(workspace.resolve("results/mlst_summary.tsv"), "sample\tST\ng1\t131\n");

        var outcome = classifier.classify(mlst, exit(0));
        assertEquals(TaskStatus.SUCCESS, outcome.status());
        assertNull(outcome.message());
    }

    @Test
    @DisplayName("Warning marker in the summary downgrades to SUCCESS_WITH_WARNINGS")
    void warningMarker() throws IOException {
        Files.createDirectories(workspace.resolve("results"));
        Files.writeString(workspace.resolve("results/mlst_summary.tsv"), "sample\tST\ng1\tUNKNOWN\n");

        var outcome = classifier.classify(mlst, exit(0));
        assertEquals(TaskStatus.SUCCESS_WITH_WARNINGS, outcome.status());
        assertTrue(outcome.message().contains("UNKNOWN"));
    }

    @Test
    @DisplayName("Markers match whole cells, not substrings")
    void markerIsToken() throws IOException {
        Files.createDirectories(workspace.resolve("results"));
        Files.writeString(workspace.resolve("results/mlst_summary.tsv"), "sample\tST\nLONDON_1\t131\n");

        assertEquals(TaskStatus.SUCCESS, classifier.classify(mlst, exit(0)).status());
    }

    @Test
    @DisplayName("Non-zero exit with the artifact present is a success with warnings")
    void nonZeroExitWithArtifact() throws IOException {
        Files.createDirectories(workspace.resolve("results"));
        Files.writeString(workspace.resolve("results/st.txt"), "131");

        var outcome = classifier.classify(mlst, exit(1));
        assertEquals(TaskStatus.SUCCESS_WITH_WARNINGS, outcome.status());
        assertTrue(outcome.message().contains("code 1"));
    }

    @Test
    @DisplayName("A file artifact counts when it exists")
    void fileArtifact() throws IOException {
        var lineage = new TaskSpec("lineage", null, null, workspace, "ref.py", null, InputMode.NONE,
                TaskPhase.REFERENCE, "report.html", null, null, null);
        Files.writeString(workspace.resolve("report.html"), "<html/>");

        assertEquals(TaskStatus.SUCCESS, classifier.classify(lineage, exit(0)).status());
    }
}
