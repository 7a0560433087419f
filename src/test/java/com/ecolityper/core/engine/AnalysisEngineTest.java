package com.ecolityper.core.engine;

import com.ecolityper.core.events.AnalysisEvent;
import com.ecolityper.core.events.EventBus;
import com.ecolityper.core.input.FileSetResolver;
import com.ecolityper.core.input.InputNotFoundException;
import com.ecolityper.core.interrupt.EmergencyCleanup;
import com.ecolityper.core.interrupt.InterruptController;
import com.ecolityper.core.model.InputFile;
import com.ecolityper.core.model.InputSet;
import com.ecolityper.core.model.ResultSet;
import com.ecolityper.core.model.TaskPhase;
import com.ecolityper.core.model.TaskResult;
import com.ecolityper.core.model.TaskSpec;
import com.ecolityper.core.model.TaskStatus;
import com.ecolityper.core.scheduler.AnalysisScheduler;
import com.ecolityper.core.scheduler.NoInputFilesException;
import com.ecolityper.core.state.RunState;
import com.ecolityper.tools.ToolCatalog;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class AnalysisEngineTest {

    @TempDir
    Path root;

    private FileSetResolver resolver;
    private ToolCatalog catalog;
    private AnalysisScheduler scheduler;
    private InterruptController interruptController;
    private EmergencyCleanup emergencyCleanup;
    private List<AnalysisEvent> events;
    private AnalysisEngine engine;
    private InputSet inputs;
    private Path outputRoot;

    @BeforeEach
    void setUp() throws IOException {
        resolver = mock(FileSetResolver.class);
        catalog = mock(ToolCatalog.class);
        scheduler = mock(AnalysisScheduler.class);
        interruptController = mock(InterruptController.class);
        emergencyCleanup = mock(EmergencyCleanup.class);
        var eventBus = new EventBus();
        events = new ArrayList<>();
        eventBus.subscribeAll(events::add);
        engine = new AnalysisEngine(resolver, catalog, scheduler, interruptController, emergencyCleanup,
                new RunSummaryWriter(), eventBus, null);

        inputs = InputSet.of(InputFile.of(Files.writeString(root.resolve("g.fna"), ">g\nA\n")));
        outputRoot = root.resolve("results");
        when(resolver.resolve("genomes/")).thenReturn(inputs);
        when(catalog.all()).thenReturn(List.of(spec("mlst", TaskPhase.PARALLEL),
                spec("amrfinder", TaskPhase.EXCLUSIVE), spec("lineage", TaskPhase.REFERENCE)));
        when(catalog.isEnabled(anyString())).thenReturn(true);
    }

    private TaskSpec spec(String name, TaskPhase phase) {
        return new TaskSpec(name, null, null, root.resolve(name), name + ".py", null, null, phase,
                "out", null, null, null);
    }

    private static ResultSet resultsOf(TaskResult... results) {
        var set = new ResultSet();
        for (TaskResult r : results) set.record(r);
        return set;
    }

    private static TaskResult ok(String name) {
        return new TaskResult(name, TaskStatus.SUCCESS, null, null, 0, null, Instant.now(), Instant.now());
    }

    @Test
    @DisplayName("Runs enabled tasks, writes the summary and reports counts")
    @SuppressWarnings("unchecked")
    void fullRun() {
        when(scheduler.runAll(any(), eq(outputRoot), eq(4), anyList()))
                .thenReturn(resultsOf(ok("mlst"), ok("amrfinder"), ok("lineage")));

        AnalysisReport report = engine.run("ECT-1", new AnalysisRequest("genomes/", outputRoot, 4, Set.of()));

        ArgumentCaptor<List<TaskSpec>> tasks = ArgumentCaptor.forClass(List.class);
        verify(scheduler).runAll(any(RunState.class), eq(outputRoot), eq(4), tasks.capture());
        assertEquals(List.of("mlst", "amrfinder", "lineage"), tasks.getValue().stream().map(TaskSpec::name).toList());
        assertEquals(3, report.summary().succeededCount());
        assertTrue(report.summary().allSucceeded());
        assertEquals(outputRoot.resolve("run_summary.json"), report.summaryFile());
        assertTrue(Files.exists(report.summaryFile()));
        assertEquals("run.started", events.get(0).eventType());
        assertEquals("run.completed", events.get(events.size() - 1).eventType());
    }

    @Test
    @DisplayName("Skipped and disabled tools are reported as SKIPPED and not scheduled")
    @SuppressWarnings("unchecked")
    void skippedTools() {
        when(catalog.isEnabled("lineage")).thenReturn(false);
        when(scheduler.runAll(any(), any(), anyInt(), anyList())).thenReturn(resultsOf(ok("mlst")));

        AnalysisReport report = engine.run("ECT-2",
                new AnalysisRequest("genomes/", outputRoot, 2, Set.of("amrfinder")));

        ArgumentCaptor<List<TaskSpec>> tasks = ArgumentCaptor.forClass(List.class);
        verify(scheduler).runAll(any(), any(), anyInt(), tasks.capture());
        assertEquals(List.of("mlst"), tasks.getValue().stream().map(TaskSpec::name).toList());
        assertEquals(TaskStatus.SKIPPED, report.results().get("amrfinder").orElseThrow().status());
        assertEquals(TaskStatus.SKIPPED, report.results().get("lineage").orElseThrow().status());
        assertEquals(1, report.summary().totalCount());
    }

    @Test
    @DisplayName("Interrupt handler is installed for the run and removed afterwards")
    void interruptHandlerLifecycle() {
        when(scheduler.runAll(any(), any(), anyInt(), anyList())).thenReturn(new ResultSet());

        engine.run("ECT-3", new AnalysisRequest("genomes/", outputRoot, 2, Set.of()));

        ArgumentCaptor<RunState> state = ArgumentCaptor.forClass(RunState.class);
        var order = inOrder(interruptController, scheduler);
        order.verify(interruptController).install(state.capture());
        order.verify(scheduler).runAll(any(), any(), anyInt(), anyList());
        order.verify(interruptController).uninstall();
        assertFalse(state.getValue().isActive());
    }

    @Test
    @DisplayName("Unexpected scheduler failure triggers emergency cleanup and propagates")
    void unexpectedFailure() {
        when(scheduler.runAll(any(), any(), anyInt(), anyList())).thenThrow(new IllegalStateException("pool died"));

        assertThrows(IllegalStateException.class,
                () -> engine.run("ECT-4", new AnalysisRequest("genomes/", outputRoot, 2, Set.of())));

        verify(emergencyCleanup).run(any(RunState.class));
        verify(interruptController).uninstall();
    }

    @Test
    @DisplayName("No FASTA files stops the run before scheduling")
    void noInputFiles() {
        when(resolver.resolve("empty/")).thenReturn(InputSet.empty());

        assertThrows(NoInputFilesException.class,
                () -> engine.run("ECT-5", new AnalysisRequest("empty/", outputRoot, 2, Set.of())));

        verifyNoInteractions(scheduler, interruptController);
    }

    @Test
    @DisplayName("Unknown input propagates InputNotFoundException")
    void inputNotFound() {
        when(resolver.resolve("missing")).thenThrow(new InputNotFoundException("Input path not found: missing"));

        assertThrows(InputNotFoundException.class,
                () -> engine.run("ECT-6", new AnalysisRequest("missing", outputRoot, 2, Set.of())));
        verifyNoInteractions(scheduler);
    }

    @Test
    @DisplayName("Run IDs follow ECT-yyyyMMdd-HHmmss-NNN")
    void runIdFormat() {
        assertTrue(engine.generateRunId().matches("ECT-\\d{8}-\\d{6}-\\d{3}"));
    }

    @Test
    @DisplayName("Request validation rejects a zero thread count")
    void requestValidation() {
        assertThrows(IllegalArgumentException.class,
                () -> new AnalysisRequest("genomes/", outputRoot, 0, Set.of()));
    }
}
