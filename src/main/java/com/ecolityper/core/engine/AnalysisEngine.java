package com.ecolityper.core.engine;

import com.ecolityper.core.events.AnalysisEvent;
import com.ecolityper.core.events.EventBus;
import com.ecolityper.core.input.FileSetResolver;
import com.ecolityper.core.interrupt.EmergencyCleanup;
import com.ecolityper.core.interrupt.InterruptController;
import com.ecolityper.core.logging.MdcContext;
import com.ecolityper.core.metrics.TyperMetrics;
import com.ecolityper.core.model.InputSet;
import com.ecolityper.core.model.ResultSet;
import com.ecolityper.core.model.RunSummary;
import com.ecolityper.core.model.TaskResult;
import com.ecolityper.core.model.TaskSpec;
import com.ecolityper.core.scheduler.AnalysisScheduler;
import com.ecolityper.core.scheduler.NoInputFilesException;
import com.ecolityper.core.state.RunState;
import com.ecolityper.tools.ToolCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Entry point for a typing run: resolves inputs, schedules the enabled tools, and reports.
 *
 * <p>The interrupt handler is installed only while the scheduler runs. If the scheduler dies
 * with an unexpected exception every registered workspace is cleaned before the exception
 * propagates.
 */
@Service
public class AnalysisEngine {

    private static final Logger log = LoggerFactory.getLogger(AnalysisEngine.class);
    private static final AtomicInteger RUN_COUNTER = new AtomicInteger(0);
    private static final DateTimeFormatter RUN_ID_TIME = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss");

    private final FileSetResolver resolver;
    private final ToolCatalog catalog;
    private final AnalysisScheduler scheduler;
    private final InterruptController interruptController;
    private final EmergencyCleanup emergencyCleanup;
    private final RunSummaryWriter summaryWriter;
    private final EventBus eventBus;
    private final TyperMetrics metrics;

    @Autowired
    public AnalysisEngine(FileSetResolver resolver, ToolCatalog catalog, AnalysisScheduler scheduler,
                          InterruptController interruptController, EmergencyCleanup emergencyCleanup,
                          RunSummaryWriter summaryWriter, EventBus eventBus,
                          @Autowired(required = false) TyperMetrics metrics) {
        this.resolver = resolver;
        this.catalog = catalog;
        this.scheduler = scheduler;
        this.interruptController = interruptController;
        this.emergencyCleanup = emergencyCleanup;
        this.summaryWriter = summaryWriter;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    public AnalysisReport run(AnalysisRequest request) {
        return run(generateRunId(), request);
    }

    /**
     * @throws com.ecolityper.core.input.InputNotFoundException if the input specifier matches nothing
     * @throws NoInputFilesException if the specifier names no FASTA files
     */
    public AnalysisReport run(String runId, AnalysisRequest request) {
        MdcContext.setRun(runId);
        try {
            Instant startedAt = Instant.now();
            InputSet inputs = resolver.resolve(request.inputSpecifier());
            log.info("Run {}: {} input file(s), {} thread(s), output to {}",
                    runId, inputs.size(), request.threads(), request.outputRoot());

            List<TaskSpec> enabled = new ArrayList<>();
            List<TaskSpec> disabled = new ArrayList<>();
            for (TaskSpec spec : catalog.all()) {
                if (request.skippedTools().contains(spec.name()) || !catalog.isEnabled(spec.name())) {
                    disabled.add(spec);
                } else {
                    enabled.add(spec);
                }
            }

            RunState state = new RunState(runId, inputs);
            ResultSet results = schedule(state, request, enabled);

            for (TaskSpec spec : disabled) {
                results.recordIfAbsent(TaskResult.skipped(spec.name(), "Disabled"));
                eventBus.publish(AnalysisEvent.of("task.skipped", runId, spec.name(),
                        Map.of("reason", "Disabled")));
            }

            RunSummary summary = ResultAggregator.summarize(results);
            var report = new AnalysisReport(runId, inputs, request.outputRoot(), results, summary,
                    null, startedAt, Instant.now());
            report = withSummaryFile(report);

            if (metrics != null) {
                metrics.recordRunResult(summary.succeededCount(), summary.totalCount());
            }
            log.info("Run {} finished: {}/{} analyses completed successfully",
                    runId, summary.succeededCount(), summary.totalCount());
            eventBus.publish(AnalysisEvent.of("run.completed", runId, null,
                    Map.of("succeeded", summary.succeededCount(),
                           "total", summary.totalCount(),
                           "cancelled", state.isCancelled())));
            return report;
        } finally {
            MdcContext.clear();
        }
    }

    private ResultSet schedule(RunState state, AnalysisRequest request, List<TaskSpec> enabled) {
        if (state.inputs().isEmpty()) {
            throw new NoInputFilesException("No FASTA files found for " + request.inputSpecifier());
        }
        try {
            Files.createDirectories(request.outputRoot());
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create output directory " + request.outputRoot(), e);
        }

        eventBus.publish(AnalysisEvent.of("run.started", state.runId(), null,
                Map.of("inputs", state.inputs().size(),
                       "tasks", enabled.stream().map(TaskSpec::name).toList(),
                       "threads", request.threads())));

        interruptController.install(state);
        try {
            return scheduler.runAll(state, request.outputRoot(), request.threads(), enabled);
        } catch (NoInputFilesException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Run {} aborted: {}", state.runId(), e.getMessage(), e);
            state.cancellation().cancel();
            emergencyCleanup.run(state);
            throw e;
        } finally {
            state.complete();
            interruptController.uninstall();
        }
    }

    private AnalysisReport withSummaryFile(AnalysisReport report) {
        try {
            Path written = summaryWriter.write(report);
            log.info("Run summary written to {}", written);
            return new AnalysisReport(report.runId(), report.inputs(), report.outputRoot(),
                    report.results(), report.summary(), written, report.startedAt(), report.completedAt());
        } catch (IOException e) {
            log.error("Could not write run summary to {}: {}", report.outputRoot(), e.getMessage());
            return report;
        }
    }

    /**
     * Generates a run ID in the format ECT-yyyyMMdd-HHmmss-NNN.
     */
    public String generateRunId() {
        int count = RUN_COUNTER.incrementAndGet() % 1000;
        return String.format("ECT-%s-%03d", LocalDateTime.now().format(RUN_ID_TIME), count);
    }
}
