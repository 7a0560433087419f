package com.ecolityper.dispatch.cli;

import com.ecolityper.core.engine.AnalysisEngine;
import com.ecolityper.core.engine.AnalysisReport;
import com.ecolityper.core.engine.AnalysisRequest;
import com.ecolityper.core.events.EventBus;
import com.ecolityper.core.input.InputNotFoundException;
import com.ecolityper.core.model.TaskResult;
import com.ecolityper.core.scheduler.NoInputFilesException;
import com.ecolityper.tools.ToolCatalog;
import com.ecolityper.tools.ToolProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.concurrent.Callable;

/**
 * CLI command: ecolityper run -i &lt;input&gt; -o &lt;output&gt;
 * <p>
 * Runs every enabled typing tool over the input genomes and prints per-tool progress and a
 * final summary.
 */
@Command(name = "run", mixinStandardHelpOptions = true, description = "Type a batch of E. coli genomes")
@Component
public class RunCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(RunCommand.class);

    static final int EXIT_OK = 0;
    static final int EXIT_ERROR = 1;
    static final int EXIT_INCOMPLETE = 2;

    @Option(names = {"-i", "--input"}, required = true,
            description = "FASTA file, directory of FASTA files, or glob pattern (quote it)")
    private String input;

    @Option(names = {"-o", "--output"}, required = true, description = "Output directory")
    private Path output;

    @Option(names = {"-t", "--threads"}, description = "Total threads shared by the tools (default: ecolityper.execution.default-threads)")
    private Integer threads;

    @Option(names = "--skip-mlst", description = "Skip MLST")
    private boolean skipMlst;

    @Option(names = "--skip-serotyping", description = "Skip serotyping")
    private boolean skipSerotyping;

    @Option(names = "--skip-chtyper", description = "Skip CH typing")
    private boolean skipChtyper;

    @Option(names = "--skip-phylogrouping", description = "Skip phylogrouping")
    private boolean skipPhylogrouping;

    @Option(names = "--skip-abricate", description = "Skip ABRicate")
    private boolean skipAbricate;

    @Option(names = "--skip-amrfinder", description = "Skip AMRFinderPlus")
    private boolean skipAmrfinder;

    @Option(names = "--skip-lineage", description = "Skip the lineage reference report")
    private boolean skipLineage;

    @Option(names = "--strict", description = "Exit with status 2 unless every analysis succeeded")
    private boolean strict;

    private final AnalysisEngine engine;
    private final EventBus eventBus;
    private final ToolProperties properties;

    public RunCommand(AnalysisEngine engine, EventBus eventBus, ToolProperties properties) {
        this.engine = engine;
        this.eventBus = eventBus;
        this.properties = properties;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        int threadCount = threads != null ? threads : properties.getDefaultThreads();
        if (threadCount < 1) {
            ConsoleOutput.error("Thread count must be at least 1");
            return EXIT_ERROR;
        }

        String runId = engine.generateRunId();
        var subscription = eventBus.subscribe(runId, ConsoleOutput::event);
        try {
            ConsoleOutput.info("Run " + runId);
            AnalysisReport report = engine.run(runId,
                    new AnalysisRequest(input, output, threadCount, skippedTools()));

            ConsoleOutput.rule();
            for (TaskResult result : report.results().results()) {
                ConsoleOutput.taskResult(result);
            }
            ConsoleOutput.summary(report.summary());
            if (report.summaryFile() != null) {
                ConsoleOutput.info("Summary written to " + report.summaryFile());
            }

            if (strict && !report.summary().allSucceeded()) {
                return EXIT_INCOMPLETE;
            }
            return EXIT_OK;
        } catch (InputNotFoundException | NoInputFilesException e) {
            ConsoleOutput.error(e.getMessage());
            return EXIT_ERROR;
        } catch (Exception e) {
            log.error("Run {} failed", runId, e);
            ConsoleOutput.error("Run failed: " + rootCauseMessage(e));
            return EXIT_ERROR;
        } finally {
            subscription.unsubscribe();
        }
    }

    Set<String> skippedTools() {
        var skipped = new LinkedHashSet<String>();
        if (skipMlst) skipped.add(ToolCatalog.MLST);
        if (skipSerotyping) skipped.add(ToolCatalog.SEROTYPING);
        if (skipChtyper) skipped.add(ToolCatalog.CHTYPER);
        if (skipPhylogrouping) skipped.add(ToolCatalog.PHYLOGROUPING);
        if (skipAbricate) skipped.add(ToolCatalog.ABRICATE);
        if (skipAmrfinder) skipped.add(ToolCatalog.AMRFINDER);
        if (skipLineage) skipped.add(ToolCatalog.LINEAGE);
        return skipped;
    }

    private static String rootCauseMessage(Throwable t) {
        Throwable cause = t;
        while (cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
