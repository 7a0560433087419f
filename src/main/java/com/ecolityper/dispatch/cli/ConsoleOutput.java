package com.ecolityper.dispatch.cli;

import com.ecolityper.core.events.AnalysisEvent;
import com.ecolityper.core.model.RunSummary;
import com.ecolityper.core.model.TaskResult;
import picocli.CommandLine;

import java.util.Collection;
import java.util.Map;

/**
 * ANSI-colored terminal output for the EcoliTyper CLI.
 *
 * <p>Progress lines arrive from several worker threads at once; every print goes through one lock
 * so lines never interleave.
 */
public class ConsoleOutput {

    private static final Object LOCK = new Object();
    private static final String RULE = "──────────────────────────────────";

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        print("@|bold,fg(green) ECOLITYPER v0.1.0|@");
        print(RULE);
    }

    public static void info(String message) {
        print("@|fg(cyan) [ECOLITYPER]|@ " + message);
    }

    public static void success(String message) {
        print("@|fg(green) +|@ " + message);
    }

    public static void warning(String message) {
        print("@|fg(yellow) !|@ " + message);
    }

    public static void error(String message) {
        print("@|fg(red) x|@ " + message);
    }

    public static void rule() {
        print(RULE);
    }

    /**
     * Renders a progress event published during a run.
     */
    public static void event(AnalysisEvent event) {
        Map<String, Object> payload = event.payload() != null ? event.payload() : Map.of();
        String task = event.taskName();
        switch (event.eventType()) {
            case "run.started" -> info("Analysing " + payload.get("inputs") + " genome(s) with "
                    + payload.get("threads") + " thread(s)");
            case "task.started" -> print("@|fg(blue) [TASK]|@ " + task + " started ("
                    + payload.get("threads") + " thread(s))");
            case "task.completed" -> {
                if ("SUCCESS".equals(payload.get("status"))) {
                    success(task + " completed in " + formatDuration(elapsed(payload)));
                } else {
                    warning(task + " completed with warnings: " + payload.get("message"));
                }
            }
            case "task.failed" -> {
                error(task + " failed: " + payload.get("message"));
                if (payload.get("stderr") != null) {
                    print("    @|faint " + payload.get("stderr") + "|@");
                }
            }
            case "task.skipped" -> warning(task + " skipped (" + payload.get("reason") + ")");
            case "workspace.cleaned" -> {
                if (payload.get("warnings") instanceof Collection<?> warnings && !warnings.isEmpty()) {
                    warning("Cleanup of " + task + " left " + warnings.size() + " item(s) behind");
                }
            }
            case "run.cancelled" -> error("Run cancelled, workspaces cleaned");
            default -> {
                // run.completed is reported from the final summary
            }
        }
    }

    public static void taskResult(TaskResult result) {
        String line = String.format("%-14s %s", result.taskName(), result.status());
        switch (result.status()) {
            case SUCCESS -> print("  @|fg(green) " + line + "|@" + outputSuffix(result));
            case SUCCESS_WITH_WARNINGS -> print("  @|fg(yellow) " + line + "|@" + outputSuffix(result));
            case FAILED -> print("  @|fg(red) " + line + "|@");
            case SKIPPED -> print("  @|faint " + line + "|@");
        }
    }

    public static void summary(RunSummary summary) {
        rule();
        String counts = summary.succeededCount() + "/" + summary.totalCount()
                + " analyses completed successfully";
        if (summary.allSucceeded()) {
            success(counts);
        } else {
            warning(counts);
        }
    }

    private static String outputSuffix(TaskResult result) {
        return result.outputDirectory() != null ? "  -> " + result.outputDirectory() : "";
    }

    private static long elapsed(Map<String, Object> payload) {
        return payload.get("elapsedMs") instanceof Number n ? n.longValue() : 0L;
    }

    private static void print(String markup) {
        String line = CommandLine.Help.Ansi.AUTO.string(markup);
        synchronized (LOCK) {
            System.out.println(line);
        }
    }

    static String formatDuration(long ms) {
        if (ms < 1000) return ms + "ms";
        long seconds = ms / 1000;
        if (seconds < 60) return seconds + "s";
        return (seconds / 60) + "m " + (seconds % 60) + "s";
    }
}
