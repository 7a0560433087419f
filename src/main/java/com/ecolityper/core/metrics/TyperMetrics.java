package com.ecolityper.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for analysis runs.
 */
@Service
public class TyperMetrics {

    private final MeterRegistry registry;

    public TyperMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordTaskExecution(String tool, String status, long ms) {
        Timer.builder("ecolityper.task.duration")
                .tag("tool", tool)
                .tag("status", status)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    /**
     * Records entries a workspace cleanup could not remove.
     *
     * @param tool  the task whose workspace was cleaned
     * @param count number of entries left behind
     */
    public void recordCleanupWarnings(String tool, int count) {
        Counter.builder("ecolityper.cleanup.warnings")
                .description("Workspace entries that could not be removed")
                .tag("tool", tool)
                .register(registry)
                .increment(count);
    }

    public void recordInterrupt() {
        Counter.builder("ecolityper.run.interrupts")
                .register(registry)
                .increment();
    }

    public void recordRunResult(int succeeded, int total) {
        Counter.builder("ecolityper.runs.total")
                .tag("result", succeeded == total ? "complete" : "partial")
                .register(registry)
                .increment();
        DistributionSummary.builder("ecolityper.run.analyses")
                .description("Analyses attempted per run")
                .register(registry)
                .record(total);
    }

    /**
     * Records the worker pool width chosen for a parallel batch.
     */
    public void recordPoolWidth(int width) {
        DistributionSummary.builder("ecolityper.parallel.pool_width")
                .register(registry)
                .record(width);
    }
}
