package com.ecolityper.core.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class TyperMetricsTest {

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final TyperMetrics metrics = new TyperMetrics(registry);

    @Test
    void taskExecutionTaggedByToolAndStatus() {
        metrics.recordTaskExecution("mlst", "SUCCESS", 1500);

        var timer = registry.get("ecolityper.task.duration").tag("tool", "mlst").tag("status", "SUCCESS").timer();
        assertEquals(1, timer.count());
        assertEquals(1500, timer.totalTime(TimeUnit.MILLISECONDS), 0.1);
    }

    @Test
    void runResultDistinguishesPartialRuns() {
        metrics.recordRunResult(6, 6);
        metrics.recordRunResult(4, 6);

        assertEquals(1, registry.get("ecolityper.runs.total").tag("result", "complete").counter().count());
        assertEquals(1, registry.get("ecolityper.runs.total").tag("result", "partial").counter().count());
        assertEquals(2, registry.get("ecolityper.run.analyses").summary().count());
    }

    @Test
    void interruptsAndCleanupWarningsAreCounted() {
        metrics.recordInterrupt();
        metrics.recordCleanupWarnings("chtyper", 3);

        assertEquals(1, registry.get("ecolityper.run.interrupts").counter().count());
        assertEquals(3, registry.get("ecolityper.cleanup.warnings").tag("tool", "chtyper").counter().count());
    }
}
