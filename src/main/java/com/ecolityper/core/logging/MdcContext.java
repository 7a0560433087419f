package com.ecolityper.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing run-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setRun(String runId) {
        MDC.put("runId", runId);
    }

    public static void setTask(String runId, String taskName) {
        MDC.put("runId", runId);
        MDC.put("task", taskName);
    }

    /** Run id bound to the current thread, or null outside a run. */
    public static String currentRunId() {
        return MDC.get("runId");
    }

    public static void clear() {
        MDC.remove("runId");
        MDC.remove("task");
    }
}
