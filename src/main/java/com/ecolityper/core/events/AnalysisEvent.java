package com.ecolityper.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted during a run, rendered by the CLI as progress output.
 *
 * @param eventType event type (e.g. "run.started", "task.started", "task.completed", "workspace.cleaned")
 * @param runId     the run this event belongs to
 * @param taskName  the task this event relates to (nullable for run-level events)
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record AnalysisEvent(
    String eventType,
    String runId,
    String taskName,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static AnalysisEvent of(String eventType, String runId, String taskName, Map<String, Object> payload) {
        return new AnalysisEvent(eventType, runId, taskName, payload, Instant.now());
    }
}
