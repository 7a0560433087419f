package com.ecolityper.core.model;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Per-task results of a run, keyed by task name.
 *
 * <p>Iteration order is the order results were recorded, which for the parallel batch is
 * completion order. Consumers must not depend on it.
 */
public class ResultSet {

    private final Map<String, TaskResult> results = new LinkedHashMap<>();

    public void record(TaskResult result) {
        results.put(result.taskName(), result);
    }

    /** Records a result only if the task has none yet. */
    public void recordIfAbsent(TaskResult result) {
        results.putIfAbsent(result.taskName(), result);
    }

    public Optional<TaskResult> get(String taskName) {
        return Optional.ofNullable(results.get(taskName));
    }

    public boolean contains(String taskName) {
        return results.containsKey(taskName);
    }

    public Collection<TaskResult> results() {
        return Collections.unmodifiableCollection(results.values());
    }

    public Map<String, TaskResult> asMap() {
        return Collections.unmodifiableMap(results);
    }

    public int size() {
        return results.size();
    }
}
