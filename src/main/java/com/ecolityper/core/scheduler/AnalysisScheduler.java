package com.ecolityper.core.scheduler;

import com.ecolityper.core.events.AnalysisEvent;
import com.ecolityper.core.events.EventBus;
import com.ecolityper.core.logging.MdcContext;
import com.ecolityper.core.metrics.TyperMetrics;
import com.ecolityper.core.model.ResultSet;
import com.ecolityper.core.model.TaskPhase;
import com.ecolityper.core.model.TaskResult;
import com.ecolityper.core.model.TaskSpec;
import com.ecolityper.core.model.ThreadBudget;
import com.ecolityper.core.state.RunState;
import com.ecolityper.runner.TaskRunner;
import com.ecolityper.workspace.Workspace;
import com.ecolityper.workspace.WorkspaceManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs the enabled tasks of a run in three phases:
 * <ol>
 *   <li>{@link TaskPhase#PARALLEL} tasks on a fixed worker pool, collected in completion order</li>
 *   <li>{@link TaskPhase#EXCLUSIVE} tasks one at a time on the calling thread with every thread</li>
 *   <li>{@link TaskPhase#REFERENCE} tasks one at a time with a single thread</li>
 * </ol>
 *
 * <p>A failed task never stops the others. Cancellation is polled before each task starts and
 * between result collections; tasks that never ran are recorded as
 * {@link com.ecolityper.core.model.TaskStatus#SKIPPED}. Running tools are left to finish.
 */
@Service
public class AnalysisScheduler {

    private static final Logger log = LoggerFactory.getLogger(AnalysisScheduler.class);

    /** How long the collector waits for a result before re-checking cancellation. */
    private static final long POLL_INTERVAL_MS = 250;

    private final TaskRunner taskRunner;
    private final WorkspaceManager workspaceManager;
    private final ThreadBudgetPolicy budgetPolicy;
    private final EventBus eventBus;
    private final TyperMetrics metrics;

    @Autowired
    public AnalysisScheduler(TaskRunner taskRunner, WorkspaceManager workspaceManager,
                             ThreadBudgetPolicy budgetPolicy, EventBus eventBus,
                             @Autowired(required = false) TyperMetrics metrics) {
        this.taskRunner = taskRunner;
        this.workspaceManager = workspaceManager;
        this.budgetPolicy = budgetPolicy;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    AnalysisScheduler(TaskRunner taskRunner, WorkspaceManager workspaceManager, ThreadBudgetPolicy budgetPolicy) {
        this(taskRunner, workspaceManager, budgetPolicy, new EventBus(), null);
    }

    /**
     * @throws NoInputFilesException if the run's input set is empty; no task is started
     */
    public ResultSet runAll(RunState state, Path outputRoot, int threadCount, List<TaskSpec> enabledTasks) {
        if (state.inputs().isEmpty()) {
            throw new NoInputFilesException("No FASTA files to analyse");
        }

        List<TaskSpec> parallel = inPhase(enabledTasks, TaskPhase.PARALLEL);
        List<TaskSpec> exclusive = inPhase(enabledTasks, TaskPhase.EXCLUSIVE);
        List<TaskSpec> reference = inPhase(enabledTasks, TaskPhase.REFERENCE);

        var results = new ResultSet();
        runParallel(state, outputRoot, threadCount, parallel, results);

        for (TaskSpec spec : exclusive) {
            runSequential(state, outputRoot, spec, budgetPolicy.exclusive(threadCount), results);
        }
        for (TaskSpec spec : reference) {
            runSequential(state, outputRoot, spec, ThreadBudget.SINGLE, results);
        }
        return results;
    }

    private void runParallel(RunState state, Path outputRoot, int threadCount,
                             List<TaskSpec> tasks, ResultSet results) {
        if (tasks.isEmpty()) {
            return;
        }
        int width = budgetPolicy.poolWidth(threadCount, tasks.size());
        ThreadBudget budget = budgetPolicy.perTask(threadCount, tasks.size());
        log.info("Running {} analyses in parallel: {} worker(s), {} thread(s) each",
                tasks.size(), width, budget);
        if (metrics != null) {
            metrics.recordPoolWidth(width);
        }

        ExecutorService executor = Executors.newFixedThreadPool(width, workerThreads());
        var completion = new ExecutorCompletionService<TaskResult>(executor);
        Map<Future<TaskResult>, TaskSpec> pending = new HashMap<>();
        try {
            for (TaskSpec spec : tasks) {
                if (state.isCancelled()) {
                    break;
                }
                Workspace workspace = workspaceManager.open(spec, state.inputs());
                state.register(workspace);
                pending.put(completion.submit(() -> runWorker(state, workspace, outputRoot, budget)), spec);
            }

            while (!pending.isEmpty() && !state.isCancelled()) {
                Future<TaskResult> done = completion.poll(POLL_INTERVAL_MS, TimeUnit.MILLISECONDS);
                if (done == null) {
                    continue;
                }
                TaskSpec spec = pending.remove(done);
                results.record(collect(done, spec));
            }
            // Keep results that were already finished when the run was cancelled
            Future<TaskResult> done;
            while (!pending.isEmpty() && (done = completion.poll()) != null) {
                results.record(collect(done, pending.remove(done)));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while collecting results; cancelling run {}", state.runId());
            state.cancellation().cancel();
        } finally {
            pending.keySet().forEach(f -> f.cancel(false));
            executor.shutdown();
        }

        for (TaskSpec spec : tasks) {
            if (!results.contains(spec.name())) {
                results.record(skip(state, spec));
            }
        }
    }

    private TaskResult runWorker(RunState state, Workspace workspace, Path outputRoot, ThreadBudget budget) {
        MdcContext.setTask(state.runId(), workspace.spec().name());
        try {
            if (state.isCancelled()) {
                log.info("Run cancelled before {} started", workspace.spec().name());
                return TaskResult.skipped(workspace.spec().name(), "Run cancelled");
            }
            return taskRunner.run(state.runId(), workspace, outputRoot, budget);
        } finally {
            MdcContext.clear();
        }
    }

    private void runSequential(RunState state, Path outputRoot, TaskSpec spec,
                               ThreadBudget budget, ResultSet results) {
        if (state.isCancelled()) {
            results.record(skip(state, spec));
            return;
        }
        Workspace workspace = workspaceManager.open(spec, state.inputs());
        state.register(workspace);
        log.info("Running {} alone with {} thread(s)", spec.displayName(), budget);
        MdcContext.setTask(state.runId(), spec.name());
        try {
            results.record(taskRunner.run(state.runId(), workspace, outputRoot, budget));
        } finally {
            MdcContext.setRun(state.runId());
        }
    }

    private TaskResult collect(Future<TaskResult> future, TaskSpec spec) {
        try {
            return future.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("Worker for {} died: {}", spec.name(), cause.getMessage(), cause);
            return TaskResult.failed(spec.name(), "Worker error: " + cause.getMessage(), Instant.now());
        } catch (InterruptedException e) {
            // poll() already returned this future, so get() does not block
            Thread.currentThread().interrupt();
            return TaskResult.failed(spec.name(), "Interrupted while collecting result", Instant.now());
        }
    }

    private TaskResult skip(RunState state, TaskSpec spec) {
        TaskResult skipped = TaskResult.skipped(spec.name(), "Run cancelled");
        eventBus.publish(AnalysisEvent.of("task.skipped", state.runId(), spec.name(),
                Map.of("reason", skipped.message())));
        return skipped;
    }

    private static List<TaskSpec> inPhase(List<TaskSpec> tasks, TaskPhase phase) {
        return tasks.stream().filter(t -> t.phase() == phase).toList();
    }

    private static ThreadFactory workerThreads() {
        var counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "ecolityper-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
