package com.ecolityper.core.interrupt;

import com.ecolityper.core.state.RunState;
import com.ecolityper.tools.ToolProperties;
import com.ecolityper.workspace.Workspace;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Releases every workspace a run has registered.
 *
 * <p>Used by the signal path and by the engine when a run dies unexpectedly. Workspaces already
 * released by their task are skipped (closing is idempotent). One failing workspace never stops
 * the rest. The whole pass is bounded by a deadline; workspaces not reached in time are logged
 * and returned.
 */
@Component
public class EmergencyCleanup {

    private static final Logger log = LoggerFactory.getLogger(EmergencyCleanup.class);

    private final Duration timeout;

    @Autowired
    public EmergencyCleanup(ToolProperties properties) {
        this(Duration.ofSeconds(properties.getInterruptCleanupTimeoutSeconds()));
    }

    EmergencyCleanup(Duration timeout) {
        this.timeout = timeout;
    }

    /**
     * @return names of tasks whose workspaces were not released before the deadline
     */
    public List<String> run(RunState state) {
        List<Workspace> workspaces = state.workspaces();
        if (workspaces.isEmpty()) {
            return List.of();
        }
        log.warn("Emergency cleanup of {} workspace(s) for run {}", workspaces.size(), state.runId());

        ExecutorService cleaner = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "ecolityper-emergency-cleanup");
            t.setDaemon(true);
            return t;
        });
        Future<?> pass = cleaner.submit(() -> releaseAll(workspaces));
        try {
            pass.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.error("Emergency cleanup did not finish within {}s", timeout.toSeconds());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Emergency cleanup interrupted");
        } catch (ExecutionException e) {
            log.error("Emergency cleanup failed: {}", e.getCause().getMessage(), e.getCause());
        } finally {
            cleaner.shutdownNow();
        }

        var unreleased = new ArrayList<String>();
        for (Workspace workspace : workspaces) {
            if (!workspace.isReleased()) {
                unreleased.add(workspace.spec().name());
            }
        }
        if (!unreleased.isEmpty()) {
            log.error("Workspaces left uncleaned: {}", unreleased);
        }
        return unreleased;
    }

    private static void releaseAll(List<Workspace> workspaces) {
        for (Workspace workspace : workspaces) {
            if (Thread.currentThread().isInterrupted()) {
                return;
            }
            if (workspace.isReleased()) {
                continue;
            }
            try {
                workspace.close();
            } catch (RuntimeException e) {
                log.error("Could not clean workspace of {}: {}", workspace.spec().name(), e.getMessage(), e);
            }
        }
    }
}
