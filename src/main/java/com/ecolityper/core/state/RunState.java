package com.ecolityper.core.state;

import com.ecolityper.core.model.InputSet;
import com.ecolityper.workspace.Workspace;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * State of a single analysis run, shared between the scheduler and the interrupt path.
 *
 * <p>The scheduler registers each workspace as its task is dispatched; the interrupt path reads
 * the registry to clean up everything a cancelled run may have staged. The registry is guarded
 * by this object's monitor.
 */
public final class RunState {

    private final String runId;
    private final InputSet inputs;
    private final Instant startedAt;
    private final CancellationToken cancellation = new CancellationToken();
    private final List<Workspace> workspaces = new ArrayList<>();
    private final AtomicBoolean signalHandled = new AtomicBoolean();
    private volatile boolean active = true;

    public RunState(String runId, InputSet inputs) {
        this.runId = runId;
        this.inputs = inputs;
        this.startedAt = Instant.now();
    }

    public String runId() {
        return runId;
    }

    public InputSet inputs() {
        return inputs;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public CancellationToken cancellation() {
        return cancellation;
    }

    public boolean isCancelled() {
        return cancellation.isCancelled();
    }

    public synchronized void register(Workspace workspace) {
        workspaces.add(workspace);
    }

    /** Snapshot of every workspace registered so far, in dispatch order. */
    public synchronized List<Workspace> workspaces() {
        return List.copyOf(workspaces);
    }

    /**
     * Claims the interrupt for this run. Only the first caller gets true, however the
     * cancellation token was set.
     */
    public boolean claimSignal() {
        return signalHandled.compareAndSet(false, true);
    }

    public boolean isActive() {
        return active;
    }

    /** Marks the run finished; the interrupt path ignores signals from then on. */
    public void complete() {
        active = false;
    }
}
