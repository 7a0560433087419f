package com.ecolityper.workspace;

import com.ecolityper.core.model.InputSet;
import com.ecolityper.core.model.TaskSpec;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Scoped handle on a tool's workspace for one task invocation.
 *
 * <p>Closing the handle cleans the workspace. Only the first {@link #close()} cleans; later calls
 * do nothing, so a try-with-resources block releases the workspace exactly once on every exit
 * path.
 */
public final class Workspace implements AutoCloseable {

    private final WorkspaceManager manager;
    private final TaskSpec spec;
    private final InputSet inputs;
    private final AtomicBoolean released = new AtomicBoolean(false);
    private volatile List<String> cleanupWarnings = List.of();

    Workspace(WorkspaceManager manager, TaskSpec spec, InputSet inputs) {
        this.manager = manager;
        this.spec = spec;
        this.inputs = inputs;
    }

    /**
     * Copies the inputs into the workspace.
     *
     * @throws StageException if the workspace is missing or a copy fails
     */
    public void stage() {
        manager.stage(spec, inputs);
    }

    public Path path() {
        return spec.workspace();
    }

    public TaskSpec spec() {
        return spec;
    }

    public InputSet inputs() {
        return inputs;
    }

    public boolean isReleased() {
        return released.get();
    }

    /** Warnings reported by the cleanup performed on close; empty before close. */
    public List<String> cleanupWarnings() {
        return cleanupWarnings;
    }

    @Override
    public void close() {
        if (released.compareAndSet(false, true)) {
            cleanupWarnings = manager.clean(spec, inputs);
        }
    }
}
