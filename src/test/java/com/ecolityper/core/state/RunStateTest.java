package com.ecolityper.core.state;

import com.ecolityper.core.model.InputSet;
import com.ecolityper.workspace.Workspace;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

class RunStateTest {

    @Test
    @DisplayName("Cancellation happens once and is visible through the run state")
    void cancelOnce() {
        var state = new RunState("ECT-1", InputSet.empty());
        assertFalse(state.isCancelled());

        assertTrue(state.cancellation().cancel());
        assertFalse(state.cancellation().cancel());
        assertTrue(state.isCancelled());
    }

    @Test
    @DisplayName("Workspace snapshot is a copy in registration order")
    void workspaceSnapshot() {
        var state = new RunState("ECT-1", InputSet.empty());
        Workspace first = mock(Workspace.class);
        Workspace second = mock(Workspace.class);
        state.register(first);

        var snapshot = state.workspaces();
        state.register(second);

        assertEquals(1, snapshot.size());
        assertEquals(2, state.workspaces().size());
        assertSame(first, state.workspaces().get(0));
        assertThrows(UnsupportedOperationException.class, () -> snapshot.add(second));
    }

    @Test
    void completeDeactivates() {
        var state = new RunState("ECT-1", InputSet.empty());
        assertTrue(state.isActive());
        state.complete();
        assertFalse(state.isActive());
    }

    @Test
    @DisplayName("Signal is claimed once, independently of the cancellation token")
    void claimSignalOnce() {
        var state = new RunState("ECT-1", InputSet.empty());
        state.cancellation().cancel();

        assertTrue(state.claimSignal());
        assertFalse(state.claimSignal());
    }
}
