package com.ecolityper.core.interrupt;

import com.ecolityper.core.events.AnalysisEvent;
import com.ecolityper.core.events.EventBus;
import com.ecolityper.core.metrics.TyperMetrics;
import com.ecolityper.core.state.RunState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Turns SIGINT/SIGTERM into a cancelled run with cleaned workspaces.
 *
 * <p>The JVM reports both signals by running shutdown hooks, so {@link #install} registers one
 * for the lifetime of a run. When it fires while the run is active it cancels the run's token
 * and runs {@link EmergencyCleanup}. The JVM then exits with the signal status (130 or 143).
 * Tool subprocesses already running are not killed.
 */
@Component
public class InterruptController {

    private static final Logger log = LoggerFactory.getLogger(InterruptController.class);

    private final EmergencyCleanup emergencyCleanup;
    private final EventBus eventBus;
    private final TyperMetrics metrics;
    private Thread hook;

    @Autowired
    public InterruptController(EmergencyCleanup emergencyCleanup, EventBus eventBus,
                               @Autowired(required = false) TyperMetrics metrics) {
        this.emergencyCleanup = emergencyCleanup;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    public synchronized void install(RunState state) {
        if (hook != null) {
            throw new IllegalStateException("An interrupt handler is already installed");
        }
        hook = new Thread(() -> onSignal(state), "ecolityper-interrupt");
        Runtime.getRuntime().addShutdownHook(hook);
        log.debug("Interrupt handler installed for run {}", state.runId());
    }

    public synchronized void uninstall() {
        if (hook == null) {
            return;
        }
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            log.debug("JVM already shutting down, interrupt handler left in place");
        }
        hook = null;
    }

    /**
     * Cancels the run and cleans its workspaces. Does nothing once the run has completed or a
     * signal was already handled; a token cancelled elsewhere still gets cleaned.
     *
     * @return true if this call handled the signal
     */
    boolean onSignal(RunState state) {
        if (!state.isActive() || !state.claimSignal()) {
            return false;
        }
        state.cancellation().cancel();
        log.warn("Interrupt received, cancelling run {}", state.runId());
        if (metrics != null) {
            metrics.recordInterrupt();
        }
        List<String> unreleased = emergencyCleanup.run(state);
        eventBus.publish(AnalysisEvent.of("run.cancelled", state.runId(), null,
                Map.of("workspaces", state.workspaces().size(), "uncleaned", unreleased)));
        return true;
    }
}
