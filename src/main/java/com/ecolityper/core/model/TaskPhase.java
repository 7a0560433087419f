package com.ecolityper.core.model;

/**
 * Scheduling phase of a task. Phases run strictly in declaration order.
 */
public enum TaskPhase {
    PARALLEL,   // independent, shares the worker pool
    EXCLUSIVE,  // resource-heavy, runs alone with the full thread budget
    REFERENCE   // input-free reference generation, runs last
}
