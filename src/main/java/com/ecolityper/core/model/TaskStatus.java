package com.ecolityper.core.model;

/**
 * Outcome of a single analysis task.
 */
public enum TaskStatus {
    SUCCESS,
    SUCCESS_WITH_WARNINGS,  // artifact present but partial (unresolved values, non-zero exit)
    FAILED,
    SKIPPED;                // disabled by the user or cancelled before it ran

    public boolean isSuccessful() {
        return this == SUCCESS || this == SUCCESS_WITH_WARNINGS;
    }
}
