package com.ecolityper.core.scheduler;

import com.ecolityper.core.model.ThreadBudget;

/**
 * Splits the user's thread count between concurrently running tools.
 */
public interface ThreadBudgetPolicy {

    /** Number of pool workers for a parallel batch of {@code taskCount} tasks. */
    int poolWidth(int threadCount, int taskCount);

    /** Threads each task in a parallel batch of {@code taskCount} tasks may use. */
    ThreadBudget perTask(int threadCount, int taskCount);

    /** Threads for a task that runs alone. */
    default ThreadBudget exclusive(int threadCount) {
        return new ThreadBudget(Math.max(1, threadCount));
    }
}
