package com.ecolityper.core.scheduler;

import com.ecolityper.core.model.ThreadBudget;

/**
 * Even split: each task gets {@code threads / tasks}, and at most half the threads are spent on
 * pool workers since every worker blocks on a tool that is itself multi-threaded.
 */
public class DefaultThreadBudgetPolicy implements ThreadBudgetPolicy {

    @Override
    public int poolWidth(int threadCount, int taskCount) {
        return Math.max(1, Math.min(taskCount, threadCount / 2));
    }

    @Override
    public ThreadBudget perTask(int threadCount, int taskCount) {
        if (taskCount < 1) {
            return new ThreadBudget(Math.max(1, threadCount));
        }
        return new ThreadBudget(Math.max(1, threadCount / taskCount));
    }
}
