package com.ecolityper.core.scheduler;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DefaultThreadBudgetPolicyTest {

    private final ThreadBudgetPolicy policy = new DefaultThreadBudgetPolicy();

    @Test
    @DisplayName("4 threads over 2 tasks: 2 workers with 2 threads each")
    void fourThreadsTwoTasks() {
        assertEquals(2, policy.poolWidth(4, 2));
        assertEquals(2, policy.perTask(4, 2).threads());
    }

    @Test
    @DisplayName("Default 2 threads over 5 tasks: 1 worker, 1 thread each")
    void defaultThreads() {
        assertEquals(1, policy.poolWidth(2, 5));
        assertEquals(1, policy.perTask(2, 5).threads());
    }

    @Test
    @DisplayName("Pool never exceeds the task count")
    void widthCappedByTasks() {
        assertEquals(5, policy.poolWidth(32, 5));
        assertEquals(6, policy.perTask(32, 5).threads());
    }

    @Test
    @DisplayName("Single thread still gets one worker")
    void singleThread() {
        assertEquals(1, policy.poolWidth(1, 5));
        assertEquals(1, policy.perTask(1, 5).threads());
    }

    @Test
    @DisplayName("Exclusive tasks get every thread")
    void exclusive() {
        assertEquals(8, policy.exclusive(8).threads());
        assertEquals(1, policy.exclusive(0).threads());
    }
}
