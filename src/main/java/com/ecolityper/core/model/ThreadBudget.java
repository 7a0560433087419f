package com.ecolityper.core.model;

import java.io.Serializable;

/**
 * Number of threads a task may hand to its tool. Never less than one.
 */
public record ThreadBudget(int threads) implements Serializable {

    public static final ThreadBudget SINGLE = new ThreadBudget(1);

    public ThreadBudget {
        if (threads < 1) {
            throw new IllegalArgumentException("Thread budget must be at least 1, got " + threads);
        }
    }

    @Override
    public String toString() {
        return String.valueOf(threads);
    }
}
