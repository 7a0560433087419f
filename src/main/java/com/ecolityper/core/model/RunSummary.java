package com.ecolityper.core.model;

import java.io.Serializable;

/**
 * Aggregate outcome of a run. Skipped tasks count toward neither figure.
 */
public record RunSummary(
    int succeededCount,
    int totalCount,
    boolean allSucceeded
) implements Serializable {}
