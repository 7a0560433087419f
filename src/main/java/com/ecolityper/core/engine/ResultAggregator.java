package com.ecolityper.core.engine;

import com.ecolityper.core.model.ResultSet;
import com.ecolityper.core.model.RunSummary;
import com.ecolityper.core.model.TaskResult;
import com.ecolityper.core.model.TaskStatus;

/**
 * Reduces a run's results to success counts. Skipped tasks count neither way.
 */
public final class ResultAggregator {

    private ResultAggregator() {}

    public static RunSummary summarize(ResultSet results) {
        int succeeded = 0;
        int total = 0;
        for (TaskResult result : results.results()) {
            if (result.status() == TaskStatus.SKIPPED) continue;
            total++;
            if (result.status().isSuccessful()) succeeded++;
        }
        return new RunSummary(succeeded, total, succeeded == total);
    }
}
