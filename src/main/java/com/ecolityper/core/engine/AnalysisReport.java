package com.ecolityper.core.engine;

import com.ecolityper.core.model.InputSet;
import com.ecolityper.core.model.ResultSet;
import com.ecolityper.core.model.RunSummary;

import java.nio.file.Path;
import java.time.Instant;

/**
 * Everything a finished run produced.
 *
 * @param summaryFile the written {@code run_summary.json}, null if it could not be written
 */
public record AnalysisReport(
    String runId,
    InputSet inputs,
    Path outputRoot,
    ResultSet results,
    RunSummary summary,
    Path summaryFile,
    Instant startedAt,
    Instant completedAt
) {}
