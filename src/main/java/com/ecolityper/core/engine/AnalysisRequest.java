package com.ecolityper.core.engine;

import java.nio.file.Path;
import java.util.Set;

/**
 * A user's request to type a batch of genomes.
 *
 * @param inputSpecifier file, directory or glob naming the FASTA inputs
 * @param outputRoot     directory receiving one {@code <tool>_results} subdirectory per tool
 * @param threads        total thread count shared by the tools
 * @param skippedTools   tool names the user opted out of
 */
public record AnalysisRequest(
    String inputSpecifier,
    Path outputRoot,
    int threads,
    Set<String> skippedTools
) {
    public AnalysisRequest {
        if (inputSpecifier == null || inputSpecifier.isBlank()) {
            throw new IllegalArgumentException("An input file, directory or pattern is required");
        }
        if (outputRoot == null) {
            throw new IllegalArgumentException("An output directory is required");
        }
        if (threads < 1) {
            throw new IllegalArgumentException("Thread count must be at least 1, got " + threads);
        }
        skippedTools = skippedTools == null ? Set.of() : Set.copyOf(skippedTools);
    }
}
