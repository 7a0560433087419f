package com.ecolityper.runner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Runs tools as local subprocesses via {@link ProcessBuilder}.
 *
 * <p>stdout is read on the calling thread and stderr on a reader thread of this executor's own
 * unbounded pool, so every running tool has its stderr drained at once and neither pipe can fill
 * up and block it. There is no timeout: a tool that never exits blocks its task.
 */
public class LocalProcessExecutor implements ProcessExecutor {

    private static final Logger log = LoggerFactory.getLogger(LocalProcessExecutor.class);

    private final ExecutorService stderrReaders = Executors.newCachedThreadPool(readerThreads());

    @Override
    public ProcessResult execute(List<String> command, Path workDir) {
        log.debug("Running in {}: {}", workDir, String.join(" ", command));
        long startMs = System.currentTimeMillis();

        Process process;
        try {
            process = new ProcessBuilder(command)
                    .directory(workDir.toFile())
                    .redirectErrorStream(false)
                    .start();
        } catch (IOException e) {
            throw new ToolExecutionException("Failed to launch " + command.get(0) + ": " + e.getMessage(), e);
        }

        CompletableFuture<String> stderr = CompletableFuture.supplyAsync(
                () -> readAll(process.getErrorStream()), stderrReaders);
        try {
            String stdout = readAll(process.getInputStream());
            int exitCode = process.waitFor();
            String err = stderr.join();
            long elapsedMs = System.currentTimeMillis() - startMs;
            if (exitCode != 0) {
                log.warn("{} exited with code {} after {}ms", command.get(0), exitCode, elapsedMs);
            }
            return new ProcessResult(exitCode, stdout, err, elapsedMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ToolExecutionException("Interrupted while waiting for " + command.get(0), e);
        } catch (UncheckedIOException | CompletionException e) {
            throw new ToolExecutionException("Failed to read output of " + command.get(0), e);
        }
    }

    private static String readAll(InputStream stream) {
        try (var reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
            return reader.lines().collect(Collectors.joining("\n"));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static ThreadFactory readerThreads() {
        var counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "ecolityper-stderr-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
