package com.ecolityper.core.scheduler;

/**
 * Thrown when a run is started with an empty input set.
 */
public class NoInputFilesException extends RuntimeException {
    public NoInputFilesException(String message) {
        super(message);
    }
}
