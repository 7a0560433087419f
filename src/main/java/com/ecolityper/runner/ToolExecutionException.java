package com.ecolityper.runner;

/**
 * Thrown when a wrapped tool cannot be launched (missing script, missing interpreter, interrupted wait).
 */
public class ToolExecutionException extends RuntimeException {
    public ToolExecutionException(String message) {
        super(message);
    }

    public ToolExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
