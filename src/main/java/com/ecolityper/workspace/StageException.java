package com.ecolityper.workspace;

/**
 * Thrown when inputs cannot be copied into a tool's workspace.
 */
public class StageException extends RuntimeException {
    public StageException(String message) {
        super(message);
    }

    public StageException(String message, Throwable cause) {
        super(message, cause);
    }
}
