package com.ecolityper.core.input;

/**
 * Thrown when an input specifier names neither a matching pattern, a FASTA file, nor a directory.
 */
public class InputNotFoundException extends RuntimeException {
    public InputNotFoundException(String message) {
        super(message);
    }

    public InputNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
