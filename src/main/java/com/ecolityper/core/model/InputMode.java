package com.ecolityper.core.model;

/**
 * How a tool receives the input set on its command line.
 */
public enum InputMode {
    /** Always the derived {@link FilePattern}. */
    PATTERN,
    /** The bare file name for a single input, the derived pattern otherwise. */
    PATTERN_OR_SINGLE_FILE,
    /** The tool takes no inputs; nothing is staged. */
    NONE
}
