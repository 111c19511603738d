package com.di.rawingest.runner;

/**
 * How a run ended when it did not throw.
 */
public enum IngestOutcome {
    /** The pipeline ran and every record was written. */
    COMPLETED,
    /** The input file does not exist; nothing was read, looked up or written. */
    INPUT_UNREACHABLE
}
