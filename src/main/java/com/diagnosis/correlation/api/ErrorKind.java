package com.diagnosis.correlation.api;

/**
 * Category of a failed engine operation.
 */
public enum ErrorKind {
    /** Empty or malformed input, or a missing required key. */
    INVALID_INPUT,
    /** An unexpected failure inside the engine. */
    INTERNAL
}
