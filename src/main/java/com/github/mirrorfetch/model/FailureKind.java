package com.github.mirrorfetch.model;

/**
 * Error taxonomy surfaced by transfers and tasks.
 */
public enum FailureKind {
    /**
     * Resource absent at one mirror, not necessarily everywhere.
     */
    NOT_FOUND,
    /**
     * Timeout, connection reset or server error.
     */
    TRANSIENT,
    RATE_LIMITED,
    /**
     * Byte count on disk disagrees with the expected size.
     */
    INTEGRITY_MISMATCH,
    /**
     * No eligible mirror remains for the task.
     */
    EXHAUSTED,
    /**
     * Local resource failure; halts the batch.
     */
    FATAL
}
