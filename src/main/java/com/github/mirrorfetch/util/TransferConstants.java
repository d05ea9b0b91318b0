package com.github.mirrorfetch.util;

/**
 * Constants used throughout the transfer engine.
 */
public final class TransferConstants {

    private TransferConstants() {
        // Utility class, no instantiation
    }

    // ========== HTTP ==========

    public static final String HEADER_RANGE = "Range";

    public static final String HEADER_CONTENT_RANGE = "Content-Range";

    public static final String HEADER_RETRY_AFTER = "Retry-After";

    public static final int HTTP_PARTIAL_CONTENT = 206;

    public static final int HTTP_NOT_FOUND = 404;

    public static final int HTTP_GONE = 410;

    public static final int HTTP_TOO_MANY_REQUESTS = 429;

    public static final int HTTP_RANGE_NOT_SATISFIABLE = 416;

    // ========== Progress Tracking ==========

    /**
     * Minimum interval between progress broadcasts in milliseconds.
     */
    public static final long PROGRESS_BROADCAST_INTERVAL_MS = 500;

    // ========== Batch Operations ==========

    /**
     * Reason attached to tasks that were never dispatched because the batch aborted.
     */
    public static final String BATCH_ABORTED_REASON = "Batch aborted before this task started";

    public static final String BATCH_CANCELLED_REASON = "Batch cancelled";

    // ========== Size Units ==========

    public static final long BYTES_PER_KB = 1_000L;

    public static final long BYTES_PER_MB = 1_000_000L;

    public static final long BYTES_PER_GB = 1_000_000_000L;
}
