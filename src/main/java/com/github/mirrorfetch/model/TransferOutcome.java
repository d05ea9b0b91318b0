package com.github.mirrorfetch.model;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Result of a single transfer attempt against one mirror.
 */
@Value
@Builder
public class TransferOutcome {

    OutcomeType type;

    /**
     * Size of the destination file when the attempt ended.
     */
    long bytesOnDisk;

    /**
     * Total size as declared by the server, when it declared one.
     */
    Long totalSize;

    Integer httpStatus;

    /**
     * Server-requested delay for rate limited responses.
     */
    Duration retryAfter;

    String message;

    Throwable cause;

    public static TransferOutcome completed(long bytesOnDisk) {
        return TransferOutcome.builder()
                .type(OutcomeType.COMPLETED)
                .bytesOnDisk(bytesOnDisk)
                .totalSize(bytesOnDisk)
                .build();
    }

    public static TransferOutcome partial(long bytesOnDisk, Long totalSize, Throwable cause) {
        return TransferOutcome.builder()
                .type(OutcomeType.PARTIAL)
                .bytesOnDisk(bytesOnDisk)
                .totalSize(totalSize)
                .message("Stream interrupted after " + bytesOnDisk + " bytes")
                .cause(cause)
                .build();
    }

    public static TransferOutcome notFound(int httpStatus, long bytesOnDisk) {
        return TransferOutcome.builder()
                .type(OutcomeType.NOT_FOUND)
                .httpStatus(httpStatus)
                .bytesOnDisk(bytesOnDisk)
                .message("HTTP " + httpStatus)
                .build();
    }

    public static TransferOutcome transientFailure(Integer httpStatus, long bytesOnDisk, String message, Throwable cause) {
        return TransferOutcome.builder()
                .type(OutcomeType.TRANSIENT)
                .httpStatus(httpStatus)
                .bytesOnDisk(bytesOnDisk)
                .message(message)
                .cause(cause)
                .build();
    }

    public static TransferOutcome rateLimited(int httpStatus, long bytesOnDisk, Duration retryAfter) {
        return TransferOutcome.builder()
                .type(OutcomeType.RATE_LIMITED)
                .httpStatus(httpStatus)
                .bytesOnDisk(bytesOnDisk)
                .retryAfter(retryAfter)
                .message("HTTP " + httpStatus)
                .build();
    }

    public static TransferOutcome integrityMismatch(long bytesOnDisk, Long expectedSize, String message) {
        return TransferOutcome.builder()
                .type(OutcomeType.INTEGRITY_MISMATCH)
                .bytesOnDisk(bytesOnDisk)
                .totalSize(expectedSize)
                .message(message)
                .build();
    }

    public static TransferOutcome fatal(long bytesOnDisk, String message, Throwable cause) {
        return TransferOutcome.builder()
                .type(OutcomeType.FATAL)
                .bytesOnDisk(bytesOnDisk)
                .message(message)
                .cause(cause)
                .build();
    }

    public static TransferOutcome cancelled(long bytesOnDisk, Long totalSize) {
        return TransferOutcome.builder()
                .type(OutcomeType.CANCELLED)
                .bytesOnDisk(bytesOnDisk)
                .totalSize(totalSize)
                .message("Cancelled after " + bytesOnDisk + " bytes")
                .build();
    }

    public boolean isCompleted() {
        return type == OutcomeType.COMPLETED;
    }

    /**
     * True for timeouts and resets that happened before any response arrived.
     */
    public boolean isConnectionFailure() {
        return type == OutcomeType.TRANSIENT && httpStatus == null;
    }

    public boolean isServerError() {
        return httpStatus != null && httpStatus >= 500;
    }

    public FailureKind getFailureKind() {
        switch (type) {
            case NOT_FOUND:
                return FailureKind.NOT_FOUND;
            case TRANSIENT:
            case PARTIAL:
                return FailureKind.TRANSIENT;
            case RATE_LIMITED:
                return FailureKind.RATE_LIMITED;
            case INTEGRITY_MISMATCH:
                return FailureKind.INTEGRITY_MISMATCH;
            case FATAL:
                return FailureKind.FATAL;
            default:
                return null;
        }
    }

    public String describe() {
        StringBuilder description = new StringBuilder(type.name());
        if (message != null) {
            description.append(": ").append(message);
        }
        if (cause != null && cause.getMessage() != null) {
            description.append(" (").append(cause.getMessage()).append(')');
        }
        return description.toString();
    }
}
