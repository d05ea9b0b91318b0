package com.github.mirrorfetch.model;

import lombok.Builder;
import lombok.Value;

/**
 * Caller-facing terminal state of one submitted request.
 * Every request in a batch yields exactly one of these.
 */
@Value
@Builder
public class TaskResult {

    String identifier;

    String destination;

    /**
     * COMPLETED, PAUSED or FAILED.
     */
    TaskStatus status;

    /**
     * Bytes present at the destination when the task ended.
     */
    long bytesTransferred;

    Long expectedSize;

    /**
     * Human-readable explanation for paused and failed results.
     */
    String reason;

    FailureKind failureKind;

    String lastMirror;

    int attempts;

    public static TaskResult completed(TransferTask task) {
        return from(task, TaskStatus.COMPLETED, null, null);
    }

    /**
     * A paused result: a later call with the same request continues from {@link #bytesTransferred}.
     */
    public static TaskResult paused(TransferTask task, String reason) {
        return from(task, TaskStatus.PAUSED,
                reason + "; resumable from byte " + task.getBytesTransferred(), null);
    }

    public static TaskResult failed(TransferTask task, FailureKind kind, String reason) {
        return from(task, TaskStatus.FAILED, reason, kind);
    }

    private static TaskResult from(TransferTask task, TaskStatus status, String reason, FailureKind kind) {
        return TaskResult.builder()
                .identifier(task.getIdentifier())
                .destination(task.getDestination().toString())
                .status(status)
                .bytesTransferred(task.getBytesTransferred())
                .expectedSize(task.getExpectedSize())
                .reason(reason)
                .failureKind(kind)
                .lastMirror(task.getLastMirrorTried())
                .attempts(task.getAttemptCount())
                .build();
    }

    public boolean isCompleted() {
        return status == TaskStatus.COMPLETED;
    }

    public boolean isPaused() {
        return status == TaskStatus.PAUSED;
    }

    public boolean isFailed() {
        return status == TaskStatus.FAILED;
    }
}
