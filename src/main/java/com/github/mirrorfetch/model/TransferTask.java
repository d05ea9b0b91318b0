package com.github.mirrorfetch.model;

import lombok.Builder;
import lombok.Data;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.UUID;

@Data
@Builder
public class TransferTask {

    @Builder.Default
    private String id = UUID.randomUUID().toString();

    private String identifier;
    private String canonicalPath;
    private Path destination;
    private Long expectedSize;

    @Builder.Default
    private TaskPriority priority = TaskPriority.NORMAL;

    /**
     * Submission order within the batch, used to break priority ties.
     */
    private long sequence;

    @Builder.Default
    private volatile long bytesTransferred = 0L;

    @Builder.Default
    private volatile TaskStatus status = TaskStatus.PENDING;

    private int attemptCount;
    private String lastMirrorTried;

    private FailureKind failureKind;
    private String failureReason;

    private LocalDateTime createdAt;

    private LocalDateTime startedAt;
    private LocalDateTime completedAt;

    public static TransferTask fromRequest(TransferRequest request, long sequence, LocalDateTime createdAt) {
        return TransferTask.builder()
                .identifier(request.getIdentifier())
                .canonicalPath(request.getCanonicalPath())
                .destination(request.getDestinationPath())
                .expectedSize(request.getExpectedSize())
                .priority(request.getPriority() != null ? request.getPriority() : TaskPriority.NORMAL)
                .sequence(sequence)
                .createdAt(createdAt)
                .build();
    }

    public int incrementAttempts() {
        return ++attemptCount;
    }

    public String getDisplayName() {
        return String.format("%s -> %s", identifier, destination);
    }
}
