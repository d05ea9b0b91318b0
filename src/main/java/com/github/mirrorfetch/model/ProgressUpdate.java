package com.github.mirrorfetch.model;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;

@Data
@Builder
public class ProgressUpdate {

    private String batchId;
    private String taskId;
    private String identifier;
    private TaskStatus status;
    private Double progress;
    private Long bytesTransferred;
    private Long totalBytes;
    private String downloadSpeed;  // Human readable: "5.2 MB/s"
    private Long etaSeconds;
    private String mirror;
    private String message;

    private LocalDateTime timestamp;

    public static ProgressUpdate forTask(String batchId, TransferTask task, String message, LocalDateTime timestamp) {
        return ProgressUpdate.builder()
                .timestamp(timestamp)
                .batchId(batchId)
                .taskId(task.getId())
                .identifier(task.getIdentifier())
                .status(task.getStatus())
                .bytesTransferred(task.getBytesTransferred())
                .totalBytes(task.getExpectedSize())
                .mirror(task.getLastMirrorTried())
                .message(message)
                .build();
    }
}
