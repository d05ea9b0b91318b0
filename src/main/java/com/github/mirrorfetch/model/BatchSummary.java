package com.github.mirrorfetch.model;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * Externally visible state of a submitted batch. {@link #result} is set once the batch has finished.
 */
@Data
@Builder
public class BatchSummary {

    public enum State {
        RUNNING, FINISHED
    }

    private String batchId;

    @Builder.Default
    private volatile State state = State.RUNNING;

    private int requestCount;
    private int maxConcurrency;
    private volatile boolean cancelRequested;

    private LocalDateTime submittedAt;

    private volatile BatchResult result;
}
