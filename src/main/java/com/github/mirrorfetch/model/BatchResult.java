package com.github.mirrorfetch.model;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Data
@Builder
public class BatchResult {

    private String batchId;

    /**
     * One result per submitted request, in submission order.
     */
    @Builder.Default
    private List<TaskResult> results = new ArrayList<>();

    private boolean cancelled;

    /**
     * Set when a fatal local failure halted the batch.
     */
    private boolean aborted;
    private String abortReason;

    /**
     * Highest number of transfers observed in flight at once.
     */
    private int peakInFlight;

    private LocalDateTime startedAt;
    private LocalDateTime completedAt;

    public long count(TaskStatus status) {
        return results.stream().filter(r -> r.getStatus() == status).count();
    }

    public Optional<TaskResult> resultFor(String identifier) {
        return results.stream().filter(r -> r.getIdentifier().equals(identifier)).findFirst();
    }

    public boolean isFullyCompleted() {
        return !results.isEmpty() && results.stream().allMatch(TaskResult::isCompleted);
    }
}
