package com.github.mirrorfetch.service;

import com.github.mirrorfetch.config.MirrorFetchProperties;
import com.github.mirrorfetch.model.BatchResult;
import com.github.mirrorfetch.model.BatchSummary;
import com.github.mirrorfetch.model.TransferRequest;
import com.github.mirrorfetch.service.transfer.CancellationToken;
import jakarta.annotation.PreDestroy;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;

/**
 * Accepts batches, runs them in the background and keeps their results for inspection.
 */
@Slf4j
@Service
public class BatchService {

    private final ConcurrencyCoordinator coordinator;
    private final PartialTransferInspector inspector;
    private final MirrorFetchProperties properties;
    private final Executor batchExecutor;
    private final Clock clock;

    private final ConcurrentHashMap<String, BatchSummary> batches = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, CancellationToken> tokens = new ConcurrentHashMap<>();
    // Finished batch ids, oldest first
    private final ConcurrentLinkedQueue<String> finished = new ConcurrentLinkedQueue<>();

    public BatchService(ConcurrencyCoordinator coordinator,
                        PartialTransferInspector inspector,
                        MirrorFetchProperties properties,
                        @Qualifier("batchExecutor") Executor batchExecutor,
                        Clock clock) {
        this.coordinator = coordinator;
        this.inspector = inspector;
        this.properties = properties;
        this.batchExecutor = batchExecutor;
        this.clock = clock;
    }

    /**
     * Queue a batch for background execution.
     *
     * @param maxConcurrency worker budget, or null for the configured default
     */
    public BatchSummary submit(@NonNull List<TransferRequest> requests, Integer maxConcurrency) {
        int concurrency = maxConcurrency != null ? maxConcurrency : properties.getCoordinator().getMaxConcurrency();
        String batchId = UUID.randomUUID().toString();
        CancellationToken token = new CancellationToken();
        List<TransferRequest> snapshot = new ArrayList<>(requests);

        BatchSummary summary = BatchSummary.builder()
                .batchId(batchId)
                .requestCount(snapshot.size())
                .maxConcurrency(concurrency)
                .submittedAt(LocalDateTime.now(clock))
                .build();
        batches.put(batchId, summary);
        tokens.put(batchId, token);
        log.info("Submitted batch {} with {} requests", batchId, snapshot.size());

        CompletableFuture.runAsync(() -> execute(summary, snapshot, concurrency, token), batchExecutor);
        return summary;
    }

    private void execute(BatchSummary summary, List<TransferRequest> requests, int concurrency, CancellationToken token) {
        try {
            BatchResult result = coordinator.run(summary.getBatchId(), requests, concurrency, token);
            summary.setResult(result);
        } catch (RuntimeException e) {
            log.error("Batch {} failed: {}", summary.getBatchId(), e.getMessage(), e);
            summary.setResult(BatchResult.builder()
                    .batchId(summary.getBatchId())
                    .aborted(true)
                    .abortReason(e.getMessage())
                    .build());
        } finally {
            summary.setState(BatchSummary.State.FINISHED);
            tokens.remove(summary.getBatchId());
            retire(summary.getBatchId());
        }
    }

    /**
     * Drop the oldest finished summaries beyond {@code coordinator.retained-batches}.
     * Running batches are never dropped.
     */
    private void retire(String batchId) {
        finished.add(batchId);
        int retained = properties.getCoordinator().getRetainedBatches();
        while (finished.size() > retained) {
            String oldest = finished.poll();
            if (oldest == null) {
                break;
            }
            batches.remove(oldest);
            log.debug("Dropped finished batch {} from history", oldest);
        }
    }

    public Optional<BatchSummary> getBatch(String batchId) {
        return Optional.ofNullable(batches.get(batchId));
    }

    public List<BatchSummary> getAllBatches() {
        return batches.values().stream()
                .sorted(Comparator.comparing(BatchSummary::getSubmittedAt))
                .collect(Collectors.toList());
    }

    /**
     * Request cancellation. In-flight transfers stop at the next chunk and are reported as paused.
     *
     * @return false when the batch is unknown or already finished
     */
    public boolean cancel(String batchId) {
        BatchSummary summary = batches.get(batchId);
        CancellationToken token = tokens.get(batchId);
        if (summary == null || token == null) {
            return false;
        }
        summary.setCancelRequested(true);
        token.cancel();
        log.info("Cancellation requested for batch {}", batchId);
        return true;
    }

    public List<TransferRequest> findResumable(@NonNull List<TransferRequest> requests) {
        return inspector.findResumable(requests);
    }

    /**
     * Cancel running batches so their partial files stay consistent for a later resume.
     */
    @PreDestroy
    public void shutdown() {
        if (tokens.isEmpty()) {
            return;
        }
        log.info("Shutting down, cancelling {} running batch(es)", tokens.size());
        tokens.values().forEach(CancellationToken::cancel);
    }
}
