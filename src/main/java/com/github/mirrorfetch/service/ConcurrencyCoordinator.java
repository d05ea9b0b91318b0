package com.github.mirrorfetch.service;

import com.github.mirrorfetch.config.MirrorFetchProperties;
import com.github.mirrorfetch.exception.ConfigurationException;
import com.github.mirrorfetch.exception.FatalTransferException;
import com.github.mirrorfetch.exception.MirrorRegistryException;
import com.github.mirrorfetch.model.BatchResult;
import com.github.mirrorfetch.model.FailureKind;
import com.github.mirrorfetch.model.TaskResult;
import com.github.mirrorfetch.model.TaskStatus;
import com.github.mirrorfetch.model.TransferRequest;
import com.github.mirrorfetch.model.TransferTask;
import com.github.mirrorfetch.service.state.TransferStateMachine;
import com.github.mirrorfetch.service.transfer.CancellationToken;
import com.github.mirrorfetch.util.FormatUtils;
import com.github.mirrorfetch.util.TransferConstants;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.PriorityQueue;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Schedules a batch of transfers under a bounded worker budget.
 * <p>
 * Waiting tasks are dispatched by priority, then submission order. A failed task never
 * affects its siblings; a fatal local failure stops dispatch and pauses whatever is still
 * in flight. Every submitted request yields exactly one {@link TaskResult}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ConcurrencyCoordinator {

    static final Comparator<TransferTask> DISPATCH_ORDER = Comparator
            .comparing(TransferTask::getPriority)
            .thenComparingLong(TransferTask::getSequence);

    private final TransferTaskProcessor processor;
    private final TransferStateMachine stateMachine;
    private final PartialTransferInspector inspector;
    private final MirrorRegistry registry;
    private final MirrorFetchProperties properties;
    private final Clock clock;

    public BatchResult run(@NonNull List<TransferRequest> requests, int maxConcurrency, @NonNull CancellationToken cancellation) {
        return run(UUID.randomUUID().toString(), requests, maxConcurrency, cancellation);
    }

    /**
     * Run the batch to completion, cancellation or abort.
     *
     * @param maxConcurrency upper bound on transfers in flight at once
     * @throws ConfigurationException if {@code maxConcurrency} is below one
     */
    public BatchResult run(@NonNull String batchId,
                           @NonNull List<TransferRequest> requests,
                           int maxConcurrency,
                           @NonNull CancellationToken cancellation) {
        if (maxConcurrency < 1) {
            throw new ConfigurationException("maxConcurrency must be at least 1",
                    "mirrorfetch.coordinator.max-concurrency", String.valueOf(maxConcurrency));
        }

        LocalDateTime startedAt = LocalDateTime.now(clock);
        List<TransferTask> tasks = new ArrayList<>(requests.size());
        for (int i = 0; i < requests.size(); i++) {
            TransferRequest request = requests.get(i);
            TransferTask task = TransferTask.fromRequest(request, i, startedAt);
            TaskStatus onDisk = inspector.statusOf(request);
            if (stateMachine.canResume(onDisk)) {
                task.setStatus(stateMachine.transitionOrThrow(task.getId(), onDisk, TaskStatus.PENDING));
                task.setBytesTransferred(inspector.bytesOnDisk(task.getDestination()));
                log.info("Resuming {} from byte {}", task.getDisplayName(), task.getBytesTransferred());
            }
            tasks.add(task);
        }
        log.info("Batch {}: {} transfers, concurrency {}", batchId, tasks.size(), maxConcurrency);

        PriorityQueue<TransferTask> waiting = new PriorityQueue<>(DISPATCH_ORDER);
        waiting.addAll(tasks);

        TaskResult[] results = new TaskResult[tasks.size()];
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger peakInFlight = new AtomicInteger();
        AtomicBoolean aborted = new AtomicBoolean(false);
        AtomicReference<String> abortReason = new AtomicReference<>();

        // Child token: an abort stops in-flight siblings without marking the caller's token cancelled
        CancellationToken batchToken = new CancellationToken();
        Runnable propagate = batchToken::cancel;
        cancellation.onCancel(propagate);

        int workers = Math.max(1, Math.min(maxConcurrency, tasks.size()));
        AtomicInteger threadIndex = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(workers,
                runnable -> new Thread(runnable, "transfer-" + threadIndex.incrementAndGet()));
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < workers; i++) {
                futures.add(pool.submit(() -> {
                    while (!batchToken.isCancelled()) {
                        TransferTask task;
                        synchronized (waiting) {
                            task = waiting.poll();
                        }
                        if (task == null) {
                            return;
                        }

                        int current = inFlight.incrementAndGet();
                        peakInFlight.accumulateAndGet(current, Math::max);
                        try {
                            results[(int) task.getSequence()] = processor.process(batchId, task, batchToken);
                        } catch (FatalTransferException e) {
                            results[(int) task.getSequence()] = TaskResult.failed(task, FailureKind.FATAL, e.getMessage());
                            if (aborted.compareAndSet(false, true)) {
                                abortReason.set(e.getMessage());
                                log.error("Batch {} aborted by fatal failure on {}: {}",
                                        batchId, e.getIdentifier(), e.getMessage(), e);
                                batchToken.cancel();
                            }
                        } catch (RuntimeException e) {
                            log.error("Unexpected error transferring {}: {}", task.getDisplayName(), e.getMessage(), e);
                            task.setStatus(stateMachine.transition(task.getId(), task.getStatus(), TaskStatus.FAILED));
                            results[(int) task.getSequence()] = TaskResult.failed(task, FailureKind.TRANSIENT,
                                    "Unexpected error: " + e.getMessage());
                        } finally {
                            inFlight.decrementAndGet();
                        }
                    }
                }));
            }
            awaitAll(futures, batchToken);
        } finally {
            pool.shutdownNow();
            cancellation.removeHook(propagate);
        }

        // Tasks never dispatched
        List<TransferTask> undispatched;
        synchronized (waiting) {
            undispatched = new ArrayList<>(waiting);
            waiting.clear();
        }
        for (TransferTask task : undispatched) {
            results[(int) task.getSequence()] = aborted.get() ? failUndispatched(task) : pauseUndispatched(task);
        }
        // Left behind by an interrupted wait
        for (int i = 0; i < results.length; i++) {
            if (results[i] == null) {
                TransferTask task = tasks.get(i);
                task.setBytesTransferred(inspector.bytesOnDisk(task.getDestination()));
                results[i] = TaskResult.paused(task, "Interrupted");
            }
        }

        BatchResult result = BatchResult.builder()
                .batchId(batchId)
                .results(new ArrayList<>(Arrays.asList(results)))
                .cancelled(cancellation.isCancelled())
                .aborted(aborted.get())
                .abortReason(abortReason.get())
                .peakInFlight(peakInFlight.get())
                .startedAt(startedAt)
                .completedAt(LocalDateTime.now(clock))
                .build();

        log.info("Batch {} finished in {}: {} completed, {} paused, {} failed{}", batchId,
                FormatUtils.formatDuration(Duration.between(startedAt, result.getCompletedAt()).getSeconds()),
                result.count(TaskStatus.COMPLETED), result.count(TaskStatus.PAUSED), result.count(TaskStatus.FAILED),
                result.isAborted() ? " (aborted)" : result.isCancelled() ? " (cancelled)" : "");

        if (properties.getRegistry().isAutosave()) {
            try {
                registry.persist();
            } catch (MirrorRegistryException e) {
                log.error("Failed to save mirror registry after batch {}: {}", batchId, e.getMessage(), e);
            }
        }
        return result;
    }

    private void awaitAll(List<Future<?>> futures, CancellationToken batchToken) {
        for (Future<?> future : futures) {
            try {
                future.get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while waiting for transfers, cancelling batch");
                batchToken.cancel();
                return;
            } catch (ExecutionException e) {
                log.error("Transfer worker died: {}", e.getCause().getMessage(), e.getCause());
            }
        }
    }

    private TaskResult pauseUndispatched(TransferTask task) {
        task.setStatus(stateMachine.transitionOrThrow(task.getId(), task.getStatus(), TaskStatus.PAUSED));
        task.setBytesTransferred(inspector.bytesOnDisk(task.getDestination()));
        return TaskResult.paused(task, TransferConstants.BATCH_CANCELLED_REASON);
    }

    private TaskResult failUndispatched(TransferTask task) {
        task.setStatus(stateMachine.transitionOrThrow(task.getId(), task.getStatus(), TaskStatus.FAILED));
        task.setBytesTransferred(inspector.bytesOnDisk(task.getDestination()));
        return TaskResult.failed(task, FailureKind.FATAL, TransferConstants.BATCH_ABORTED_REASON);
    }
}
