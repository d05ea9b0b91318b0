package com.github.mirrorfetch.service;

import com.github.mirrorfetch.config.MirrorFetchProperties;
import com.github.mirrorfetch.exception.FatalTransferException;
import com.github.mirrorfetch.model.FailureKind;
import com.github.mirrorfetch.model.MirrorSite;
import com.github.mirrorfetch.model.OutcomeType;
import com.github.mirrorfetch.model.ProgressUpdate;
import com.github.mirrorfetch.model.RetryAction;
import com.github.mirrorfetch.model.RetryDecision;
import com.github.mirrorfetch.model.TaskResult;
import com.github.mirrorfetch.model.TaskStatus;
import com.github.mirrorfetch.model.TransferOutcome;
import com.github.mirrorfetch.model.TransferTask;
import com.github.mirrorfetch.service.state.TransferStateMachine;
import com.github.mirrorfetch.service.transfer.CancellationToken;
import com.github.mirrorfetch.service.transfer.TransferEngine;
import com.github.mirrorfetch.service.transfer.TransferListener;
import com.github.mirrorfetch.util.FormatUtils;
import com.github.mirrorfetch.util.ProgressCalculator;
import com.github.mirrorfetch.util.TransferConstants;
import com.github.mirrorfetch.util.UrlUtils;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Runs the attempt loop for one task: select a mirror, transfer, classify, repeat.
 * Everything inside one task is sequential; only the registry is shared with other tasks.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TransferTaskProcessor {

    private final MirrorSelector selector;
    private final TransferEngine engine;
    private final FailureClassifier classifier;
    private final PartialTransferInspector inspector;
    private final TransferStateMachine stateMachine;
    private final ProgressBroadcastService progressBroadcast;
    private final MirrorFetchProperties properties;
    private final Clock clock;

    /**
     * Drive the task to COMPLETED, PAUSED or FAILED.
     *
     * @throws FatalTransferException on a local filesystem failure; the caller must halt the batch
     */
    public TaskResult process(@NonNull String batchId, @NonNull TransferTask task, @NonNull CancellationToken token) {
        task.setStatus(stateMachine.transitionOrThrow(task.getId(), task.getStatus(), TaskStatus.IN_FLIGHT));
        task.setStartedAt(LocalDateTime.now(clock));
        task.setBytesTransferred(inspector.bytesOnDisk(task.getDestination()));
        log.info("Starting {} [{}]", task.getDisplayName(), task.getId());

        if (task.getExpectedSize() != null && task.getBytesTransferred() == task.getExpectedSize()
                && Files.exists(task.getDestination())) {
            log.debug("{} already complete on disk", task.getDisplayName());
            return complete(batchId, task);
        }

        int maxAttempts = properties.getRetry().getMaxAttemptsPerTask();
        AttemptState state = new AttemptState(task.getIdentifier());
        MirrorSite retryTarget = null;
        RetryDecision last = null;

        while (true) {
            if (token.isCancelled()) {
                return pause(batchId, task, TransferConstants.BATCH_CANCELLED_REASON);
            }
            if (task.getAttemptCount() >= maxAttempts) {
                return giveUp(batchId, task, last, maxAttempts);
            }

            MirrorSite mirror = retryTarget;
            retryTarget = null;
            if (mirror == null) {
                Optional<MirrorSite> selected = selector.select(task.getIdentifier(), state.getExcludedMirrors());
                if (selected.isEmpty()) {
                    String reason = "No eligible mirror left for " + task.getIdentifier()
                            + (last != null ? "; last error: " + last.getReason() : "");
                    return fail(batchId, task, FailureKind.EXHAUSTED, reason);
                }
                mirror = selected.get();
            }

            int attempt = task.incrementAttempts();
            task.setLastMirrorTried(mirror.getName());
            String url = UrlUtils.resolve(mirror.getBaseUrl(), task.getCanonicalPath());
            log.debug("Attempt {}/{} for {} from {}", attempt, maxAttempts, task.getIdentifier(), url);

            TransferOutcome outcome = engine.transfer(url, task.getDestination(), task.getExpectedSize(),
                    progressListener(batchId, task), token);
            task.setBytesTransferred(outcome.getBytesOnDisk());

            RetryDecision decision = classifier.classify(outcome, state, mirror, task.getIdentifier());
            last = decision;

            switch (decision.getAction()) {
                case COMPLETE:
                    return complete(batchId, task);

                case FATAL:
                    task.setStatus(stateMachine.transition(task.getId(), task.getStatus(), TaskStatus.FAILED));
                    task.setFailureKind(FailureKind.FATAL);
                    task.setFailureReason(decision.getReason());
                    task.setCompletedAt(LocalDateTime.now(clock));
                    log.error("Fatal local failure for {}: {}", task.getDisplayName(), decision.getReason(), outcome.getCause());
                    throw new FatalTransferException(decision.getReason(), outcome.getCause(),
                            task.getIdentifier(), task.getDestination());

                case RETRY_SAME_MIRROR:
                    if (!token.sleep(decision.getDelay())) {
                        return pause(batchId, task, TransferConstants.BATCH_CANCELLED_REASON);
                    }
                    retryTarget = mirror;
                    break;

                case RETRY_DIFFERENT_MIRROR:
                    if (decision.isDiscardPartial()) {
                        inspector.discard(task.getIdentifier(), task.getDestination());
                        task.setBytesTransferred(0L);
                    }
                    log.warn("{} failed on {}: {}; trying another mirror",
                            task.getIdentifier(), mirror.getName(), decision.getReason());
                    break;

                case PAUSE_FOR_RESUME:
                default:
                    if (outcome.getType() == OutcomeType.CANCELLED || token.isCancelled()) {
                        return pause(batchId, task, TransferConstants.BATCH_CANCELLED_REASON);
                    }
                    log.warn("{}; resuming in {} ms", decision.getReason(), decision.getDelay().toMillis());
                    if (!token.sleep(decision.getDelay())) {
                        return pause(batchId, task, TransferConstants.BATCH_CANCELLED_REASON);
                    }
                    break;
            }
        }
    }

    private TransferListener progressListener(String batchId, TransferTask task) {
        long startedAt = clock.millis();
        long resumedFrom = task.getBytesTransferred();
        long[] lastBroadcast = {0L};
        return (bytesOnDisk, totalBytes) -> {
            task.setBytesTransferred(bytesOnDisk);
            long now = clock.millis();
            if (now - lastBroadcast[0] < TransferConstants.PROGRESS_BROADCAST_INTERVAL_MS) {
                return;
            }
            lastBroadcast[0] = now;
            ProgressCalculator.ProgressMetrics metrics =
                    ProgressCalculator.calculateMetrics(bytesOnDisk, resumedFrom, totalBytes, now - startedAt);
            ProgressUpdate update = ProgressUpdate.forTask(batchId, task, null, LocalDateTime.now(clock));
            update.setTotalBytes(totalBytes);
            update.setProgress(metrics.getProgressPercentage());
            update.setDownloadSpeed(metrics.getDownloadSpeed());
            update.setEtaSeconds(metrics.getEtaSeconds());
            progressBroadcast.broadcastProgress(update);
        };
    }

    private TaskResult complete(String batchId, TransferTask task) {
        task.setStatus(stateMachine.transitionOrThrow(task.getId(), task.getStatus(), TaskStatus.COMPLETED));
        task.setCompletedAt(LocalDateTime.now(clock));
        log.info("Completed {} ({}) after {} attempt(s) from {}", task.getDisplayName(),
                FormatUtils.formatSize(task.getBytesTransferred()), task.getAttemptCount(), task.getLastMirrorTried());
        progressBroadcast.broadcastProgress(ProgressUpdate.forTask(batchId, task, "Completed", LocalDateTime.now(clock)));
        return TaskResult.completed(task);
    }

    private TaskResult pause(String batchId, TransferTask task, String reason) {
        task.setBytesTransferred(inspector.bytesOnDisk(task.getDestination()));
        task.setStatus(stateMachine.transitionOrThrow(task.getId(), task.getStatus(), TaskStatus.PAUSED));
        task.setFailureReason(reason);
        log.info("Paused {} at {}: {}", task.getDisplayName(),
                FormatUtils.formatProgress(task.getBytesTransferred(), task.getExpectedSize()), reason);
        TaskResult result = TaskResult.paused(task, reason);
        progressBroadcast.broadcastProgress(ProgressUpdate.forTask(batchId, task, result.getReason(), LocalDateTime.now(clock)));
        return result;
    }

    private TaskResult fail(String batchId, TransferTask task, FailureKind kind, String reason) {
        task.setStatus(stateMachine.transitionOrThrow(task.getId(), task.getStatus(), TaskStatus.FAILED));
        task.setFailureKind(kind);
        task.setFailureReason(reason);
        task.setCompletedAt(LocalDateTime.now(clock));
        log.warn("Failed {}: {}", task.getDisplayName(), reason);
        progressBroadcast.broadcastProgress(ProgressUpdate.forTask(batchId, task, reason, LocalDateTime.now(clock)));
        return TaskResult.failed(task, kind, reason);
    }

    /**
     * Attempts used up. An interrupted stream leaves a resumable partial file, so that case
     * pauses instead of failing.
     */
    private TaskResult giveUp(String batchId, TransferTask task, RetryDecision last, int maxAttempts) {
        String lastReason = last != null ? last.getReason() : "no attempt made";
        if (last != null && last.getAction() == RetryAction.PAUSE_FOR_RESUME
                && inspector.bytesOnDisk(task.getDestination()) > 0) {
            return pause(batchId, task, "Gave up after " + maxAttempts + " attempts: " + lastReason);
        }
        FailureKind kind = last != null && last.getFailureKind() != null ? last.getFailureKind() : FailureKind.EXHAUSTED;
        return fail(batchId, task, kind, "Gave up after " + maxAttempts + " attempts: " + lastReason);
    }
}
