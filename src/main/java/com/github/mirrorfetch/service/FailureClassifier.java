package com.github.mirrorfetch.service;

import com.github.mirrorfetch.config.MirrorFetchProperties;
import com.github.mirrorfetch.model.FailureKind;
import com.github.mirrorfetch.model.FailureSeverity;
import com.github.mirrorfetch.model.MirrorSite;
import com.github.mirrorfetch.model.RetryDecision;
import com.github.mirrorfetch.model.TransferOutcome;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Turns a transfer outcome into the next step for the task and feeds the outcome back
 * into mirror health.
 * <p>
 * Not-found and other client errors cost a mirror little, since they usually reflect a
 * gap in that mirror's copy of the catalog. Timeouts, server errors and corrupt data
 * cost more.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FailureClassifier {

    private final MirrorRegistry registry;
    private final MirrorFetchProperties properties;

    public RetryDecision classify(@NonNull TransferOutcome outcome,
                                  @NonNull AttemptState state,
                                  @NonNull MirrorSite mirror,
                                  @NonNull String identifier) {
        MirrorFetchProperties.Retry retry = properties.getRetry();

        switch (outcome.getType()) {
            case COMPLETED:
                registry.reportSuccess(mirror);
                registry.markPresent(mirror, identifier);
                return RetryDecision.complete();

            case NOT_FOUND:
                registry.markAbsent(mirror, identifier);
                registry.reportFailure(mirror, FailureSeverity.MINOR, describe(outcome, identifier));
                state.exclude(mirror);
                return RetryDecision.retryDifferentMirror(FailureKind.NOT_FOUND,
                        identifier + " not found on " + mirror.getName());

            case TRANSIENT:
                return classifyTransient(outcome, state, mirror, identifier, retry);

            case RATE_LIMITED:
                return classifyRateLimited(outcome, state, mirror, identifier, retry);

            case PARTIAL:
                registry.reportFailure(mirror, FailureSeverity.MINOR, describe(outcome, identifier));
                return RetryDecision.pauseForResume(backoff(state.nextFailure()),
                        "Stream from " + mirror.getName() + " interrupted at byte " + outcome.getBytesOnDisk());

            case INTEGRITY_MISMATCH:
                registry.reportFailure(mirror, FailureSeverity.MODERATE, describe(outcome, identifier));
                state.exclude(mirror);
                return RetryDecision.restartOnDifferentMirror(FailureKind.INTEGRITY_MISMATCH,
                        "Integrity mismatch from " + mirror.getName() + ": " + outcome.getMessage());

            case CANCELLED:
                return RetryDecision.pauseForResume(Duration.ZERO, "Cancelled");

            case FATAL:
            default:
                return RetryDecision.fatal(outcome.describe());
        }
    }

    private RetryDecision classifyTransient(TransferOutcome outcome,
                                            AttemptState state,
                                            MirrorSite mirror,
                                            String identifier,
                                            MirrorFetchProperties.Retry retry) {
        if (outcome.isConnectionFailure()) {
            registry.reportFailure(mirror, FailureSeverity.MODERATE, describe(outcome, identifier));
            if (state.getSameMirrorRetries() < retry.getMaxSameMirrorRetries()) {
                int attempt = state.nextSameMirrorRetry();
                Duration delay = backoff(attempt);
                log.warn("Connection to {} failed for {}, retrying same mirror in {} ms (retry {}/{})",
                        mirror.getName(), identifier, delay.toMillis(), attempt, retry.getMaxSameMirrorRetries());
                return RetryDecision.retrySameMirror(delay, FailureKind.TRANSIENT, outcome.describe());
            }
            state.exclude(mirror);
            return RetryDecision.retryDifferentMirror(FailureKind.TRANSIENT,
                    "Connection to " + mirror.getName() + " kept failing: " + outcome.getMessage());
        }

        FailureSeverity severity = outcome.isServerError() ? FailureSeverity.MODERATE : FailureSeverity.MINOR;
        registry.reportFailure(mirror, severity, describe(outcome, identifier));
        state.exclude(mirror);
        return RetryDecision.retryDifferentMirror(FailureKind.TRANSIENT,
                mirror.getName() + " answered " + outcome.getMessage());
    }

    private RetryDecision classifyRateLimited(TransferOutcome outcome,
                                              AttemptState state,
                                              MirrorSite mirror,
                                              String identifier,
                                              MirrorFetchProperties.Retry retry) {
        if (state.firstRateLimitFrom(mirror)) {
            registry.reportFailure(mirror, FailureSeverity.MINOR, describe(outcome, identifier));
        }

        Duration delay = outcome.getRetryAfter() != null
                ? cap(outcome.getRetryAfter())
                : backoff(state.getRateLimitRetries() + 1);
        registry.markUnavailableFor(mirror, delay);

        if (state.getRateLimitRetries() >= retry.getMaxRateLimitRetries()) {
            state.exclude(mirror);
            return RetryDecision.retryDifferentMirror(FailureKind.RATE_LIMITED,
                    mirror.getName() + " kept rate limiting");
        }
        int attempt = state.nextRateLimitRetry();
        log.warn("{} rate limited {}, waiting {} ms (retry {}/{})",
                mirror.getName(), identifier, delay.toMillis(), attempt, retry.getMaxRateLimitRetries());
        return RetryDecision.retrySameMirror(delay, FailureKind.RATE_LIMITED, "Rate limited by " + mirror.getName());
    }

    /**
     * Exponential backoff: {@code base * multiplier^(attempt-1)}, capped at the configured maximum.
     */
    public Duration backoff(int attempt) {
        MirrorFetchProperties.Retry retry = properties.getRetry();
        double delay = retry.getBaseDelayMs() * Math.pow(retry.getBackoffMultiplier(), Math.max(0, attempt - 1));
        return Duration.ofMillis((long) Math.min(delay, retry.getMaxDelayMs()));
    }

    private Duration cap(Duration delay) {
        Duration max = Duration.ofMillis(properties.getRetry().getMaxDelayMs());
        return delay.compareTo(max) > 0 ? max : delay;
    }

    private static String describe(TransferOutcome outcome, String identifier) {
        return identifier + ": " + outcome.describe();
    }
}
