package com.github.mirrorfetch.model;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * What the task loop should do after an attempt.
 */
@Value
@Builder
public class RetryDecision {

    RetryAction action;

    @Builder.Default
    Duration delay = Duration.ZERO;

    /**
     * Delete the partial file before the next attempt.
     */
    boolean discardPartial;

    FailureKind failureKind;

    String reason;

    public static RetryDecision complete() {
        return RetryDecision.builder()
                .action(RetryAction.COMPLETE)
                .reason("Transfer completed")
                .build();
    }

    public static RetryDecision retrySameMirror(Duration delay, FailureKind kind, String reason) {
        return RetryDecision.builder()
                .action(RetryAction.RETRY_SAME_MIRROR)
                .delay(delay)
                .failureKind(kind)
                .reason(reason)
                .build();
    }

    public static RetryDecision retryDifferentMirror(FailureKind kind, String reason) {
        return RetryDecision.builder()
                .action(RetryAction.RETRY_DIFFERENT_MIRROR)
                .failureKind(kind)
                .reason(reason)
                .build();
    }

    public static RetryDecision restartOnDifferentMirror(FailureKind kind, String reason) {
        return RetryDecision.builder()
                .action(RetryAction.RETRY_DIFFERENT_MIRROR)
                .discardPartial(true)
                .failureKind(kind)
                .reason(reason)
                .build();
    }

    public static RetryDecision pauseForResume(Duration delay, String reason) {
        return RetryDecision.builder()
                .action(RetryAction.PAUSE_FOR_RESUME)
                .delay(delay)
                .failureKind(FailureKind.TRANSIENT)
                .reason(reason)
                .build();
    }

    public static RetryDecision fatal(String reason) {
        return RetryDecision.builder()
                .action(RetryAction.FATAL)
                .failureKind(FailureKind.FATAL)
                .reason(reason)
                .build();
    }
}
