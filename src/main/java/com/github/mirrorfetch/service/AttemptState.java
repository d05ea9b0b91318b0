package com.github.mirrorfetch.service;

import com.github.mirrorfetch.model.MirrorSite;
import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Retry bookkeeping for one task. Confined to the worker running that task.
 */
@Getter
public class AttemptState {

    private final String identifier;

    private int sameMirrorRetries;
    private int rateLimitRetries;

    /**
     * Failures since the last success or mirror switch, drives backoff growth.
     */
    private int consecutiveFailures;

    private final Set<String> excludedMirrors = new LinkedHashSet<>();
    private final Set<String> rateLimitPenalized = new LinkedHashSet<>();

    public AttemptState(String identifier) {
        this.identifier = identifier;
    }

    int nextSameMirrorRetry() {
        consecutiveFailures++;
        return ++sameMirrorRetries;
    }

    int nextRateLimitRetry() {
        consecutiveFailures++;
        return ++rateLimitRetries;
    }

    int nextFailure() {
        return ++consecutiveFailures;
    }

    /**
     * Exclude the mirror for the rest of this task and reset per-mirror counters.
     */
    void exclude(MirrorSite mirror) {
        excludedMirrors.add(MirrorRegistry.normalizeBaseUrl(mirror.getBaseUrl()));
        sameMirrorRetries = 0;
        rateLimitRetries = 0;
        consecutiveFailures = 0;
    }

    /**
     * @return true the first time a mirror rate-limits this task
     */
    boolean firstRateLimitFrom(MirrorSite mirror) {
        return rateLimitPenalized.add(MirrorRegistry.normalizeBaseUrl(mirror.getBaseUrl()));
    }

    public Set<String> getExcludedMirrors() {
        return Collections.unmodifiableSet(excludedMirrors);
    }
}
