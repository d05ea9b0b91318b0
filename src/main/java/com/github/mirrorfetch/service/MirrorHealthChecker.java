package com.github.mirrorfetch.service;

import com.github.mirrorfetch.config.MirrorFetchProperties;
import com.github.mirrorfetch.exception.MirrorRegistryException;
import com.github.mirrorfetch.model.FailureSeverity;
import com.github.mirrorfetch.model.MirrorSite;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Sends a HEAD request to each mirror's base URL and feeds the result into the registry.
 * <p>
 * A reply below 400 counts as a success and reactivates the mirror. An HTTP error costs a
 * moderate penalty and an unreachable mirror a severe one. Either kind of failure deactivates
 * the mirror once its failure count passes {@code health.failure-threshold}.
 */
@Slf4j
@Service
public class MirrorHealthChecker {

    private final OkHttpClient httpClient;
    private final MirrorRegistry registry;
    private final MirrorFetchProperties properties;

    public MirrorHealthChecker(OkHttpClient okHttpClient, MirrorRegistry registry, MirrorFetchProperties properties) {
        this.httpClient = okHttpClient.newBuilder()
                .callTimeout(Duration.ofSeconds(properties.getHealth().getCheckTimeoutSeconds()))
                .build();
        this.registry = registry;
        this.properties = properties;
    }

    /**
     * Check one mirror.
     *
     * @return true if the mirror answered below 400
     */
    public boolean check(MirrorSite mirror) {
        Request request = new Request.Builder()
                .url(mirror.getBaseUrl())
                .head()
                .build();

        try (Response response = httpClient.newCall(request).execute()) {
            if (response.code() < 400) {
                registry.reportSuccess(mirror);
                if (!mirror.isActive()) {
                    registry.setActive(mirror.getBaseUrl(), true);
                }
                log.debug("Mirror {} healthy (HTTP {})", mirror.getName(), response.code());
                return true;
            }
            recordFailure(mirror, FailureSeverity.MODERATE, "Health check HTTP " + response.code());
            return false;
        } catch (IOException e) {
            log.warn("Health check failed for {}: {}", mirror.getDisplayName(), e.getMessage());
            recordFailure(mirror, FailureSeverity.SEVERE, "Health check error: " + e.getMessage());
            return false;
        }
    }

    /**
     * Check every registered mirror, active or not, and save the result when autosave is on.
     *
     * @return base URL to health, in registry order
     */
    public Map<String, Boolean> checkAll() {
        Map<String, Boolean> results = new LinkedHashMap<>();
        for (MirrorSite mirror : registry.listMirrors()) {
            results.put(mirror.getBaseUrl(), check(mirror));
        }
        long healthy = results.values().stream().filter(Boolean::booleanValue).count();
        log.info("Health check finished: {}/{} mirrors healthy", healthy, results.size());

        if (properties.getRegistry().isAutosave()) {
            try {
                registry.persist();
            } catch (MirrorRegistryException e) {
                log.error("Failed to save mirrors after health check: {}", e.getMessage(), e);
            }
        }
        return results;
    }

    private void recordFailure(MirrorSite mirror, FailureSeverity severity, String error) {
        MirrorSite updated = registry.reportFailure(mirror, severity, error);
        int threshold = properties.getHealth().getFailureThreshold();
        if (updated.isActive() && updated.getFailureCount() > threshold) {
            registry.setActive(updated.getBaseUrl(), false);
            log.warn("Mirror {} deactivated after {} failures", updated.getDisplayName(), updated.getFailureCount());
        }
    }
}
