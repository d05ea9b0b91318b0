package com.github.mirrorfetch.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A mirror origin server and its learned reliability.
 * Instances handed out by the registry are snapshots; mutate state only through the registry.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class MirrorSite {

    private String name;
    private String baseUrl;
    private String country;

    @Builder.Default
    private int priority = 1;

    @Builder.Default
    private boolean active = true;

    @Builder.Default
    private double healthScore = 1.0;

    private int failureCount;
    private Instant lastChecked;
    private String lastError;

    /**
     * Soft cool-down set after rate limiting; null when the mirror is not cooling down.
     */
    private Instant unavailableUntil;

    public MirrorSite copy() {
        return toBuilder().build();
    }

    @JsonIgnore
    public boolean isCoolingDown(Instant now) {
        return unavailableUntil != null && unavailableUntil.isAfter(now);
    }

    @JsonIgnore
    public String getDisplayName() {
        return String.format("%s (%s)", name, baseUrl);
    }
}
