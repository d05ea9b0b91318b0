package com.github.mirrorfetch.service;

import com.github.mirrorfetch.config.MirrorFetchProperties;
import com.github.mirrorfetch.exception.ConfigurationException;
import com.github.mirrorfetch.exception.MirrorRegistryException;
import com.github.mirrorfetch.model.Availability;
import com.github.mirrorfetch.model.AvailabilityRecord;
import com.github.mirrorfetch.model.FailureSeverity;
import com.github.mirrorfetch.model.MirrorSite;
import com.github.mirrorfetch.service.persistence.MirrorStore;
import com.github.mirrorfetch.util.FormatUtils;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Durable record of known mirrors and their health.
 * <p>
 * This is the only shared mutable state of the download engine. Every read-modify-write
 * happens under the registry lock and callers only ever receive copies, so concurrent
 * tasks cannot race on a health score.
 */
@Slf4j
@Service
public class MirrorRegistry {

    private final MirrorFetchProperties properties;
    private final MirrorStore store;
    private final Clock clock;

    private final Object lock = new Object();

    // Saves run one at a time so an older snapshot never replaces a newer one
    private final Object persistLock = new Object();

    // Keyed by normalized base URL, insertion order kept for stable listing
    private final Map<String, MirrorSite> mirrors = new LinkedHashMap<>();

    // identifier -> (base URL -> record)
    private final Map<String, Map<String, AvailabilityRecord>> availability = new HashMap<>();

    @Autowired
    public MirrorRegistry(MirrorFetchProperties properties, Clock clock) {
        this(properties, new MirrorStore(properties.getRegistry().getMirrorFilePath()), clock);
    }

    public MirrorRegistry(MirrorFetchProperties properties, MirrorStore store, Clock clock) {
        this.properties = properties;
        this.store = store;
        this.clock = clock;
    }

    /**
     * Load the stored mirror list, or seed from configured defaults when none exists.
     */
    @PostConstruct
    public void initialize() {
        int loaded = load();
        if (loaded == 0) {
            seedDefaults();
        }
    }

    @PreDestroy
    public void shutdown() {
        try {
            persist();
        } catch (MirrorRegistryException e) {
            log.error("Failed to save mirrors on shutdown: {}", e.getMessage(), e);
        }
    }

    /**
     * Replace in-memory mirrors with the stored list.
     *
     * @return number of mirrors loaded
     */
    public int load() {
        Optional<List<MirrorSite>> stored = store.load();
        if (stored.isEmpty()) {
            return 0;
        }
        synchronized (lock) {
            mirrors.clear();
            for (MirrorSite mirror : stored.get()) {
                MirrorSite copy = mirror.copy();
                copy.setBaseUrl(normalizeBaseUrl(copy.getBaseUrl()));
                copy.setHealthScore(clamp(copy.getHealthScore()));
                mirrors.put(copy.getBaseUrl(), copy);
            }
            return mirrors.size();
        }
    }

    public void persist() {
        synchronized (persistLock) {
            store.save(listMirrors());
        }
    }

    private void seedDefaults() {
        List<MirrorFetchProperties.MirrorDefinition> defaults = properties.getRegistry().getDefaults();
        for (MirrorFetchProperties.MirrorDefinition definition : defaults) {
            upsertMirror(MirrorSite.builder()
                    .name(definition.getName())
                    .baseUrl(definition.getBaseUrl())
                    .country(definition.getCountry())
                    .priority(definition.getPriority())
                    .build());
        }
        log.info("Seeded {} default mirrors", defaults.size());
    }

    /**
     * Add a mirror, or refresh the descriptive fields of a known one while keeping its learned health.
     */
    public MirrorSite upsertMirror(@NonNull MirrorSite mirror) {
        String key = normalizeBaseUrl(mirror.getBaseUrl());
        synchronized (lock) {
            MirrorSite existing = mirrors.get(key);
            MirrorSite stored;
            if (existing != null) {
                existing.setName(mirror.getName());
                existing.setCountry(mirror.getCountry());
                existing.setPriority(mirror.getPriority());
                existing.setActive(mirror.isActive());
                stored = existing;
                log.info("Updated mirror: {}", stored.getDisplayName());
            } else {
                stored = mirror.copy();
                stored.setBaseUrl(key);
                stored.setHealthScore(clamp(stored.getHealthScore()));
                mirrors.put(key, stored);
                log.info("Added mirror: {}", stored.getDisplayName());
            }
            return stored.copy();
        }
    }

    public List<MirrorSite> listMirrors() {
        synchronized (lock) {
            return mirrors.values().stream().map(MirrorSite::copy).collect(Collectors.toList());
        }
    }

    /**
     * Active mirrors, highest priority first. Ties keep registration order.
     */
    public List<MirrorSite> listActiveMirrors() {
        synchronized (lock) {
            return mirrors.values().stream()
                    .filter(MirrorSite::isActive)
                    .sorted(Comparator.comparingInt(MirrorSite::getPriority).reversed())
                    .map(MirrorSite::copy)
                    .collect(Collectors.toList());
        }
    }

    public Optional<MirrorSite> find(String baseUrl) {
        String key = normalizeBaseUrl(baseUrl);
        synchronized (lock) {
            return Optional.ofNullable(mirrors.get(key)).map(MirrorSite::copy);
        }
    }

    public boolean setActive(String baseUrl, boolean active) {
        String key = normalizeBaseUrl(baseUrl);
        synchronized (lock) {
            MirrorSite mirror = mirrors.get(key);
            if (mirror == null) {
                return false;
            }
            mirror.setActive(active);
            log.info("Mirror {} {}", mirror.getDisplayName(), active ? "activated" : "deactivated");
            return true;
        }
    }

    /**
     * Raise the health score by the configured increment and decay the failure count by one step.
     */
    public MirrorSite reportSuccess(@NonNull MirrorSite mirror) {
        MirrorFetchProperties.Health health = properties.getHealth();
        synchronized (lock) {
            MirrorSite stored = require(mirror.getBaseUrl());
            stored.setHealthScore(clamp(stored.getHealthScore() + health.getSuccessIncrement()));
            stored.setFailureCount(Math.max(0, stored.getFailureCount() - health.getFailureDecayStep()));
            stored.setLastChecked(clock.instant());
            stored.setUnavailableUntil(null);
            log.debug("Success reported for {} (health={}, failures={})",
                    stored.getName(), FormatUtils.formatHealth(stored.getHealthScore()), stored.getFailureCount());
            return stored.copy();
        }
    }

    /**
     * Lower the health score in proportion to the failure severity. A mirror at zero stays
     * registered and can recover through later successes.
     */
    public MirrorSite reportFailure(@NonNull MirrorSite mirror, @NonNull FailureSeverity severity, String error) {
        double decrement = properties.getHealth().decrementFor(severity);
        synchronized (lock) {
            MirrorSite stored = require(mirror.getBaseUrl());
            stored.setHealthScore(clamp(stored.getHealthScore() - decrement));
            stored.setFailureCount(stored.getFailureCount() + 1);
            stored.setLastChecked(clock.instant());
            stored.setLastError(error);
            if (stored.getHealthScore() == 0.0) {
                log.warn("Mirror {} reached zero health after {} failures", stored.getDisplayName(), stored.getFailureCount());
            } else {
                log.debug("{} failure reported for {} (health={}, failures={}): {}",
                        severity, stored.getName(), FormatUtils.formatHealth(stored.getHealthScore()),
                        stored.getFailureCount(), error);
            }
            return stored.copy();
        }
    }

    public void markUnavailableFor(@NonNull MirrorSite mirror, @NonNull Duration duration) {
        synchronized (lock) {
            MirrorSite stored = require(mirror.getBaseUrl());
            Instant until = clock.instant().plus(duration);
            if (stored.getUnavailableUntil() == null || until.isAfter(stored.getUnavailableUntil())) {
                stored.setUnavailableUntil(until);
            }
            log.debug("Mirror {} cooling down until {}", stored.getName(), stored.getUnavailableUntil());
        }
    }

    public void markAbsent(@NonNull MirrorSite mirror, @NonNull String identifier) {
        recordAvailability(mirror, identifier, Availability.ABSENT);
    }

    public void markPresent(@NonNull MirrorSite mirror, @NonNull String identifier) {
        recordAvailability(mirror, identifier, Availability.PRESENT);
    }

    /**
     * Record what is known about an identifier on a mirror, for example availability
     * previously learned by the catalog.
     */
    public void recordAvailability(@NonNull MirrorSite mirror, @NonNull String identifier, @NonNull Availability state) {
        String key = normalizeBaseUrl(mirror.getBaseUrl());
        synchronized (lock) {
            availability.computeIfAbsent(identifier, id -> new HashMap<>())
                    .put(key, AvailabilityRecord.builder()
                            .mirrorBaseUrl(key)
                            .identifier(identifier)
                            .availability(state)
                            .verifiedAt(clock.instant())
                            .build());
        }
    }

    public Availability availability(@NonNull MirrorSite mirror, @NonNull String identifier) {
        String key = normalizeBaseUrl(mirror.getBaseUrl());
        synchronized (lock) {
            AvailabilityRecord record = availability.getOrDefault(identifier, Map.of()).get(key);
            return record != null ? record.getAvailability() : Availability.UNKNOWN;
        }
    }

    /**
     * Base URLs of mirrors confirmed absent for the identifier.
     */
    public Set<String> absentMirrors(@NonNull String identifier) {
        return mirrorsWith(identifier, Availability.ABSENT);
    }

    /**
     * Base URLs of mirrors known to hold the identifier.
     */
    public Set<String> presentMirrors(@NonNull String identifier) {
        return mirrorsWith(identifier, Availability.PRESENT);
    }

    public List<AvailabilityRecord> availabilityRecords(@NonNull String identifier) {
        synchronized (lock) {
            return new ArrayList<>(availability.getOrDefault(identifier, Map.of()).values());
        }
    }

    private Set<String> mirrorsWith(String identifier, Availability state) {
        synchronized (lock) {
            return availability.getOrDefault(identifier, Map.of()).values().stream()
                    .filter(record -> record.getAvailability() == state)
                    .map(AvailabilityRecord::getMirrorBaseUrl)
                    .collect(Collectors.toSet());
        }
    }

    private MirrorSite require(String baseUrl) {
        MirrorSite stored = mirrors.get(normalizeBaseUrl(baseUrl));
        if (stored == null) {
            throw new IllegalArgumentException("Unknown mirror: " + baseUrl);
        }
        return stored;
    }

    private static double clamp(double score) {
        return Math.max(0.0, Math.min(1.0, score));
    }

    /**
     * Normalize a base URL to end with exactly one slash.
     */
    public static String normalizeBaseUrl(String baseUrl) {
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new ConfigurationException("Mirror base URL must not be blank", "mirrorfetch.registry.defaults.base-url");
        }
        String trimmed = baseUrl.trim();
        int end = trimmed.length();
        while (end > 0 && trimmed.charAt(end - 1) == '/') {
            end--;
        }
        return trimmed.substring(0, end) + "/";
    }
}
