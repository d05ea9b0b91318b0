package com.github.mirrorfetch.service;

import com.github.mirrorfetch.config.MirrorFetchProperties;
import com.github.mirrorfetch.model.MirrorSite;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Picks one mirror per attempt by weighted random draw.
 * <p>
 * Weight is {@code health * max(1, priority) * recencyPenalty * countryBonus}. Mirrors
 * that are inactive, excluded, or known to lack the identifier are never eligible.
 * Among the eligible, mirrors known to hold the identifier are preferred, and mirrors
 * cooling down after a rate limit are used only when nothing else carries weight.
 */
@Slf4j
@Service
public class MirrorSelector {

    private final MirrorRegistry registry;
    private final MirrorFetchProperties.Selection settings;
    private final Random random;
    private final Clock clock;

    private final Map<String, Instant> lastSelected = new ConcurrentHashMap<>();

    public MirrorSelector(MirrorRegistry registry, MirrorFetchProperties properties, Random selectionRandom, Clock clock) {
        this.registry = registry;
        this.settings = properties.getSelection();
        this.random = selectionRandom;
        this.clock = clock;
    }

    /**
     * Choose among the registry's active mirrors.
     */
    public Optional<MirrorSite> select(@NonNull String identifier, @NonNull Set<String> excludedBaseUrls) {
        return select(identifier, registry.listActiveMirrors(), excludedBaseUrls);
    }

    /**
     * Choose a mirror for the identifier.
     *
     * @param identifier       item being fetched; mirrors ABSENT for it are skipped
     * @param candidates       mirrors to choose from
     * @param excludedBaseUrls mirrors already tried in this retry sequence
     * @return the chosen mirror, or empty when no eligible mirror remains
     */
    public Optional<MirrorSite> select(@NonNull String identifier,
                                       @NonNull Collection<MirrorSite> candidates,
                                       @NonNull Set<String> excludedBaseUrls) {
        Set<String> excluded = excludedBaseUrls.stream()
                .map(MirrorRegistry::normalizeBaseUrl)
                .collect(Collectors.toSet());
        excluded.addAll(registry.absentMirrors(identifier));

        List<MirrorSite> eligible = candidates.stream()
                .filter(MirrorSite::isActive)
                .filter(mirror -> !excluded.contains(MirrorRegistry.normalizeBaseUrl(mirror.getBaseUrl())))
                .collect(Collectors.toList());

        if (eligible.isEmpty()) {
            log.debug("No eligible mirror for {} ({} excluded)", identifier, excluded.size());
            return Optional.empty();
        }

        Instant now = clock.instant();
        Set<String> present = registry.presentMirrors(identifier);
        List<MirrorSite> ready = eligible.stream()
                .filter(mirror -> !mirror.isCoolingDown(now))
                .collect(Collectors.toList());

        // Known holders first, mirrors cooling down last; a tier only wins with positive weight
        List<List<MirrorSite>> tiers = List.of(
                knownToHold(ready, present),
                ready,
                knownToHold(eligible, present),
                eligible);

        MirrorSite chosen = null;
        for (List<MirrorSite> tier : tiers) {
            chosen = weightedPick(tier, now);
            if (chosen != null) {
                break;
            }
        }
        if (chosen == null) {
            List<MirrorSite> pool = ready.isEmpty() ? eligible : ready;
            chosen = pool.get(random.nextInt(pool.size()));
            log.debug("All weights zero for {}, uniform pick among {} mirrors", identifier, pool.size());
        }

        lastSelected.put(MirrorRegistry.normalizeBaseUrl(chosen.getBaseUrl()), now);
        log.debug("Selected {} for {}", chosen.getName(), identifier);
        return Optional.of(chosen);
    }

    private static List<MirrorSite> knownToHold(List<MirrorSite> mirrors, Set<String> present) {
        if (present.isEmpty()) {
            return List.of();
        }
        return mirrors.stream()
                .filter(mirror -> present.contains(MirrorRegistry.normalizeBaseUrl(mirror.getBaseUrl())))
                .collect(Collectors.toList());
    }

    /**
     * Weighted draw within one tier, or null when the tier has no positive weight.
     */
    private MirrorSite weightedPick(List<MirrorSite> tier, Instant now) {
        if (tier.isEmpty()) {
            return null;
        }
        double[] cumulative = new double[tier.size()];
        double total = 0.0;
        for (int i = 0; i < tier.size(); i++) {
            total += weight(tier.get(i), now);
            cumulative[i] = total;
        }
        if (total <= 0.0) {
            return null;
        }
        return tier.get(pickIndex(cumulative, random.nextDouble() * total));
    }

    /**
     * Weight of a single mirror at the given instant.
     */
    public double weight(@NonNull MirrorSite mirror, @NonNull Instant now) {
        double priorityFactor = Math.max(1, mirror.getPriority());
        double recency = wasRecentlySelected(mirror, now) ? settings.getRecencyPenalty() : 1.0;
        double country = settings.isPreferredCountry(mirror.getCountry()) ? settings.getCountryBonus() : 1.0;
        return Math.max(0.0, mirror.getHealthScore()) * priorityFactor * recency * country;
    }

    private boolean wasRecentlySelected(MirrorSite mirror, Instant now) {
        Duration window = settings.getRecencyWindow();
        if (window == null || window.isZero() || window.isNegative()) {
            return false;
        }
        Instant selectedAt = lastSelected.get(MirrorRegistry.normalizeBaseUrl(mirror.getBaseUrl()));
        return selectedAt != null && !selectedAt.plus(window).isBefore(now);
    }

    /**
     * Index of the first cumulative weight strictly greater than the draw.
     * Zero-weight entries occupy an empty interval and are never picked.
     *
     * @param cumulative running sums of weights, non-decreasing
     * @param draw       value in {@code [0, cumulative[last])}
     */
    public static int pickIndex(double[] cumulative, double draw) {
        int low = 0;
        int high = cumulative.length - 1;
        while (low < high) {
            int mid = (low + high) >>> 1;
            if (cumulative[mid] > draw) {
                high = mid;
            } else {
                low = mid + 1;
            }
        }
        return low;
    }
}
