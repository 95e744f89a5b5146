package com.flaretrack.insights.intervention;

import com.flaretrack.insights.domain.DomainModels.EpisodeEvent;
import com.flaretrack.insights.domain.DomainModels.EventKind;
import com.flaretrack.insights.domain.EpisodeHistory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.*;

@Component
public class InterventionEffectivenessAnalyzer {
    static final int SUFFICIENT_USAGE = 5;
    static final double RATE_TOLERANCE = 0.1;
    static final Duration FOLLOW_UP_TARGET = Duration.ofHours(48);
    static final Duration FOLLOW_UP_EARLIEST = Duration.ofHours(24);
    static final Duration FOLLOW_UP_LATEST = Duration.ofHours(72);

    public List<InterventionModels.InterventionEffectiveness> analyze(List<EpisodeHistory> histories) {
        Map<InterventionCategory, List<InterventionModels.InterventionInstance>> byCategory = new LinkedHashMap<>();
        for (EpisodeHistory history : histories == null ? List.<EpisodeHistory>of() : histories) {
            if (history == null) continue;
            for (InterventionModels.InterventionInstance instance : instances(history)) {
                byCategory.computeIfAbsent(instance.category(), c -> new ArrayList<>()).add(instance);
            }
        }

        List<InterventionModels.InterventionEffectiveness> out = new ArrayList<>();
        byCategory.forEach((category, rows) -> out.add(summarize(category, rows)));
        return rank(out);
    }

    public List<InterventionModels.InterventionInstance> instances(EpisodeHistory history) {
        List<InterventionModels.InterventionInstance> out = new ArrayList<>();
        for (EpisodeEvent event : history.events()) {
            if (event.kind() != EventKind.INTERVENTION) continue;
            double before = severityAt(history, event.timestamp());
            Double after = severityAfter(history, event.timestamp());
            out.add(new InterventionModels.InterventionInstance(
                    history.episode().id(),
                    InterventionCategory.normalize(event.interventionCategory()),
                    event.timestamp(),
                    event.interventionDetail(),
                    before,
                    after,
                    after == null ? null : before - after));
        }
        return out;
    }

    private double severityAt(EpisodeHistory history, Instant at) {
        Double latest = null;
        for (EpisodeEvent event : history.events()) {
            if (event.timestamp().isAfter(at)) break;
            if (event.kind() == EventKind.SEVERITY_UPDATE && event.severity() != null) {
                latest = event.severity();
            }
        }
        return latest != null ? latest : history.episode().initialSeverity();
    }

    private Double severityAfter(EpisodeHistory history, Instant at) {
        Instant earliest = at.plus(FOLLOW_UP_EARLIEST);
        Instant latest = at.plus(FOLLOW_UP_LATEST);
        Instant target = at.plus(FOLLOW_UP_TARGET);

        EpisodeEvent closest = null;
        long closestDistance = Long.MAX_VALUE;
        for (EpisodeEvent event : history.events()) {
            if (event.kind() != EventKind.SEVERITY_UPDATE || event.severity() == null) continue;
            if (event.timestamp().isBefore(earliest) || event.timestamp().isAfter(latest)) continue;
            long distance = Math.abs(Duration.between(target, event.timestamp()).toMillis());
            if (distance < closestDistance) {
                closest = event;
                closestDistance = distance;
            }
        }
        return closest == null ? null : closest.severity();
    }

    private InterventionModels.InterventionEffectiveness summarize(InterventionCategory category,
                                                                   List<InterventionModels.InterventionInstance> rows) {
        List<Double> changes = rows.stream()
                .map(InterventionModels.InterventionInstance::severityChange)
                .filter(Objects::nonNull)
                .toList();
        Double averageChange = changes.isEmpty() ? null
                : changes.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        Double successRate = changes.isEmpty() ? null
                : changes.stream().filter(c -> c > 0).count() * 100.0 / changes.size();
        return new InterventionModels.InterventionEffectiveness(category, rows.size(), averageChange, successRate,
                rows.size() >= SUFFICIENT_USAGE, List.copyOf(rows));
    }

    /**
     * Stable insertion sort. The tolerance band makes the ordering non-transitive,
     * which List.sort may reject, so ties are resolved pairwise here instead.
     */
    static List<InterventionModels.InterventionEffectiveness> rank(List<InterventionModels.InterventionEffectiveness> rows) {
        List<InterventionModels.InterventionEffectiveness> sorted = new ArrayList<>(rows.size());
        for (InterventionModels.InterventionEffectiveness row : rows) {
            int i = sorted.size();
            while (i > 0 && ranksBefore(row, sorted.get(i - 1))) {
                i--;
            }
            sorted.add(i, row);
        }
        return sorted;
    }

    private static boolean ranksBefore(InterventionModels.InterventionEffectiveness a,
                                       InterventionModels.InterventionEffectiveness b) {
        Double ra = a.successRate();
        Double rb = b.successRate();
        if (ra == null && rb == null) return a.usageCount() > b.usageCount();
        if (ra == null) return false;
        if (rb == null) return true;
        if (Math.abs(ra - rb) > RATE_TOLERANCE) return ra > rb;
        return a.usageCount() > b.usageCount();
    }
}
