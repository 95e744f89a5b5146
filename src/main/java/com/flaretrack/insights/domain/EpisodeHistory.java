package com.flaretrack.insights.domain;

import com.flaretrack.insights.domain.DomainModels.Episode;
import com.flaretrack.insights.domain.DomainModels.EpisodeEvent;
import com.flaretrack.insights.domain.DomainModels.EpisodeTrend;
import com.flaretrack.insights.domain.DomainModels.EventKind;

import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

// events are stably sorted by timestamp, so same-instant events keep their log order
public record EpisodeHistory(Episode episode, List<EpisodeEvent> events) {
    private static final double MILLIS_PER_DAY = Duration.ofDays(1).toMillis();

    public EpisodeHistory {
        Objects.requireNonNull(episode, "episode");
        events = events == null ? List.of() : events.stream()
                .filter(Objects::nonNull)
                .filter(e -> e.timestamp() != null)
                .sorted(Comparator.comparing(EpisodeEvent::timestamp))
                .toList();
    }

    public static EpisodeHistory withoutEvents(Episode episode) {
        return new EpisodeHistory(episode, List.of());
    }

    public double peakSeverity() {
        return events.stream()
                .map(EpisodeEvent::severity)
                .filter(Objects::nonNull)
                .mapToDouble(Double::doubleValue)
                .max()
                .orElse(episode.initialSeverity());
    }

    /** Last trend_change wins; null when the trend was never reported. */
    public EpisodeTrend currentTrend() {
        EpisodeTrend current = null;
        for (EpisodeEvent event : events) {
            if (event.kind() == EventKind.TREND_CHANGE && event.trend() != null) {
                current = event.trend();
            }
        }
        return current;
    }

    public Double durationDays() {
        if (!episode.isResolved() || episode.startTime() == null) return null;
        return Duration.between(episode.startTime(), episode.endTime()).toMillis() / MILLIS_PER_DAY;
    }
}
