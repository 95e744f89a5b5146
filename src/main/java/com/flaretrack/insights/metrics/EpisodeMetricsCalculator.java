package com.flaretrack.insights.metrics;

import com.flaretrack.insights.domain.DomainModels.Episode;
import com.flaretrack.insights.domain.DomainModels.EpisodeTrend;
import com.flaretrack.insights.domain.EpisodeHistory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.stream.Collectors;

@Component
public class EpisodeMetricsCalculator {
    static final int MIN_PROBLEM_AREA_EPISODES = 3;
    private static final double MILLIS_PER_DAY = Duration.ofDays(1).toMillis();

    public List<MetricsModels.ProblemArea> problemAreas(List<Episode> episodes) {
        List<Episode> rows = nonNull(episodes);
        if (rows.isEmpty()) return List.of();

        Map<String, Long> counts = rows.stream()
                .filter(e -> e.bodyRegion() != null)
                .collect(Collectors.groupingBy(Episode::bodyRegion, LinkedHashMap::new, Collectors.counting()));

        int total = rows.size();
        // List.sort is stable, so equal counts keep first-encounter order
        return counts.entrySet().stream()
                .filter(e -> e.getValue() >= MIN_PROBLEM_AREA_EPISODES)
                .map(e -> new MetricsModels.ProblemArea(e.getKey(), e.getValue().intValue(), e.getValue() * 100.0 / total))
                .sorted(Comparator.comparingInt(MetricsModels.ProblemArea::episodeCount).reversed())
                .toList();
    }

    public MetricsModels.RegionStatistics regionStatistics(String bodyRegion, List<EpisodeHistory> histories, Instant now) {
        List<EpisodeHistory> rows = nonNull(histories).stream()
                .filter(h -> Objects.equals(bodyRegion, h.episode().bodyRegion()))
                .toList();
        if (rows.isEmpty()) {
            return new MetricsModels.RegionStatistics(bodyRegion, 0, 0, 0, null, null,
                    MetricsModels.RecurrenceRate.INSUFFICIENT, null, null);
        }

        int resolved = (int) rows.stream().filter(h -> h.episode().isResolved()).count();
        Double averageDuration = average(rows.stream().map(EpisodeHistory::durationDays).filter(Objects::nonNull).toList());
        Double averageSeverity = average(rows.stream().map(EpisodeHistory::peakSeverity).toList());

        Instant first = rows.stream().map(h -> h.episode().startTime()).filter(Objects::nonNull).min(Comparator.naturalOrder()).orElse(null);
        Instant last = rows.stream().map(h -> h.episode().startTime()).filter(Objects::nonNull).max(Comparator.naturalOrder()).orElse(null);

        return new MetricsModels.RegionStatistics(bodyRegion, rows.size(), rows.size() - resolved, resolved,
                averageDuration, averageSeverity, recurrenceRate(rows.size(), first, now), first, last);
    }

    public MetricsModels.DurationMetrics durationMetrics(List<EpisodeHistory> histories) {
        List<Double> durations = nonNull(histories).stream()
                .map(EpisodeHistory::durationDays)
                .filter(Objects::nonNull)
                .sorted()
                .toList();
        if (durations.isEmpty()) return MetricsModels.DurationMetrics.EMPTY;

        return new MetricsModels.DurationMetrics(
                average(durations),
                median(durations),
                durations.get(0),
                durations.get(durations.size() - 1),
                durations.size());
    }

    public MetricsModels.SeverityMetrics severityMetrics(List<EpisodeHistory> histories) {
        List<EpisodeHistory> rows = nonNull(histories);
        if (rows.isEmpty()) return MetricsModels.SeverityMetrics.EMPTY;

        Map<EpisodeTrend, Long> trends = rows.stream()
                .map(EpisodeHistory::currentTrend)
                .filter(Objects::nonNull)
                .collect(Collectors.groupingBy(t -> t, () -> new EnumMap<>(EpisodeTrend.class), Collectors.counting()));
        long withTrend = trends.values().stream().mapToLong(Long::longValue).sum();
        int total = rows.size();

        MetricsModels.TrendDistribution distribution = new MetricsModels.TrendDistribution(
                percentage(trends.getOrDefault(EpisodeTrend.IMPROVING, 0L), total),
                percentage(trends.getOrDefault(EpisodeTrend.STABLE, 0L), total),
                percentage(trends.getOrDefault(EpisodeTrend.WORSENING, 0L), total),
                percentage(total - withTrend, total));

        return new MetricsModels.SeverityMetrics(
                average(rows.stream().map(EpisodeHistory::peakSeverity).toList()), total, distribution);
    }

    private MetricsModels.RecurrenceRate recurrenceRate(int count, Instant earliest, Instant now) {
        if (count < 2 || earliest == null || now == null) return MetricsModels.RecurrenceRate.INSUFFICIENT;
        double days = Duration.between(earliest, now).toMillis() / MILLIS_PER_DAY;
        if (days <= 0) return MetricsModels.RecurrenceRate.INSUFFICIENT;
        return new MetricsModels.RecurrenceRate(count / days * 90);
    }

    // rounded one by one, so a distribution may not sum to exactly 100
    private static double percentage(long part, int total) {
        if (total == 0) return 0.0;
        return BigDecimal.valueOf(part * 100.0 / total).setScale(1, RoundingMode.HALF_UP).doubleValue();
    }

    private static Double median(List<Double> sorted) {
        int n = sorted.size();
        if (n == 0) return null;
        if (n % 2 == 1) return sorted.get(n / 2);
        return (sorted.get(n / 2 - 1) + sorted.get(n / 2)) / 2.0;
    }

    private static Double average(List<Double> values) {
        OptionalDouble avg = values.stream().mapToDouble(Double::doubleValue).average();
        return avg.isPresent() ? avg.getAsDouble() : null;
    }

    private static <T> List<T> nonNull(List<T> rows) {
        return rows == null ? List.of() : rows.stream().filter(Objects::nonNull).toList();
    }
}
