package com.flaretrack.insights.analytics;

import com.flaretrack.insights.domain.DomainModels.CorrelationRecord;
import com.flaretrack.insights.domain.DomainModels.Episode;
import com.flaretrack.insights.domain.DomainModels.TimelineEvent;
import com.flaretrack.insights.domain.EpisodeHistory;
import com.flaretrack.insights.intervention.InterventionEffectivenessAnalyzer;
import com.flaretrack.insights.intervention.InterventionModels;
import com.flaretrack.insights.metrics.EpisodeMetricsCalculator;
import com.flaretrack.insights.metrics.MetricsModels;
import com.flaretrack.insights.pattern.PatternDetector;
import com.flaretrack.insights.pattern.PatternModels;
import com.flaretrack.insights.repository.CorrelationProvider;
import com.flaretrack.insights.repository.EpisodeStore;
import com.flaretrack.insights.repository.TimelineProvider;
import com.flaretrack.insights.timerange.TimeRange;
import com.flaretrack.insights.timerange.TimeRangeFilter;
import com.flaretrack.insights.trend.TrendAnalyzer;
import com.flaretrack.insights.trend.TrendModels;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

@Service
public class InsightsService {
    private static final Logger log = LoggerFactory.getLogger(InsightsService.class);

    private final EpisodeStore episodeStore;
    private final CorrelationProvider correlationProvider;
    private final TimelineProvider timelineProvider;
    private final EpisodeHistoryLoader historyLoader;
    private final EpisodeMetricsCalculator metricsCalculator;
    private final TrendAnalyzer trendAnalyzer;
    private final InterventionEffectivenessAnalyzer interventionAnalyzer;
    private final PatternDetector patternDetector;
    private final Clock clock;

    public InsightsService(EpisodeStore episodeStore,
                           CorrelationProvider correlationProvider,
                           TimelineProvider timelineProvider,
                           EpisodeHistoryLoader historyLoader,
                           EpisodeMetricsCalculator metricsCalculator,
                           TrendAnalyzer trendAnalyzer,
                           InterventionEffectivenessAnalyzer interventionAnalyzer,
                           PatternDetector patternDetector,
                           Clock clock) {
        this.episodeStore = episodeStore;
        this.correlationProvider = correlationProvider;
        this.timelineProvider = timelineProvider;
        this.historyLoader = historyLoader;
        this.metricsCalculator = metricsCalculator;
        this.trendAnalyzer = trendAnalyzer;
        this.interventionAnalyzer = interventionAnalyzer;
        this.patternDetector = patternDetector;
        this.clock = clock;
    }

    public List<MetricsModels.ProblemArea> getProblemAreas(String ownerId, TimeRange range, Instant now) {
        List<MetricsModels.ProblemArea> areas = metricsCalculator.problemAreas(episodesInRange(ownerId, range, now));
        log.info("Problem areas for owner {} ({}): {} regions", ownerId, describe(range), areas.size());
        return areas;
    }

    public List<MetricsModels.ProblemArea> getProblemAreas(String ownerId, TimeRange range) {
        return getProblemAreas(ownerId, range, clock.instant());
    }

    public MetricsModels.RegionStatistics getRegionStatistics(String ownerId, String bodyRegion, TimeRange range, Instant now) {
        List<Episode> episodes = ownerId == null || bodyRegion == null ? List.of()
                : inRange(episodeStore.findByOwnerAndRegion(ownerId, bodyRegion), range, now);
        return metricsCalculator.regionStatistics(bodyRegion, historyLoader.load(episodes), now);
    }

    public MetricsModels.RegionStatistics getRegionStatistics(String ownerId, String bodyRegion, TimeRange range) {
        return getRegionStatistics(ownerId, bodyRegion, range, clock.instant());
    }

    public MetricsModels.DurationMetrics getDurationMetrics(String ownerId, TimeRange range, Instant now) {
        // durations only need the episode rows, so no event logs are read here
        List<EpisodeHistory> histories = episodesInRange(ownerId, range, now).stream()
                .map(EpisodeHistory::withoutEvents)
                .toList();
        return metricsCalculator.durationMetrics(histories);
    }

    public MetricsModels.DurationMetrics getDurationMetrics(String ownerId, TimeRange range) {
        return getDurationMetrics(ownerId, range, clock.instant());
    }

    public MetricsModels.SeverityMetrics getSeverityMetrics(String ownerId, TimeRange range, Instant now) {
        return metricsCalculator.severityMetrics(historiesInRange(ownerId, range, now));
    }

    public MetricsModels.SeverityMetrics getSeverityMetrics(String ownerId, TimeRange range) {
        return getSeverityMetrics(ownerId, range, clock.instant());
    }

    public TrendModels.TrendAnalysis getTrendAnalysis(String ownerId, TimeRange range, Instant now) {
        TrendModels.TrendAnalysis analysis = trendAnalyzer.analyze(historiesInRange(ownerId, range, now));
        log.info("Trend analysis for owner {} ({}): {} months, {}", ownerId, describe(range),
                analysis.dataPoints().size(), analysis.classification());
        return analysis;
    }

    public TrendModels.TrendAnalysis getTrendAnalysis(String ownerId, TimeRange range) {
        return getTrendAnalysis(ownerId, range, clock.instant());
    }

    public List<InterventionModels.InterventionEffectiveness> getInterventionEffectiveness(String ownerId, TimeRange range, Instant now) {
        List<InterventionModels.InterventionEffectiveness> out = interventionAnalyzer.analyze(historiesInRange(ownerId, range, now));
        log.info("Intervention effectiveness for owner {} ({}): {} categories", ownerId, describe(range), out.size());
        return out;
    }

    public List<InterventionModels.InterventionEffectiveness> getInterventionEffectiveness(String ownerId, TimeRange range) {
        return getInterventionEffectiveness(ownerId, range, clock.instant());
    }

    public List<PatternModels.DetectedPattern> detectRecurringSequences(List<TimelineEvent> events,
                                                                        List<CorrelationRecord> correlations) {
        return patternDetector.detectRecurringSequences(events, correlations);
    }

    public List<PatternModels.DayOfWeekPattern> detectDayOfWeekPatterns(List<TimelineEvent> events) {
        return patternDetector.detectDayOfWeekPatterns(events);
    }

    public PatternReport detectPatterns(String ownerId, TimeRange range, Instant now) {
        if (ownerId == null) return PatternReport.EMPTY;
        TimeRange window = range == null ? TimeRange.ALL_TIME : range;
        Instant from = window.lowerBound(now);
        Instant to = window.upperBound();

        List<TimelineEvent> timeline = timelineProvider.findByOwner(ownerId, from, to);
        List<CorrelationRecord> correlations = correlationProvider.findByOwner(ownerId, from, to);
        PatternReport report = new PatternReport(
                patternDetector.detectRecurringSequences(timeline, correlations),
                patternDetector.detectDayOfWeekPatterns(timeline));
        log.info("Pattern detection for owner {} ({}): {} sequences, {} weekday buckets", ownerId, describe(window),
                report.sequences().size(), report.dayOfWeek().size());
        return report;
    }

    public PatternReport detectPatterns(String ownerId, TimeRange range) {
        return detectPatterns(ownerId, range, clock.instant());
    }

    private List<EpisodeHistory> historiesInRange(String ownerId, TimeRange range, Instant now) {
        return historyLoader.load(episodesInRange(ownerId, range, now));
    }

    private List<Episode> episodesInRange(String ownerId, TimeRange range, Instant now) {
        if (ownerId == null) return List.of();
        return inRange(episodeStore.findByOwner(ownerId), range, now);
    }

    private List<Episode> inRange(List<Episode> episodes, TimeRange range, Instant now) {
        if (episodes == null) return List.of();
        return episodes.stream()
                .filter(e -> e != null && TimeRangeFilter.inRange(e.startTime(), range, now))
                .toList();
    }

    private static String describe(TimeRange range) {
        return range == null ? TimeRange.Kind.ALL_TIME.name() : range.kind().name();
    }

    public record PatternReport(List<PatternModels.DetectedPattern> sequences,
                                List<PatternModels.DayOfWeekPattern> dayOfWeek) {
        public static final PatternReport EMPTY = new PatternReport(List.of(), List.of());
    }
}
