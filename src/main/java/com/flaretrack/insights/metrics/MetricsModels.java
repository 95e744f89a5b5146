package com.flaretrack.insights.metrics;

import java.time.Instant;

public class MetricsModels {
    public static final String INSUFFICIENT_DATA = "insufficient data";

    public record ProblemArea(String bodyRegion, int episodeCount, double percentage) {}

    /** Episodes per 90 days, or the "insufficient data" sentinel when no rate can be derived. */
    public record RecurrenceRate(Double perNinetyDays) {
        public static final RecurrenceRate INSUFFICIENT = new RecurrenceRate(null);

        public boolean isInsufficient() {
            return perNinetyDays == null;
        }

        public String label() {
            return isInsufficient() ? INSUFFICIENT_DATA : String.format(java.util.Locale.US, "%.2f", perNinetyDays);
        }
    }

    public record RegionStatistics(String bodyRegion,
                                   int totalCount,
                                   int activeCount,
                                   int resolvedCount,
                                   Double averageDurationDays,
                                   Double averageSeverity,
                                   RecurrenceRate recurrenceRate,
                                   Instant firstEpisodeStart,
                                   Instant lastEpisodeStart) {}

    public record DurationMetrics(Double averageDays,
                                  Double medianDays,
                                  Double shortestDays,
                                  Double longestDays,
                                  int resolvedCount) {
        public static final DurationMetrics EMPTY = new DurationMetrics(null, null, null, null, 0);
    }

    public record TrendDistribution(double improving, double stable, double worsening, double noData) {
        public static final TrendDistribution EMPTY = new TrendDistribution(0.0, 0.0, 0.0, 0.0);
    }

    public record SeverityMetrics(Double averageSeverity, int episodeCount, TrendDistribution trendDistribution) {
        public static final SeverityMetrics EMPTY = new SeverityMetrics(null, 0, TrendDistribution.EMPTY);
    }
}
