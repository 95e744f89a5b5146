package com.flaretrack.insights.trend;

import com.flaretrack.insights.domain.EpisodeHistory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.util.*;
import java.util.stream.Collectors;

@Component
public class TrendAnalyzer {
    static final int MIN_BUCKETS = 3;
    static final double SLOPE_THRESHOLD = 0.3;

    public TrendModels.TrendAnalysis analyze(List<EpisodeHistory> histories) {
        Map<YearMonth, List<EpisodeHistory>> byMonth = (histories == null ? List.<EpisodeHistory>of() : histories).stream()
                .filter(Objects::nonNull)
                .filter(h -> h.episode().startTime() != null)
                .collect(Collectors.groupingBy(h -> YearMonth.from(h.episode().startTime().atOffset(ZoneOffset.UTC)),
                        TreeMap::new, Collectors.toList()));

        List<TrendModels.MonthlyDataPoint> points = byMonth.entrySet().stream()
                .map(e -> toDataPoint(e.getKey(), e.getValue()))
                .toList();

        if (points.size() < MIN_BUCKETS) {
            return new TrendModels.TrendAnalysis(points, TrendModels.TrendLine.FLAT, TrendModels.INSUFFICIENT_DATA);
        }

        LinearRegression.Fit fit = LinearRegression.fit(LinearRegression.indexed(
                points.stream().map(TrendModels.MonthlyDataPoint::episodeCount).toList()));
        return new TrendModels.TrendAnalysis(points,
                new TrendModels.TrendLine(fit.slope(), fit.intercept(), fit.rSquared()),
                classify(fit.slope()));
    }

    static String classify(double slope) {
        if (slope < -SLOPE_THRESHOLD) return TrendModels.IMPROVING;
        if (slope > SLOPE_THRESHOLD) return TrendModels.DECLINING;
        return TrendModels.STABLE;
    }

    private TrendModels.MonthlyDataPoint toDataPoint(YearMonth month, List<EpisodeHistory> rows) {
        OptionalDouble severity = rows.stream()
                .mapToDouble(EpisodeHistory::peakSeverity)
                .filter(s -> s > 0)
                .average();
        Instant monthStart = month.atDay(1).atStartOfDay(ZoneOffset.UTC).toInstant();
        return new TrendModels.MonthlyDataPoint(month.toString(), monthStart, rows.size(),
                severity.isPresent() ? severity.getAsDouble() : null);
    }
}
