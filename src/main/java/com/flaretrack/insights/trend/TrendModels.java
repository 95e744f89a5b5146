package com.flaretrack.insights.trend;

import java.time.Instant;
import java.util.List;

public class TrendModels {
    public static final String IMPROVING = "improving";
    public static final String STABLE = "stable";
    public static final String DECLINING = "declining";
    public static final String INSUFFICIENT_DATA = "insufficient-data";

    public record MonthlyDataPoint(String month, Instant monthStart, int episodeCount, Double averageSeverity) {}

    public record TrendLine(double slope, double intercept, double rSquared) {
        public static final TrendLine FLAT = new TrendLine(0.0, 0.0, 0.0);
    }

    public record TrendAnalysis(List<MonthlyDataPoint> dataPoints, TrendLine trendLine, String classification) {
        public boolean hasSufficientData() {
            return !INSUFFICIENT_DATA.equals(classification);
        }
    }
}
