package com.flaretrack.insights.trend;

import java.util.List;

public final class LinearRegression {
    private static final double EPSILON = 1e-12;

    private LinearRegression() {}

    public static Fit fit(List<Point> points) {
        if (points == null || points.size() < 2) {
            throw new IllegalArgumentException("Linear regression requires at least 2 data points");
        }
        int n = points.size();
        double meanX = points.stream().mapToDouble(Point::x).average().orElse(0.0);
        double meanY = points.stream().mapToDouble(Point::y).average().orElse(0.0);

        double covariance = 0.0;
        double varianceX = 0.0;
        for (Point p : points) {
            covariance += (p.x() - meanX) * (p.y() - meanY);
            varianceX += (p.x() - meanX) * (p.x() - meanX);
        }
        if (varianceX < EPSILON) {
            throw new IllegalArgumentException("Cannot fit regression: all " + n + " x values are identical");
        }

        double slope = covariance / varianceX;
        double intercept = meanY - slope * meanX;
        return new Fit(slope, intercept, rSquared(points, slope, intercept, meanY));
    }

    public static List<Point> indexed(List<? extends Number> values) {
        return java.util.stream.IntStream.range(0, values.size())
                .mapToObj(i -> new Point(i, values.get(i).doubleValue()))
                .toList();
    }

    private static double rSquared(List<Point> points, double slope, double intercept, double meanY) {
        double total = 0.0;
        double residual = 0.0;
        for (Point p : points) {
            double predicted = slope * p.x() + intercept;
            total += (p.y() - meanY) * (p.y() - meanY);
            residual += (p.y() - predicted) * (p.y() - predicted);
        }
        if (total < EPSILON) {
            // flat series: a flat fit explains it fully
            return Math.abs(slope) < EPSILON ? 1.0 : 0.0;
        }
        return 1.0 - residual / total;
    }

    public record Point(double x, double y) {}

    public record Fit(double slope, double intercept, double rSquared) {
        public double predict(double x) {
            return slope * x + intercept;
        }
    }
}
