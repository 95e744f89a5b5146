package com.flaretrack.insights.timerange;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

public record TimeRange(Kind kind, Instant start, Instant end) {
    public static final TimeRange LAST_30_DAYS = new TimeRange(Kind.LAST_30_DAYS, null, null);
    public static final TimeRange LAST_90_DAYS = new TimeRange(Kind.LAST_90_DAYS, null, null);
    public static final TimeRange LAST_YEAR = new TimeRange(Kind.LAST_YEAR, null, null);
    public static final TimeRange ALL_TIME = new TimeRange(Kind.ALL_TIME, null, null);

    public TimeRange {
        Objects.requireNonNull(kind, "kind");
        if (kind == Kind.EXPLICIT) {
            Objects.requireNonNull(start, "start");
            Objects.requireNonNull(end, "end");
            if (end.isBefore(start)) {
                throw new IllegalArgumentException("Time range end " + end + " is before start " + start);
            }
        }
    }

    public static TimeRange between(Instant start, Instant end) {
        return new TimeRange(Kind.EXPLICIT, start, end);
    }

    public static TimeRange fromCode(String code) {
        if (code == null) return ALL_TIME;
        return switch (code.trim()) {
            case "last30d" -> LAST_30_DAYS;
            case "last90d" -> LAST_90_DAYS;
            case "lastYear" -> LAST_YEAR;
            case "allTime" -> ALL_TIME;
            default -> throw new IllegalArgumentException("Unknown time range code: " + code);
        };
    }

    public Instant lowerBound(Instant now) {
        return switch (kind) {
            case EXPLICIT -> start;
            case ALL_TIME -> null;
            default -> Objects.requireNonNull(now, "now").minus(kind.window);
        };
    }

    public Instant upperBound() {
        return kind == Kind.EXPLICIT ? end : null;
    }

    public enum Kind {
        LAST_30_DAYS(Duration.ofDays(30)),
        LAST_90_DAYS(Duration.ofDays(90)),
        LAST_YEAR(Duration.ofDays(365)),
        ALL_TIME(null),
        EXPLICIT(null);

        private final Duration window;

        Kind(Duration window) {
            this.window = window;
        }
    }
}
