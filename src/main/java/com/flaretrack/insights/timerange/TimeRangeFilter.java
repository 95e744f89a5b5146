package com.flaretrack.insights.timerange;

import java.time.Instant;

public final class TimeRangeFilter {

    private TimeRangeFilter() {}

    /**
     * Returns true when the reference instant falls inside the range as seen from {@code now}.
     * Relative windows only bound from below, so shorter windows are subsets of longer ones.
     */
    public static boolean inRange(Instant reference, TimeRange range, Instant now) {
        if (reference == null) return false;
        if (range == null || range.kind() == TimeRange.Kind.ALL_TIME) return true;
        Instant lower = range.lowerBound(now);
        if (lower != null && reference.isBefore(lower)) return false;
        Instant upper = range.upperBound();
        return upper == null || !reference.isAfter(upper);
    }
}
