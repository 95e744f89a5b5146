package com.flaretrack.insights.pattern;

public enum PatternMatchingMode {
    INDEPENDENT,
    EXCLUSIVE
}
