package com.flaretrack.insights.pattern;

import com.flaretrack.insights.domain.DomainModels.CorrelationRecord;
import com.flaretrack.insights.domain.DomainModels.TimelineCategory;
import com.flaretrack.insights.domain.DomainModels.TimelineEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.TextStyle;
import java.util.*;
import java.util.stream.Collectors;

@Component
public class PatternDetector {
    private static final Logger log = LoggerFactory.getLogger(PatternDetector.class);

    static final double SIGNIFICANT_COEFFICIENT = 0.3;
    static final Duration LAG_TOLERANCE = Duration.ofHours(2);
    static final int MIN_SYMPTOM_EVENTS = 7;
    static final double SIGNIFICANT_DAY_FACTOR = 1.5;

    private final PatternMatchingMode matchingMode;
    private final ZoneId zone;

    public PatternDetector(@Value("${insights.patterns.matching-mode:INDEPENDENT}") PatternMatchingMode matchingMode,
                           ZoneId zone) {
        this.matchingMode = matchingMode;
        this.zone = zone;
    }

    public List<PatternModels.DetectedPattern> detectRecurringSequences(List<TimelineEvent> events,
                                                                        List<CorrelationRecord> correlations) {
        return detectRecurringSequences(events, correlations, matchingMode);
    }

    public List<PatternModels.DetectedPattern> detectRecurringSequences(List<TimelineEvent> events,
                                                                        List<CorrelationRecord> correlations,
                                                                        PatternMatchingMode mode) {
        List<TimelineEvent> timeline = sortedTimeline(events);
        List<CorrelationRecord> all = correlations == null ? List.of() : correlations;
        List<CorrelationRecord> significant = all.stream()
                .filter(Objects::nonNull)
                .filter(c -> c.category() != null)
                .filter(c -> Math.abs(c.coefficient()) >= SIGNIFICANT_COEFFICIENT)
                .toList();

        List<PatternModels.DetectedPattern> patterns = new ArrayList<>();
        for (CorrelationRecord correlation : significant) {
            List<PatternModels.PatternOccurrence> occurrences = findOccurrences(timeline, correlation,
                    mode == null ? matchingMode : mode);
            if (occurrences.isEmpty()) continue;
            patterns.add(new PatternModels.DetectedPattern(
                    "pattern-" + correlation.id(),
                    correlation.category(),
                    describe(correlation),
                    occurrences.size(),
                    correlation.confidence(),
                    List.copyOf(occurrences),
                    correlation.id(),
                    correlation.coefficient(),
                    correlation.lagHours()));
        }
        log.debug("Pattern detection: {} timeline events, {} of {} correlations significant, {} patterns found",
                timeline.size(), significant.size(), all.size(), patterns.size());
        return patterns;
    }

    // 0 = Sunday; averageSymptomSeverity carries the count since timeline events have no severity
    public List<PatternModels.DayOfWeekPattern> detectDayOfWeekPatterns(List<TimelineEvent> events) {
        List<TimelineEvent> symptoms = sortedTimeline(events).stream()
                .filter(e -> e.category() == TimelineCategory.SYMPTOM)
                .toList();
        if (symptoms.size() < MIN_SYMPTOM_EVENTS) return List.of();

        Map<Integer, Long> byDay = symptoms.stream()
                .collect(Collectors.groupingBy(e -> dayIndex(e.timestamp()), TreeMap::new, Collectors.counting()));
        double mean = byDay.values().stream().mapToLong(Long::longValue).average().orElse(0.0);

        return byDay.entrySet().stream()
                .map(e -> new PatternModels.DayOfWeekPattern(
                        e.getKey(),
                        dayName(e.getKey()),
                        e.getValue(),
                        e.getValue().intValue(),
                        e.getValue() > mean * SIGNIFICANT_DAY_FACTOR))
                .toList();
    }

    private List<PatternModels.PatternOccurrence> findOccurrences(List<TimelineEvent> timeline,
                                                                  CorrelationRecord correlation,
                                                                  PatternMatchingMode mode) {
        TimelineCategory triggerCategory = correlation.category().triggerCategory();
        TimelineCategory resultCategory = correlation.category().resultCategory();
        List<TimelineEvent> triggers = timeline.stream().filter(e -> e.category() == triggerCategory).toList();
        List<TimelineEvent> results = timeline.stream().filter(e -> e.category() == resultCategory).toList();
        Duration lag = Duration.ofMillis(Math.round(correlation.lagHours() * Duration.ofHours(1).toMillis()));

        List<PatternModels.PatternOccurrence> occurrences = new ArrayList<>();
        Set<String> consumed = new HashSet<>();
        for (TimelineEvent trigger : triggers) {
            Instant expected = trigger.timestamp().plus(lag);
            Instant earliest = expected.minus(LAG_TOLERANCE);
            Instant latest = expected.plus(LAG_TOLERANCE);
            List<TimelineEvent> inWindow = results.stream()
                    .filter(r -> !r.timestamp().isBefore(earliest) && !r.timestamp().isAfter(latest))
                    .toList();

            if (mode == PatternMatchingMode.EXCLUSIVE) {
                nearestUnused(inWindow, expected, consumed).ifPresent(r -> {
                    consumed.add(r.id());
                    occurrences.add(new PatternModels.PatternOccurrence(trigger, r, trigger.timestamp()));
                });
            } else {
                inWindow.forEach(r -> occurrences.add(new PatternModels.PatternOccurrence(trigger, r, trigger.timestamp())));
            }
        }
        return occurrences;
    }

    private Optional<TimelineEvent> nearestUnused(List<TimelineEvent> candidates, Instant expected, Set<String> consumed) {
        TimelineEvent best = null;
        long bestDistance = Long.MAX_VALUE;
        for (TimelineEvent candidate : candidates) {
            if (consumed.contains(candidate.id())) continue;
            long distance = Math.abs(Duration.between(expected, candidate.timestamp()).toMillis());
            if (distance < bestDistance) {
                best = candidate;
                bestDistance = distance;
            }
        }
        return Optional.ofNullable(best);
    }

    private String describe(CorrelationRecord correlation) {
        String direction = correlation.coefficient() > 0 ? "correlates with" : "correlates negatively with";
        String outcome = correlation.category().isFlareOutcome() ? "flare in " + correlation.item2() : correlation.item2();
        return String.format(Locale.US, "%s %s %s %sh later",
                correlation.item1(), direction, outcome, formatHours(correlation.lagHours()));
    }

    private static String formatHours(double hours) {
        return hours == Math.rint(hours) ? String.valueOf((long) hours) : String.valueOf(hours);
    }

    private int dayIndex(Instant timestamp) {
        return timestamp.atZone(zone).getDayOfWeek().getValue() % 7;
    }

    private static String dayName(int index) {
        DayOfWeek day = index == 0 ? DayOfWeek.SUNDAY : DayOfWeek.of(index);
        return day.getDisplayName(TextStyle.FULL, Locale.ENGLISH);
    }

    private static List<TimelineEvent> sortedTimeline(List<TimelineEvent> events) {
        if (events == null) return List.of();
        return events.stream()
                .filter(Objects::nonNull)
                .filter(e -> e.timestamp() != null && e.category() != null)
                .sorted(Comparator.comparing(TimelineEvent::timestamp))
                .toList();
    }
}
