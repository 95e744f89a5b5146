package com.flaretrack.insights;

import com.flaretrack.insights.domain.DomainModels.CorrelationCategory;
import com.flaretrack.insights.domain.DomainModels.CorrelationRecord;
import com.flaretrack.insights.domain.DomainModels.TimelineCategory;
import com.flaretrack.insights.domain.DomainModels.TimelineEvent;
import com.flaretrack.insights.pattern.PatternDetector;
import com.flaretrack.insights.pattern.PatternMatchingMode;
import com.flaretrack.insights.pattern.PatternModels;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

import static com.flaretrack.insights.support.InsightsFixtures.timeline;
import static org.junit.jupiter.api.Assertions.*;

class PatternDetectorTest {
    private static final Instant T = Instant.parse("2026-05-04T08:00:00Z");

    private final PatternDetector detector = new PatternDetector(PatternMatchingMode.INDEPENDENT, ZoneId.of("UTC"));

    @Test
    void matchesFoodFollowedBySymptomAtLag() {
        var dairy = correlation("c1", CorrelationCategory.FOOD_SYMPTOM, 0.75, 12);
        List<TimelineEvent> events = List.of(
                timeline(TimelineCategory.FOOD, T),
                timeline(TimelineCategory.SYMPTOM, T.plus(Duration.ofHours(12))));

        var patterns = detector.detectRecurringSequences(events, List.of(dairy));

        assertEquals(1, patterns.size());
        var pattern = patterns.get(0);
        assertEquals("pattern-c1", pattern.id());
        assertEquals(1, pattern.frequency());
        assertEquals(12.0, pattern.lagHours());
        assertEquals("high", pattern.confidence());
        assertEquals("Dairy correlates with Headache 12h later", pattern.description());
        assertEquals(T, pattern.occurrences().get(0).timestamp());
    }

    @Test
    void toleranceIsTwoHoursEitherSide() {
        var record = correlation("c2", CorrelationCategory.FOOD_SYMPTOM, 0.6, 12);

        assertEquals(1, detector.detectRecurringSequences(pair(12 + 1.9), List.of(record)).size());
        assertEquals(1, detector.detectRecurringSequences(pair(12 - 2), List.of(record)).size());
        assertTrue(detector.detectRecurringSequences(pair(12 + 3), List.of(record)).isEmpty());
        assertTrue(detector.detectRecurringSequences(pair(12 - 2.5), List.of(record)).isEmpty());
    }

    @Test
    void weakCorrelationsAreIgnoredButStrongNegativeOnesKept() {
        var weak = correlation("weak", CorrelationCategory.FOOD_SYMPTOM, 0.29, 12);
        var negative = correlation("neg", CorrelationCategory.FOOD_SYMPTOM, -0.5, 12);

        var patterns = detector.detectRecurringSequences(pair(12), List.of(weak, negative));

        assertEquals(List.of("pattern-neg"), patterns.stream().map(PatternModels.DetectedPattern::id).toList());
        assertTrue(patterns.get(0).description().contains("correlates negatively with"));
    }

    @Test
    void usesCategoryMappingForTriggerAndResultEvents() {
        var flare = correlation("flare", CorrelationCategory.TRIGGER_FLARE, 0.5, 6);
        List<TimelineEvent> events = List.of(
                timeline(TimelineCategory.TRIGGER, T),
                timeline(TimelineCategory.SYMPTOM, T.plus(Duration.ofHours(6))),
                timeline(TimelineCategory.FLARE_CREATED, T.plus(Duration.ofHours(7))));

        var patterns = detector.detectRecurringSequences(events, List.of(flare));

        assertEquals(1, patterns.size());
        assertEquals(TimelineCategory.FLARE_CREATED, patterns.get(0).occurrences().get(0).resultEvent().category());
        assertEquals("Dairy correlates with flare in Headache 6h later", patterns.get(0).description());
        assertTrue(detector.detectRecurringSequences(events,
                List.of(correlation("med", CorrelationCategory.MEDICATION_SYMPTOM, 0.9, 6))).isEmpty());
    }

    @Test
    void independentModeCountsEveryPairing() {
        var record = correlation("c3", CorrelationCategory.FOOD_SYMPTOM, 0.7, 12);
        List<TimelineEvent> events = List.of(
                timeline(TimelineCategory.FOOD, T),
                timeline(TimelineCategory.FOOD, T.plus(Duration.ofHours(1))),
                timeline(TimelineCategory.SYMPTOM, T.plus(Duration.ofHours(12))),
                timeline(TimelineCategory.SYMPTOM, T.plus(Duration.ofHours(13))));

        var independent = detector.detectRecurringSequences(events, List.of(record));
        var exclusive = detector.detectRecurringSequences(events, List.of(record), PatternMatchingMode.EXCLUSIVE);

        assertEquals(4, independent.get(0).frequency());
        assertEquals(2, exclusive.get(0).frequency());
        assertNotEquals(exclusive.get(0).occurrences().get(0).resultEvent().id(),
                exclusive.get(0).occurrences().get(1).resultEvent().id());
    }

    @Test
    void emptyInputsProduceNoPatterns() {
        assertTrue(detector.detectRecurringSequences(List.of(), List.of()).isEmpty());
        assertTrue(detector.detectRecurringSequences(null, null).isEmpty());
        assertTrue(detector.detectRecurringSequences(pair(12), List.of()).isEmpty());
    }

    @Test
    void dayOfWeekNeedsSevenSymptomEvents() {
        List<TimelineEvent> events = new ArrayList<>();
        for (int i = 0; i < 6; i++) events.add(timeline(TimelineCategory.SYMPTOM, T.plus(Duration.ofDays(i))));
        events.add(timeline(TimelineCategory.FOOD, T));

        assertTrue(detector.detectDayOfWeekPatterns(events).isEmpty());
    }

    @Test
    void flagsDaysWellAboveTheMeanAsSignificant() {
        // 2026-05-04 is a Monday
        List<TimelineEvent> events = new ArrayList<>();
        for (int i = 0; i < 6; i++) events.add(timeline(TimelineCategory.SYMPTOM, T.plus(Duration.ofHours(i))));
        events.add(timeline(TimelineCategory.SYMPTOM, T.plus(Duration.ofDays(1))));
        events.add(timeline(TimelineCategory.SYMPTOM, T.plus(Duration.ofDays(6))));

        var days = detector.detectDayOfWeekPatterns(events);

        assertEquals(3, days.size());
        assertEquals(0, days.get(0).dayOfWeek());
        assertEquals("Sunday", days.get(0).dayName());
        var monday = days.get(1);
        assertEquals(1, monday.dayOfWeek());
        assertEquals("Monday", monday.dayName());
        assertEquals(6, monday.occurrenceCount());
        assertEquals(6.0, monday.averageSymptomSeverity());
        assertTrue(monday.significant());
        assertFalse(days.get(2).significant());
    }

    @Test
    void dayOfWeekFollowsConfiguredZone() {
        var tokyo = new PatternDetector(PatternMatchingMode.INDEPENDENT, ZoneId.of("Asia/Tokyo"));
        Instant sundayEveningUtc = Instant.parse("2026-05-03T20:00:00Z");
        List<TimelineEvent> events = new ArrayList<>();
        for (int i = 0; i < 7; i++) events.add(timeline(TimelineCategory.SYMPTOM, sundayEveningUtc.plusSeconds(i)));

        assertEquals(1, tokyo.detectDayOfWeekPatterns(events).get(0).dayOfWeek());
        assertEquals(0, detector.detectDayOfWeekPatterns(events).get(0).dayOfWeek());
    }

    private static List<TimelineEvent> pair(double lagHours) {
        return List.of(
                timeline(TimelineCategory.FOOD, T),
                timeline(TimelineCategory.SYMPTOM, T.plusMillis(Math.round(lagHours * 3_600_000))));
    }

    private static CorrelationRecord correlation(String id, CorrelationCategory category, double coefficient, double lagHours) {
        return new CorrelationRecord(id, "Dairy", "Headache", category, coefficient, lagHours, "high", null, null);
    }
}
