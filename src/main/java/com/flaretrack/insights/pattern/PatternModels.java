package com.flaretrack.insights.pattern;

import com.flaretrack.insights.domain.DomainModels.CorrelationCategory;
import com.flaretrack.insights.domain.DomainModels.TimelineEvent;

import java.time.Instant;
import java.util.List;

public class PatternModels {
    public record PatternOccurrence(TimelineEvent triggerEvent, TimelineEvent resultEvent, Instant timestamp) {}

    public record DetectedPattern(String id,
                                  CorrelationCategory category,
                                  String description,
                                  int frequency,
                                  String confidence,
                                  List<PatternOccurrence> occurrences,
                                  String correlationId,
                                  double coefficient,
                                  double lagHours) {}

    public record DayOfWeekPattern(int dayOfWeek,
                                   String dayName,
                                   double averageSymptomSeverity,
                                   int occurrenceCount,
                                   boolean significant) {}
}
