package com.flaretrack.insights.domain;

import java.time.Instant;
import java.util.Locale;

public class DomainModels {
    public record Episode(String id,
                          String ownerId,
                          String bodyRegion,
                          Instant startTime,
                          Instant endTime,
                          EpisodeStatus status,
                          int initialSeverity) {
        public boolean isResolved() {
            return endTime != null;
        }
    }

    public record EpisodeEvent(String id,
                               String episodeId,
                               Instant timestamp,
                               EventKind kind,
                               Double severity,
                               EpisodeTrend trend,
                               String interventionCategory,
                               String interventionDetail,
                               String notes) {}

    public record CorrelationRecord(String id,
                                    String item1,
                                    String item2,
                                    CorrelationCategory category,
                                    double coefficient,
                                    double lagHours,
                                    String confidence,
                                    Instant windowStart,
                                    Instant windowEnd) {}

    public record TimelineEvent(String id, TimelineCategory category, Instant timestamp, String summary) {}

    public enum EpisodeStatus {
        ACTIVE, RESOLVED;

        public static EpisodeStatus fromCode(String code) {
            return code != null && "resolved".equalsIgnoreCase(code.trim()) ? RESOLVED : ACTIVE;
        }

        public String code() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public enum EventKind {
        CREATED("created"),
        SEVERITY_UPDATE("severity_update"),
        TREND_CHANGE("trend_change"),
        INTERVENTION("intervention"),
        RESOLVED("resolved");

        private final String code;

        EventKind(String code) {
            this.code = code;
        }

        public String code() {
            return code;
        }

        /** Returns null for codes this engine does not know. */
        public static EventKind fromCode(String code) {
            if (code == null) return null;
            for (EventKind kind : values()) {
                if (kind.code.equalsIgnoreCase(code.trim())) return kind;
            }
            return null;
        }
    }

    public enum EpisodeTrend {
        IMPROVING, STABLE, WORSENING;

        public static EpisodeTrend fromCode(String code) {
            if (code == null) return null;
            for (EpisodeTrend trend : values()) {
                if (trend.name().equalsIgnoreCase(code.trim())) return trend;
            }
            return null;
        }
    }

    public enum TimelineCategory {
        FOOD("food"),
        SYMPTOM("symptom"),
        TRIGGER("trigger"),
        MEDICATION("medication"),
        FLARE_CREATED("flare-created");

        private final String code;

        TimelineCategory(String code) {
            this.code = code;
        }

        public String code() {
            return code;
        }

        public static TimelineCategory fromCode(String code) {
            if (code == null) return null;
            for (TimelineCategory category : values()) {
                if (category.code.equalsIgnoreCase(code.trim())) return category;
            }
            return null;
        }
    }

    public enum CorrelationCategory {
        FOOD_SYMPTOM("food-symptom", TimelineCategory.FOOD, TimelineCategory.SYMPTOM),
        TRIGGER_SYMPTOM("trigger-symptom", TimelineCategory.TRIGGER, TimelineCategory.SYMPTOM),
        MEDICATION_SYMPTOM("medication-symptom", TimelineCategory.MEDICATION, TimelineCategory.SYMPTOM),
        FOOD_FLARE("food-flare", TimelineCategory.FOOD, TimelineCategory.FLARE_CREATED),
        TRIGGER_FLARE("trigger-flare", TimelineCategory.TRIGGER, TimelineCategory.FLARE_CREATED);

        private final String code;
        private final TimelineCategory triggerCategory;
        private final TimelineCategory resultCategory;

        CorrelationCategory(String code, TimelineCategory triggerCategory, TimelineCategory resultCategory) {
            this.code = code;
            this.triggerCategory = triggerCategory;
            this.resultCategory = resultCategory;
        }

        public String code() {
            return code;
        }

        public TimelineCategory triggerCategory() {
            return triggerCategory;
        }

        public TimelineCategory resultCategory() {
            return resultCategory;
        }

        public boolean isFlareOutcome() {
            return resultCategory == TimelineCategory.FLARE_CREATED;
        }

        public static CorrelationCategory fromCode(String code) {
            if (code == null) return null;
            for (CorrelationCategory category : values()) {
                if (category.code.equalsIgnoreCase(code.trim())) return category;
            }
            return null;
        }
    }
}
