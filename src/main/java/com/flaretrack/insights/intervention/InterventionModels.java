package com.flaretrack.insights.intervention;

import java.time.Instant;
import java.util.List;

public class InterventionModels {
    public record InterventionInstance(String episodeId,
                                       InterventionCategory category,
                                       Instant timestamp,
                                       String detail,
                                       double severityBefore,
                                       Double severityAfter,
                                       Double severityChange) {}

    public record InterventionEffectiveness(InterventionCategory category,
                                            int usageCount,
                                            Double averageSeverityChange,
                                            Double successRate,
                                            boolean hasSufficientData,
                                            List<InterventionInstance> instances) {
        public String label() {
            return category.label();
        }
    }
}
