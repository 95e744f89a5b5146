package com.flaretrack.insights.intervention;

import java.util.Locale;

public enum InterventionCategory {
    ICE("Ice"),
    HEAT("Heat"),
    MEDICATION("Medication"),
    REST("Rest"),
    DRAINAGE("Drainage"),
    OTHER("Other");

    private final String label;

    InterventionCategory(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /** Maps free text to a category, case-insensitively. Unrecognised or blank text is OTHER. */
    public static InterventionCategory normalize(String raw) {
        if (raw == null || raw.isBlank()) return OTHER;
        String value = raw.trim().toUpperCase(Locale.ROOT);
        for (InterventionCategory category : values()) {
            if (category.name().equals(value)) return category;
        }
        return OTHER;
    }
}
