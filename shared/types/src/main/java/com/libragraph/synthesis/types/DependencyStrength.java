package com.libragraph.synthesis.types;

import java.util.Locale;

public enum DependencyStrength {
    WEAK("weak"),
    MODERATE("moderate"),
    STRONG("strong");

    private final String label;

    DependencyStrength(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /** Missing or unrecognized strengths are read as {@link #MODERATE}. */
    public static DependencyStrength fromLabel(String label) {
        if (label == null) return MODERATE;
        String normalized = label.trim().toLowerCase(Locale.ROOT);
        for (DependencyStrength s : values()) {
            if (s.label.equals(normalized)) return s;
        }
        return MODERATE;
    }
}
