package com.libragraph.synthesis.types;

import java.util.Locale;
import java.util.Optional;

public enum ClaimType {
    FACTUAL("factual"),
    STATISTICAL("statistical"),
    CAUSAL("causal"),
    OPINION("opinion"),
    HYPOTHESIS("hypothesis");

    private final String label;

    ClaimType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static Optional<ClaimType> fromLabel(String label) {
        if (label == null) return Optional.empty();
        String normalized = label.trim().toLowerCase(Locale.ROOT);
        for (ClaimType t : values()) {
            if (t.label.equals(normalized)) return Optional.of(t);
        }
        return Optional.empty();
    }

    /** Unknown or missing labels become {@link #FACTUAL}. */
    public static ClaimType fromLabelOrDefault(String label) {
        return fromLabel(label).orElse(FACTUAL);
    }
}
