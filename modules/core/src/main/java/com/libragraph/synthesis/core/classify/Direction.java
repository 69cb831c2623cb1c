package com.libragraph.synthesis.core.classify;

import java.util.Locale;

/** Orientation of a judged relationship relative to the (A, B) pair that was asked about. */
public enum Direction {
    A_TO_B("A_to_B"),
    B_TO_A("B_to_A"),
    BIDIRECTIONAL("bidirectional");

    private final String label;

    Direction(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /** Missing or unrecognized directions read as {@link #A_TO_B}. */
    public static Direction fromLabel(String label) {
        if (label == null) return A_TO_B;
        String normalized = label.trim().toLowerCase(Locale.ROOT);
        for (Direction d : values()) {
            if (d.label.toLowerCase(Locale.ROOT).equals(normalized)) return d;
        }
        return A_TO_B;
    }
}
