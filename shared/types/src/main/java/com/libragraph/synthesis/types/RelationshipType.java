package com.libragraph.synthesis.types;

import java.util.Locale;
import java.util.Optional;

/**
 * Closed set of edge types between two claims.
 * <p>
 * The classifier's "no relationship" answer ({@link #NO_RELATIONSHIP_LABEL}) is not a member:
 * such judgments never become edges.
 */
public enum RelationshipType {
    CAUSAL("causal"),
    EVIDENTIAL("evidential"),
    TEMPORAL("temporal"),
    PREREQUISITE("prerequisite"),
    CONTRADICTORY("contradictory"),
    REFINES("refines");

    public static final String NO_RELATIONSHIP_LABEL = "NONE";

    /** Type assigned when the classifier answers with a label outside this set. */
    public static final RelationshipType FALLBACK = EVIDENTIAL;

    private final String label;

    RelationshipType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static Optional<RelationshipType> fromLabel(String label) {
        if (label == null) return Optional.empty();
        String normalized = label.trim().toLowerCase(Locale.ROOT);
        for (RelationshipType t : values()) {
            if (t.label.equals(normalized)) return Optional.of(t);
        }
        return Optional.empty();
    }

    public static RelationshipType fromLabelOrFallback(String label) {
        return fromLabel(label).orElse(FALLBACK);
    }

    public static boolean isNoRelationship(String label) {
        return label != null && NO_RELATIONSHIP_LABEL.equalsIgnoreCase(label.trim());
    }
}
