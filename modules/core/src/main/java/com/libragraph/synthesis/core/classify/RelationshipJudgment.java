package com.libragraph.synthesis.core.classify;

import com.libragraph.synthesis.types.DependencyStrength;
import com.libragraph.synthesis.types.RelationshipType;

import java.util.List;

/**
 * One classifier answer for a claim pair. {@code relationshipLabel} is kept verbatim; use
 * {@link #isNoRelationship()} and {@link #relationshipType()} to interpret it.
 */
public record RelationshipJudgment(
        String relationshipLabel,
        Direction direction,
        double confidence,
        String explanation,
        DependencyStrength strength,
        List<String> semanticMarkers
) {
    public static final double DEFAULT_CONFIDENCE = 0.8;

    public RelationshipJudgment {
        direction = direction == null ? Direction.A_TO_B : direction;
        strength = strength == null ? DependencyStrength.MODERATE : strength;
        explanation = explanation == null ? "" : explanation;
        semanticMarkers = semanticMarkers == null ? List.of() : List.copyOf(semanticMarkers);
    }

    public boolean isNoRelationship() {
        return RelationshipType.isNoRelationship(relationshipLabel);
    }

    /** Closed edge type; labels outside the set map to {@link RelationshipType#FALLBACK}. */
    public RelationshipType relationshipType() {
        return RelationshipType.fromLabelOrFallback(relationshipLabel);
    }

    public static RelationshipJudgment none() {
        return new RelationshipJudgment(RelationshipType.NO_RELATIONSHIP_LABEL, Direction.A_TO_B,
                0.0, "", DependencyStrength.MODERATE, List.of());
    }
}
