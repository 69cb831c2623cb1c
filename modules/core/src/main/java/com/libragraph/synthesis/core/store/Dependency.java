package com.libragraph.synthesis.core.store;

import com.libragraph.synthesis.types.DependencyStrength;
import com.libragraph.synthesis.types.RelationshipType;

import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * A directed edge {@code source → target} about to be persisted.
 */
public record Dependency(
        UUID pipelineId,
        UUID sourceClaimId,
        UUID targetClaimId,
        RelationshipType relationshipType,
        double confidence,
        DependencyStrength strength,
        String explanation,
        List<String> semanticMarkers
) {
    public Dependency {
        Objects.requireNonNull(pipelineId, "pipelineId");
        Objects.requireNonNull(sourceClaimId, "sourceClaimId");
        Objects.requireNonNull(targetClaimId, "targetClaimId");
        Objects.requireNonNull(relationshipType, "relationshipType");
        Objects.requireNonNull(strength, "strength");
        if (sourceClaimId.equals(targetClaimId)) {
            throw new IllegalArgumentException("Self-dependency on claim " + sourceClaimId);
        }
        if (confidence < 0.0 || confidence > 1.0 || Double.isNaN(confidence)) {
            throw new IllegalArgumentException("confidence must be in [0, 1]: " + confidence);
        }
        explanation = explanation == null ? "" : explanation;
        semanticMarkers = semanticMarkers == null ? List.of() : List.copyOf(semanticMarkers);
    }

    /** Key under which a pipeline holds at most one edge. */
    public EdgeKey key() {
        return new EdgeKey(pipelineId, sourceClaimId, targetClaimId, relationshipType);
    }

    public record EdgeKey(UUID pipelineId, UUID source, UUID target, RelationshipType type) {}
}
