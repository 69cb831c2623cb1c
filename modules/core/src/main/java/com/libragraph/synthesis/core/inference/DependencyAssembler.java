package com.libragraph.synthesis.core.inference;

import com.libragraph.synthesis.core.classify.RelationshipJudgment;
import com.libragraph.synthesis.core.store.Dependency;
import com.libragraph.synthesis.types.RelationshipType;

import java.util.List;
import java.util.UUID;

/**
 * Turns one judgment into zero, one or two directed edges. A bidirectional judgment becomes two
 * opposite edges with identical attributes.
 */
public class DependencyAssembler {

    public List<Dependency> assemble(UUID pipelineId, ClaimPair pair, RelationshipJudgment judgment) {
        if (judgment.isNoRelationship()) {
            return List.of();
        }

        UUID a = pair.a().id();
        UUID b = pair.b().id();
        switch (judgment.direction()) {
            case B_TO_A:
                return List.of(edge(pipelineId, b, a, judgment));
            case BIDIRECTIONAL:
                return List.of(edge(pipelineId, a, b, judgment), edge(pipelineId, b, a, judgment));
            case A_TO_B:
            default:
                return List.of(edge(pipelineId, a, b, judgment));
        }
    }

    private static Dependency edge(UUID pipelineId, UUID source, UUID target, RelationshipJudgment j) {
        RelationshipType type = j.relationshipType();
        double confidence = Math.max(0.0, Math.min(1.0, j.confidence()));
        return new Dependency(pipelineId, source, target, type, confidence, j.strength(),
                j.explanation(), j.semanticMarkers());
    }
}
