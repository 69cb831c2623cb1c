package com.libragraph.synthesis.core.inference;

import com.libragraph.synthesis.core.classify.Direction;
import com.libragraph.synthesis.core.classify.RelationshipJudgment;
import com.libragraph.synthesis.core.dao.ClaimRecord;
import com.libragraph.synthesis.core.store.Dependency;
import com.libragraph.synthesis.types.DependencyStrength;
import com.libragraph.synthesis.types.RelationshipType;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.UUID;

import static com.libragraph.synthesis.core.store.TestData.claim;
import static org.assertj.core.api.Assertions.*;

class DependencyAssemblerTest {

    private final UUID pipelineId = UUID.randomUUID();
    private final ClaimRecord a = claim(pipelineId, "X causes Y", 0.9);
    private final ClaimRecord b = claim(pipelineId, "Y follows X", 0.6);
    private final ClaimPair pair = new ClaimPair(a, b);
    private final DependencyAssembler assembler = new DependencyAssembler();

    private static RelationshipJudgment judgment(String label, Direction direction, double confidence) {
        return new RelationshipJudgment(label, direction, confidence, "because", DependencyStrength.STRONG,
                List.of("causes"));
    }

    @Test
    void noRelationship_yieldsNoEdges() {
        assertThat(assembler.assemble(pipelineId, pair, RelationshipJudgment.none())).isEmpty();
        assertThat(assembler.assemble(pipelineId, pair, judgment("none", Direction.BIDIRECTIONAL, 0.9))).isEmpty();
    }

    @Test
    void aToB_yieldsForwardEdgeWithJudgmentAttributes() {
        List<Dependency> edges = assembler.assemble(pipelineId, pair, judgment("CAUSAL", Direction.A_TO_B, 0.85));

        assertThat(edges).singleElement().satisfies(d -> {
            assertThat(d.pipelineId()).isEqualTo(pipelineId);
            assertThat(d.sourceClaimId()).isEqualTo(a.id());
            assertThat(d.targetClaimId()).isEqualTo(b.id());
            assertThat(d.relationshipType()).isEqualTo(RelationshipType.CAUSAL);
            assertThat(d.confidence()).isEqualTo(0.85);
            assertThat(d.strength()).isEqualTo(DependencyStrength.STRONG);
            assertThat(d.explanation()).isEqualTo("because");
            assertThat(d.semanticMarkers()).containsExactly("causes");
        });
    }

    @Test
    void bToA_yieldsReversedEdge() {
        List<Dependency> edges = assembler.assemble(pipelineId, pair, judgment("TEMPORAL", Direction.B_TO_A, 0.7));

        assertThat(edges).singleElement().satisfies(d -> {
            assertThat(d.sourceClaimId()).isEqualTo(b.id());
            assertThat(d.targetClaimId()).isEqualTo(a.id());
        });
    }

    @Test
    void bidirectional_yieldsTwoOppositeEdgesWithSameAttributes() {
        List<Dependency> edges = assembler.assemble(pipelineId, pair,
                judgment("EVIDENTIAL", Direction.BIDIRECTIONAL, 0.6));

        assertThat(edges).hasSize(2);
        assertThat(edges.get(0).sourceClaimId()).isEqualTo(a.id());
        assertThat(edges.get(0).targetClaimId()).isEqualTo(b.id());
        assertThat(edges.get(1).sourceClaimId()).isEqualTo(b.id());
        assertThat(edges.get(1).targetClaimId()).isEqualTo(a.id());
        assertThat(edges).extracting(Dependency::relationshipType).containsOnly(RelationshipType.EVIDENTIAL);
        assertThat(edges).extracting(Dependency::confidence).containsOnly(0.6);
    }

    @Test
    void unknownLabel_fallsBackToEvidential() {
        List<Dependency> edges = assembler.assemble(pipelineId, pair, judgment("SUPPORTS", Direction.A_TO_B, 0.5));

        assertThat(edges).singleElement()
                .extracting(Dependency::relationshipType)
                .isEqualTo(RelationshipType.EVIDENTIAL);
    }

    @Test
    void outOfRangeConfidence_isClamped() {
        assertThat(assembler.assemble(pipelineId, pair, judgment("CAUSAL", Direction.A_TO_B, 1.4)))
                .singleElement().extracting(Dependency::confidence).isEqualTo(1.0);
        assertThat(assembler.assemble(pipelineId, pair, judgment("CAUSAL", Direction.A_TO_B, -0.3)))
                .singleElement().extracting(Dependency::confidence).isEqualTo(0.0);
    }
}
