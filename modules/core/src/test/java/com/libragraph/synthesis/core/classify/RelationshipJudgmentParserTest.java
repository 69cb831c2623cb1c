package com.libragraph.synthesis.core.classify;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.libragraph.synthesis.types.DependencyStrength;
import com.libragraph.synthesis.types.RelationshipType;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class RelationshipJudgmentParserTest {

    private final RelationshipJudgmentParser parser = new RelationshipJudgmentParser(new ObjectMapper());

    @Test
    void fullAnswer_isReadField() {
        RelationshipJudgment judgment = parser.parse("""
                {"relationship_type": "CAUSAL", "direction": "B_to_A", "confidence": 0.85,
                 "explanation": "B drives A", "semantic_markers": ["because", "leads to"],
                 "strength": "strong"}
                """);

        assertThat(judgment.relationshipLabel()).isEqualTo("CAUSAL");
        assertThat(judgment.relationshipType()).isEqualTo(RelationshipType.CAUSAL);
        assertThat(judgment.isNoRelationship()).isFalse();
        assertThat(judgment.direction()).isEqualTo(Direction.B_TO_A);
        assertThat(judgment.confidence()).isEqualTo(0.85);
        assertThat(judgment.explanation()).isEqualTo("B drives A");
        assertThat(judgment.semanticMarkers()).containsExactly("because", "leads to");
        assertThat(judgment.strength()).isEqualTo(DependencyStrength.STRONG);
    }

    @Test
    void missingFields_takeDefaults() {
        RelationshipJudgment judgment = parser.parse("{}");

        assertThat(judgment.isNoRelationship()).isTrue();
        assertThat(judgment.direction()).isEqualTo(Direction.A_TO_B);
        assertThat(judgment.confidence()).isEqualTo(0.8);
        assertThat(judgment.explanation()).isEmpty();
        assertThat(judgment.strength()).isEqualTo(DependencyStrength.MODERATE);
        assertThat(judgment.semanticMarkers()).isEmpty();
    }

    @Test
    void fencedAnswer_isUnwrapped() {
        RelationshipJudgment judgment = parser.parse("```json\n{\"relationship_type\": \"TEMPORAL\"}\n```");

        assertThat(judgment.relationshipType()).isEqualTo(RelationshipType.TEMPORAL);
    }

    @Test
    void confidence_isClampedToUnitInterval() {
        assertThat(parser.parse("{\"relationship_type\": \"CAUSAL\", \"confidence\": 1.7}").confidence()).isEqualTo(1.0);
        assertThat(parser.parse("{\"relationship_type\": \"CAUSAL\", \"confidence\": -0.2}").confidence()).isEqualTo(0.0);
    }

    @Test
    void numericTextConfidence_isAccepted() {
        assertThat(parser.parse("{\"relationship_type\": \"CAUSAL\", \"confidence\": \"0.7\"}").confidence())
                .isEqualTo(0.7);
    }

    @Test
    void nonNumericConfidence_isRejected() {
        assertThatThrownBy(() -> parser.parse("{\"relationship_type\": \"CAUSAL\", \"confidence\": \"high\"}"))
                .isInstanceOf(ClassificationException.class)
                .hasMessageContaining("high");
    }

    @Test
    void markersThatAreNotAList_areDropped() {
        RelationshipJudgment judgment = parser.parse(
                "{\"relationship_type\": \"CAUSAL\", \"semantic_markers\": \"because\"}");

        assertThat(judgment.semanticMarkers()).isEmpty();
    }

    @Test
    void unknownDirectionAndStrength_fallBack() {
        RelationshipJudgment judgment = parser.parse(
                "{\"relationship_type\": \"CAUSAL\", \"direction\": \"sideways\", \"strength\": \"huge\"}");

        assertThat(judgment.direction()).isEqualTo(Direction.A_TO_B);
        assertThat(judgment.strength()).isEqualTo(DependencyStrength.MODERATE);
    }

    @Test
    void unknownLabel_isKeptButMapsToFallbackType() {
        RelationshipJudgment judgment = parser.parse("{\"relationship_type\": \"SUPPORTS\"}");

        assertThat(judgment.relationshipLabel()).isEqualTo("SUPPORTS");
        assertThat(judgment.isNoRelationship()).isFalse();
        assertThat(judgment.relationshipType()).isEqualTo(RelationshipType.FALLBACK);
    }

    @Test
    void unusableAnswers_areRejected() {
        assertThatThrownBy(() -> parser.parse("")).isInstanceOf(ClassificationException.class);
        assertThatThrownBy(() -> parser.parse(null)).isInstanceOf(ClassificationException.class);
        assertThatThrownBy(() -> parser.parse("not json at all")).isInstanceOf(ClassificationException.class);
        assertThatThrownBy(() -> parser.parse("[1, 2]")).isInstanceOf(ClassificationException.class);
    }

    @Test
    void stripFence_leavesPlainTextAlone() {
        assertThat(RelationshipJudgmentParser.stripFence("  {\"a\": 1} ")).isEqualTo("{\"a\": 1}");
        assertThat(RelationshipJudgmentParser.stripFence("```\n{}\n```")).isEqualTo("{}");
    }
}
