package com.libragraph.synthesis.core.classify;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.libragraph.synthesis.types.RelationshipType;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class GeminiRelationshipClassifierTest {

    @Test
    void classify_sendsBothClaimsAndParsesAnswer() {
        FakeChatModel model = FakeChatModel.replying(
                "{\"relationship_type\": \"EVIDENTIAL\", \"direction\": \"A_to_B\", \"confidence\": 0.9}");
        GeminiRelationshipClassifier classifier = new GeminiRelationshipClassifier(model, new ObjectMapper());

        RelationshipJudgment judgment = classifier.classify("Trials show X", "statistical", "X works", "factual");

        assertThat(judgment.relationshipType()).isEqualTo(RelationshipType.EVIDENTIAL);
        assertThat(judgment.confidence()).isEqualTo(0.9);
        assertThat(model.prompts()).singleElement().satisfies(prompt -> {
            assertThat(prompt).contains("Text: \"Trials show X\"").contains("Type: statistical");
            assertThat(prompt).contains("Text: \"X works\"").contains("Type: factual");
        });
    }

    @Test
    void longClaims_areTruncated() {
        FakeChatModel model = FakeChatModel.replying("{\"relationship_type\": \"NONE\"}");
        GeminiRelationshipClassifier classifier = new GeminiRelationshipClassifier(model, new ObjectMapper());
        String longText = "a".repeat(600);

        classifier.classify(longText, "factual", "short", "factual");

        assertThat(model.prompts().get(0))
                .contains("\"" + "a".repeat(500) + "\"")
                .doesNotContain("a".repeat(501));
    }

    @Test
    void modelFailure_becomesClassificationException() {
        FakeChatModel model = new FakeChatModel(prompt -> {
            throw new IllegalStateException("deadline exceeded");
        });
        GeminiRelationshipClassifier classifier = new GeminiRelationshipClassifier(model, new ObjectMapper());

        assertThatThrownBy(() -> classifier.classify("a", "factual", "b", "factual"))
                .isInstanceOf(ClassificationException.class)
                .hasMessageContaining("deadline exceeded");
    }

    @Test
    void garbageAnswer_becomesClassificationException() {
        GeminiRelationshipClassifier classifier =
                new GeminiRelationshipClassifier(FakeChatModel.replying("I think they are related."), new ObjectMapper());

        assertThatThrownBy(() -> classifier.classify("a", "factual", "b", "factual"))
                .isInstanceOf(ClassificationException.class);
    }

    @Test
    void truncate_handlesNullAndShortText() {
        assertThat(GeminiRelationshipClassifier.truncate(null, 10)).isEmpty();
        assertThat(GeminiRelationshipClassifier.truncate("short", 10)).isEqualTo("short");
        assertThat(GeminiRelationshipClassifier.truncate("0123456789AB", 10)).isEqualTo("0123456789");
    }
}
