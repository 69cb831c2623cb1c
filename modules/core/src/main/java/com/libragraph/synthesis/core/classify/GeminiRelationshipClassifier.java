package com.libragraph.synthesis.core.classify;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.model.chat.ChatLanguageModel;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import org.jboss.logging.Logger;

/**
 * {@link RelationshipClassifier} backed by a Gemini chat model in JSON response mode.
 */
@ApplicationScoped
public class GeminiRelationshipClassifier implements RelationshipClassifier {

    private static final Logger log = Logger.getLogger(GeminiRelationshipClassifier.class);

    static final int MAX_CLAIM_CHARS = 500;

    static final String PROMPT = """
            Analyze the semantic relationship between these two research claims:

            Claim A:
            Text: "%s"
            Type: %s

            Claim B:
            Text: "%s"
            Type: %s

            Determine the PRIMARY relationship type:
            - CAUSAL: A causes or enables B (or vice versa)
            - EVIDENTIAL: A provides evidence supporting B (or vice versa)
            - TEMPORAL: A precedes B chronologically
            - PREREQUISITE: B requires A to be true
            - CONTRADICTORY: A and B are mutually exclusive
            - REFINES: B is a more specific version of A
            - NONE: No significant relationship

            Return ONLY valid JSON:
            {
              "relationship_type": "EVIDENTIAL",
              "direction": "A_to_B",
              "confidence": 0.85,
              "explanation": "Clear reasoning here",
              "semantic_markers": ["keyword1", "keyword2"],
              "strength": "moderate"
            }

            Direction options: A_to_B, B_to_A, or bidirectional
            Strength options: weak, moderate, strong
            """;

    private final ChatLanguageModel model;
    private final RelationshipJudgmentParser parser;

    @Inject
    public GeminiRelationshipClassifier(@Named(GeminiModelProducer.RELATIONSHIP_MODEL) ChatLanguageModel model,
                                        ObjectMapper objectMapper) {
        this.model = model;
        this.parser = new RelationshipJudgmentParser(objectMapper);
    }

    @Override
    public RelationshipJudgment classify(String claimAText, String claimAType,
                                         String claimBText, String claimBType) {
        String prompt = PROMPT.formatted(
                truncate(claimAText, MAX_CLAIM_CHARS), claimAType,
                truncate(claimBText, MAX_CLAIM_CHARS), claimBType);

        String response;
        try {
            response = model.generate(prompt);
        } catch (RuntimeException e) {
            throw new ClassificationException("Relationship classifier call failed: " + e.getMessage(), e);
        }
        log.debugf("Relationship classifier answered %d chars", response == null ? 0 : response.length());
        return parser.parse(response);
    }

    static String truncate(String text, int max) {
        if (text == null) return "";
        return text.length() <= max ? text : text.substring(0, max);
    }
}
