package com.libragraph.synthesis.core.classify;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.model.chat.ChatLanguageModel;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import org.jboss.logging.Logger;

import java.util.List;

@ApplicationScoped
public class GeminiClaimExtractor implements ClaimExtractor {

    private static final Logger log = Logger.getLogger(GeminiClaimExtractor.class);

    static final int MAX_TEXT_CHARS = 10_000;

    static final String PROMPT = """
            Extract atomic, verifiable claims from the following research document.

            --- BEGIN TEXT ---
            %s
            --- END TEXT ---

            Source: %s
            Source LLM: %s

            Return a JSON object with this exact structure:
            {
              "claims": [
                {
                  "text": "exact claim text",
                  "type": "factual|statistical|causal|opinion|hypothesis",
                  "confidence": 0.95,
                  "evidence_type": "empirical|theoretical|anecdotal",
                  "source_span_start": 0,
                  "source_span_end": 100,
                  "surrounding_context": "brief context around claim"
                }
              ]
            }

            Focus on:
            - Factual assertions
            - Statistical findings
            - Causal relationships
            - Key conclusions
            - Hypotheses and predictions

            Ignore:
            - Boilerplate text
            - References and citations
            - Methodology details (unless they're claims themselves)

            Output ONLY valid JSON. Extract at least 5-10 claims if the text is substantial.
            """;

    private final ChatLanguageModel model;
    private final ObjectMapper objectMapper;

    @Inject
    public GeminiClaimExtractor(@Named(GeminiModelProducer.EXTRACTION_MODEL) ChatLanguageModel model,
                                ObjectMapper objectMapper) {
        this.model = model;
        this.objectMapper = objectMapper;
    }

    @Override
    public List<ExtractedClaim> extract(String text, String sourceName, String sourceLlm) {
        String prompt = PROMPT.formatted(
                GeminiRelationshipClassifier.truncate(text, MAX_TEXT_CHARS),
                sourceName,
                sourceLlm == null ? "unknown" : sourceLlm);

        log.infof("Calling claim extractor (text length: %d)", text == null ? 0 : text.length());
        String response;
        try {
            response = model.generate(prompt);
        } catch (RuntimeException e) {
            throw new ClassificationException("Claim extractor call failed: " + e.getMessage(), e);
        }

        if (response == null || response.isBlank()) {
            throw new ClassificationException("Empty claim extractor response");
        }
        try {
            ExtractionResponse parsed = objectMapper.readValue(
                    RelationshipJudgmentParser.stripFence(response), ExtractionResponse.class);
            List<ExtractedClaim> claims = parsed.claims() == null ? List.of() : parsed.claims();
            log.infof("Extracted %d claims", claims.size());
            return claims;
        } catch (JsonProcessingException e) {
            throw new ClassificationException("Malformed claim extractor response: " + e.getOriginalMessage(), e);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ExtractionResponse(@JsonProperty("claims") List<ExtractedClaim> claims) {}
}
