package com.libragraph.synthesis.core.classify;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class GeminiClaimExtractorTest {

    @Test
    void extract_readsClaimsFromAnswer() {
        FakeChatModel model = FakeChatModel.replying("""
                ```json
                {"claims": [
                  {"text": "Sea levels rose 20cm", "type": "statistical", "confidence": 0.9,
                   "evidence_type": "empirical", "source_span_start": 0, "source_span_end": 20,
                   "surrounding_context": "intro", "extra": true},
                  {"text": "Warming causes melting"}
                ]}
                ```
                """);
        GeminiClaimExtractor extractor = new GeminiClaimExtractor(model, new ObjectMapper());

        List<ExtractedClaim> claims = extractor.extract("Sea levels rose 20cm since 1900.", "climate.md", "gpt-4");

        assertThat(claims).hasSize(2);
        assertThat(claims.get(0).type()).isEqualTo("statistical");
        assertThat(claims.get(0).confidence()).isEqualTo(0.9);
        assertThat(claims.get(0).sourceSpanEnd()).isEqualTo(20);
        assertThat(claims.get(1).confidence()).isNull();
        assertThat(model.prompts().get(0))
                .contains("Sea levels rose 20cm since 1900.")
                .contains("Source: climate.md")
                .contains("Source LLM: gpt-4");
    }

    @Test
    void missingClaimsList_meansNoClaims() {
        GeminiClaimExtractor extractor = new GeminiClaimExtractor(FakeChatModel.replying("{}"), new ObjectMapper());

        assertThat(extractor.extract("text", "doc.md", null)).isEmpty();
    }

    @Test
    void unknownSourceModel_isLabelled() {
        FakeChatModel model = FakeChatModel.replying("{\"claims\": []}");

        new GeminiClaimExtractor(model, new ObjectMapper()).extract("text", "doc.md", null);

        assertThat(model.prompts().get(0)).contains("Source LLM: unknown");
    }

    @Test
    void longDocuments_areTruncated() {
        FakeChatModel model = FakeChatModel.replying("{\"claims\": []}");

        new GeminiClaimExtractor(model, new ObjectMapper()).extract("x".repeat(12_000), "doc.md", "gpt-4");

        assertThat(model.prompts().get(0))
                .contains("x".repeat(GeminiClaimExtractor.MAX_TEXT_CHARS))
                .doesNotContain("x".repeat(GeminiClaimExtractor.MAX_TEXT_CHARS + 1));
    }

    @Test
    void unusableAnswers_areRejected() {
        assertThatThrownBy(() -> new GeminiClaimExtractor(FakeChatModel.replying(" "), new ObjectMapper())
                .extract("text", "doc.md", null))
                .isInstanceOf(ClassificationException.class);
        assertThatThrownBy(() -> new GeminiClaimExtractor(FakeChatModel.replying("claims: none"), new ObjectMapper())
                .extract("text", "doc.md", null))
                .isInstanceOf(ClassificationException.class);
    }
}
