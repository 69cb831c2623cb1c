package com.libragraph.synthesis.core.classify;

import dev.langchain4j.model.chat.ChatLanguageModel;
import dev.langchain4j.model.chat.request.ResponseFormat;
import dev.langchain4j.model.googleai.GoogleAiGeminiChatModel;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Named;
import jakarta.inject.Singleton;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.time.Duration;

/**
 * Builds the Gemini chat models used by the classifiers. Both run at low temperature in JSON
 * response mode; they differ only in their output budget.
 */
@ApplicationScoped
public class GeminiModelProducer {

    private static final Logger log = Logger.getLogger(GeminiModelProducer.class);

    public static final String RELATIONSHIP_MODEL = "relationship-model";
    public static final String EXTRACTION_MODEL = "extraction-model";

    @ConfigProperty(name = "synthesis.gemini.api-key")
    String apiKey;

    @ConfigProperty(name = "synthesis.gemini.model", defaultValue = "gemini-1.5-flash")
    String modelName;

    @ConfigProperty(name = "synthesis.gemini.timeout-seconds", defaultValue = "60")
    int timeoutSeconds;

    @Produces
    @Singleton
    @Named(RELATIONSHIP_MODEL)
    ChatLanguageModel relationshipModel() {
        return build(1024);
    }

    @Produces
    @Singleton
    @Named(EXTRACTION_MODEL)
    ChatLanguageModel extractionModel() {
        return build(8192);
    }

    private ChatLanguageModel build(int maxOutputTokens) {
        log.infof("Gemini model %s (max output tokens %d, timeout %ds)", modelName, maxOutputTokens, timeoutSeconds);
        return GoogleAiGeminiChatModel.builder()
                .apiKey(apiKey)
                .modelName(modelName)
                .temperature(0.1)
                .topP(0.95)
                .maxOutputTokens(maxOutputTokens)
                .responseFormat(ResponseFormat.JSON)
                .timeout(Duration.ofSeconds(timeoutSeconds))
                .build();
    }
}
