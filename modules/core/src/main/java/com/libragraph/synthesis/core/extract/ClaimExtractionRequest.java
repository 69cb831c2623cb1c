package com.libragraph.synthesis.core.extract;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.UUID;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ClaimExtractionRequest(
        @JsonProperty("pipeline_id") UUID pipelineId,
        @JsonProperty("document_id") UUID documentId
) {}
