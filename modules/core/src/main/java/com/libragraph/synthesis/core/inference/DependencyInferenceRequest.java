package com.libragraph.synthesis.core.inference;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.UUID;

@JsonIgnoreProperties(ignoreUnknown = true)
public record DependencyInferenceRequest(
        @JsonProperty("pipeline_id") UUID pipelineId,
        @JsonProperty("batch_size") Integer batchSize
) {}
