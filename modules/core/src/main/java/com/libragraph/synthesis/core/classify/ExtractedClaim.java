package com.libragraph.synthesis.core.classify;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/** One claim as returned by the extraction model; every field may be missing. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ExtractedClaim(
        @JsonProperty("text") String text,
        @JsonProperty("type") String type,
        @JsonProperty("confidence") Double confidence,
        @JsonProperty("evidence_type") String evidenceType,
        @JsonProperty("source_span_start") Integer sourceSpanStart,
        @JsonProperty("source_span_end") Integer sourceSpanEnd,
        @JsonProperty("surrounding_context") String surroundingContext
) {}
