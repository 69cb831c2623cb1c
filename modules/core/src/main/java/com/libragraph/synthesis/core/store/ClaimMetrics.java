package com.libragraph.synthesis.core.store;

import java.util.UUID;

/** The four derived fields written back to one claim. */
public record ClaimMetrics(
        UUID claimId,
        double pagerank,
        double centrality,
        boolean foundational,
        double importanceScore
) {}
