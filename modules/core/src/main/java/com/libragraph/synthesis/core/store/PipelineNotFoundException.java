package com.libragraph.synthesis.core.store;

import java.util.UUID;

public class PipelineNotFoundException extends RuntimeException {

    private final UUID pipelineId;

    public PipelineNotFoundException(UUID pipelineId) {
        super("Pipeline " + pipelineId + " not found");
        this.pipelineId = pipelineId;
    }

    public UUID pipelineId() {
        return pipelineId;
    }
}
