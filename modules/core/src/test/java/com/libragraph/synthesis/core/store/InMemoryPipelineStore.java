package com.libragraph.synthesis.core.store;

import com.libragraph.synthesis.core.dao.PipelineRecord;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

public class InMemoryPipelineStore implements PipelineStore {

    private final Map<UUID, PipelineRecord> pipelines = new HashMap<>();

    public synchronized UUID create() {
        UUID id = UUID.randomUUID();
        Instant now = Instant.now();
        pipelines.put(id, new PipelineRecord(id, "user-1", "test pipeline", "processing", 0, 0, 0, now, now));
        return id;
    }

    @Override
    public synchronized Optional<PipelineRecord> findById(UUID pipelineId) {
        return Optional.ofNullable(pipelines.get(pipelineId));
    }

    @Override
    public synchronized void updateTotalDependencies(UUID pipelineId, int total) {
        PipelineRecord p = require(pipelineId);
        pipelines.put(pipelineId, new PipelineRecord(p.id(), p.userId(), p.name(), p.status(), p.totalClaims(),
                total, p.totalContradictions(), p.createdAt(), Instant.now()));
    }

    @Override
    public synchronized void updateTotalClaims(UUID pipelineId, int total) {
        PipelineRecord p = require(pipelineId);
        pipelines.put(pipelineId, new PipelineRecord(p.id(), p.userId(), p.name(), p.status(), total,
                p.totalDependencies(), p.totalContradictions(), p.createdAt(), Instant.now()));
    }
}
