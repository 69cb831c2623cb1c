package com.libragraph.synthesis.core.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.libragraph.synthesis.core.dao.DependencyDao;
import com.libragraph.synthesis.core.dao.EdgeRecord;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jdbi.v3.core.Jdbi;

import java.util.List;
import java.util.UUID;

@ApplicationScoped
public class JdbiDependencyStore implements DependencyStore {

    @Inject
    Jdbi jdbi;

    @Inject
    ObjectMapper objectMapper;

    @Override
    public int insertAll(List<Dependency> dependencies) {
        if (dependencies.isEmpty()) return 0;
        return jdbi.inTransaction(handle -> {
            DependencyDao dao = handle.attach(DependencyDao.class);
            int inserted = 0;
            for (Dependency d : dependencies) {
                inserted += dao.insert(UUID.randomUUID(), d.pipelineId(), d.sourceClaimId(), d.targetClaimId(),
                        d.relationshipType().label(), d.confidence(), d.strength().label(),
                        d.explanation(), markersJson(d.semanticMarkers()));
            }
            return inserted;
        });
    }

    @Override
    public List<EdgeRecord> findEdges(UUID pipelineId) {
        return jdbi.withExtension(DependencyDao.class, dao -> dao.findEdges(pipelineId));
    }

    @Override
    public int countByPipeline(UUID pipelineId) {
        return jdbi.withExtension(DependencyDao.class, dao -> dao.countByPipeline(pipelineId));
    }

    private String markersJson(List<String> markers) {
        try {
            return objectMapper.writeValueAsString(markers);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Semantic markers are not serializable", e);
        }
    }
}
