package com.libragraph.synthesis.core.store;

import com.libragraph.synthesis.core.dao.PipelineDao;
import com.libragraph.synthesis.core.dao.PipelineRecord;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jdbi.v3.core.Jdbi;

import java.util.Optional;
import java.util.UUID;

@ApplicationScoped
public class JdbiPipelineStore implements PipelineStore {

    @Inject
    Jdbi jdbi;

    @Override
    public Optional<PipelineRecord> findById(UUID pipelineId) {
        return jdbi.withExtension(PipelineDao.class, dao -> dao.findById(pipelineId));
    }

    @Override
    public void updateTotalDependencies(UUID pipelineId, int total) {
        int rows = jdbi.withExtension(PipelineDao.class, dao -> dao.updateTotalDependencies(pipelineId, total));
        if (rows == 0) throw new PipelineNotFoundException(pipelineId);
    }

    @Override
    public void updateTotalClaims(UUID pipelineId, int total) {
        int rows = jdbi.withExtension(PipelineDao.class, dao -> dao.updateTotalClaims(pipelineId, total));
        if (rows == 0) throw new PipelineNotFoundException(pipelineId);
    }
}
