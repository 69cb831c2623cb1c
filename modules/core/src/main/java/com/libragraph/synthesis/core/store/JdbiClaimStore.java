package com.libragraph.synthesis.core.store;

import com.libragraph.synthesis.core.dao.ClaimDao;
import com.libragraph.synthesis.core.dao.ClaimRecord;
import com.libragraph.synthesis.core.dao.NewClaim;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jdbi.v3.core.Jdbi;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

@ApplicationScoped
public class JdbiClaimStore implements ClaimStore {

    @Inject
    Jdbi jdbi;

    @Override
    public List<ClaimRecord> findByPipeline(UUID pipelineId) {
        return jdbi.withExtension(ClaimDao.class, dao -> dao.findByPipeline(pipelineId));
    }

    @Override
    public int countByPipeline(UUID pipelineId) {
        return jdbi.withExtension(ClaimDao.class, dao -> dao.countByPipeline(pipelineId));
    }

    @Override
    public void updateMetrics(Collection<ClaimMetrics> metrics) {
        if (metrics.isEmpty()) return;
        jdbi.useTransaction(handle -> {
            ClaimDao dao = handle.attach(ClaimDao.class);
            for (ClaimMetrics m : metrics) {
                dao.updateMetrics(m.claimId(), m.pagerank(), m.centrality(), m.foundational(), m.importanceScore());
            }
        });
    }

    @Override
    public void insertAll(List<NewClaim> claims) {
        if (claims.isEmpty()) return;
        jdbi.useTransaction(handle -> handle.attach(ClaimDao.class).insertAll(claims));
    }
}
