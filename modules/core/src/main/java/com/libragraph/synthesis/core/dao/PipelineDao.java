package com.libragraph.synthesis.core.dao;

import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

import java.util.Optional;
import java.util.UUID;

@RegisterConstructorMapper(PipelineRecord.class)
public interface PipelineDao {

    @SqlQuery("SELECT * FROM pipelines WHERE id = :id")
    Optional<PipelineRecord> findById(@Bind("id") UUID id);

    @SqlUpdate("UPDATE pipelines SET total_dependencies = :total, updated_at = now() WHERE id = :id")
    int updateTotalDependencies(@Bind("id") UUID id, @Bind("total") int total);

    @SqlUpdate("UPDATE pipelines SET total_claims = :total, updated_at = now() WHERE id = :id")
    int updateTotalClaims(@Bind("id") UUID id, @Bind("total") int total);
}
