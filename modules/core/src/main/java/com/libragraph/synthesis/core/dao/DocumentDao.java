package com.libragraph.synthesis.core.dao;

import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

import java.util.Optional;
import java.util.UUID;

@RegisterConstructorMapper(DocumentRecord.class)
public interface DocumentDao {

    @SqlQuery("SELECT * FROM documents WHERE id = :id")
    Optional<DocumentRecord> findById(@Bind("id") UUID id);

    @SqlUpdate("UPDATE documents SET status = :status, processed_at = now() WHERE id = :id")
    int markProcessed(@Bind("id") UUID id, @Bind("status") String status);
}
